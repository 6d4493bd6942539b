package com.platform.prioritizer.store;

import java.util.List;
import java.util.Map;

/**
 * Runs parameterized read-only SQL against the event store.
 * Parameters are bound by name ({@code :as_of_date}); rows come back as column name to value.
 */
public interface QueryExecutor {

    List<Map<String, Object>> query(String sql, Map<String, Object> params);
}
