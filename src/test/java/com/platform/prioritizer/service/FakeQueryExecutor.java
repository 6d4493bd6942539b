package com.platform.prioritizer.service;

import com.platform.prioritizer.store.QueryExecutor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * In-memory {@link QueryExecutor}. Each query is answered by the first route whose
 * fragment occurs in the SQL text; every call is recorded.
 */
class FakeQueryExecutor implements QueryExecutor {

    record Call(String sql, Map<String, Object> params) {}

    private record Route(String fragment, Function<Map<String, Object>, List<Map<String, Object>>> answer) {}

    private final List<Route> routes = new CopyOnWriteArrayList<>();
    private final List<Call> calls = new CopyOnWriteArrayList<>();

    FakeQueryExecutor on(String fragment, List<Map<String, Object>> rows) {
        return on(fragment, params -> rows);
    }

    FakeQueryExecutor on(String fragment, Function<Map<String, Object>, List<Map<String, Object>>> answer) {
        routes.add(new Route(fragment, answer));
        return this;
    }

    @Override
    public List<Map<String, Object>> query(String sql, Map<String, Object> params) {
        calls.add(new Call(sql, Map.copyOf(params)));
        for (Route route : routes) {
            if (sql.contains(route.fragment())) {
                return route.answer().apply(params);
            }
        }
        throw new IllegalStateException("No route for query: " + sql);
    }

    List<Call> calls() {
        return calls;
    }

    long count(String fragment) {
        return calls.stream().filter(c -> c.sql().contains(fragment)).count();
    }

    /** A row that may hold nulls, from alternating column names and values. */
    static Map<String, Object> row(Object... columnsAndValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < columnsAndValues.length; i += 2) {
            row.put((String) columnsAndValues[i], columnsAndValues[i + 1]);
        }
        return row;
    }
}
