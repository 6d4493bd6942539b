package com.platform.prioritizer.experiment;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optional cohort definition. Without a query the cohort is every labelled entity.
 */
public record CohortConfig(
        @JsonProperty("query") String query,
        @JsonProperty("name") String name
) {

    public static final String DEFAULT_NAME = "default";

    public CohortConfig {
        if (name == null || name.isBlank()) {
            name = DEFAULT_NAME;
        }
        if (query != null && query.isBlank()) {
            query = null;
        }
    }

    public static CohortConfig labelledEntities() {
        return new CohortConfig(null, DEFAULT_NAME);
    }

    public boolean hasQuery() {
        return query != null;
    }
}
