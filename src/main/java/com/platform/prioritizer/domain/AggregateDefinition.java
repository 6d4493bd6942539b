package com.platform.prioritizer.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.platform.prioritizer.error.SpecException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Numeric aggregates: each named quantity (a column, or {@code *} for one per row)
 * is aggregated with every listed metric.
 */
public record AggregateDefinition(Map<String, String> quantities, List<AggregateMetric> metrics) {

    public static final String ROW_QUANTITY = "*";

    public AggregateDefinition {
        if (quantities == null || quantities.isEmpty()) {
            throw new SpecException("Aggregate without a quantity");
        }
        if (metrics == null || metrics.isEmpty()) {
            throw new SpecException("Aggregate " + quantities.keySet() + " has no metrics");
        }
        quantities = Collections.unmodifiableMap(new LinkedHashMap<>(quantities));
        metrics = List.copyOf(metrics);
    }

    /**
     * {@code quantity} is either a column name or a mapping of quantity name to column.
     */
    @JsonCreator
    public static AggregateDefinition fromConfig(@JsonProperty("quantity") Object quantity,
                                                 @JsonProperty("metrics") List<AggregateMetric> metrics) {
        Map<String, String> quantities = new LinkedHashMap<>();
        if (quantity instanceof String column) {
            quantities.put(column, column);
        } else if (quantity instanceof Map<?, ?> named) {
            named.forEach((k, v) -> quantities.put(String.valueOf(k), String.valueOf(v)));
        } else if (quantity != null) {
            throw new SpecException("Unsupported aggregate quantity: " + quantity);
        }
        return new AggregateDefinition(quantities, metrics);
    }
}
