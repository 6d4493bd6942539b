package com.platform.prioritizer.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Imputed feature values of one aggregation spec at one as-of date, keyed by entity id.
 * Every cohort entity has a complete row.
 */
public record FeatureBlock(String prefix, List<String> columnNames, Map<String, double[]> values) {

    public FeatureBlock {
        columnNames = List.copyOf(columnNames);
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public double[] row(String entityId) {
        double[] row = values.get(entityId);
        if (row == null) {
            throw new IllegalArgumentException("Entity " + entityId + " is not in the '" + prefix + "' block");
        }
        return row.clone();
    }
}
