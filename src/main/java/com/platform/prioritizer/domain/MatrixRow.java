package com.platform.prioritizer.domain;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Objects;

/**
 * One (entity, as-of date) observation: feature values in matrix column order plus its label.
 */
public record MatrixRow(String entityId, LocalDateTime asOfDate, double[] features, double label) {

    public MatrixRow {
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(asOfDate, "asOfDate");
        features = features.clone();
    }

    public double feature(int index) {
        return features[index];
    }

    @Override
    public double[] features() {
        return features.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MatrixRow other)) return false;
        return entityId.equals(other.entityId)
                && asOfDate.equals(other.asOfDate)
                && Double.compare(label, other.label) == 0
                && Arrays.equals(features, other.features);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, asOfDate, label) * 31 + Arrays.hashCode(features);
    }

    @Override
    public String toString() {
        return "MatrixRow[" + entityId + " @ " + asOfDate + ", label=" + label
                + ", features=" + Arrays.toString(features) + "]";
    }
}
