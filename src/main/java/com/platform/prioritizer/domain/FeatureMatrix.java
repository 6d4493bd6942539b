package com.platform.prioritizer.domain;

import java.util.List;

/**
 * Entity x feature matrix for one or more as-of dates, with a label per row.
 * <p>
 * Rows are ordered by as-of date, then entity id. Column order is fixed by the
 * aggregation specs, so matrices built from the same specs share a schema.
 */
public record FeatureMatrix(String matrixId, List<String> featureNames, List<MatrixRow> rows) {

    public FeatureMatrix {
        featureNames = List.copyOf(featureNames);
        rows = List.copyOf(rows);
        for (MatrixRow row : rows) {
            if (row.features().length != featureNames.size()) {
                throw new IllegalArgumentException("Row for " + row.entityId() + " has "
                        + row.features().length + " values, schema has " + featureNames.size());
            }
        }
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int featureCount() {
        return featureNames.size();
    }

    public double[] labels() {
        double[] labels = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            labels[i] = rows.get(i).label();
        }
        return labels;
    }

    /** Row-major float copy of the feature values, the layout native learners expect. */
    public float[] toRowMajorFloats() {
        int nFeat = featureNames.size();
        float[] data = new float[rows.size() * nFeat];
        for (int i = 0; i < rows.size(); i++) {
            MatrixRow row = rows.get(i);
            for (int j = 0; j < nFeat; j++) {
                data[i * nFeat + j] = (float) row.feature(j);
            }
        }
        return data;
    }
}
