package com.platform.prioritizer.fitting;

import com.platform.prioritizer.domain.FeatureMatrix;

/**
 * A trained model. Scores are higher for rows more likely to be positive.
 * Native resources, if any, are released on {@link #close()}.
 */
public interface FittedModel extends AutoCloseable {

    double[] score(FeatureMatrix matrix);

    @Override
    default void close() {
    }
}
