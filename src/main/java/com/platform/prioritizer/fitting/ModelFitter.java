package com.platform.prioritizer.fitting;

import com.platform.prioritizer.domain.FeatureMatrix;
import com.platform.prioritizer.domain.ModelConfiguration;

import java.util.Set;

/**
 * Fits one family of models. Implementations are Spring beans picked up by
 * {@link ModelFitterRegistry} and must be safe to call from several workers at once.
 */
public interface ModelFitter {

    /** Class identifiers accepted in {@code grid_config}. */
    Set<String> classIdentifiers();

    /**
     * @throws com.platform.prioritizer.error.FitException when the matrix or the
     *         hyperparameters cannot be fitted
     */
    FittedModel fit(ModelConfiguration configuration, FeatureMatrix train, long seed);
}
