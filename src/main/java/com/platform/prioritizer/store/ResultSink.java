package com.platform.prioritizer.store;

import com.platform.prioritizer.domain.EvaluationResult;
import com.platform.prioritizer.domain.FeatureMatrix;
import com.platform.prioritizer.domain.ModelGroupKey;

import java.util.List;

/**
 * Write-only destination for evaluation results. Called from worker threads,
 * so implementations must be thread-safe.
 */
public interface ResultSink {

    void recordEvaluations(ModelGroupKey modelGroupKey, String splitId, List<EvaluationResult> results);

    /**
     * Offered every finished split matrix. Ignored unless the sink caches matrices.
     */
    default void cacheMatrix(String splitId, boolean training, FeatureMatrix matrix) {
    }
}
