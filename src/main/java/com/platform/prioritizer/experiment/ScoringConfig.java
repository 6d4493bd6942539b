package com.platform.prioritizer.experiment;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.platform.prioritizer.error.ConfigException;

import java.util.List;

/**
 * Metric groups for test and training matrices.
 *
 * @param tieTolerance share of the requested count by which a threshold may grow to
 *                     keep rows tied at the cut-off together; {@code null} uses the
 *                     application default
 */
public record ScoringConfig(
        @JsonProperty("testing_metric_groups") List<MetricGroup> testingMetricGroups,
        @JsonProperty("training_metric_groups") List<MetricGroup> trainingMetricGroups,
        @JsonProperty("tie_tolerance") Double tieTolerance
) {

    public ScoringConfig {
        testingMetricGroups = testingMetricGroups == null ? List.of() : List.copyOf(testingMetricGroups);
        trainingMetricGroups = trainingMetricGroups == null ? List.of() : List.copyOf(trainingMetricGroups);
        if (tieTolerance != null && (tieTolerance.isNaN() || tieTolerance < 0)) {
            throw new ConfigException("scoring.tie_tolerance must be non-negative, got " + tieTolerance);
        }
    }

    public static ScoringConfig empty() {
        return new ScoringConfig(List.of(), List.of(), null);
    }
}
