package com.platform.prioritizer.domain;

/**
 * One metric value of one model on one split, at one threshold and parameter.
 *
 * @param parameter  threshold and extra metric parameters, e.g. {@code 10_abs} or {@code 0.5_beta/5.0_pct}
 * @param value      {@code NaN} when the metric is undefined for the data
 * @param worstValue value when tied scores rank negatives ahead of positives
 * @param bestValue  value when tied scores rank positives ahead of negatives
 */
public record EvaluationResult(
        ModelGroupKey modelGroupKey,
        String splitId,
        String metricName,
        String parameter,
        Threshold threshold,
        double value,
        double worstValue,
        double bestValue,
        boolean training,
        int numLabeledExamples,
        int numLabeledAboveThreshold,
        int numPositiveLabels
) {
}
