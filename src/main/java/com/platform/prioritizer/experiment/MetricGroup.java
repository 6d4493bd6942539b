package com.platform.prioritizer.experiment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.platform.prioritizer.domain.EvaluationMetric;
import com.platform.prioritizer.domain.Threshold;
import com.platform.prioritizer.error.ConfigException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A list of metrics evaluated at every listed threshold and parameter combination.
 */
public record MetricGroup(List<EvaluationMetric> metrics, List<Threshold> thresholds,
                          List<Map<String, Object>> parameters) {

    public MetricGroup {
        if (metrics == null || metrics.isEmpty()) {
            throw new ConfigException("Metric group without metrics");
        }
        metrics = List.copyOf(metrics);
        thresholds = thresholds == null || thresholds.isEmpty()
                ? List.of(Threshold.ALL_SELECTED)
                : List.copyOf(thresholds);
        List<Map<String, Object>> params = new ArrayList<>();
        if (parameters == null || parameters.isEmpty()) {
            params.add(Map.of());
        } else {
            for (Map<String, Object> p : parameters) {
                if (p == null) {
                    throw new ConfigException("Empty entry in metric group parameters");
                }
                params.add(Collections.unmodifiableMap(new LinkedHashMap<>(p)));
            }
        }
        parameters = List.copyOf(params);
    }

    public record Thresholds(@JsonProperty("percentiles") List<Double> percentiles,
                             @JsonProperty("top_n") List<Integer> topN) {}

    @JsonCreator
    public static MetricGroup fromConfig(@JsonProperty("metrics") List<EvaluationMetric> metrics,
                                         @JsonProperty("thresholds") Thresholds thresholds,
                                         @JsonProperty("parameters") List<Map<String, Object>> parameters) {
        List<Threshold> resolved = new ArrayList<>();
        if (thresholds != null) {
            try {
                if (thresholds.percentiles() != null) {
                    for (Double p : thresholds.percentiles()) {
                        resolved.add(Threshold.percentile(present(p, "percentiles")));
                    }
                }
                if (thresholds.topN() != null) {
                    for (Integer n : thresholds.topN()) {
                        resolved.add(Threshold.topN(present(n, "top_n")));
                    }
                }
            } catch (IllegalArgumentException e) {
                throw new ConfigException("Invalid threshold: " + e.getMessage(), e);
            }
        }
        return new MetricGroup(metrics, resolved, parameters);
    }

    private static <T> T present(T value, String field) {
        if (value == null) {
            throw new ConfigException("Empty entry in thresholds." + field);
        }
        return value;
    }
}
