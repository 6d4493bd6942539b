package com.platform.prioritizer.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.platform.prioritizer.error.SpecException;

import java.util.List;
import java.util.Locale;

/**
 * Aggregate functions over the non-null values of a group.
 * {@link #apply(List)} returns {@code null} when the aggregate is undefined,
 * which the engine treats as a missing value.
 */
public enum AggregateMetric {

    COUNT("count", "sum"),
    SUM("sum", null),
    AVG("avg", null),
    MIN("min", "avg"),
    MAX("max", "avg"),
    STDDEV("stddev", "avg"),
    VARIANCE("variance", "avg");

    private final String configName;
    private final String familyDefault;

    AggregateMetric(String configName, String familyDefault) {
        this.configName = configName;
        this.familyDefault = familyDefault;
    }

    @JsonCreator
    public static AggregateMetric fromConfig(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (AggregateMetric metric : values()) {
                if (metric.configName.equals(normalized)) {
                    return metric;
                }
            }
        }
        throw new SpecException("Unknown aggregate metric '" + name + "'");
    }

    @JsonValue
    public String configName() {
        return configName;
    }

    /**
     * Name of the imputation rule consulted after an exact match fails:
     * {@code sum} for counts, {@code avg} for the value-shaped aggregates.
     */
    public String familyDefault() {
        return familyDefault;
    }

    public Double apply(List<Double> values) {
        if (this == COUNT) {
            return (double) values.size();
        }
        if (values.isEmpty()) {
            return null;
        }
        return switch (this) {
            case SUM -> sum(values);
            case AVG -> sum(values) / values.size();
            case MIN -> values.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
            case MAX -> values.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
            case VARIANCE -> sampleVariance(values);
            case STDDEV -> {
                Double variance = sampleVariance(values);
                yield variance == null ? null : Math.sqrt(variance);
            }
            case COUNT -> (double) values.size();
        };
    }

    private static double sum(List<Double> values) {
        double total = 0;
        for (double v : values) total += v;
        return total;
    }

    private static Double sampleVariance(List<Double> values) {
        if (values.size() < 2) return null;
        double mean = sum(values) / values.size();
        double squares = 0;
        for (double v : values) squares += (v - mean) * (v - mean);
        return squares / (values.size() - 1);
    }
}
