package com.platform.prioritizer.domain;

import com.platform.prioritizer.error.ImputationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered imputation lookup for one section of an aggregation spec.
 * <p>
 * For a metric the candidate keys are, in order: the metric's own name, its family
 * default ({@code sum} or {@code avg}), then {@code all}. The first key present wins.
 */
public final class ImputationRuleTable {

    public static final String ALL = "all";

    private final String section;
    private final Map<String, ImputationRule> rules;

    public ImputationRuleTable(String section, Map<String, ImputationRule> rules) {
        this.section = section;
        this.rules = rules == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    public static List<String> resolutionOrder(AggregateMetric metric) {
        List<String> order = new ArrayList<>();
        order.add(metric.configName());
        if (metric.familyDefault() != null) {
            order.add(metric.familyDefault());
        }
        order.add(ALL);
        return order;
    }

    public Optional<ImputationRule> find(AggregateMetric metric) {
        for (String key : resolutionOrder(metric)) {
            ImputationRule rule = rules.get(key);
            if (rule != null) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public ImputationRule resolve(String prefix, AggregateMetric metric) {
        return find(metric).orElseThrow(() -> new ImputationException(
                "No imputation rule for metric '" + metric.configName() + "' in " + section
                        + " of aggregation '" + prefix + "' (tried " + resolutionOrder(metric) + ")"));
    }

    public Map<String, ImputationRule> rules() {
        return rules;
    }
}
