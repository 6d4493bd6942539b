package com.platform.prioritizer.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.platform.prioritizer.error.SpecException;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Declares one feature group: which source to aggregate, which column bounds what is
 * knowable, the look-back intervals, the grouping keys, and how missing values are imputed.
 */
public record AggregationSpec(
        String prefix,
        String fromObj,
        String knowledgeDateColumn,
        List<AggregationInterval> intervals,
        List<String> groups,
        List<AggregateDefinition> aggregates,
        List<CategoricalDefinition> categoricals,
        ImputationRuleTable aggregatesImputation,
        ImputationRuleTable categoricalsImputation
) {

    public static final String ENTITY_GROUP = "entity_id";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public AggregationSpec {
        if (prefix == null || !IDENTIFIER.matcher(prefix).matches()) {
            throw new SpecException("Aggregation prefix must be an identifier, got '" + prefix + "'");
        }
        if (fromObj == null || fromObj.isBlank()) {
            throw new SpecException("Aggregation '" + prefix + "' has no from_obj");
        }
        if (knowledgeDateColumn == null || !IDENTIFIER.matcher(knowledgeDateColumn).matches()) {
            throw new SpecException("Aggregation '" + prefix + "' needs a knowledge_date_column identifier");
        }
        if (intervals == null || intervals.isEmpty()) {
            throw new SpecException("Aggregation '" + prefix + "' has no intervals");
        }
        if (groups == null || groups.isEmpty()) {
            throw new SpecException("Aggregation '" + prefix + "' has no groups");
        }
        for (String group : groups) {
            if (group == null || !IDENTIFIER.matcher(group).matches()) {
                throw new SpecException("Aggregation '" + prefix + "' has an invalid group '" + group + "'");
            }
        }
        aggregates = aggregates == null ? List.of() : List.copyOf(aggregates);
        categoricals = categoricals == null ? List.of() : List.copyOf(categoricals);
        if (aggregates.isEmpty() && categoricals.isEmpty()) {
            throw new SpecException("Aggregation '" + prefix + "' declares neither aggregates nor categoricals");
        }
        intervals = List.copyOf(intervals);
        groups = List.copyOf(groups);
        Set<String> intervalNames = new HashSet<>();
        for (AggregationInterval interval : intervals) {
            if (!intervalNames.add(interval.name())) {
                throw new SpecException("Aggregation '" + prefix + "' repeats the interval '" + interval.name() + "'");
            }
        }
        if (aggregatesImputation == null) {
            aggregatesImputation = new ImputationRuleTable("aggregates_imputation", Map.of());
        }
        if (categoricalsImputation == null) {
            categoricalsImputation = new ImputationRuleTable("categoricals_imputation", Map.of());
        }
    }

    @JsonCreator
    public static AggregationSpec fromConfig(
            @JsonProperty("prefix") String prefix,
            @JsonProperty("from_obj") String fromObj,
            @JsonProperty("knowledge_date_column") String knowledgeDateColumn,
            @JsonProperty("intervals") List<AggregationInterval> intervals,
            @JsonProperty("groups") List<String> groups,
            @JsonProperty("aggregates") List<AggregateDefinition> aggregates,
            @JsonProperty("categoricals") List<CategoricalDefinition> categoricals,
            @JsonProperty("aggregates_imputation") Map<String, ImputationRule> aggregatesImputation,
            @JsonProperty("categoricals_imputation") Map<String, ImputationRule> categoricalsImputation) {
        return new AggregationSpec(prefix, fromObj, knowledgeDateColumn, intervals, groups,
                aggregates, categoricals,
                new ImputationRuleTable("aggregates_imputation", aggregatesImputation),
                new ImputationRuleTable("categoricals_imputation", categoricalsImputation));
    }

    /**
     * Fail closed: every metric must resolve to an imputation rule.
     *
     * @throws com.platform.prioritizer.error.ImputationException on the first unresolvable metric
     */
    public void validateImputation() {
        for (AggregateDefinition aggregate : aggregates) {
            for (AggregateMetric metric : aggregate.metrics()) {
                aggregatesImputation.resolve(prefix, metric);
            }
        }
        for (CategoricalDefinition categorical : categoricals) {
            for (AggregateMetric metric : categorical.metrics()) {
                categoricalsImputation.resolve(prefix, metric);
            }
        }
    }

    public boolean hasUnresolvedChoices() {
        return categoricals.stream().anyMatch(c -> !c.hasResolvedChoices());
    }

    public AggregationSpec withCategoricals(List<CategoricalDefinition> resolved) {
        return new AggregationSpec(prefix, fromObj, knowledgeDateColumn, intervals, groups,
                aggregates, resolved, aggregatesImputation, categoricalsImputation);
    }
}
