package com.platform.prioritizer.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.platform.prioritizer.error.SpecException;

import java.util.List;

/**
 * A categorical column expanded into one indicator per choice. Choices are either
 * listed literally or discovered by {@code choiceQuery} before any matrix is built.
 */
public record CategoricalDefinition(String column, List<String> choices, String choiceQuery,
                                    List<AggregateMetric> metrics) {

    public CategoricalDefinition {
        if (column == null || column.isBlank()) {
            throw new SpecException("Categorical without a column");
        }
        if ((choices == null || choices.isEmpty()) && (choiceQuery == null || choiceQuery.isBlank())) {
            throw new SpecException("Categorical '" + column + "' needs either choices or a choice_query");
        }
        if (metrics == null || metrics.isEmpty()) {
            throw new SpecException("Categorical '" + column + "' has no metrics");
        }
        choices = choices == null ? null : List.copyOf(choices);
        metrics = List.copyOf(metrics);
    }

    @JsonCreator
    public static CategoricalDefinition fromConfig(@JsonProperty("column") String column,
                                                   @JsonProperty("choices") List<String> choices,
                                                   @JsonProperty("choice_query") String choiceQuery,
                                                   @JsonProperty("metrics") List<AggregateMetric> metrics) {
        return new CategoricalDefinition(column, choices, choiceQuery, metrics);
    }

    public boolean hasResolvedChoices() {
        return choices != null && !choices.isEmpty();
    }

    public CategoricalDefinition withChoices(List<String> resolved) {
        return new CategoricalDefinition(column, resolved, choiceQuery, metrics);
    }
}
