package com.platform.prioritizer.experiment;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Feature groups by aggregation prefix. An absent definition means every spec prefix.
 */
public record FeatureGroupDefinition(@JsonProperty("prefix") List<String> prefix) {

    public FeatureGroupDefinition {
        prefix = prefix == null ? List.of() : List.copyOf(prefix);
    }
}
