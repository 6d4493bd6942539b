package com.platform.prioritizer.experiment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.platform.prioritizer.error.ConfigException;

/**
 * Outcome query and the policy for cohort members without a label.
 *
 * @param missingTrainLabelValue value given to unlabelled training rows, or {@code null}
 *                               to drop them from the training matrix
 */
public record LabelConfig(String query, String name, Double missingTrainLabelValue) {

    public LabelConfig {
        if (query == null || query.isBlank()) {
            throw new ConfigException("label_config.query is required");
        }
        if (name == null || name.isBlank()) {
            name = "outcome";
        }
    }

    @JsonCreator
    public static LabelConfig fromConfig(@JsonProperty("query") String query,
                                         @JsonProperty("name") String name,
                                         @JsonProperty("include_missing_labels_in_train_as") Object missing) {
        return new LabelConfig(query, name, missingValue(missing));
    }

    private static Double missingValue(Object missing) {
        if (missing == null) {
            return null;
        }
        if (missing instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        if (missing instanceof Number n) {
            return n.doubleValue();
        }
        throw new ConfigException("label_config.include_missing_labels_in_train_as must be a boolean or a number, got '"
                + missing + "'");
    }

    public boolean imputesMissingTrainLabels() {
        return missingTrainLabelValue != null;
    }
}
