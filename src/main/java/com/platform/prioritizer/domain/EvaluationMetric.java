package com.platform.prioritizer.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.platform.prioritizer.error.ConfigException;

/**
 * Metrics the evaluator knows how to compute, by their configured names.
 */
public enum EvaluationMetric {
    PRECISION_AT("precision@"),
    RECALL_AT("recall@"),
    FBETA_AT("fbeta@"),
    F1("f1"),
    ACCURACY("accuracy"),
    ROC_AUC("roc_auc"),
    AVERAGE_PRECISION("average precision score"),
    TRUE_POSITIVES_AT("true positives@"),
    TRUE_NEGATIVES_AT("true negatives@"),
    FALSE_POSITIVES_AT("false positives@"),
    FALSE_NEGATIVES_AT("false negatives@"),
    FPR_AT("fpr@");

    private final String configName;

    EvaluationMetric(String configName) {
        this.configName = configName;
    }

    @JsonCreator
    public static EvaluationMetric fromConfig(String name) {
        if (name != null) {
            for (EvaluationMetric metric : values()) {
                if (metric.configName.equals(name.trim())) {
                    return metric;
                }
            }
        }
        throw new ConfigException("Unknown evaluation metric '" + name + "'");
    }

    @JsonValue
    public String configName() {
        return configName;
    }
}
