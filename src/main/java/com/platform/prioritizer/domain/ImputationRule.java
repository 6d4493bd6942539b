package com.platform.prioritizer.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.platform.prioritizer.error.SpecException;

/**
 * One imputation rule. {@code value} is only meaningful for {@link ImputationType#CONSTANT}.
 */
public record ImputationRule(ImputationType type, Double value) {

    public ImputationRule {
        if (type == null) {
            throw new SpecException("Imputation rule without a type");
        }
        if (type == ImputationType.CONSTANT && value == null) {
            throw new SpecException("Imputation type 'constant' requires a value");
        }
    }

    @JsonCreator
    public static ImputationRule fromConfig(@JsonProperty("type") ImputationType type,
                                            @JsonProperty("value") Double value) {
        return new ImputationRule(type, value);
    }

    public static ImputationRule of(ImputationType type) {
        return new ImputationRule(type, null);
    }
}
