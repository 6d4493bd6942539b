package com.platform.prioritizer.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.platform.prioritizer.error.SpecException;

import java.util.Locale;

public enum ImputationType {

    ZERO("zero", true),
    ZERO_NOFLAG("zero_noflag", false),
    CONSTANT("constant", true),
    MEAN("mean", true),
    BINARY_MODE("binary_mode", true),
    ERROR("error", false);

    private final String configName;
    private final boolean flagged;

    ImputationType(String configName, boolean flagged) {
        this.configName = configName;
        this.flagged = flagged;
    }

    @JsonCreator
    public static ImputationType fromConfig(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (ImputationType type : values()) {
                if (type.configName.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new SpecException("Unknown imputation type '" + name + "'");
    }

    @JsonValue
    public String configName() {
        return configName;
    }

    /** Whether a companion {@code _imp} indicator column is emitted. */
    public boolean isFlagged() {
        return flagged;
    }
}
