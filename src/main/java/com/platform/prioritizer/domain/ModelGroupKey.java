package com.platform.prioritizer.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stable identity of a logical model across splits and runs (hex digest).
 */
public record ModelGroupKey(String value) {

    @JsonValue
    @Override
    public String toString() {
        return value;
    }
}
