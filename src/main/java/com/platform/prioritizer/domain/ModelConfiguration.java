package com.platform.prioritizer.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One concrete point of the model grid: a class identifier and its hyperparameters.
 */
public record ModelConfiguration(String classPath, Map<String, Object> parameters) {

    public ModelConfiguration {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public String describe() {
        return classPath + parameters;
    }
}
