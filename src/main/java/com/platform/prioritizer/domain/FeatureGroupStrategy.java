package com.platform.prioritizer.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.platform.prioritizer.error.ConfigException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns the declared feature-group prefixes into the selections models are trained on.
 */
public enum FeatureGroupStrategy {

    ALL("all") {
        @Override
        public List<Set<String>> select(List<String> prefixes) {
            return List.of(new TreeSet<>(prefixes));
        }
    },
    LEAVE_ONE_OUT("leave-one-out") {
        @Override
        public List<Set<String>> select(List<String> prefixes) {
            if (prefixes.size() < 2) {
                return List.of(new TreeSet<>(prefixes));
            }
            List<Set<String>> selections = new ArrayList<>();
            for (String left : prefixes) {
                Set<String> selection = new TreeSet<>(prefixes);
                selection.remove(left);
                selections.add(selection);
            }
            return selections;
        }
    },
    LEAVE_ONE_IN("leave-one-in") {
        @Override
        public List<Set<String>> select(List<String> prefixes) {
            List<Set<String>> selections = new ArrayList<>();
            for (String kept : prefixes) {
                selections.add(new TreeSet<>(Set.of(kept)));
            }
            return selections;
        }
    };

    private final String configName;

    FeatureGroupStrategy(String configName) {
        this.configName = configName;
    }

    public abstract List<Set<String>> select(List<String> prefixes);

    @JsonCreator
    public static FeatureGroupStrategy fromConfig(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
            for (FeatureGroupStrategy strategy : values()) {
                if (strategy.configName.equals(normalized)) {
                    return strategy;
                }
            }
        }
        throw new ConfigException("Unknown feature group strategy '" + name + "'");
    }

    @JsonValue
    public String configName() {
        return configName;
    }
}
