package com.platform.prioritizer.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.platform.prioritizer.domain.Digests;
import com.platform.prioritizer.domain.ModelConfiguration;
import com.platform.prioritizer.domain.ModelGroupKey;
import com.platform.prioritizer.domain.Timespan;
import com.platform.prioritizer.error.ConfigException;
import com.platform.prioritizer.error.GridException;
import com.platform.prioritizer.fitting.ModelFitterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Expands {@code grid_config} into concrete model configurations and derives the
 * {@link ModelGroupKey} that identifies a logical model across splits.
 */
@Service
public class ModelGridExpander {

    private static final Logger log = LoggerFactory.getLogger(ModelGridExpander.class);

    private final ModelFitterRegistry fitterRegistry;
    private final ObjectMapper canonicalMapper = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    public ModelGridExpander(ModelFitterRegistry fitterRegistry) {
        this.fitterRegistry = fitterRegistry;
    }

    /**
     * Configurations per class, and the reason each failed class was left out.
     */
    public record Expansion(List<ModelConfiguration> configurations, Map<String, String> failedClasses) {}

    /**
     * Everything that can go into a model group key besides the model configuration.
     */
    public record KeyContext(
            List<String> featureNames,
            Set<String> featureGroups,
            String cohortName,
            String state,
            String labelName,
            Timespan labelTimespan,
            Timespan trainingAsOfDateFrequency,
            Timespan maxTrainingHistory,
            long randomSeed,
            Map<String, Object> userMetadata
    ) {}

    public static final String DEFAULT_STATE = "active";

    // --- Grid expansion ---

    public Expansion expand(Map<String, Map<String, Object>> gridConfig) {
        List<ModelConfiguration> configurations = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        gridConfig.forEach((classPath, params) -> {
            try {
                List<ModelConfiguration> expanded = expandClass(classPath, params);
                log.info("Model class {} expands to {} configurations", classPath, expanded.size());
                configurations.addAll(expanded);
            } catch (GridException e) {
                log.warn("Skipping model class {}: {}", classPath, e.getMessage());
                failed.put(classPath, e.getMessage());
            }
        });
        return new Expansion(List.copyOf(configurations), failed);
    }

    /**
     * Cartesian product of the candidate values, in declared parameter order.
     * A scalar candidate counts as a one-element list.
     *
     * @throws GridException when no fitter handles {@code classPath} or a candidate list is empty
     */
    public List<ModelConfiguration> expandClass(String classPath, Map<String, Object> params) {
        fitterRegistry.resolve(classPath);

        List<Map<String, Object>> combinations = new ArrayList<>();
        combinations.add(new LinkedHashMap<>());
        for (Map.Entry<String, Object> param : params.entrySet()) {
            List<?> candidates = param.getValue() instanceof Collection<?> c
                    ? new ArrayList<>(c)
                    : Collections.singletonList(param.getValue());
            if (candidates.isEmpty()) {
                throw new GridException("Parameter '" + param.getKey() + "' of " + classPath + " has no candidates");
            }
            List<Map<String, Object>> next = new ArrayList<>(combinations.size() * candidates.size());
            for (Map<String, Object> partial : combinations) {
                for (Object candidate : candidates) {
                    Map<String, Object> extended = new LinkedHashMap<>(partial);
                    extended.put(param.getKey(), candidate);
                    next.add(extended);
                }
            }
            combinations = next;
        }

        List<ModelConfiguration> configurations = new ArrayList<>(combinations.size());
        for (Map<String, Object> combination : combinations) {
            configurations.add(new ModelConfiguration(classPath, combination));
        }
        return configurations;
    }

    // --- Model group keys ---

    /**
     * MD5 of the canonical JSON of the declared key fields. Map entries are sorted by
     * key and unordered collections are sorted, so declaration order does not matter.
     *
     * @throws ConfigException when a declared key is neither a standard field nor user metadata
     */
    public ModelGroupKey modelGroupKey(ModelConfiguration configuration, KeyContext context,
                                       List<String> declaredKeys) {
        Map<String, Object> available = new TreeMap<>();
        available.put("class_path", configuration.classPath());
        available.put("parameters", new TreeMap<>(configuration.parameters()));
        available.put("feature_names", context.featureNames());
        available.put("feature_groups", new ArrayList<>(new TreeSet<>(context.featureGroups())));
        available.put("cohort_name", context.cohortName());
        available.put("state", context.state() == null ? DEFAULT_STATE : context.state());
        available.put("label_name", context.labelName());
        available.put("label_timespan", context.labelTimespan().text());
        available.put("training_as_of_date_frequency", context.trainingAsOfDateFrequency().text());
        available.put("max_training_history", context.maxTrainingHistory().text());
        available.put("random_seed", context.randomSeed());

        Map<String, Object> selected = new TreeMap<>();
        for (String key : declaredKeys) {
            if (available.containsKey(key)) {
                selected.put(key, available.get(key));
            } else if (context.userMetadata().containsKey(key)) {
                selected.put(key, context.userMetadata().get(key));
            } else {
                throw new ConfigException("Unknown model group key '" + key + "'");
            }
        }
        return new ModelGroupKey(Digests.md5Hex(canonicalJson(selected)));
    }

    String canonicalJson(Map<String, Object> fields) {
        try {
            return canonicalMapper.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Model group key fields are not serializable: " + fields, e);
        }
    }
}
