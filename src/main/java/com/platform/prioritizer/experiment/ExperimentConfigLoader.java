package com.platform.prioritizer.experiment;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.platform.prioritizer.domain.AggregationSpec;
import com.platform.prioritizer.error.ConfigException;
import com.platform.prioritizer.error.PrioritizerException;
import com.platform.prioritizer.error.SpecException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Reads experiment YAML into an {@link ExperimentConfig} and validates it as a whole.
 * <p>
 * Frequencies, durations and thresholds may be written as a single value or a list.
 * Every failure surfaces as a {@link PrioritizerException}: a defect found while
 * binding a section keeps its own type, anything else becomes a {@link ConfigException}.
 */
@Component
public class ExperimentConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ExperimentConfigLoader.class);

    private final ObjectMapper yamlMapper;

    public ExperimentConfigLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY);
    }

    public ExperimentConfig load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigException("Experiment config not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new ConfigException("Cannot read experiment config " + path, e);
        }
    }

    public ExperimentConfig load(InputStream in, String source) {
        ExperimentConfig config;
        try {
            config = yamlMapper.readValue(in, ExperimentConfig.class);
        } catch (IOException e) {
            throw translate(source, e);
        }
        if (config == null) {
            throw new ConfigException("Experiment config " + source + " is empty");
        }
        validate(config);
        log.info("Loaded experiment '{}' from {}: {} aggregations, {} model classes",
                config.modelComment(), source, config.featureAggregations().size(), config.gridConfig().size());
        return config;
    }

    public ExperimentConfig parse(String yaml) {
        try {
            ExperimentConfig config = yamlMapper.readValue(yaml, ExperimentConfig.class);
            if (config == null) {
                throw new ConfigException("Experiment config is empty");
            }
            validate(config);
            return config;
        } catch (IOException e) {
            throw translate("<inline>", e);
        }
    }

    void validate(ExperimentConfig config) {
        Set<String> prefixes = new HashSet<>();
        for (AggregationSpec spec : config.featureAggregations()) {
            if (!prefixes.add(spec.prefix())) {
                throw new SpecException("Duplicate aggregation prefix '" + spec.prefix() + "'");
            }
            spec.validateImputation();
        }

        for (String prefix : config.featureGroupDefinition().prefix()) {
            if (!prefixes.contains(prefix)) {
                throw new ConfigException("feature_group_definition names unknown prefix '" + prefix
                        + "', known: " + config.specPrefixes());
            }
        }

        Set<String> allowedKeys = new LinkedHashSet<>(ExperimentConfig.STANDARD_MODEL_GROUP_KEYS);
        allowedKeys.addAll(config.userMetadata().keySet());
        for (String key : config.modelGroupKeys()) {
            if (!allowedKeys.contains(key)) {
                throw new ConfigException("model_group_keys entry '" + key
                        + "' is neither a standard key nor a user_metadata entry");
            }
        }
    }

    private static PrioritizerException translate(String source, IOException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof PrioritizerException pe) {
                return pe;
            }
        }
        return new ConfigException("Invalid experiment config " + source + ": " + e.getMessage(), e);
    }
}
