package com.platform.prioritizer.experiment;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.platform.prioritizer.domain.AggregationSpec;
import com.platform.prioritizer.domain.FeatureGroupStrategy;
import com.platform.prioritizer.domain.TemporalConfig;
import com.platform.prioritizer.error.ConfigException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed experiment file. Immutable; loaded once per run by {@link ExperimentConfigLoader}.
 * Connection settings that older files carry ({@code db_user}, {@code db_password}, ...)
 * are ignored: the data source is configured on the application.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExperimentConfig(
        @JsonProperty("model_comment") String modelComment,
        @JsonProperty("random_seed") Long randomSeed,
        @JsonProperty("user_metadata") Map<String, Object> userMetadata,
        @JsonProperty("temporal_config") TemporalConfig temporalConfig,
        @JsonProperty("cohort_config") CohortConfig cohortConfig,
        @JsonProperty("label_config") LabelConfig labelConfig,
        @JsonProperty("grid_config") Map<String, Map<String, Object>> gridConfig,
        @JsonProperty("feature_aggregations") List<AggregationSpec> featureAggregations,
        @JsonProperty("feature_group_definition") FeatureGroupDefinition featureGroupDefinition,
        @JsonProperty("feature_group_strategies") List<FeatureGroupStrategy> featureGroupStrategies,
        @JsonProperty("model_group_keys") List<String> modelGroupKeys,
        @JsonProperty("scoring") ScoringConfig scoring
) {

    /** Model group key fields every configuration can supply. */
    public static final List<String> STANDARD_MODEL_GROUP_KEYS = List.of(
            "class_path", "parameters", "feature_names", "feature_groups", "cohort_name", "state",
            "label_name", "label_timespan", "training_as_of_date_frequency", "max_training_history",
            "random_seed");

    static final List<String> DEFAULT_MODEL_GROUP_KEYS = List.of(
            "class_path", "parameters", "feature_names", "feature_groups", "cohort_name", "state",
            "label_name", "label_timespan", "training_as_of_date_frequency", "max_training_history");

    public ExperimentConfig {
        if (temporalConfig == null) {
            throw new ConfigException("temporal_config is required");
        }
        if (labelConfig == null) {
            throw new ConfigException("label_config is required");
        }
        if (featureAggregations == null || featureAggregations.isEmpty()) {
            throw new ConfigException("feature_aggregations must declare at least one aggregation");
        }
        if (gridConfig == null || gridConfig.isEmpty()) {
            throw new ConfigException("grid_config must declare at least one model class");
        }
        if (randomSeed == null) {
            randomSeed = 0L;
        }
        userMetadata = userMetadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(userMetadata));
        if (cohortConfig == null) {
            cohortConfig = CohortConfig.labelledEntities();
        }
        Map<String, Map<String, Object>> grid = new LinkedHashMap<>();
        gridConfig.forEach((classPath, params) -> grid.put(classPath,
                params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params))));
        gridConfig = Collections.unmodifiableMap(grid);
        featureAggregations = List.copyOf(featureAggregations);
        if (featureGroupDefinition == null || featureGroupDefinition.prefix().isEmpty()) {
            List<String> prefixes = new ArrayList<>();
            featureAggregations.forEach(spec -> prefixes.add(spec.prefix()));
            featureGroupDefinition = new FeatureGroupDefinition(prefixes);
        }
        featureGroupStrategies = featureGroupStrategies == null || featureGroupStrategies.isEmpty()
                ? List.of(FeatureGroupStrategy.ALL)
                : List.copyOf(featureGroupStrategies);
        modelGroupKeys = modelGroupKeys == null || modelGroupKeys.isEmpty()
                ? DEFAULT_MODEL_GROUP_KEYS
                : List.copyOf(modelGroupKeys);
        if (scoring == null) {
            scoring = ScoringConfig.empty();
        }
    }

    public List<String> specPrefixes() {
        return featureAggregations.stream().map(AggregationSpec::prefix).toList();
    }
}
