package com.platform.prioritizer.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.platform.prioritizer.error.ConfigException;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Time boundaries and cadences that drive split generation.
 * <p>
 * Validated on construction: {@code feature_start_time <= feature_end_time} and
 * {@code label_start_time <= label_end_time <= feature_end_time}; every list is non-empty.
 */
public record TemporalConfig(
        LocalDateTime featureStartTime,
        LocalDateTime featureEndTime,
        LocalDateTime labelStartTime,
        LocalDateTime labelEndTime,
        Timespan modelUpdateFrequency,
        List<Timespan> trainingAsOfDateFrequencies,
        List<Timespan> testAsOfDateFrequencies,
        List<Timespan> trainingLabelTimespans,
        List<Timespan> testLabelTimespans,
        List<Timespan> testDurations,
        List<Timespan> maxTrainingHistories
) {

    public TemporalConfig {
        if (featureStartTime == null || featureEndTime == null
                || labelStartTime == null || labelEndTime == null) {
            throw new ConfigException("temporal_config requires feature and label start/end times");
        }
        if (featureStartTime.isAfter(featureEndTime)) {
            throw new ConfigException("feature_start_time (" + featureStartTime
                    + ") is after feature_end_time (" + featureEndTime + ")");
        }
        if (labelStartTime.isAfter(labelEndTime)) {
            throw new ConfigException("label_start_time (" + labelStartTime
                    + ") is after label_end_time (" + labelEndTime + ")");
        }
        if (labelEndTime.isAfter(featureEndTime)) {
            throw new ConfigException("label_end_time (" + labelEndTime
                    + ") is after feature_end_time (" + featureEndTime + ")");
        }
        if (modelUpdateFrequency == null) {
            throw new ConfigException("temporal_config.model_update_frequency is required");
        }
        trainingAsOfDateFrequencies = required("training_as_of_date_frequencies", trainingAsOfDateFrequencies);
        testAsOfDateFrequencies = required("test_as_of_date_frequencies", testAsOfDateFrequencies);
        trainingLabelTimespans = required("training_label_timespans", trainingLabelTimespans);
        testLabelTimespans = required("test_label_timespans", testLabelTimespans);
        testDurations = required("test_durations", testDurations);
        maxTrainingHistories = required("max_training_histories", maxTrainingHistories);
    }

    @JsonCreator
    public static TemporalConfig fromConfig(
            @JsonProperty("feature_start_time") String featureStartTime,
            @JsonProperty("feature_end_time") String featureEndTime,
            @JsonProperty("label_start_time") String labelStartTime,
            @JsonProperty("label_end_time") String labelEndTime,
            @JsonProperty("model_update_frequency") Timespan modelUpdateFrequency,
            @JsonProperty("training_as_of_date_frequencies") List<Timespan> trainingAsOfDateFrequencies,
            @JsonProperty("test_as_of_date_frequencies") List<Timespan> testAsOfDateFrequencies,
            @JsonProperty("training_label_timespans") List<Timespan> trainingLabelTimespans,
            @JsonProperty("test_label_timespans") List<Timespan> testLabelTimespans,
            @JsonProperty("test_durations") List<Timespan> testDurations,
            @JsonProperty("max_training_histories") List<Timespan> maxTrainingHistories) {
        return new TemporalConfig(
                TemporalValues.parseConfigInstant("feature_start_time", featureStartTime),
                TemporalValues.parseConfigInstant("feature_end_time", featureEndTime),
                TemporalValues.parseConfigInstant("label_start_time", labelStartTime),
                TemporalValues.parseConfigInstant("label_end_time", labelEndTime),
                modelUpdateFrequency,
                trainingAsOfDateFrequencies,
                testAsOfDateFrequencies,
                trainingLabelTimespans,
                testLabelTimespans,
                testDurations,
                maxTrainingHistories);
    }

    private static List<Timespan> required(String field, List<Timespan> values) {
        if (values == null || values.isEmpty()) {
            throw new ConfigException("temporal_config." + field + " must not be empty");
        }
        if (values.contains(null)) {
            throw new ConfigException("temporal_config." + field + " contains an empty entry");
        }
        return List.copyOf(values);
    }
}
