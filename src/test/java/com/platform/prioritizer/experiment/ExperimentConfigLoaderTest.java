package com.platform.prioritizer.experiment;

import com.platform.prioritizer.domain.AggregationSpec;
import com.platform.prioritizer.domain.EvaluationMetric;
import com.platform.prioritizer.domain.FeatureGroupStrategy;
import com.platform.prioritizer.domain.Threshold;
import com.platform.prioritizer.domain.Timespan;
import com.platform.prioritizer.error.ConfigException;
import com.platform.prioritizer.error.ImputationException;
import com.platform.prioritizer.error.SpecException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExperimentConfigLoaderTest {

    private final ExperimentConfigLoader loader = new ExperimentConfigLoader();
    private String fixture;

    @BeforeEach
    void setUp() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/experiment-test.yaml")) {
            assertNotNull(in, "experiment-test.yaml missing from test resources");
            fixture = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private String fixtureWith(String from, String to) {
        assertTrue(fixture.contains(from), "fixture does not contain: " + from);
        return fixture.replace(from, to);
    }

    // --- Happy path ---

    @Test
    void testLoadsFixture() {
        ExperimentConfig config = loader.parse(fixture);

        assertEquals("unit_test", config.modelComment());
        assertEquals(42L, config.randomSeed());
        assertEquals("tests", config.userMetadata().get("author"));
        assertEquals(LocalDateTime.of(2014, 1, 2, 0, 0), config.temporalConfig().labelStartTime());
        assertEquals(List.of(Timespan.parse("1month")), config.temporalConfig().trainingAsOfDateFrequencies());
        assertEquals(List.of(Timespan.parse("1y")), config.temporalConfig().testDurations());
    }

    @Test
    void testDefaultsAreApplied() {
        ExperimentConfig config = loader.parse(fixture);

        assertEquals(CohortConfig.DEFAULT_NAME, config.cohortConfig().name());
        assertFalse(config.cohortConfig().hasQuery());
        assertEquals(List.of("inspections", "results"), config.featureGroupDefinition().prefix());
        assertEquals(List.of(FeatureGroupStrategy.ALL, FeatureGroupStrategy.LEAVE_ONE_IN),
                config.featureGroupStrategies());
        assertEquals(1.0, config.labelConfig().missingTrainLabelValue());
        assertNull(config.scoring().tieTolerance());
    }

    @Test
    void testAggregationsAreBound() {
        ExperimentConfig config = loader.parse(fixture);

        AggregationSpec inspections = config.featureAggregations().get(0);
        assertEquals("inspections", inspections.prefix());
        assertEquals(2, inspections.intervals().size());
        assertTrue(inspections.intervals().get(1).isUnbounded());
        assertEquals("*", inspections.aggregates().get(0).quantities().get("total"));

        AggregationSpec results = config.featureAggregations().get(1);
        assertEquals(1, results.intervals().size());
        assertTrue(results.hasUnresolvedChoices());
    }

    @Test
    void testScoringIsBound() {
        ExperimentConfig config = loader.parse(fixture);

        MetricGroup testing = config.scoring().testingMetricGroups().get(0);
        assertEquals(List.of(EvaluationMetric.PRECISION_AT), testing.metrics());
        assertEquals(List.of(Threshold.percentile(10.0), Threshold.topN(5)), testing.thresholds());

        MetricGroup training = config.scoring().trainingMetricGroups().get(0);
        assertEquals(List.of(Threshold.ALL_SELECTED), training.thresholds());
    }

    @Test
    void testLoadsFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("experiment.yaml");
        Files.writeString(file, fixture);

        assertEquals("unit_test", loader.load(file).modelComment());
    }

    @Test
    void testMissingFile(@TempDir Path dir) {
        assertThrows(ConfigException.class, () -> loader.load(dir.resolve("absent.yaml")));
    }

    // --- Validation ---

    @Test
    void testUnknownMetricIsConfigError() {
        String yaml = fixtureWith("metrics: ['accuracy']", "metrics: ['accuracy', 'lift@']");
        assertThrows(ConfigException.class, () -> loader.parse(yaml));
    }

    @Test
    void testUnknownModelGroupKeyIsConfigError() {
        String yaml = fixtureWith("'feature_groups', 'author'", "'feature_groups', 'colour'");
        ConfigException e = assertThrows(ConfigException.class, () -> loader.parse(yaml));
        assertTrue(e.getMessage().contains("colour"));
    }

    @Test
    void testAmbiguousTimespanIsConfigError() {
        String yaml = fixtureWith("test_as_of_date_frequencies: '3month'", "test_as_of_date_frequencies: '3m'");
        assertThrows(ConfigException.class, () -> loader.parse(yaml));
    }

    @Test
    void testUnresolvableImputationFailsAtLoad() {
        String yaml = fixtureWith(
                "aggregates_imputation:\n      all:\n        type: 'zero'",
                "aggregates_imputation:\n      avg:\n        type: 'zero'");
        assertThrows(ImputationException.class, () -> loader.parse(yaml));
    }

    @Test
    void testUnknownImputationTypeIsSpecError() {
        String yaml = fixtureWith("type: 'mean'", "type: 'median'");
        assertThrows(SpecException.class, () -> loader.parse(yaml));
    }

    @Test
    void testCategoricalWithoutChoicesIsSpecError() {
        String yaml = fixtureWith("choice_query: 'select distinct result from events'", "choices: []");
        assertThrows(SpecException.class, () -> loader.parse(yaml));
    }

    @Test
    void testUnknownFeatureGroupPrefix() {
        String yaml = fixture + "\nfeature_group_definition:\n  prefix: ['inspections', 'weather']\n";
        assertThrows(ConfigException.class, () -> loader.parse(yaml));
    }

    @Test
    void testSpellingsOfTheSameIntervalAreRepeats() {
        String yaml = fixtureWith("intervals: ['1y', 'all']", "intervals: ['1y', '1 y', 'all']");
        SpecException e = assertThrows(SpecException.class, () -> loader.parse(yaml));
        assertTrue(e.getMessage().contains("'1y'"));
    }

    @Test
    void testEmptyThresholdEntryIsConfigError() {
        String percentiles = fixtureWith("percentiles: 10.0", "percentiles: [10.0, ~]");
        assertThrows(ConfigException.class, () -> loader.parse(percentiles));

        String topN = fixtureWith("top_n: [5]", "top_n: [5, null]");
        assertThrows(ConfigException.class, () -> loader.parse(topN));
    }

    @Test
    void testMalformedYaml() {
        assertThrows(ConfigException.class, () -> loader.parse("temporal_config: [unclosed"));
    }
}
