package com.platform.prioritizer.service;

import com.platform.prioritizer.domain.Timespan;
import com.platform.prioritizer.error.ResolutionException;
import com.platform.prioritizer.experiment.CohortConfig;
import com.platform.prioritizer.experiment.LabelConfig;
import com.platform.prioritizer.service.CohortLabelResolver.LabelSet;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.platform.prioritizer.service.FakeQueryExecutor.row;
import static org.junit.jupiter.api.Assertions.*;

class CohortLabelResolverTest {

    private static final LocalDateTime AS_OF = TestSpecs.date("2015-01-01");
    private static final Timespan MONTH = Timespan.parse("1month");
    private static final LabelConfig LABELS = new LabelConfig("select entity_id, outcome from labels", "failed", null);

    @Test
    void testLabelledEntitiesFormTheCohort() {
        FakeQueryExecutor db = new FakeQueryExecutor().on("from labels", List.of(
                row("entity_id", 10, "outcome", 1),
                row("entity_id", 9, "outcome", false),
                row("entity_id", 3, "outcome", null)));
        CohortLabelResolver resolver = new CohortLabelResolver(db);

        LabelSet set = resolver.resolve(CohortConfig.labelledEntities(), LABELS, AS_OF, MONTH);

        assertEquals(List.of("3", "9", "10"), List.copyOf(set.cohort()));
        assertEquals(Map.of("10", 1.0, "9", 0.0), set.labels());
        assertFalse(set.hasLabel("3"));
        assertEquals(1, set.missingCount());

        Map<String, Object> params = db.calls().get(0).params();
        assertEquals(AS_OF, params.get("as_of_date"));
        assertEquals("1 month", params.get("label_timespan"));
    }

    @Test
    void testCohortQueryRestrictsLabels() {
        FakeQueryExecutor db = new FakeQueryExecutor()
                .on("from labels", List.of(
                        row("entity_id", 1, "outcome", 1),
                        row("entity_id", 2, "outcome", 0),
                        row("entity_id", 3, "outcome", 1)))
                .on("from facilities", List.of(
                        row("entity_id", 1),
                        row("entity_id", 2),
                        row("entity_id", 4)));
        CohortLabelResolver resolver = new CohortLabelResolver(db);
        CohortConfig cohort = new CohortConfig("select entity_id from facilities where opened < :as_of_date", "active");

        LabelSet set = resolver.resolve(cohort, LABELS, AS_OF, MONTH);

        assertEquals(Set.of("1", "2", "4"), set.cohort());
        assertEquals(Map.of("1", 1.0, "2", 0.0), set.labels());
        assertEquals(1, set.missingCount());
        assertEquals(AS_OF, db.calls().get(1).params().get("as_of_date"));
    }

    @Test
    void testIdsDifferingOnlyByLeadingZerosAreDistinctEntities() {
        FakeQueryExecutor db = new FakeQueryExecutor().on("from labels", List.of(
                row("entity_id", "007", "outcome", 0),
                row("entity_id", "7", "outcome", 1)));

        LabelSet set = new CohortLabelResolver(db).resolve(CohortConfig.labelledEntities(), LABELS, AS_OF, MONTH);

        assertEquals(List.of("007", "7"), List.copyOf(set.cohort()));
        assertEquals(Map.of("007", 0.0, "7", 1.0), set.labels());
    }

    // --- Failures ---

    @Test
    void testDuplicateLabelIsResolutionError() {
        FakeQueryExecutor db = new FakeQueryExecutor().on("from labels", List.of(
                row("entity_id", 1, "outcome", 1),
                row("entity_id", 1, "outcome", null)));

        ResolutionException e = assertThrows(ResolutionException.class,
                () -> new CohortLabelResolver(db).resolve(CohortConfig.labelledEntities(), LABELS, AS_OF, MONTH));
        assertFalse(e.isRunFatal());
    }

    @Test
    void testMissingEntityIdColumn() {
        FakeQueryExecutor db = new FakeQueryExecutor().on("from labels", List.of(row("id", 1, "outcome", 1)));

        assertThrows(ResolutionException.class,
                () -> new CohortLabelResolver(db).resolve(CohortConfig.labelledEntities(), LABELS, AS_OF, MONTH));
    }

    @Test
    void testNonNumericOutcome() {
        FakeQueryExecutor db = new FakeQueryExecutor().on("from labels", List.of(row("entity_id", 1, "outcome", "yes")));

        assertThrows(ResolutionException.class,
                () -> new CohortLabelResolver(db).resolve(CohortConfig.labelledEntities(), LABELS, AS_OF, MONTH));
    }
}
