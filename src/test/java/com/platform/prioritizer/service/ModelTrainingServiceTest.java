package com.platform.prioritizer.service;

import com.platform.prioritizer.domain.*;
import com.platform.prioritizer.error.FitException;
import com.platform.prioritizer.error.GridException;
import com.platform.prioritizer.error.ImputationException;
import com.platform.prioritizer.experiment.MetricGroup;
import com.platform.prioritizer.experiment.ScoringConfig;
import com.platform.prioritizer.fitting.FittedModel;
import com.platform.prioritizer.fitting.ModelFitter;
import com.platform.prioritizer.fitting.ModelFitterRegistry;
import com.platform.prioritizer.store.ResultSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ModelTrainingServiceTest {

    private static final LocalDateTime TRAIN_END = TestSpecs.date("2016-01-01");
    private static final ScoringConfig SCORING = new ScoringConfig(
            List.of(new MetricGroup(List.of(EvaluationMetric.PRECISION_AT), List.of(Threshold.topN(1)), null)),
            List.of(new MetricGroup(List.of(EvaluationMetric.ACCURACY), null, null)),
            null);

    @Mock
    private ModelFitterRegistry fitterRegistry;

    @Mock
    private ModelFitter fitter;

    @Mock
    private FittedModel model;

    @Mock
    private ResultSink resultSink;

    private ModelTrainingService service;
    private WorkUnit unit;
    private FeatureMatrix train;
    private FeatureMatrix test;

    @BeforeEach
    void setUp() {
        service = new ModelTrainingService(fitterRegistry, new ModelEvaluator(), resultSink);
        Timespan month = Timespan.parse("1month");
        Split split = new Split(TRAIN_END, List.of(TRAIN_END), List.of(TRAIN_END.plusMonths(1)),
                month, month, month, Timespan.parse("5y"), Timespan.parse("1y"), month);
        unit = new WorkUnit(split, new ModelConfiguration("dummy", Map.of("strategy", "prior")),
                new ModelGroupKey("abc"));
        train = matrix("train", TRAIN_END, 1, 0);
        test = matrix("test", TRAIN_END.plusMonths(1), 0, 1);
    }

    private static FeatureMatrix matrix(String id, LocalDateTime asOf, double... labels) {
        List<MatrixRow> rows = new ArrayList<>();
        for (int i = 0; i < labels.length; i++) {
            rows.add(new MatrixRow(String.valueOf(i + 1), asOf, new double[]{i}, labels[i]));
        }
        return new FeatureMatrix(id, List.of("f"), rows);
    }

    // --- Happy path ---

    @Test
    void testUnitRunsToDone() {
        when(fitterRegistry.resolve("dummy")).thenReturn(fitter);
        when(fitter.fit(unit.configuration(), train, 7L)).thenReturn(model);
        when(model.score(train)).thenReturn(new double[]{0.9, 0.1});
        when(model.score(test)).thenReturn(new double[]{0.2, 0.8});

        List<EvaluationResult> results = service.run(unit, train, test, SCORING, 0.0, 7L, () -> false);

        assertEquals(UnitState.DONE, unit.state());
        assertEquals(2, results.size());
        EvaluationResult accuracy = results.get(0);
        assertTrue(accuracy.training());
        assertEquals("accuracy", accuracy.metricName());
        EvaluationResult precision = results.get(1);
        assertFalse(precision.training());
        assertEquals(1.0, precision.value());
        assertEquals("1_abs", precision.parameter());
        verify(resultSink).recordEvaluations(unit.modelGroupKey(), unit.split().id(), results);
        verify(model).close();
    }

    // --- Unit failures ---

    @Test
    void testFitFailureMarksUnitFailed() {
        when(fitterRegistry.resolve("dummy")).thenReturn(fitter);
        when(fitter.fit(any(), any(), anyLong())).thenThrow(new FitException("single label class"));

        List<EvaluationResult> results = service.run(unit, train, test, SCORING, 0.0, 7L, () -> false);

        assertTrue(results.isEmpty());
        assertEquals(UnitState.FAILED, unit.state());
        assertEquals("FitException: single label class", unit.failureReason());
        verifyNoInteractions(resultSink);
    }

    @Test
    void testUnknownClassMarksUnitFailed() {
        when(fitterRegistry.resolve("dummy")).thenThrow(new GridException("no fitter"));

        assertTrue(service.run(unit, train, test, SCORING, 0.0, 7L, () -> false).isEmpty());
        assertEquals(UnitState.FAILED, unit.state());
    }

    @Test
    void testScoringErrorClosesModel() {
        when(fitterRegistry.resolve("dummy")).thenReturn(fitter);
        when(fitter.fit(any(), any(), anyLong())).thenReturn(model);
        when(model.score(train)).thenThrow(new IllegalStateException("booster gone"));

        assertTrue(service.run(unit, train, test, SCORING, 0.0, 7L, () -> false).isEmpty());

        assertEquals(UnitState.FAILED, unit.state());
        assertEquals("IllegalStateException: booster gone", unit.failureReason());
        verify(model).close();
    }

    @Test
    void testRunFatalErrorPropagates() {
        when(fitterRegistry.resolve("dummy")).thenReturn(fitter);
        when(fitter.fit(any(), any(), anyLong())).thenThrow(new ImputationException("no rule"));

        assertThrows(ImputationException.class,
                () -> service.run(unit, train, test, SCORING, 0.0, 7L, () -> false));
    }

    // --- Cancellation ---

    @Test
    void testCancelledBeforeStart() {
        assertTrue(service.run(unit, train, test, SCORING, 0.0, 7L, () -> true).isEmpty());

        assertEquals(UnitState.FAILED, unit.state());
        assertEquals(ModelTrainingService.CANCELLED, unit.failureReason());
        verifyNoInteractions(fitterRegistry, resultSink);
    }

    @Test
    void testCancelledBetweenStages() {
        when(fitterRegistry.resolve("dummy")).thenReturn(fitter);
        when(fitter.fit(any(), any(), anyLong())).thenReturn(model);
        AtomicInteger checks = new AtomicInteger();

        // the first check passes, the one after fitting sees the cancellation
        service.run(unit, train, test, SCORING, 0.0, 7L, () -> checks.incrementAndGet() > 1);

        assertEquals(UnitState.FAILED, unit.state());
        assertEquals(ModelTrainingService.CANCELLED, unit.failureReason());
        verify(model, never()).score(any());
        verify(model).close();
        verifyNoInteractions(resultSink);
    }
}
