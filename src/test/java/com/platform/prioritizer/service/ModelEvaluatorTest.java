package com.platform.prioritizer.service;

import com.platform.prioritizer.domain.EvaluationMetric;
import com.platform.prioritizer.domain.EvaluationResult;
import com.platform.prioritizer.domain.FeatureMatrix;
import com.platform.prioritizer.domain.MatrixRow;
import com.platform.prioritizer.domain.ModelGroupKey;
import com.platform.prioritizer.domain.Threshold;
import com.platform.prioritizer.experiment.MetricGroup;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.*;

import static com.platform.prioritizer.service.TestSpecs.date;
import static org.junit.jupiter.api.Assertions.*;

class ModelEvaluatorTest {

    private static final ModelGroupKey KEY = new ModelGroupKey("key");
    private static final LocalDateTime AS_OF = date("2017-01-01");

    private final ModelEvaluator evaluator = new ModelEvaluator();

    /** Entity ids 1..n; {@code positive} holds the ids labelled 1. */
    private static FeatureMatrix matrix(int n, Set<Integer> positive) {
        List<MatrixRow> rows = new ArrayList<>();
        for (int id = 1; id <= n; id++) {
            rows.add(new MatrixRow(String.valueOf(id), AS_OF, new double[]{id}, positive.contains(id) ? 1 : 0));
        }
        return new FeatureMatrix("test", List.of("f"), rows);
    }

    private static MetricGroup group(EvaluationMetric metric, Threshold... thresholds) {
        return new MetricGroup(List.of(metric), List.of(thresholds), null);
    }

    private EvaluationResult single(FeatureMatrix matrix, double[] scores, MetricGroup group, double tieTolerance) {
        List<EvaluationResult> results = evaluator.evaluate(KEY, "split", matrix, scores, List.of(group), false,
                tieTolerance);
        assertEquals(1, results.size());
        return results.get(0);
    }

    // --- Thresholds ---

    @Test
    void testPrecisionAtPercentile() {
        Set<Integer> positive = new HashSet<>();
        for (int id = 91; id <= 100; id++) positive.add(id);
        double[] scores = new double[100];
        for (int i = 0; i < 100; i++) scores[i] = (i + 1) / 100.0;

        EvaluationResult result = single(matrix(100, positive), scores,
                group(EvaluationMetric.PRECISION_AT, Threshold.percentile(10.0)), 0.0);

        assertEquals("precision@", result.metricName());
        assertEquals("10.0_pct", result.parameter());
        assertEquals(1.0, result.value());
        assertEquals(100, result.numLabeledExamples());
        assertEquals(10, result.numLabeledAboveThreshold());
        assertEquals(10, result.numPositiveLabels());
    }

    @Test
    void testTiesBreakByEntityId() {
        FeatureMatrix matrix = matrix(20, Set.of(1, 2, 3, 4, 5));
        double[] scores = new double[20];
        Arrays.fill(scores, 0.5);
        MetricGroup topTen = group(EvaluationMetric.PRECISION_AT, Threshold.topN(10));

        EvaluationResult result = single(matrix, scores, topTen, 0.0);

        assertEquals("10_abs", result.parameter());
        assertEquals(10, result.numLabeledAboveThreshold());
        assertEquals(0.5, result.value());

        // same rows in another order rank the same way
        List<MatrixRow> reversed = new ArrayList<>(matrix.rows());
        Collections.reverse(reversed);
        FeatureMatrix shuffled = new FeatureMatrix("test", List.of("f"), reversed);
        assertEquals(result.value(), single(shuffled, scores, topTen, 0.0).value());
    }

    @Test
    void testWorstAndBestTieOrderings() {
        FeatureMatrix matrix = matrix(20, Set.of(3, 12, 15, 18));
        double[] scores = new double[20];
        Arrays.fill(scores, 0.5);

        EvaluationResult precision = single(matrix, scores,
                group(EvaluationMetric.PRECISION_AT, Threshold.topN(5)), 0.0);

        assertEquals(0.2, precision.value(), 1e-9);
        assertEquals(0.0, precision.worstValue(), 1e-9);
        assertEquals(0.8, precision.bestValue(), 1e-9);

        // rank metrics average over ties, so every ordering agrees
        EvaluationResult auc = single(matrix, scores, group(EvaluationMetric.ROC_AUC), 0.0);
        assertEquals(0.5, auc.value(), 1e-9);
        assertEquals(0.5, auc.worstValue(), 1e-9);
        assertEquals(0.5, auc.bestValue(), 1e-9);
    }

    @Test
    void testWorstAndBestMatchValueWithoutTies() {
        double[] scores = new double[10];
        for (int i = 0; i < 10; i++) scores[i] = (i + 1) / 10.0;

        EvaluationResult recall = single(matrix(10, Set.of(2, 9, 10)), scores,
                group(EvaluationMetric.RECALL_AT, Threshold.topN(3)), 0.0);

        assertEquals(2.0 / 3, recall.value(), 1e-9);
        assertEquals(recall.value(), recall.worstValue(), 1e-9);
        assertEquals(recall.value(), recall.bestValue(), 1e-9);
    }

    @Test
    void testRankingOrder() {
        List<MatrixRow> rows = List.of(
                new MatrixRow("10", AS_OF, new double[]{0}, 0),
                new MatrixRow("9", date("2017-02-01"), new double[]{0}, 0),
                new MatrixRow("9", AS_OF, new double[]{0}, 0),
                new MatrixRow("2", AS_OF, new double[]{0}, 0));
        FeatureMatrix matrix = new FeatureMatrix("m", List.of("f"), rows);

        int[] order = ModelEvaluator.ranking(matrix, new double[]{0.5, 0.5, 0.5, 0.9});

        assertArrayEquals(new int[]{3, 2, 1, 0}, order);
    }

    @Test
    void testTieTolerance() {
        double[] ranked = {5, 4, 3, 3, 3, 1};

        assertEquals(3, ModelEvaluator.selectedCount(ranked, 3, 0.0));
        assertEquals(5, ModelEvaluator.selectedCount(ranked, 3, 1.0));
        assertEquals(3, ModelEvaluator.selectedCount(ranked, 3, 0.5));
        assertEquals(2, ModelEvaluator.selectedCount(ranked, 2, 0.0));
        assertEquals(6, ModelEvaluator.selectedCount(ranked, 10, 0.0));
        assertEquals(0, ModelEvaluator.selectedCount(ranked, 0, 1.0));
    }

    @Test
    void testParameterString() {
        Map<String, Object> beta = Map.of("beta", 0.5);

        assertEquals("0.5_beta/10_abs", ModelEvaluator.parameterString(beta, Threshold.topN(10)));
        assertEquals("0.5_beta", ModelEvaluator.parameterString(beta, Threshold.ALL_SELECTED));
        assertEquals("5.0_pct", ModelEvaluator.parameterString(Map.of(), Threshold.percentile(5)));
        assertEquals("", ModelEvaluator.parameterString(Map.of(), Threshold.ALL_SELECTED));
    }

    // --- Metrics ---

    @Test
    void testConfusionCounts() {
        FeatureMatrix matrix = matrix(6, Set.of(1, 2, 5));
        double[] scores = {0.9, 0.2, 0.8, 0.1, 0.7, 0.3};
        MetricGroup group = new MetricGroup(List.of(
                EvaluationMetric.TRUE_POSITIVES_AT, EvaluationMetric.FALSE_POSITIVES_AT,
                EvaluationMetric.TRUE_NEGATIVES_AT, EvaluationMetric.FALSE_NEGATIVES_AT,
                EvaluationMetric.RECALL_AT, EvaluationMetric.FPR_AT),
                List.of(Threshold.topN(3)), null);

        List<EvaluationResult> results = evaluator.evaluate(KEY, "split", matrix, scores, List.of(group), true, 0.0);

        // top three are entities 1, 3 and 5
        assertEquals(List.of(2.0, 1.0, 2.0, 1.0, 2.0 / 3, 1.0 / 3),
                results.stream().map(EvaluationResult::value).toList());
        assertTrue(results.stream().allMatch(EvaluationResult::training));
    }

    @Test
    void testFbetaUsesParameter() {
        FeatureMatrix matrix = matrix(4, Set.of(1, 4));
        double[] scores = {0.9, 0.8, 0.2, 0.1};
        MetricGroup group = new MetricGroup(List.of(EvaluationMetric.FBETA_AT), List.of(Threshold.topN(2)),
                List.of(Map.of("beta", 0.5)));

        EvaluationResult result = single(matrix, scores, group, 0.0);

        // precision 0.5, recall 0.5
        assertEquals(0.5, result.value(), 1e-12);
        assertEquals("0.5_beta/2_abs", result.parameter());
    }

    @Test
    void testRocAuc() {
        FeatureMatrix matrix = matrix(4, Set.of(1, 2));
        MetricGroup auc = group(EvaluationMetric.ROC_AUC, Threshold.ALL_SELECTED);

        assertEquals(1.0, single(matrix, new double[]{0.9, 0.8, 0.2, 0.1}, auc, 0.0).value(), 1e-12);
        assertEquals(0.0, single(matrix, new double[]{0.1, 0.2, 0.8, 0.9}, auc, 0.0).value(), 1e-12);
        assertEquals(0.5, single(matrix, new double[]{0.5, 0.5, 0.5, 0.5}, auc, 0.0).value(), 1e-12);
        assertEquals(0.75, single(matrix, new double[]{0.9, 0.3, 0.5, 0.1}, auc, 0.0).value(), 1e-12);
    }

    @Test
    void testAveragePrecision() {
        FeatureMatrix matrix = matrix(3, Set.of(1, 3));

        EvaluationResult result = single(matrix, new double[]{0.9, 0.5, 0.1},
                group(EvaluationMetric.AVERAGE_PRECISION, Threshold.ALL_SELECTED), 0.0);

        assertEquals(0.5 + 0.5 * 2.0 / 3, result.value(), 1e-12);
        assertEquals("", result.parameter());
    }

    @Test
    void testUndefinedMetricsAreNaN() {
        FeatureMatrix noPositives = matrix(4, Set.of());
        double[] scores = {0.4, 0.3, 0.2, 0.1};

        assertTrue(Double.isNaN(single(noPositives, scores,
                group(EvaluationMetric.RECALL_AT, Threshold.topN(2)), 0.0).value()));
        assertTrue(Double.isNaN(single(noPositives, scores,
                group(EvaluationMetric.ROC_AUC, Threshold.ALL_SELECTED), 0.0).value()));
        assertEquals(0.0, single(noPositives, scores,
                group(EvaluationMetric.PRECISION_AT, Threshold.topN(2)), 0.0).value());

        FeatureMatrix empty = new FeatureMatrix("empty", List.of("f"), List.of());
        EvaluationResult onEmpty = single(empty, new double[0],
                group(EvaluationMetric.ACCURACY, Threshold.ALL_SELECTED), 0.0);
        assertTrue(Double.isNaN(onEmpty.value()));
        assertEquals(0, onEmpty.numLabeledExamples());
    }

    @Test
    void testScoreCountMustMatchRows() {
        assertThrows(IllegalArgumentException.class, () -> evaluator.evaluate(KEY, "split", matrix(3, Set.of(1)),
                new double[2], List.of(group(EvaluationMetric.ACCURACY, Threshold.ALL_SELECTED)), false, 0.0));
    }
}
