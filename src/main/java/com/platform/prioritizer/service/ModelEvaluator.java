package com.platform.prioritizer.service;

import com.platform.prioritizer.domain.EntityIds;
import com.platform.prioritizer.domain.EvaluationMetric;
import com.platform.prioritizer.domain.EvaluationResult;
import com.platform.prioritizer.domain.FeatureMatrix;
import com.platform.prioritizer.domain.MatrixRow;
import com.platform.prioritizer.domain.ModelGroupKey;
import com.platform.prioritizer.domain.Threshold;
import com.platform.prioritizer.experiment.MetricGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Threshold-based ranking metrics over scored matrices.
 * <p>
 * Rows are ranked by score descending, then entity id ascending, then as-of date
 * ascending. A threshold selects the top rows of that ranking; rows tied with the
 * last selected score are pulled in only while the selection grows by no more than
 * {@code tieTolerance} times the requested count.
 */
@Service
public class ModelEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ModelEvaluator.class);

    public List<EvaluationResult> evaluate(ModelGroupKey modelGroupKey, String splitId, FeatureMatrix matrix,
                                           double[] scores, List<MetricGroup> metricGroups,
                                           boolean training, double tieTolerance) {
        if (scores.length != matrix.size()) {
            throw new IllegalArgumentException("Got " + scores.length + " scores for " + matrix.size() + " rows");
        }
        Ranked ranked = Ranked.of(matrix, scores, ranking(matrix, scores));
        Ranked worst = Ranked.of(matrix, scores, ranking(matrix, scores, TieBreak.NEGATIVES_FIRST));
        Ranked best = Ranked.of(matrix, scores, ranking(matrix, scores, TieBreak.POSITIVES_FIRST));
        int n = ranked.size();
        int positives = ranked.positives();

        List<EvaluationResult> results = new ArrayList<>();
        for (MetricGroup group : metricGroups) {
            for (Threshold threshold : group.thresholds()) {
                int selected = selectedCount(ranked.scores(), threshold.count(n), tieTolerance);
                for (Map<String, Object> params : group.parameters()) {
                    String parameter = parameterString(params, threshold);
                    for (EvaluationMetric metric : group.metrics()) {
                        double value = ranked.compute(metric, params, selected);
                        if (Double.isNaN(value)) {
                            log.warn("{} {} is undefined on split {} ({} rows, {} positive); recording NaN",
                                    metric.configName(), parameter, splitId, n, positives);
                        }
                        results.add(new EvaluationResult(modelGroupKey, splitId, metric.configName(), parameter,
                                threshold, value, worst.compute(metric, params, selected),
                                best.compute(metric, params, selected), training, n, selected, positives));
                    }
                }
            }
        }
        return results;
    }

    // --- Ranking ---

    /**
     * How rows with equal scores are ordered before the entity-id tie-break.
     * {@code NEGATIVES_FIRST} gives the worst case for the model, {@code POSITIVES_FIRST} the best.
     */
    enum TieBreak {
        ENTITY_ID,
        NEGATIVES_FIRST,
        POSITIVES_FIRST
    }

    static int[] ranking(FeatureMatrix matrix, double[] scores) {
        return ranking(matrix, scores, TieBreak.ENTITY_ID);
    }

    static int[] ranking(FeatureMatrix matrix, double[] scores, TieBreak tieBreak) {
        List<MatrixRow> rows = matrix.rows();
        Comparator<Integer> order = Comparator.comparingDouble((Integer i) -> scores[i]).reversed();
        if (tieBreak == TieBreak.NEGATIVES_FIRST) {
            order = order.thenComparingDouble(i -> rows.get(i).label());
        } else if (tieBreak == TieBreak.POSITIVES_FIRST) {
            order = order.thenComparingDouble(i -> -rows.get(i).label());
        }
        order = order
                .thenComparing(i -> rows.get(i).entityId(), EntityIds.ORDER)
                .thenComparing(i -> rows.get(i).asOfDate());
        return IntStream.range(0, rows.size()).boxed().sorted(order).mapToInt(Integer::intValue).toArray();
    }

    /** Scores and labels laid out in one ranking. */
    record Ranked(double[] scores, boolean[] positive, int positives) {

        static Ranked of(FeatureMatrix matrix, double[] scores, int[] order) {
            double[] rankedScores = new double[order.length];
            boolean[] rankedPositive = new boolean[order.length];
            int positives = 0;
            for (int i = 0; i < order.length; i++) {
                rankedScores[i] = scores[order[i]];
                rankedPositive[i] = matrix.rows().get(order[i]).label() != 0;
                if (rankedPositive[i]) positives++;
            }
            return new Ranked(rankedScores, rankedPositive, positives);
        }

        int size() {
            return scores.length;
        }

        double compute(EvaluationMetric metric, Map<String, Object> params, int selected) {
            if (scores.length == 0) {
                return Double.NaN;
            }
            return ModelEvaluator.compute(metric, params, Confusion.of(positive, selected), scores, positive);
        }
    }

    /**
     * Size of the selection for {@code requested} rows out of scores sorted descending.
     */
    static int selectedCount(double[] rankedScores, int requested, double tieTolerance) {
        int n = rankedScores.length;
        if (requested <= 0 || requested >= n) {
            return Math.max(0, Math.min(requested, n));
        }
        double cutoff = rankedScores[requested - 1];
        if (Double.compare(rankedScores[requested], cutoff) != 0) {
            return requested;
        }
        int extended = requested;
        while (extended < n && Double.compare(rankedScores[extended], cutoff) == 0) {
            extended++;
        }
        return extended - requested <= tieTolerance * requested ? extended : requested;
    }

    static String parameterString(Map<String, Object> params, Threshold threshold) {
        List<String> parts = new ArrayList<>();
        params.forEach((key, value) -> parts.add(value + "_" + key));
        if (threshold.specified()) {
            parts.add(threshold.parameter());
        }
        return String.join("/", parts);
    }

    // --- Metrics ---

    record Confusion(int tp, int fp, int tn, int fn) {

        static Confusion of(boolean[] rankedPositive, int selected) {
            int tp = 0, fp = 0, tn = 0, fn = 0;
            for (int i = 0; i < rankedPositive.length; i++) {
                boolean predicted = i < selected;
                if (predicted && rankedPositive[i]) tp++;
                else if (predicted) fp++;
                else if (rankedPositive[i]) fn++;
                else tn++;
            }
            return new Confusion(tp, fp, tn, fn);
        }

        double precision() {
            return ratio(tp, tp + fp);
        }

        double recall() {
            return ratio(tp, tp + fn);
        }

        double fpr() {
            return ratio(fp, fp + tn);
        }

        double accuracy() {
            return ratio(tp + tn, tp + fp + tn + fn);
        }

        double fbeta(double beta) {
            double p = precision();
            double r = recall();
            if (Double.isNaN(p) || Double.isNaN(r)) return Double.NaN;
            if (p + r == 0) return 0.0;
            double b2 = beta * beta;
            return (1 + b2) * p * r / (b2 * p + r);
        }

        private static double ratio(int numerator, int denominator) {
            return denominator == 0 ? Double.NaN : (double) numerator / denominator;
        }
    }

    private static double compute(EvaluationMetric metric, Map<String, Object> params, Confusion c,
                                  double[] rankedScores, boolean[] rankedPositive) {
        return switch (metric) {
            case PRECISION_AT -> c.precision();
            case RECALL_AT -> c.recall();
            case FBETA_AT -> c.fbeta(beta(params));
            case F1 -> c.fbeta(1.0);
            case ACCURACY -> c.accuracy();
            case ROC_AUC -> rocAuc(rankedScores, rankedPositive);
            case AVERAGE_PRECISION -> averagePrecision(rankedScores, rankedPositive);
            case TRUE_POSITIVES_AT -> c.tp();
            case TRUE_NEGATIVES_AT -> c.tn();
            case FALSE_POSITIVES_AT -> c.fp();
            case FALSE_NEGATIVES_AT -> c.fn();
            case FPR_AT -> c.fpr();
        };
    }

    private static double beta(Map<String, Object> params) {
        Object beta = params.get("beta");
        if (beta == null) return 1.0;
        if (beta instanceof Number n) return n.doubleValue();
        return Double.parseDouble(beta.toString());
    }

    /**
     * Mann-Whitney AUC with average ranks for tied scores. Expects scores sorted descending.
     */
    static double rocAuc(double[] rankedScores, boolean[] rankedPositive) {
        int n = rankedScores.length;
        long positives = 0;
        for (boolean p : rankedPositive) if (p) positives++;
        long negatives = n - positives;
        if (positives == 0 || negatives == 0) {
            return Double.NaN;
        }
        // Ascending ranks: position i in descending order has rank n - i.
        double positiveRankSum = 0;
        int i = 0;
        while (i < n) {
            int j = i;
            while (j < n && Double.compare(rankedScores[j], rankedScores[i]) == 0) j++;
            double averageRank = ((n - i) + (n - j + 1)) / 2.0;
            for (int k = i; k < j; k++) {
                if (rankedPositive[k]) positiveRankSum += averageRank;
            }
            i = j;
        }
        double u = positiveRankSum - positives * (positives + 1) / 2.0;
        return u / ((double) positives * negatives);
    }

    /**
     * Step-wise average precision over distinct score thresholds. Expects scores sorted descending.
     */
    static double averagePrecision(double[] rankedScores, boolean[] rankedPositive) {
        int n = rankedScores.length;
        int positives = 0;
        for (boolean p : rankedPositive) if (p) positives++;
        if (positives == 0) {
            return Double.NaN;
        }
        double ap = 0;
        double previousRecall = 0;
        int tp = 0;
        int i = 0;
        while (i < n) {
            int j = i;
            while (j < n && Double.compare(rankedScores[j], rankedScores[i]) == 0) {
                if (rankedPositive[j]) tp++;
                j++;
            }
            double precision = (double) tp / j;
            double recall = (double) tp / positives;
            ap += (recall - previousRecall) * precision;
            previousRecall = recall;
            i = j;
        }
        return ap;
    }
}
