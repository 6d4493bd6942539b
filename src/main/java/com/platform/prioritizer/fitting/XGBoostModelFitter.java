package com.platform.prioritizer.fitting;

import com.platform.prioritizer.domain.FeatureMatrix;
import com.platform.prioritizer.domain.ModelConfiguration;
import com.platform.prioritizer.error.FitException;
import ml.dmlc.xgboost4j.java.Booster;
import ml.dmlc.xgboost4j.java.DMatrix;
import ml.dmlc.xgboost4j.java.XGBoost;
import ml.dmlc.xgboost4j.java.XGBoostError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Gradient-boosted trees through XGBoost4J.
 * <p>
 * Hyperparameters are handed to the booster unchanged, except {@code num_round}
 * (alias {@code n_estimators}), which sets the number of boosting rounds. The
 * objective defaults to {@code binary:logistic}; the experiment seed is used unless
 * the grid sets {@code seed}. Each booster runs single-threaded since the worker
 * pool already spreads units over the available cores.
 */
@Component
public class XGBoostModelFitter extends AbstractModelFitter {

    private static final Logger log = LoggerFactory.getLogger(XGBoostModelFitter.class);

    static final int DEFAULT_ROUNDS = 100;

    @Override
    public Set<String> classIdentifiers() {
        return Set.of("xgboost", "ml.dmlc.xgboost4j.java.XGBoost");
    }

    @Override
    protected FittedModel doFit(ModelConfiguration configuration, FeatureMatrix train, long seed) {
        Map<String, Object> params = boosterParams(configuration.parameters(), seed);
        int rounds = rounds(configuration.parameters());

        DMatrix trainMatrix = null;
        try {
            trainMatrix = toDMatrix(train);
            float[] labels = new float[train.size()];
            double[] source = train.labels();
            for (int i = 0; i < labels.length; i++) {
                labels[i] = (float) source[i];
            }
            trainMatrix.setLabel(labels);

            Map<String, DMatrix> watches = new LinkedHashMap<>();
            long t0 = System.currentTimeMillis();
            Booster booster = XGBoost.train(trainMatrix, params, rounds, watches, null, null);
            log.debug("Trained {} rounds on {} rows x {} features in {} ms",
                    rounds, train.size(), train.featureCount(), System.currentTimeMillis() - t0);
            return new BoosterModel(booster, train.featureCount());
        } catch (XGBoostError e) {
            throw new FitException("XGBoost training failed for " + configuration.describe() + ": " + e.getMessage(), e);
        } finally {
            if (trainMatrix != null) {
                trainMatrix.dispose();
            }
        }
    }

    static Map<String, Object> boosterParams(Map<String, Object> gridParams, long seed) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("objective", "binary:logistic");
        params.put("nthread", 1);
        params.put("seed", seed);
        gridParams.forEach((name, value) -> {
            if (!name.equals("num_round") && !name.equals("n_estimators")) {
                params.put(name, value);
            }
        });
        return params;
    }

    static int rounds(Map<String, Object> gridParams) {
        String key = gridParams.containsKey("num_round") ? "num_round" : "n_estimators";
        int rounds = intParam(gridParams, key, DEFAULT_ROUNDS);
        if (rounds <= 0) {
            throw new FitException("Number of boosting rounds must be positive, got " + rounds);
        }
        return rounds;
    }

    private static DMatrix toDMatrix(FeatureMatrix matrix) throws XGBoostError {
        return new DMatrix(matrix.toRowMajorFloats(), matrix.size(), matrix.featureCount(), Float.NaN);
    }

    private static final class BoosterModel implements FittedModel {

        private final Booster booster;
        private final int featureCount;
        private volatile boolean closed;

        BoosterModel(Booster booster, int featureCount) {
            this.booster = booster;
            this.featureCount = featureCount;
        }

        @Override
        public double[] score(FeatureMatrix matrix) {
            if (closed) {
                throw new FitException("Model was closed before scoring " + matrix.matrixId());
            }
            if (matrix.featureCount() != featureCount) {
                throw new FitException("Model expects " + featureCount + " features, matrix "
                        + matrix.matrixId() + " has " + matrix.featureCount());
            }
            if (matrix.isEmpty()) {
                return new double[0];
            }
            DMatrix dm = null;
            try {
                dm = toDMatrix(matrix);
                float[][] predictions;
                synchronized (booster) {
                    predictions = booster.predict(dm);
                }
                double[] scores = new double[predictions.length];
                for (int i = 0; i < predictions.length; i++) {
                    scores[i] = predictions[i][0];
                }
                return scores;
            } catch (XGBoostError e) {
                throw new FitException("XGBoost scoring failed on " + matrix.matrixId() + ": " + e.getMessage(), e);
            } finally {
                if (dm != null) {
                    dm.dispose();
                }
            }
        }

        @Override
        public void close() {
            synchronized (booster) {
                closed = true;
                booster.dispose();
            }
        }
    }
}
