package com.platform.prioritizer.service;

import com.platform.prioritizer.domain.EvaluationResult;
import com.platform.prioritizer.domain.FeatureMatrix;
import com.platform.prioritizer.domain.UnitState;
import com.platform.prioritizer.domain.WorkUnit;
import com.platform.prioritizer.error.PrioritizerException;
import com.platform.prioritizer.experiment.ScoringConfig;
import com.platform.prioritizer.fitting.FittedModel;
import com.platform.prioritizer.fitting.ModelFitter;
import com.platform.prioritizer.fitting.ModelFitterRegistry;
import com.platform.prioritizer.store.ResultSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Fits, scores and evaluates one work unit, moving it through its states.
 * <p>
 * Failures scoped to the unit leave it {@code FAILED} with a reason and an empty
 * result list; run-fatal failures propagate. The cancellation flag is checked
 * between stages.
 */
@Service
public class ModelTrainingService {

    private static final Logger log = LoggerFactory.getLogger(ModelTrainingService.class);

    static final String CANCELLED = "cancelled";

    private final ModelFitterRegistry fitterRegistry;
    private final ModelEvaluator evaluator;
    private final ResultSink resultSink;

    public ModelTrainingService(ModelFitterRegistry fitterRegistry, ModelEvaluator evaluator, ResultSink resultSink) {
        this.fitterRegistry = fitterRegistry;
        this.evaluator = evaluator;
        this.resultSink = resultSink;
    }

    public List<EvaluationResult> run(WorkUnit unit, FeatureMatrix train, FeatureMatrix test,
                                      ScoringConfig scoring, double tieTolerance, long seed,
                                      BooleanSupplier cancelled) {
        String splitId = unit.split().id();
        try {
            if (stop(unit, cancelled)) return List.of();
            ModelFitter fitter = fitterRegistry.resolve(unit.configuration().classPath());

            long t0 = System.currentTimeMillis();
            try (FittedModel model = fitter.fit(unit.configuration(), train, seed)) {
                unit.advance(UnitState.FITTED);
                log.debug("Fitted {} in {} ms", unit.describe(), System.currentTimeMillis() - t0);
                if (stop(unit, cancelled)) return List.of();

                double[] trainScores = model.score(train);
                unit.advance(UnitState.SCORED_TRAIN);
                if (stop(unit, cancelled)) return List.of();

                double[] testScores = model.score(test);
                unit.advance(UnitState.SCORED_TEST);
                if (stop(unit, cancelled)) return List.of();

                List<EvaluationResult> results = new ArrayList<>();
                results.addAll(evaluator.evaluate(unit.modelGroupKey(), splitId, train, trainScores,
                        scoring.trainingMetricGroups(), true, tieTolerance));
                results.addAll(evaluator.evaluate(unit.modelGroupKey(), splitId, test, testScores,
                        scoring.testingMetricGroups(), false, tieTolerance));
                unit.advance(UnitState.EVALUATED);

                resultSink.recordEvaluations(unit.modelGroupKey(), splitId, results);
                unit.advance(UnitState.DONE);
                log.info("Unit {} done: {} evaluations", unit.describe(), results.size());
                return List.copyOf(results);
            }
        } catch (PrioritizerException e) {
            if (e.isRunFatal()) {
                throw e;
            }
            failUnit(unit, e);
            return List.of();
        } catch (RuntimeException e) {
            failUnit(unit, e);
            return List.of();
        }
    }

    private static boolean stop(WorkUnit unit, BooleanSupplier cancelled) {
        if (cancelled.getAsBoolean()) {
            log.info("Unit {} cancelled in state {}", unit.describe(), unit.state());
            unit.fail(CANCELLED);
            return true;
        }
        return false;
    }

    private static void failUnit(WorkUnit unit, RuntimeException e) {
        log.error("Unit {} failed in state {}", unit.describe(), unit.state(), e);
        if (!unit.state().isTerminal()) {
            unit.fail(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
