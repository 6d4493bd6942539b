package com.platform.prioritizer.store;

import com.platform.prioritizer.domain.EvaluationResult;
import com.platform.prioritizer.domain.ModelGroupKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class LoggingResultSink implements ResultSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingResultSink.class);

    @Override
    public void recordEvaluations(ModelGroupKey modelGroupKey, String splitId, List<EvaluationResult> results) {
        for (EvaluationResult r : results) {
            log.info("[{}] {} {} {}{} = {} (worst={}, best={}, labeled={}, above={}, positive={})",
                    splitId, modelGroupKey, r.training() ? "train" : "test",
                    r.metricName(), r.parameter().isEmpty() ? "" : " " + r.parameter(), r.value(),
                    r.worstValue(), r.bestValue(),
                    r.numLabeledExamples(), r.numLabeledAboveThreshold(), r.numPositiveLabels());
        }
    }
}
