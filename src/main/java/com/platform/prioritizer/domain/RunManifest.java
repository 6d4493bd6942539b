package com.platform.prioritizer.domain;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Final account of an experiment run. A run that did not finish every unit says so
 * through {@link #status()}; partial success is never reported as {@code COMPLETED}.
 */
public record RunManifest(
        String runId,
        Status status,
        Instant startedAt,
        Instant completedAt,
        int splitCount,
        int resultCount,
        List<UnitOutcome> completedUnits,
        List<UnitOutcome> failedUnits,
        List<SkippedSplit> skippedSplits,
        List<GridFailure> gridFailures,
        String abortCause
) {

    public enum Status {
        COMPLETED, COMPLETED_WITH_FAILURES, CANCELLED, ABORTED
    }

    public record UnitOutcome(
            String splitId,
            String modelGroupKey,
            String classPath,
            Map<String, Object> parameters,
            UnitState state,
            String reason
    ) {}

    public record SkippedSplit(String splitId, String reason) {}

    public record GridFailure(String classPath, String reason) {}

    public RunManifest {
        completedUnits = List.copyOf(completedUnits);
        failedUnits = List.copyOf(failedUnits);
        skippedSplits = List.copyOf(skippedSplits);
        gridFailures = List.copyOf(gridFailures);
    }
}
