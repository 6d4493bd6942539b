package com.platform.prioritizer.service;

import com.platform.prioritizer.domain.EvaluationResult;
import com.platform.prioritizer.domain.RunManifest;
import com.platform.prioritizer.domain.RunManifest.GridFailure;
import com.platform.prioritizer.domain.RunManifest.SkippedSplit;
import com.platform.prioritizer.domain.RunManifest.UnitOutcome;
import com.platform.prioritizer.domain.UnitState;
import com.platform.prioritizer.domain.WorkUnit;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable state of one run, shared between the orchestrating thread and the workers.
 * Results are append-only.
 */
public class RunContext {

    private final String runId;
    private final Instant startedAt = Instant.now();
    private final List<EvaluationResult> results = new CopyOnWriteArrayList<>();
    private final List<UnitOutcome> completedUnits = new CopyOnWriteArrayList<>();
    private final List<UnitOutcome> failedUnits = new CopyOnWriteArrayList<>();
    private final List<SkippedSplit> skippedSplits = new CopyOnWriteArrayList<>();
    private final List<GridFailure> gridFailures = new CopyOnWriteArrayList<>();
    private final AtomicInteger splitCount = new AtomicInteger();
    private final AtomicInteger splitErrors = new AtomicInteger();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicReference<String> abortCause = new AtomicReference<>();

    public RunContext(String runId) {
        this.runId = runId;
    }

    public String runId() {
        return runId;
    }

    public void cancel() {
        cancelled.set(true);
    }

    /** True once the run was cancelled or aborted: no new unit may start. */
    public boolean isStopped() {
        return cancelled.get() || abortCause.get() != null;
    }

    /** Records the first run-fatal cause; later ones are ignored. */
    public void abort(Throwable cause) {
        abortCause.compareAndSet(null, cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }

    public String abortCause() {
        return abortCause.get();
    }

    void splitStarted() {
        splitCount.incrementAndGet();
    }

    void skipSplit(String splitId, String reason, boolean error) {
        skippedSplits.add(new SkippedSplit(splitId, reason));
        if (error) {
            splitErrors.incrementAndGet();
        }
    }

    void gridFailure(String classPath, String reason) {
        gridFailures.add(new GridFailure(classPath, reason));
    }

    void record(WorkUnit unit, List<EvaluationResult> unitResults) {
        UnitOutcome outcome = new UnitOutcome(unit.split().id(), unit.modelGroupKey().value(),
                unit.configuration().classPath(), unit.configuration().parameters(),
                unit.state(), unit.failureReason());
        if (unit.state() == UnitState.DONE) {
            results.addAll(unitResults);
            completedUnits.add(outcome);
        } else {
            failedUnits.add(outcome);
        }
    }

    public List<EvaluationResult> results() {
        return Collections.unmodifiableList(results);
    }

    public RunManifest toManifest() {
        return new RunManifest(runId, status(), startedAt, Instant.now(), splitCount.get(), results.size(),
                completedUnits, failedUnits, skippedSplits, gridFailures, abortCause.get());
    }

    RunManifest.Status status() {
        if (abortCause.get() != null) {
            return RunManifest.Status.ABORTED;
        }
        if (cancelled.get()) {
            return RunManifest.Status.CANCELLED;
        }
        if (!failedUnits.isEmpty() || !gridFailures.isEmpty() || splitErrors.get() > 0) {
            return RunManifest.Status.COMPLETED_WITH_FAILURES;
        }
        return RunManifest.Status.COMPLETED;
    }
}
