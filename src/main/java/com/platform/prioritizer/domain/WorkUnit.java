package com.platform.prioritizer.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Training and evaluation of one model configuration on one split.
 * Transitions are checked against {@link UnitState#successors()}.
 */
public class WorkUnit {

    private static final Logger log = LoggerFactory.getLogger(WorkUnit.class);

    private final Split split;
    private final ModelConfiguration configuration;
    private final ModelGroupKey modelGroupKey;
    private volatile UnitState state = UnitState.PENDING;
    private volatile String failureReason;

    public WorkUnit(Split split, ModelConfiguration configuration, ModelGroupKey modelGroupKey) {
        this.split = split;
        this.configuration = configuration;
        this.modelGroupKey = modelGroupKey;
    }

    public synchronized void advance(UnitState next) {
        if (next == UnitState.FAILED) {
            throw new IllegalArgumentException("Use fail(reason) to mark a unit as failed");
        }
        transition(next);
    }

    public synchronized void fail(String reason) {
        transition(UnitState.FAILED);
        this.failureReason = reason;
    }

    private void transition(UnitState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Work unit " + describe() + " cannot move from " + state + " to " + next);
        }
        log.debug("Unit {}: {} -> {}", describe(), state, next);
        state = next;
    }

    public Split split() {
        return split;
    }

    public ModelConfiguration configuration() {
        return configuration;
    }

    public ModelGroupKey modelGroupKey() {
        return modelGroupKey;
    }

    public UnitState state() {
        return state;
    }

    public String failureReason() {
        return failureReason;
    }

    public String describe() {
        return split.id() + "/" + configuration.describe();
    }
}
