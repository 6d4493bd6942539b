package com.platform.prioritizer.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a (split, model configuration) work unit.
 */
public enum UnitState {
    PENDING, FITTED, SCORED_TRAIN, SCORED_TEST, EVALUATED, DONE, FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    public Set<UnitState> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(FITTED, FAILED);
            case FITTED -> EnumSet.of(SCORED_TRAIN, FAILED);
            case SCORED_TRAIN -> EnumSet.of(SCORED_TEST, FAILED);
            case SCORED_TEST -> EnumSet.of(EVALUATED, FAILED);
            case EVALUATED -> EnumSet.of(DONE, FAILED);
            case DONE, FAILED -> EnumSet.noneOf(UnitState.class);
        };
    }

    public boolean canMoveTo(UnitState next) {
        return successors().contains(next);
    }
}
