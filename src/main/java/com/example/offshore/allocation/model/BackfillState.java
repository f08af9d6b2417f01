package com.example.offshore.allocation.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a backfill run. {@code FAILED} is reachable from every non-terminal state.
 */
public enum BackfillState {
    NOT_STARTED,
    BACKING_UP,
    LOADING_LEDGER,
    PROCESSING,
    VERIFYING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    public boolean isActive() {
        return !isTerminal() && this != NOT_STARTED;
    }

    public boolean canTransitionTo(BackfillState next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return allowedSuccessors().contains(next);
    }

    private Set<BackfillState> allowedSuccessors() {
        return switch (this) {
            case NOT_STARTED -> EnumSet.of(BACKING_UP, DONE);
            case BACKING_UP -> EnumSet.of(LOADING_LEDGER);
            case LOADING_LEDGER -> EnumSet.of(PROCESSING);
            case PROCESSING -> EnumSet.of(PROCESSING, VERIFYING);
            case VERIFYING -> EnumSet.of(DONE);
            default -> EnumSet.noneOf(BackfillState.class);
        };
    }
}
