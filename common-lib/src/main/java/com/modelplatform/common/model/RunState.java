package com.modelplatform.common.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of a single retraining run.
 *
 * <pre>
 *   IDLE → VALIDATING → TRAINING → EVALUATING → PROMOTING → NOTIFYING → DONE
 *                 └→ SKIPPED               └→ DONE (not promoted)
 *   any non-terminal state → FAILED
 * </pre>
 */
public enum RunState {
    IDLE,
    VALIDATING,
    TRAINING,
    EVALUATING,
    PROMOTING,
    NOTIFYING,
    DONE,
    SKIPPED,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == SKIPPED || this == FAILED;
    }

    public boolean canTransitionTo(RunState next) {
        return successors().contains(next);
    }

    public Set<RunState> successors() {
        return switch (this) {
            case IDLE       -> EnumSet.of(VALIDATING, FAILED);
            case VALIDATING -> EnumSet.of(TRAINING, SKIPPED, FAILED);
            case TRAINING   -> EnumSet.of(EVALUATING, FAILED);
            case EVALUATING -> EnumSet.of(PROMOTING, DONE, FAILED);
            case PROMOTING  -> EnumSet.of(NOTIFYING, FAILED);
            case NOTIFYING  -> EnumSet.of(DONE, FAILED);
            case DONE, SKIPPED, FAILED -> EnumSet.noneOf(RunState.class);
        };
    }
}
