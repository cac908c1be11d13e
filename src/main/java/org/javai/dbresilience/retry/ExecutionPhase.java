package org.javai.dbresilience.retry;

import java.util.EnumSet;
import java.util.Set;

/**
 * Phases of one call through a {@link RetryExecutor}.
 *
 * <pre>
 * IDLE -> ATTEMPTING -> SUCCEEDED
 *                    -> BACKING_OFF -> ATTEMPTING
 *                    -> FAILED
 * </pre>
 */
public enum ExecutionPhase {
    IDLE,
    ATTEMPTING,
    BACKING_OFF,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    public boolean canTransitionTo(ExecutionPhase next) {
        return successors().contains(next);
    }

    private Set<ExecutionPhase> successors() {
        return switch (this) {
            case IDLE -> EnumSet.of(ATTEMPTING);
            case ATTEMPTING -> EnumSet.of(SUCCEEDED, BACKING_OFF, FAILED);
            case BACKING_OFF -> EnumSet.of(ATTEMPTING);
            case SUCCEEDED, FAILED -> EnumSet.noneOf(ExecutionPhase.class);
        };
    }
}
