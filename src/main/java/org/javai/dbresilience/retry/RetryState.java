package org.javai.dbresilience.retry;

import java.time.Duration;
import java.util.Objects;
import org.javai.dbresilience.classify.RawFailure;

/**
 * Retry bookkeeping for one call. Owned by that call alone and never shared.
 *
 * @param attempt The current attempt number (1-based)
 * @param currentDelay The delay waited before the current attempt
 * @param lastFailure The failure of the previous attempt (null before any failure)
 * @param phase Where the call is in its lifecycle
 */
public record RetryState(
        int attempt,
        Duration currentDelay,
        RawFailure lastFailure,
        ExecutionPhase phase
) {
    public RetryState {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        Objects.requireNonNull(currentDelay, "currentDelay must not be null");
        Objects.requireNonNull(phase, "phase must not be null");
    }

    public static RetryState idle() {
        return new RetryState(1, Duration.ZERO, null, ExecutionPhase.IDLE);
    }

    /**
     * Starts the first attempt.
     */
    public RetryState start() {
        return transitionTo(ExecutionPhase.ATTEMPTING);
    }

    /**
     * Records a retryable failure and the delay before the next attempt.
     */
    public RetryState backingOff(Duration delay, RawFailure failure) {
        Objects.requireNonNull(delay, "delay must not be null");
        requireTransition(ExecutionPhase.BACKING_OFF);
        return new RetryState(attempt, delay, failure, ExecutionPhase.BACKING_OFF);
    }

    /**
     * Starts the next attempt after backing off.
     */
    public RetryState nextAttempt() {
        if (phase != ExecutionPhase.BACKING_OFF) {
            throw new IllegalStateException("Cannot start attempt " + (attempt + 1) + " from " + phase);
        }
        return new RetryState(attempt + 1, currentDelay, lastFailure, ExecutionPhase.ATTEMPTING);
    }

    public RetryState succeeded() {
        return transitionTo(ExecutionPhase.SUCCEEDED);
    }

    public RetryState failed(RawFailure failure) {
        requireTransition(ExecutionPhase.FAILED);
        return new RetryState(attempt, currentDelay, failure, ExecutionPhase.FAILED);
    }

    private RetryState transitionTo(ExecutionPhase next) {
        requireTransition(next);
        return new RetryState(attempt, currentDelay, lastFailure, next);
    }

    private void requireTransition(ExecutionPhase next) {
        if (!phase.canTransitionTo(next)) {
            throw new IllegalStateException("Cannot move from " + phase + " to " + next);
        }
    }
}
