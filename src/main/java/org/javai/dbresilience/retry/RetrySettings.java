package org.javai.dbresilience.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings for a {@link RetryExecutor}.
 *
 * @param maxAttempts Ceiling on attempts per call, including the first
 * @param initialDelay Delay before the second attempt, before jitter
 * @param delayCap Upper bound on any single delay, jitter included
 * @param maxJitter Exclusive upper bound of the uniform jitter added to each delay
 * @param probeTimeout Bound on the health probe run before each attempt
 */
public record RetrySettings(
        int maxAttempts,
        Duration initialDelay,
        Duration delayCap,
        Duration maxJitter,
        Duration probeTimeout
) {

    private static final RetrySettings DEFAULTS = new RetrySettings(
            3,
            Duration.ofMillis(500),
            Duration.ofMillis(5000),
            Duration.ofMillis(100),
            Duration.ofSeconds(5)
    );

    public RetrySettings {
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        Objects.requireNonNull(delayCap, "delayCap must not be null");
        Objects.requireNonNull(maxJitter, "maxJitter must not be null");
        Objects.requireNonNull(probeTimeout, "probeTimeout must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was: " + maxAttempts);
        }
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative");
        }
        if (delayCap.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("delayCap must be >= initialDelay");
        }
        if (maxJitter.isNegative()) {
            throw new IllegalArgumentException("maxJitter must not be negative");
        }
        if (probeTimeout.isZero() || probeTimeout.isNegative()) {
            throw new IllegalArgumentException("probeTimeout must be > 0");
        }
    }

    /**
     * Three attempts, 500ms initial delay doubling per attempt, 5s cap, up to 100ms jitter,
     * 5s probe timeout.
     */
    public static RetrySettings defaults() {
        return DEFAULTS;
    }

    public RetrySettings withMaxAttempts(int maxAttempts) {
        return new RetrySettings(maxAttempts, initialDelay, delayCap, maxJitter, probeTimeout);
    }

    public RetrySettings withDelays(Duration initialDelay, Duration delayCap) {
        return new RetrySettings(maxAttempts, initialDelay, delayCap, maxJitter, probeTimeout);
    }

    public RetrySettings withMaxJitter(Duration maxJitter) {
        return new RetrySettings(maxAttempts, initialDelay, delayCap, maxJitter, probeTimeout);
    }

    public RetrySettings withProbeTimeout(Duration probeTimeout) {
        return new RetrySettings(maxAttempts, initialDelay, delayCap, maxJitter, probeTimeout);
    }
}
