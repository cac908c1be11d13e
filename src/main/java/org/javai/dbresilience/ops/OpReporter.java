package org.javai.dbresilience.ops;

import java.time.Duration;
import org.javai.dbresilience.Failure;

/**
 * Reports failures and retries for observability.
 * Implementations might emit structured logs or metrics. They must not throw.
 */
public interface OpReporter {

    /**
     * Reports a terminal failure: the call gives up and returns it.
     */
    void report(Failure failure);

    /**
     * Reports a failed attempt that will be retried.
     *
     * @param failure The failure of the attempt
     * @param attemptNumber The failed attempt (1-based)
     * @param maxAttempts The attempt ceiling for the call
     */
    default void reportRetryAttempt(Failure failure, int attemptNumber, int maxAttempts) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports the delay about to be waited before the next attempt.
     *
     * @param failure The failure that triggered the retry
     * @param attemptNumber The failed attempt (1-based)
     * @param delay The delay before the next attempt
     */
    default void reportBackoff(Failure failure, int attemptNumber, Duration delay) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static OpReporter noOp() {
        return failure -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static OpReporter composite(OpReporter... reporters) {
        return CompositeOpReporter.of(reporters);
    }
}
