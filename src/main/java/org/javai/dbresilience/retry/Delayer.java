package org.javai.dbresilience.retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Suspends a call between attempts without holding a thread.
 */
@FunctionalInterface
public interface Delayer {

    /**
     * Returns a future completing after the delay.
     */
    CompletableFuture<Void> delay(Duration duration);

    /**
     * Completes on the shared JDK timer. The returned future runs no work of its own, so
     * submitting the next attempt stays with the caller.
     */
    static Delayer scheduled() {
        return duration -> {
            if (duration.isZero() || duration.isNegative()) {
                return CompletableFuture.completedFuture(null);
            }
            return new CompletableFuture<Void>().completeOnTimeout(null, duration.toMillis(), TimeUnit.MILLISECONDS);
        };
    }

    /**
     * Completes immediately. Useful for testing.
     */
    static Delayer immediate() {
        return duration -> CompletableFuture.completedFuture(null);
    }
}
