package org.javai.dbresilience.retry;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Supplies the random component added to backoff delays.
 */
@FunctionalInterface
public interface JitterSource {

    /**
     * Returns a value in {@code [0, boundMillis)}; zero when the bound is zero.
     */
    long nextMillis(long boundMillis);

    static JitterSource uniform() {
        return bound -> bound <= 0 ? 0 : ThreadLocalRandom.current().nextLong(bound);
    }

    static JitterSource none() {
        return bound -> 0;
    }
}
