package org.javai.dbresilience.retry;

import java.time.Duration;
import java.util.Objects;
import org.javai.dbresilience.Failure;

/**
 * Decides whether and when to retry after a failure.
 */
public interface RetryPolicy {

    /**
     * A unique identifier for this policy, used in reporting.
     */
    String id();

    /**
     * Evaluates a failed attempt and decides whether to retry.
     *
     * @param state The state of the call, positioned at the failed attempt
     * @param failure The classified failure of that attempt
     * @return Retry with a delay, or GiveUp
     */
    RetryDecision decide(RetryState state, Failure failure);

    /**
     * Creates a policy that never retries.
     */
    static RetryPolicy noRetry() {
        return new RetryPolicy() {
            @Override
            public String id() {
                return "no-retry";
            }

            @Override
            public RetryDecision decide(RetryState state, Failure failure) {
                return RetryDecision.GiveUp.because("no-retry policy");
            }
        };
    }

    /**
     * Creates a policy with jittered exponential backoff.
     *
     * <p>Permanent failures and the last permitted attempt give up. Otherwise the delay before
     * attempt {@code k + 1} is {@code min(delayCap, initialDelay * 2^(k-1) + jitter)}, with jitter
     * drawn from {@code [0, maxJitter)}.
     */
    static RetryPolicy exponentialBackoff(String id, RetrySettings settings, JitterSource jitter) {
        Objects.requireNonNull(id);
        Objects.requireNonNull(settings);
        Objects.requireNonNull(jitter);

        return new RetryPolicy() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public RetryDecision decide(RetryState state, Failure failure) {
                if (!failure.isTransient()) {
                    return RetryDecision.GiveUp.because("failure is not retryable");
                }
                if (state.attempt() >= settings.maxAttempts()) {
                    return RetryDecision.GiveUp.because("max attempts reached");
                }
                return RetryDecision.Retry.after(backoffDelay(settings, state.attempt(), jitter));
            }
        };
    }

    /**
     * The delay waited after the given failed attempt.
     */
    static Duration backoffDelay(RetrySettings settings, int failedAttempt, JitterSource jitter) {
        long capMillis = settings.delayCap().toMillis();
        int exponent = Math.min(failedAttempt - 1, 62);
        long baseMillis;
        try {
            baseMillis = Math.multiplyExact(settings.initialDelay().toMillis(), 1L << exponent);
        } catch (ArithmeticException overflow) {
            baseMillis = capMillis;
        }
        long jitterMillis = jitter.nextMillis(settings.maxJitter().toMillis());
        long delayMillis = baseMillis >= capMillis ? capMillis : Math.min(capMillis, baseMillis + jitterMillis);
        return Duration.ofMillis(delayMillis);
    }
}
