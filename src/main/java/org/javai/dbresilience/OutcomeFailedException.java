package org.javai.dbresilience;

/**
 * Thrown when {@link Outcome#getOrThrow()} is called on a failed outcome.
 * This is an unchecked exception because it indicates misuse of the API:
 * the caller should have checked {@link Outcome#isFail()} first.
 */
public class OutcomeFailedException extends RuntimeException {

    private final Failure failure;

    public OutcomeFailedException(Failure failure) {
        super("Outcome failed after " + failure.attempts() + " attempt(s): " + failure.message());
        this.failure = failure;
    }

    public Failure failure() {
        return failure;
    }
}
