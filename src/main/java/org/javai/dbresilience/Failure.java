package org.javai.dbresilience;

import java.util.Objects;
import java.util.Optional;
import org.javai.dbresilience.classify.ErrorClassification;
import org.javai.dbresilience.classify.RawFailure;

/**
 * A classified, terminal-or-intermediate failure of one call.
 *
 * @param classification How the failure was classified
 * @param message Human-readable description
 * @param attempts Number of attempts made when this failure was produced (1-based)
 * @param operation The operation that failed (e.g., "executeQuery")
 * @param resource The logical resource name the operation ran against
 * @param cause The raw failure the classification was derived from (may be null)
 */
public record Failure(
        ErrorClassification classification,
        String message,
        int attempts,
        String operation,
        String resource,
        RawFailure cause
) {

    public Failure {
        Objects.requireNonNull(classification, "classification must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(resource, "resource must not be null");
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be >= 1, was: " + attempts);
        }
    }

    /**
     * Creates a failure from a raw failure and its classification.
     */
    public static Failure of(RawFailure cause, ErrorClassification classification,
                             int attempts, String operation, String resource) {
        Objects.requireNonNull(cause, "cause must not be null");
        return new Failure(classification, cause.message(), attempts, operation, resource, cause);
    }

    public boolean isTransient() {
        return classification.type() == FailureType.TRANSIENT;
    }

    public Optional<String> diagnosticCode() {
        return classification.code();
    }

    /**
     * Returns a copy of this failure attributed to the given operation and attempt count.
     */
    public Failure withContext(String operation, int attempts) {
        return new Failure(classification, message, attempts, operation, resource, cause);
    }
}
