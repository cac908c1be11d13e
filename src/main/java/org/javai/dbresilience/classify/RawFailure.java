package org.javai.dbresilience.classify;

import java.util.Objects;
import java.util.Optional;

/**
 * An unclassified failure of one attempt, as reported by a collaborator.
 *
 * @param kind The tagged kind of failure
 * @param message Human-readable description
 * @param diagnosticCode Structured diagnostic code, such as a SQLSTATE (may be null)
 * @param exceptionType Fully-qualified name of the originating exception, for diagnostics (may be null)
 * @param cause The failure this one wraps (may be null)
 */
public record RawFailure(
        FaultKind kind,
        String message,
        String diagnosticCode,
        String exceptionType,
        RawFailure cause
) {

    public RawFailure {
        Objects.requireNonNull(kind, "kind must not be null");
        message = message == null ? kind.name().toLowerCase() : message;
        diagnosticCode = diagnosticCode == null || diagnosticCode.isBlank() ? null : diagnosticCode.trim();
    }

    public static RawFailure of(FaultKind kind, String message) {
        return new RawFailure(kind, message, null, null, null);
    }

    public static RawFailure database(String sqlState, String message) {
        return new RawFailure(FaultKind.DATABASE, message, sqlState, null, null);
    }

    /**
     * Returns a copy of this failure wrapping the given cause.
     */
    public RawFailure causedBy(RawFailure cause) {
        return new RawFailure(kind, message, diagnosticCode, exceptionType, cause);
    }

    public Optional<String> code() {
        return Optional.ofNullable(diagnosticCode);
    }
}
