package org.javai.dbresilience.classify;

import java.util.Objects;
import java.util.Optional;
import org.javai.dbresilience.FailureType;

/**
 * The result of classifying a {@link RawFailure}.
 *
 * @param type Whether the failure is transient or permanent
 * @param diagnosticCode The diagnostic code extracted from the failure chain (may be null)
 * @param networkLevel Whether the deciding link of the chain was a network-level fault
 * @param reason Stable token naming what decided the classification (e.g., "deadlock_detected")
 */
public record ErrorClassification(
        FailureType type,
        String diagnosticCode,
        boolean networkLevel,
        String reason
) {

    public ErrorClassification {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }

    public static ErrorClassification transientFailure(String diagnosticCode, boolean networkLevel, String reason) {
        return new ErrorClassification(FailureType.TRANSIENT, diagnosticCode, networkLevel, reason);
    }

    public static ErrorClassification permanentFailure(String diagnosticCode, String reason) {
        return new ErrorClassification(FailureType.PERMANENT, diagnosticCode, false, reason);
    }

    public boolean isTransient() {
        return type == FailureType.TRANSIENT;
    }

    public Optional<String> code() {
        return Optional.ofNullable(diagnosticCode);
    }
}
