package org.javai.dbresilience.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The externally visible result of one call. Null fields are omitted when serialized.
 *
 * @param success Whether the call succeeded
 * @param data The result payload on success
 * @param error The failure message on failure
 * @param diagnosticCode The SQLSTATE of the failure, if one was reported
 * @param isTransient Whether the failure was transient
 * @param suggestion What the caller can do about the failure
 * @param attempts How many attempts were made before failing
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "data", "error", "diagnosticCode", "isTransient", "suggestion", "attempts"})
public record StructuredResult(
        boolean success,
        Object data,
        String error,
        String diagnosticCode,
        @JsonProperty("isTransient") Boolean isTransient,
        String suggestion,
        Integer attempts
) {

    static final String FALLBACK_ERROR = "Internal error while rendering the result";

    public static StructuredResult success(Object data) {
        return new StructuredResult(true, data, null, null, null, null, null);
    }

    public static StructuredResult failure(String error, String diagnosticCode, boolean isTransient,
                                           String suggestion, int attempts) {
        return new StructuredResult(false, null, error, diagnosticCode, isTransient, suggestion, attempts);
    }

    /**
     * A permanent failure result used when a result could not be rendered.
     */
    public static StructuredResult fallback() {
        return new StructuredResult(false, null, FALLBACK_ERROR, null, false,
                OutcomeReporter.PERMANENT_SUGGESTION, null);
    }
}
