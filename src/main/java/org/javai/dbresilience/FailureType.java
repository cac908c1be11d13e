package org.javai.dbresilience;

/**
 * Classifies failures by whether retrying them unchanged can help.
 */
public enum FailureType {
    /**
     * Temporary failure that may resolve on retry.
     * Examples: dropped connection, serialization conflict, too many connections.
     */
    TRANSIENT,

    /**
     * Permanent failure that will recur identically on retry.
     * Examples: unknown resource, syntax error, constraint violation, authorization failure.
     */
    PERMANENT
}
