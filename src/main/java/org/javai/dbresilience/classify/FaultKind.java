package org.javai.dbresilience.classify;

/**
 * The closed vocabulary of failure kinds the resilience layer understands.
 *
 * <p>Collaborators (the JDBC driver, the pool, the configuration layer) map their own faults
 * into this vocabulary before handing them over; see
 * {@link org.javai.dbresilience.boundary.FaultTranslator}.
 */
public enum FaultKind {
    /** Socket-level error: refused, reset, unreachable. */
    SOCKET(true),

    /** General I/O error on the wire. */
    IO(true),

    /** A timeout, whether of the socket, the statement or an awaited future. */
    TIMEOUT(true),

    /** An error reported by the data store, usually carrying a SQLSTATE. */
    DATABASE(false),

    /** The handle failed its health probe. */
    HANDLE_UNUSABLE(false),

    /** No connection parameters exist for the requested resource. */
    NOT_FOUND(false),

    /** Connection parameters exist but do not form a valid profile. */
    INVALID_PROFILE(false),

    /** The request itself is malformed (blank names, missing SQL). */
    INVALID_REQUEST(false),

    /** Anything not recognized. */
    OTHER(false);

    private final boolean networkLevel;

    FaultKind(boolean networkLevel) {
        this.networkLevel = networkLevel;
    }

    /**
     * Whether this kind is a network-level fault, and therefore transient on its own.
     */
    public boolean isNetworkLevel() {
        return networkLevel;
    }
}
