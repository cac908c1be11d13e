package org.javai.dbresilience.classify;

import java.util.Map;

/**
 * Classifies failures by SQLSTATE first, then by fault kind, walking the cause chain.
 *
 * <p>Classification of a single link:
 * <ol>
 *   <li>A link whose kind is network-level ({@link FaultKind#SOCKET}, {@link FaultKind#IO},
 *       {@link FaultKind#TIMEOUT}) is transient, keeping any code it carries.</li>
 *   <li>Any other link carrying a diagnostic code is decided by the code alone: codes in the
 *       transient table are transient, every other code is permanent.</li>
 *   <li>Otherwise the wrapped cause is examined the same way.</li>
 * </ol>
 *
 * <p>The walk examines at most {@link #MAX_CHAIN_DEPTH} links. Reaching the end of the chain,
 * or the cap, without a decision yields a permanent classification.
 */
public class SqlStateErrorClassifier implements ErrorClassifier {

    public static final int MAX_CHAIN_DEPTH = 10;

    /** SQLSTATE to reason token. */
    private static final Map<String, String> TRANSIENT_SQL_STATES = Map.ofEntries(
            // Class 08: connection exception
            Map.entry("08000", "connection_exception"),
            Map.entry("08003", "connection_does_not_exist"),
            Map.entry("08006", "connection_failure"),
            Map.entry("08001", "sqlclient_unable_to_establish_sqlconnection"),
            Map.entry("08004", "sqlserver_rejected_establishment_of_sqlconnection"),
            // Class 40: transaction rollback
            Map.entry("40001", "serialization_failure"),
            Map.entry("40P01", "deadlock_detected"),
            // Class 53: insufficient resources
            Map.entry("53000", "insufficient_resources"),
            Map.entry("53100", "disk_full"),
            Map.entry("53200", "out_of_memory"),
            Map.entry("53300", "too_many_connections")
    );

    @Override
    public ErrorClassification classify(RawFailure failure) {
        if (failure == null) {
            return ErrorClassification.permanentFailure(null, "unspecified");
        }

        RawFailure link = failure;
        for (int depth = 0; link != null && depth < MAX_CHAIN_DEPTH; depth++, link = link.cause()) {
            String code = link.diagnosticCode();
            if (link.kind().isNetworkLevel()) {
                return ErrorClassification.transientFailure(code, true, link.kind().name().toLowerCase());
            }
            if (code != null) {
                return classifyCode(code);
            }
        }

        return ErrorClassification.permanentFailure(null, reasonFor(failure.kind()));
    }

    /**
     * Whether a SQLSTATE is in the transient table.
     */
    public static boolean isTransientCode(String sqlState) {
        return sqlState != null && TRANSIENT_SQL_STATES.containsKey(sqlState);
    }

    private static ErrorClassification classifyCode(String code) {
        String reason = TRANSIENT_SQL_STATES.get(code);
        if (reason != null) {
            return ErrorClassification.transientFailure(code, false, reason);
        }
        return ErrorClassification.permanentFailure(code, "sql_state");
    }

    private static String reasonFor(FaultKind kind) {
        return switch (kind) {
            case NOT_FOUND -> "resource_not_found";
            case HANDLE_UNUSABLE -> "handle_unusable";
            case INVALID_PROFILE -> "invalid_profile";
            case INVALID_REQUEST -> "invalid_request";
            default -> "unrecognized";
        };
    }
}
