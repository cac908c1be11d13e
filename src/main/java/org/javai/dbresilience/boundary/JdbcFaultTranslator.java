package org.javai.dbresilience.boundary;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import org.javai.dbresilience.classify.FaultKind;
import org.javai.dbresilience.classify.RawFailure;

/**
 * Translates JDBC, socket and I/O exceptions into {@link RawFailure} chains.
 *
 * <p>Each exception in the cause chain becomes one link. The chain is cut after
 * {@link #MAX_CHAIN_DEPTH} links or when an exception reappears, so self-referencing
 * or pathologically deep chains translate in bounded time.
 *
 * <p>SQLSTATE {@code 57014} (query canceled) is raised by the PostgreSQL driver when a statement
 * timeout fires; it is translated as a {@link FaultKind#TIMEOUT} that keeps its code.
 */
public class JdbcFaultTranslator implements FaultTranslator {

    public static final int MAX_CHAIN_DEPTH = 10;

    static final String QUERY_CANCELED = "57014";

    @Override
    public RawFailure translate(Throwable throwable) {
        if (throwable == null) {
            return RawFailure.of(FaultKind.OTHER, "unknown failure");
        }

        List<Throwable> chain = new ArrayList<>();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable t = throwable; t != null && chain.size() < MAX_CHAIN_DEPTH && seen.add(t); t = t.getCause()) {
            chain.add(t);
        }

        RawFailure translated = null;
        for (int i = chain.size() - 1; i >= 0; i--) {
            translated = translateSingle(chain.get(i)).causedBy(translated);
        }
        return translated;
    }

    private static RawFailure translateSingle(Throwable t) {
        String message = messageOf(t);
        String type = t.getClass().getName();

        if (t instanceof SQLTimeoutException
                || t instanceof SocketTimeoutException
                || t instanceof TimeoutException
                || t instanceof InterruptedIOException) {
            return new RawFailure(FaultKind.TIMEOUT, message, null, type, null);
        }

        if (t instanceof SQLException sqlEx) {
            String sqlState = sqlEx.getSQLState();
            if (QUERY_CANCELED.equals(sqlState)) {
                return new RawFailure(FaultKind.TIMEOUT, message, sqlState, type, null);
            }
            if (sqlState == null && sqlEx instanceof SQLTransientConnectionException) {
                return new RawFailure(FaultKind.SOCKET, message, null, type, null);
            }
            return new RawFailure(FaultKind.DATABASE, message, sqlState, type, null);
        }

        if (t instanceof SocketException || t instanceof UnknownHostException) {
            return new RawFailure(FaultKind.SOCKET, message, null, type, null);
        }

        if (t instanceof IOException) {
            return new RawFailure(FaultKind.IO, message, null, type, null);
        }

        return new RawFailure(FaultKind.OTHER, message, null, type, null);
    }

    private static String messageOf(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
    }
}
