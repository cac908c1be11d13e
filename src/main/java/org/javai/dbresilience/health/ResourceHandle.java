package org.javai.dbresilience.health;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

/**
 * A handle on one pooled connection, scoped to a single attempt.
 *
 * <p>A handle starts closed. {@link #open()} borrows a connection from the pool and
 * {@link #close()} returns it. Handles are never reused across attempts.
 */
public interface ResourceHandle extends AutoCloseable {

    /**
     * The logical resource this handle belongs to.
     */
    String resourceName();

    boolean isOpen();

    /**
     * Borrows a live connection from the pool. May wait if the pool is at capacity.
     *
     * @throws SQLException if no connection can be established
     */
    void open() throws SQLException;

    /**
     * Runs a minimal round-trip against the resource.
     *
     * @param timeout Bound on the round-trip, independent of the operation timeout
     * @throws SQLException if the round-trip fails or times out
     */
    void probe(Duration timeout) throws SQLException;

    /**
     * The underlying connection.
     *
     * @throws IllegalStateException if the handle is not open
     */
    Connection connection();

    /**
     * Returns the connection to the pool. Never throws.
     */
    @Override
    void close();
}
