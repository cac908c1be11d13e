package org.javai.dbresilience.pool;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Objects;
import javax.sql.DataSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.dbresilience.health.ResourceHandle;

/**
 * A handle borrowing one connection from a {@link DataSource}.
 */
final class JdbcResourceHandle implements ResourceHandle {

    static final String PROBE_SQL = "SELECT 1";

    private static final Logger LOGGER = LogManager.getLogger(JdbcResourceHandle.class);

    private final String resourceName;
    private final DataSource dataSource;
    private Connection connection;

    JdbcResourceHandle(String resourceName, DataSource dataSource) {
        this.resourceName = Objects.requireNonNull(resourceName, "resourceName must not be null");
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
    }

    @Override
    public String resourceName() {
        return resourceName;
    }

    @Override
    public boolean isOpen() {
        if (connection == null) {
            return false;
        }
        try {
            return !connection.isClosed();
        } catch (SQLException e) {
            return false;
        }
    }

    @Override
    public void open() throws SQLException {
        if (isOpen()) {
            return;
        }
        connection = dataSource.getConnection();
    }

    @Override
    public void probe(Duration timeout) throws SQLException {
        try (Statement statement = connection().createStatement()) {
            statement.setQueryTimeout(toSeconds(timeout));
            statement.execute(PROBE_SQL);
        }
    }

    @Override
    public Connection connection() {
        if (connection == null) {
            throw new IllegalStateException("Handle for resource '" + resourceName + "' is not open");
        }
        return connection;
    }

    @Override
    public void close() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            LOGGER.warn("Failed to release connection for resource {}: {}", resourceName, e.getMessage());
        } finally {
            connection = null;
        }
    }

    static int toSeconds(Duration timeout) {
        long millis = timeout.toMillis();
        return (int) Math.max(1, (millis + 999) / 1000);
    }
}
