package org.javai.dbresilience.tools;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.dbresilience.Failure;
import org.javai.dbresilience.Outcome;
import org.javai.dbresilience.classify.RawFailure;
import org.javai.dbresilience.pool.DataSourceResourcePool;
import org.javai.dbresilience.profile.ConnectionProfileResolver;
import org.javai.dbresilience.profile.ConnectionSources;
import org.javai.dbresilience.profile.ProfileDefaults;
import org.javai.dbresilience.report.OutcomeReporter;
import org.javai.dbresilience.report.StructuredResult;
import org.javai.dbresilience.retry.ResourceOperation;
import org.javai.dbresilience.retry.RetryExecutor;

/**
 * Database operations exposed to a request dispatcher.
 *
 * <p>Every operation except {@link #listAvailableDatabases()} runs through the
 * {@link RetryExecutor} and completes with a {@link StructuredResult}; none completes
 * exceptionally. Failed calls are additionally logged in detail.
 *
 * <pre>{@code
 * DatabaseTools tools = DatabaseTools.standard();
 * StructuredResult result = tools.executeQuery("SELECT id, name FROM customers", "crm").join();
 * String json = new StructuredResultWriter().toJson(result);
 * }</pre>
 */
public final class DatabaseTools {

    static final String TEST_CONNECTION_SQL =
            "SELECT NOW(), current_database(), pg_backend_pid(), version()";
    static final Duration TEST_CONNECTION_TIMEOUT = Duration.ofSeconds(10);

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final Logger LOGGER = LogManager.getLogger(DatabaseTools.class);

    private final RetryExecutor executor;
    private final OutcomeReporter reporter;

    public DatabaseTools(RetryExecutor executor) {
        this(executor, new OutcomeReporter());
    }

    public DatabaseTools(RetryExecutor executor, OutcomeReporter reporter) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Tools over the standard layered connection configuration and PostgreSQL data sources,
     * reporting retries through Log4j.
     */
    public static DatabaseTools standard() {
        ConnectionProfileResolver resolver = new ConnectionProfileResolver(ConnectionSources.standard());
        RetryExecutor executor = RetryExecutor.builder(resolver, DataSourceResourcePool.postgres()).build();
        return new DatabaseTools(executor);
    }

    /**
     * Runs a query and returns its rows as ordered column-to-value maps.
     */
    public CompletableFuture<StructuredResult> executeQuery(String sql, String resource) {
        return submit("executeQuery", resource, sql, (connection, profile) -> {
            try (Statement statement = connection.createStatement()) {
                statement.setQueryTimeout(toSeconds(profile.operationTimeout()));
                try (ResultSet rs = statement.executeQuery(sql)) {
                    List<Map<String, Object>> rows = readRows(rs);
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("rowCount", rows.size());
                    data.put("rows", rows);
                    return data;
                }
            }
        });
    }

    /**
     * Runs a statement that returns no rows (INSERT, UPDATE, DELETE, DDL).
     */
    public CompletableFuture<StructuredResult> executeNonQuery(String sql, String resource) {
        return submit("executeNonQuery", resource, sql, (connection, profile) -> {
            try (Statement statement = connection.createStatement()) {
                statement.setQueryTimeout(toSeconds(profile.operationTimeout()));
                int rowsAffected = statement.executeUpdate(sql);
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("rowsAffected", rowsAffected);
                data.put("message", "Command executed successfully. " + rowsAffected + " rows affected.");
                return data;
            }
        });
    }

    /**
     * Connects to a resource and reports server details alongside the effective settings.
     */
    public CompletableFuture<StructuredResult> testConnection(String resource) {
        return submit("testConnection", resource, TEST_CONNECTION_SQL, (connection, profile) -> {
            try (Statement statement = connection.createStatement()) {
                statement.setQueryTimeout(toSeconds(TEST_CONNECTION_TIMEOUT));
                try (ResultSet rs = statement.executeQuery(TEST_CONNECTION_SQL)) {
                    if (!rs.next()) {
                        throw new SQLException("Connection test returned no rows");
                    }
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("message", "Connection successful");
                    data.put("serverTime", convert(rs.getTimestamp(1)));
                    data.put("databaseName", rs.getString(2));
                    data.put("processId", rs.getInt(3));
                    data.put("serverVersion", rs.getString(4));
                    data.put("connectionTimeout", profile.connectTimeout().toSeconds());
                    data.put("commandTimeout", profile.operationTimeout().toSeconds());
                    data.put("keepAlive", profile.keepAlive().toSeconds());
                    data.put("poolingEnabled", executor.pool().isPooling());
                    return data;
                }
            }
        });
    }

    /**
     * Lists configured resource names with the resilience settings in effect. Not retried.
     */
    public CompletableFuture<StructuredResult> listAvailableDatabases() {
        try {
            ProfileDefaults defaults = executor.resolver().defaults();
            Map<String, Object> settings = new LinkedHashMap<>();
            settings.put("maxRetryAttempts", executor.settings().maxAttempts());
            settings.put("commandTimeoutSeconds", defaults.operationTimeout().toSeconds());
            settings.put("connectionTimeoutSeconds", defaults.connectTimeout().toSeconds());
            settings.put("poolingEnabled", executor.pool().isPooling());
            settings.put("keepAliveSeconds", defaults.keepAlive().toSeconds());

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("availableDatabases", new ArrayList<>(executor.resolver().availableResources()));
            data.put("resilienceSettings", settings);
            return CompletableFuture.completedFuture(StructuredResult.success(data));
        } catch (RuntimeException e) {
            LOGGER.error("Failed to list available databases", e);
            return CompletableFuture.completedFuture(StructuredResult.failure(
                    e.getMessage(), null, false, OutcomeReporter.PERMANENT_SUGGESTION, 1));
        }
    }

    /**
     * Runs an arbitrary operation against a resource with retry.
     */
    public <T> CompletableFuture<StructuredResult> submit(String operationName, String resourceName,
                                                          ResourceOperation<T> operation) {
        return submit(operationName, resourceName, null, operation);
    }

    private <T> CompletableFuture<StructuredResult> submit(String operationName, String resourceName, String sql,
                                                           ResourceOperation<T> operation) {
        return executor.run(operationName, resourceName, operation)
                .thenApply(outcome -> {
                    if (outcome instanceof Outcome.Fail<T> fail) {
                        logFault(fail.failure(), sql);
                    }
                    return reporter.render(outcome);
                });
    }

    private static void logFault(Failure failure, String sql) {
        try {
            RawFailure raw = failure.cause();
            LOGGER.warn("""
                    Method: {}
                    Resource: {}
                    Attempts: {}
                    SQL: {}
                    Exception Type: {}
                    Message: {}
                    SQL State: {}
                    Is Transient: {}
                    Cause: {}""",
                    failure.operation(),
                    failure.resource(),
                    failure.attempts(),
                    sql == null ? "" : sql,
                    raw == null || raw.exceptionType() == null ? "n/a" : raw.exceptionType(),
                    failure.message(),
                    failure.diagnosticCode().orElse("n/a"),
                    failure.isTransient(),
                    describeCause(raw));
        } catch (RuntimeException e) {
            // Logging must not change the result of the call
        }
    }

    private static String describeCause(RawFailure raw) {
        if (raw == null || raw.cause() == null) {
            return "none";
        }
        RawFailure cause = raw.cause();
        String type = cause.exceptionType() == null ? cause.kind().name() : cause.exceptionType();
        return type + " - " + cause.message();
    }

    static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData metaData = rs.getMetaData();
        int columns = metaData.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columns; i++) {
                row.put(metaData.getColumnLabel(i), convert(rs.getObject(i)));
            }
            rows.add(row);
        }
        return rows;
    }

    /**
     * Converts a column value into something that serializes cleanly to JSON.
     */
    static Object convert(Object value) throws SQLException {
        if (value == null || value instanceof Number || value instanceof Boolean
                || value instanceof String || value instanceof byte[]) {
            return value;
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toLocalDateTime().format(TIMESTAMP_FORMAT);
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate().atStartOfDay().format(TIMESTAMP_FORMAT);
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.format(TIMESTAMP_FORMAT);
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay().format(TIMESTAMP_FORMAT);
        }
        if (value instanceof OffsetDateTime dateTime) {
            return dateTime.toLocalDateTime().format(TIMESTAMP_FORMAT);
        }
        if (value instanceof ZonedDateTime dateTime) {
            return dateTime.toLocalDateTime().format(TIMESTAMP_FORMAT);
        }
        if (value instanceof Array array) {
            Object elements = array.getArray();
            if (elements instanceof Object[] objects) {
                List<Object> converted = new ArrayList<>(objects.length);
                for (Object element : objects) {
                    converted.add(convert(element));
                }
                return converted;
            }
            return elements;
        }
        return value.toString();
    }

    private static int toSeconds(Duration timeout) {
        long seconds = (timeout.toMillis() + 999) / 1000;
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, seconds));
    }
}
