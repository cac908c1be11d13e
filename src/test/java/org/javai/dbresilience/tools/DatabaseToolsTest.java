package org.javai.dbresilience.tools;

import java.sql.Array;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import org.javai.dbresilience.health.FakeResourceHandle;
import org.javai.dbresilience.health.ResourceHandle;
import org.javai.dbresilience.ops.RecordingOpReporter;
import org.javai.dbresilience.pool.ResourcePool;
import org.javai.dbresilience.profile.ConnectionProfileResolver;
import org.javai.dbresilience.profile.ConnectionSource;
import org.javai.dbresilience.profile.RawConnectionParameters;
import org.javai.dbresilience.profile.ResourceProfile;
import org.javai.dbresilience.report.OutcomeReporter;
import org.javai.dbresilience.report.StructuredResult;
import org.javai.dbresilience.retry.Delayer;
import org.javai.dbresilience.retry.RetryExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DatabaseToolsTest {

    private static final Executor DIRECT = Runnable::run;

    @Mock
    private Connection connection;

    @Mock
    private Statement statement;

    @Mock
    private ResultSet resultSet;

    @Mock
    private ResultSetMetaData metaData;

    private RecordingOpReporter recording;
    private DatabaseTools tools;

    @BeforeEach
    void setUp() throws SQLException {
        when(connection.createStatement()).thenReturn(statement);
        when(resultSet.getMetaData()).thenReturn(metaData);

        ConnectionProfileResolver resolver = new ConnectionProfileResolver(ConnectionSource.of(Map.of(
                "orders", new RawConnectionParameters("jdbc:postgresql://localhost:5432/orders", "app", "secret",
                        Map.of("operationTimeout", "45")),
                "billing", RawConnectionParameters.ofUrl("jdbc:postgresql://localhost:5432/billing"))));
        recording = new RecordingOpReporter();
        RetryExecutor executor = RetryExecutor.builder(resolver, profile -> new FakeResourceHandle(profile.name(), connection))
                .reporter(recording)
                .executor(DIRECT)
                .delayer(Delayer.immediate())
                .build();
        tools = new DatabaseTools(executor);
    }

    @Test
    void executeQuery_returnsOrderedRows() throws SQLException {
        when(statement.executeQuery("SELECT id, created FROM orders")).thenReturn(resultSet);
        when(metaData.getColumnCount()).thenReturn(2);
        when(metaData.getColumnLabel(1)).thenReturn("id");
        when(metaData.getColumnLabel(2)).thenReturn("created");
        when(resultSet.next()).thenReturn(true, true, false);
        when(resultSet.getObject(1)).thenReturn(1, 2);
        when(resultSet.getObject(2)).thenReturn(
                Timestamp.valueOf(LocalDateTime.of(2024, 1, 20, 10, 30, 5)), (Object) null);

        StructuredResult result = tools.executeQuery("SELECT id, created FROM orders", "orders").join();

        assertThat(result.success()).isTrue();
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) result.data();
        assertThat(data).containsEntry("rowCount", 2);
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> rows = (List<Map<String, Object>>) data.get("rows");
        assertThat(rows.get(0)).containsExactly(entry("id", 1), entry("created", "2024-01-20 10:30:05"));
        assertThat(rows.get(1)).containsEntry("created", null);
        verify(statement).setQueryTimeout(45);
        verify(statement).close();
        verify(resultSet).close();
    }

    @Test
    void executeNonQuery_reportsRowsAffected() throws SQLException {
        when(statement.executeUpdate("DELETE FROM orders WHERE id = 1")).thenReturn(1);

        StructuredResult result = tools.executeNonQuery("DELETE FROM orders WHERE id = 1", "orders").join();

        assertThat(result.success()).isTrue();
        assertThat(result.data()).isEqualTo(Map.of(
                "rowsAffected", 1,
                "message", "Command executed successfully. 1 rows affected."));
    }

    @Test
    void executeNonQuery_constraintViolation_isPermanentFailure() throws SQLException {
        when(statement.executeUpdate(anyString()))
                .thenThrow(new SQLException("duplicate key value violates unique constraint", "23505"));

        StructuredResult result = tools.executeNonQuery("INSERT INTO orders VALUES (1)", "orders").join();

        assertThat(result.success()).isFalse();
        assertThat(result.diagnosticCode()).isEqualTo("23505");
        assertThat(result.isTransient()).isFalse();
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.suggestion()).isEqualTo(OutcomeReporter.PERMANENT_SUGGESTION);
        verify(statement, times(1)).executeUpdate(anyString());
    }

    @Test
    void executeQuery_transientFailure_isRetriedThenReported() throws SQLException {
        when(statement.executeQuery(anyString())).thenThrow(new SQLException("deadlock detected", "40P01"));

        StructuredResult result = tools.executeQuery("SELECT 1", "orders").join();

        assertThat(result.isTransient()).isTrue();
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(result.suggestion()).isEqualTo(OutcomeReporter.TRANSIENT_SUGGESTION);
        assertThat(recording.retries).hasSize(2);
        verify(statement, times(3)).executeQuery(anyString());
    }

    @Test
    void unknownDatabase_isPermanentWithoutCode() {
        StructuredResult result = tools.executeQuery("SELECT 1", "unknown").join();

        assertThat(result.success()).isFalse();
        assertThat(result.isTransient()).isFalse();
        assertThat(result.diagnosticCode()).isNull();
        assertThat(result.error()).contains("unknown");
    }

    @Test
    void testConnection_reportsServerAndSettings() throws SQLException {
        when(statement.executeQuery(DatabaseTools.TEST_CONNECTION_SQL)).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getTimestamp(1)).thenReturn(Timestamp.valueOf(LocalDateTime.of(2024, 1, 20, 10, 30, 0)));
        when(resultSet.getString(2)).thenReturn("orders");
        when(resultSet.getInt(3)).thenReturn(4242);
        when(resultSet.getString(4)).thenReturn("PostgreSQL 16.2");

        StructuredResult result = tools.testConnection("orders").join();

        assertThat(result.success()).isTrue();
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) result.data();
        assertThat(data)
                .containsEntry("message", "Connection successful")
                .containsEntry("serverTime", "2024-01-20 10:30:00")
                .containsEntry("databaseName", "orders")
                .containsEntry("processId", 4242)
                .containsEntry("serverVersion", "PostgreSQL 16.2")
                .containsEntry("connectionTimeout", 30L)
                .containsEntry("commandTimeout", 45L)
                .containsEntry("keepAlive", 30L)
                .containsEntry("poolingEnabled", false);
        verify(statement).setQueryTimeout(10);
    }

    @Test
    void listAvailableDatabases_listsNamesAndSettings() {
        StructuredResult result = tools.listAvailableDatabases().join();

        assertThat(result.success()).isTrue();
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) result.data();
        assertThat(data.get("availableDatabases")).isEqualTo(List.of("billing", "orders"));
        assertThat(data.get("resilienceSettings")).isEqualTo(Map.of(
                "maxRetryAttempts", 3,
                "commandTimeoutSeconds", 120L,
                "connectionTimeoutSeconds", 30L,
                "poolingEnabled", false,
                "keepAliveSeconds", 30L));
    }

    @Test
    void poolingEnabled_followsThePool() {
        ConnectionProfileResolver resolver = new ConnectionProfileResolver(ConnectionSource.of(Map.of(
                "orders", RawConnectionParameters.ofUrl("jdbc:postgresql://localhost:5432/orders"))));
        ResourcePool pooling = new ResourcePool() {
            @Override
            public ResourceHandle acquire(ResourceProfile profile) {
                return new FakeResourceHandle(profile.name(), connection);
            }

            @Override
            public boolean isPooling() {
                return true;
            }
        };
        DatabaseTools pooled = new DatabaseTools(RetryExecutor.builder(resolver, pooling)
                .reporter(recording)
                .executor(DIRECT)
                .build());

        @SuppressWarnings("unchecked")
        Map<String, Object> settings = (Map<String, Object>) ((Map<String, Object>) pooled.listAvailableDatabases()
                .join().data()).get("resilienceSettings");
        assertThat(settings).containsEntry("poolingEnabled", true);
    }

    @Test
    void submit_runsArbitraryOperation() {
        StructuredResult result = tools.submit("countOrders", "orders", (conn, profile) -> 17).join();

        assertThat(result.success()).isTrue();
        assertThat(result.data()).isEqualTo(17);
    }

    @Test
    void convert_formatsTemporalValuesAndArrays() throws SQLException {
        Array array = mock(Array.class);
        when(array.getArray()).thenReturn(new Object[] {"a", Timestamp.valueOf(LocalDateTime.of(2024, 2, 1, 0, 0))});

        assertThat(DatabaseTools.convert(LocalDateTime.of(2024, 1, 20, 10, 30, 5))).isEqualTo("2024-01-20 10:30:05");
        assertThat(DatabaseTools.convert(OffsetDateTime.of(2024, 1, 20, 10, 30, 5, 0, ZoneOffset.UTC)))
                .isEqualTo("2024-01-20 10:30:05");
        assertThat(DatabaseTools.convert(java.sql.Date.valueOf("2024-01-20"))).isEqualTo("2024-01-20 00:00:00");
        assertThat(DatabaseTools.convert(array)).isEqualTo(List.of("a", "2024-02-01 00:00:00"));
        assertThat(DatabaseTools.convert(new java.math.BigDecimal("12.50"))).isEqualTo(new java.math.BigDecimal("12.50"));
        assertThat(DatabaseTools.convert(java.util.UUID.fromString("123e4567-e89b-12d3-a456-426614174000")))
                .isEqualTo("123e4567-e89b-12d3-a456-426614174000");
    }
}
