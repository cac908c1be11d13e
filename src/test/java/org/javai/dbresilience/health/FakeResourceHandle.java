package org.javai.dbresilience.health;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Scriptable handle for tests. Records the calls made on it.
 */
public class FakeResourceHandle implements ResourceHandle {

    private final String resourceName;
    private final Connection connection;
    private SQLException openFailure;
    private RuntimeException probeRuntimeFailure;
    private SQLException probeFailure;
    private boolean open;
    private int closeCount;
    private final List<Duration> probeTimeouts = new ArrayList<>();

    public FakeResourceHandle(String resourceName, Connection connection) {
        this.resourceName = resourceName;
        this.connection = connection;
    }

    public FakeResourceHandle failOpenWith(SQLException failure) {
        this.openFailure = failure;
        return this;
    }

    public FakeResourceHandle failProbeWith(SQLException failure) {
        this.probeFailure = failure;
        return this;
    }

    public FakeResourceHandle failProbeWith(RuntimeException failure) {
        this.probeRuntimeFailure = failure;
        return this;
    }

    @Override
    public String resourceName() {
        return resourceName;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void open() throws SQLException {
        if (openFailure != null) {
            throw openFailure;
        }
        open = true;
    }

    @Override
    public void probe(Duration timeout) throws SQLException {
        probeTimeouts.add(timeout);
        if (probeFailure != null) {
            throw probeFailure;
        }
        if (probeRuntimeFailure != null) {
            throw probeRuntimeFailure;
        }
    }

    @Override
    public Connection connection() {
        if (!open) {
            throw new IllegalStateException("not open");
        }
        return connection;
    }

    @Override
    public void close() {
        open = false;
        closeCount++;
    }

    public int closeCount() {
        return closeCount;
    }

    public List<Duration> probeTimeouts() {
        return probeTimeouts;
    }
}
