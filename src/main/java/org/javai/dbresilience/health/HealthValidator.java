package org.javai.dbresilience.health;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Confirms a handle is usable before real work is run on it.
 */
public class HealthValidator {

    public static final Duration DEFAULT_PROBE_TIMEOUT = Duration.ofSeconds(5);

    private static final Logger LOGGER = LogManager.getLogger(HealthValidator.class);

    /**
     * Opens the handle if needed, then probes it.
     *
     * @param handle The handle to validate
     * @param probeTimeout Bound on the probe round-trip
     * @return true if the probe succeeded, false if it failed for any reason
     * @throws SQLException if the handle was closed and could not be opened
     */
    public boolean ensureLive(ResourceHandle handle, Duration probeTimeout) throws SQLException {
        Objects.requireNonNull(handle, "handle must not be null");
        Objects.requireNonNull(probeTimeout, "probeTimeout must not be null");

        if (!handle.isOpen()) {
            handle.open();
        }

        try {
            handle.probe(probeTimeout);
            return true;
        } catch (SQLException | RuntimeException e) {
            LOGGER.debug("Health probe failed for resource {}: {}", handle.resourceName(), e.getMessage());
            return false;
        }
    }
}
