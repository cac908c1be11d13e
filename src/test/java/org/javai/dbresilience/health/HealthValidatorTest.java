package org.javai.dbresilience.health;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class HealthValidatorTest {

    private final HealthValidator validator = new HealthValidator();

    @Test
    void ensureLive_opensClosedHandleAndProbes() throws SQLException {
        FakeResourceHandle handle = new FakeResourceHandle("orders", null);

        boolean live = validator.ensureLive(handle, HealthValidator.DEFAULT_PROBE_TIMEOUT);

        assertThat(live).isTrue();
        assertThat(handle.isOpen()).isTrue();
        assertThat(handle.probeTimeouts()).containsExactly(Duration.ofSeconds(5));
    }

    @Test
    void ensureLive_probeFailure_returnsFalse() throws SQLException {
        FakeResourceHandle handle = new FakeResourceHandle("orders", null)
                .failProbeWith(new SQLTimeoutException("probe timed out"));

        assertThat(validator.ensureLive(handle, Duration.ofSeconds(5))).isFalse();
    }

    @Test
    void ensureLive_probeRuntimeFailure_returnsFalse() throws SQLException {
        FakeResourceHandle handle = new FakeResourceHandle("orders", null)
                .failProbeWith(new IllegalStateException("driver bug"));

        assertThat(validator.ensureLive(handle, Duration.ofSeconds(5))).isFalse();
    }

    @Test
    void ensureLive_openFailure_propagates() {
        SQLException refused = new SQLException("Connection refused", "08001");
        FakeResourceHandle handle = new FakeResourceHandle("orders", null).failOpenWith(refused);

        assertThatThrownBy(() -> validator.ensureLive(handle, Duration.ofSeconds(5)))
                .isSameAs(refused);
    }

    @Test
    void ensureLive_alreadyOpenHandle_isOnlyProbed() throws SQLException {
        FakeResourceHandle handle = new FakeResourceHandle("orders", null);
        handle.open();
        handle.failOpenWith(new SQLException("must not reopen"));

        assertThat(validator.ensureLive(handle, Duration.ofSeconds(1))).isTrue();
    }
}
