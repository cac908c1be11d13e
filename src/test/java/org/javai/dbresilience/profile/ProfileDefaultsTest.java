package org.javai.dbresilience.profile;

import java.time.Duration;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ProfileDefaultsTest {

    @Test
    void builder_startsFromStandardDefaults() {
        assertThat(ProfileDefaults.builder().build()).isEqualTo(ProfileDefaults.standard());
    }

    @Test
    void builder_overridesEveryTunable() {
        ProfileDefaults defaults = ProfileDefaults.builder()
                .connectTimeout(Duration.ofSeconds(3))
                .operationTimeout(Duration.ofSeconds(60))
                .poolBounds(0, 8)
                .idleLifetime(Duration.ofSeconds(90))
                .pruningInterval(Duration.ofSeconds(5))
                .keepAlive(Duration.ofSeconds(15), Duration.ofSeconds(3))
                .statementCache(50, 1)
                .loadBalanceHosts(true)
                .build();

        assertThat(defaults).isEqualTo(new ProfileDefaults(
                Duration.ofSeconds(3), Duration.ofSeconds(60), 0, 8, Duration.ofSeconds(90), Duration.ofSeconds(5),
                Duration.ofSeconds(15), Duration.ofSeconds(3), 50, 1, true));
    }

    @Test
    void toBuilder_leavesOriginalUntouched() {
        ProfileDefaults original = ProfileDefaults.standard();

        ProfileDefaults changed = original.toBuilder().operationTimeout(Duration.ofSeconds(10)).build();

        assertThat(original.operationTimeout()).isEqualTo(Duration.ofSeconds(120));
        assertThat(changed.operationTimeout()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void overrideKeys_matchProfileFieldNames() {
        assertThat(Arrays.stream(ProfileDefaults.OverrideKey.values()).map(ProfileDefaults.OverrideKey::key))
                .containsExactly("connectTimeout", "operationTimeout", "minPoolSize", "maxPoolSize", "idleLifetime",
                        "pruningInterval", "keepAlive", "keepAliveProbeInterval", "maxCachedStatements",
                        "statementCacheMinUses", "loadBalanceHosts");
    }
}
