package org.javai.dbresilience.pool;

import com.zaxxer.hikari.HikariDataSource;
import java.util.Map;
import org.javai.dbresilience.profile.ConnectionProfileResolver;
import org.javai.dbresilience.profile.ConnectionSource;
import org.javai.dbresilience.profile.RawConnectionParameters;
import org.javai.dbresilience.profile.ResourceProfile;
import org.junit.jupiter.api.Test;
import org.postgresql.ds.PGSimpleDataSource;

import static org.assertj.core.api.Assertions.*;

class HikariPgDataSourceFactoryTest {

    @Test
    void create_mapsProfileOntoPool() {
        ResourceProfile profile = profile(Map.of(
                "minPoolSize", "2", "maxPoolSize", "8", "idleLifetime", "120",
                "keepAlive", "45", "connectTimeout", "15"));

        try (HikariDataSource pool = (HikariDataSource) new HikariPgDataSourceFactory().create(profile)) {
            assertThat(pool.getPoolName()).isEqualTo("db-resilience-orders");
            assertThat(pool.getMinimumIdle()).isEqualTo(2);
            assertThat(pool.getMaximumPoolSize()).isEqualTo(8);
            assertThat(pool.getIdleTimeout()).isEqualTo(120_000L);
            assertThat(pool.getKeepaliveTime()).isEqualTo(45_000L);
            assertThat(pool.getConnectionTimeout()).isEqualTo(15_000L);
            assertThat(pool.getDataSource()).isInstanceOf(PGSimpleDataSource.class);
            assertThat(((PGSimpleDataSource) pool.getDataSource()).getUser()).isEqualTo("app");
            assertThat(pool.isRunning()).isFalse();
        }
    }

    @Test
    void create_defaultsGiveStandardPoolBounds() {
        try (HikariDataSource pool = (HikariDataSource) new HikariPgDataSourceFactory().create(profile(Map.of()))) {
            assertThat(pool.getMinimumIdle()).isEqualTo(1);
            assertThat(pool.getMaximumPoolSize()).isEqualTo(20);
            assertThat(pool.getIdleTimeout()).isEqualTo(300_000L);
            assertThat(pool.getKeepaliveTime()).isEqualTo(30_000L);
            assertThat(pool.getConnectionTimeout()).isEqualTo(30_000L);
        }
    }

    @Test
    void postgresPool_isPooling() {
        try (DataSourceResourcePool pool = DataSourceResourcePool.postgres()) {
            assertThat(pool.isPooling()).isTrue();
        }
        assertThat(new DataSourceResourcePool(new PgDataSourceFactory()).isPooling()).isFalse();
    }

    private static ResourceProfile profile(Map<String, String> overrides) {
        RawConnectionParameters raw = new RawConnectionParameters(
                "jdbc:postgresql://localhost:5432/orders", "app", "secret", overrides);
        return new ConnectionProfileResolver(ConnectionSource.of(Map.of("orders", raw)))
                .resolve("orders")
                .getOrThrow();
    }
}
