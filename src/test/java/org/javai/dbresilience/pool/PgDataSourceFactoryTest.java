package org.javai.dbresilience.pool;

import java.util.Map;
import org.javai.dbresilience.profile.ConnectionProfileResolver;
import org.javai.dbresilience.profile.ConnectionSource;
import org.javai.dbresilience.profile.RawConnectionParameters;
import org.javai.dbresilience.profile.ResourceProfile;
import org.junit.jupiter.api.Test;
import org.postgresql.ds.PGSimpleDataSource;

import static org.assertj.core.api.Assertions.*;

class PgDataSourceFactoryTest {

    @Test
    void create_appliesProfileSettings() {
        RawConnectionParameters raw = new RawConnectionParameters(
                "jdbc:postgresql://localhost:5432/orders", "app", "secret",
                Map.of("connectTimeout", "15", "maxCachedStatements", "25", "statementCacheMinUses", "3",
                        "loadBalanceHosts", "true"));
        ResourceProfile profile = new ConnectionProfileResolver(ConnectionSource.of(Map.of("orders", raw)))
                .resolve("orders")
                .getOrThrow();

        PGSimpleDataSource dataSource = (PGSimpleDataSource) new PgDataSourceFactory().create(profile);

        assertThat(dataSource.getDatabaseName()).isEqualTo("orders");
        assertThat(dataSource.getUser()).isEqualTo("app");
        assertThat(dataSource.getApplicationName()).isEqualTo(PgDataSourceFactory.APPLICATION_NAME);
        assertThat(dataSource.getConnectTimeout()).isEqualTo(15);
        assertThat(dataSource.getTcpKeepAlive()).isTrue();
        assertThat(dataSource.getPrepareThreshold()).isEqualTo(3);
        assertThat(dataSource.getPreparedStatementCacheQueries()).isEqualTo(25);
        assertThat(dataSource.getLoadBalanceHosts()).isTrue();
    }
}
