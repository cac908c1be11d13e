package org.javai.dbresilience.pool;

import com.zaxxer.hikari.HikariDataSource;
import java.util.Objects;
import javax.sql.DataSource;
import org.javai.dbresilience.profile.ResourceProfile;

/**
 * Pools PostgreSQL connections with HikariCP, one pool per resource.
 *
 * <p>The driver data source comes from {@link PgDataSourceFactory}; the profile's pool bounds,
 * idle lifetime, keepalive and connect timeout are applied to the pool. The pool starts on the
 * first borrowed connection, so a resource that is never used never connects.
 *
 * <p>HikariCP evicts idle connections from a housekeeping task whose period is process-wide, so
 * {@link ResourceProfile#pruningInterval()} is not applied per pool.
 */
public class HikariPgDataSourceFactory implements DataSourceFactory {

    static final String POOL_NAME_PREFIX = "db-resilience-";

    private final PgDataSourceFactory driverFactory;

    public HikariPgDataSourceFactory() {
        this(new PgDataSourceFactory());
    }

    public HikariPgDataSourceFactory(PgDataSourceFactory driverFactory) {
        this.driverFactory = Objects.requireNonNull(driverFactory, "driverFactory must not be null");
    }

    @Override
    public DataSource create(ResourceProfile profile) {
        HikariDataSource pool = new HikariDataSource();
        pool.setPoolName(POOL_NAME_PREFIX + profile.name());
        pool.setDataSource(driverFactory.create(profile));
        pool.setMinimumIdle(profile.minPoolSize());
        pool.setMaximumPoolSize(profile.maxPoolSize());
        pool.setIdleTimeout(profile.idleLifetime().toMillis());
        pool.setKeepaliveTime(profile.keepAlive().toMillis());
        pool.setConnectionTimeout(profile.connectTimeout().toMillis());
        return pool;
    }

    @Override
    public boolean pooling() {
        return true;
    }
}
