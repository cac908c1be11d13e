package org.javai.dbresilience.pool;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import javax.sql.DataSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.dbresilience.health.ResourceHandle;
import org.javai.dbresilience.profile.ResourceProfile;

/**
 * Adapts one {@link DataSource} per resource into a {@link ResourcePool}.
 *
 * <p>Data sources are created lazily, once per resource name. Closing the pool closes every
 * data source that is itself {@link AutoCloseable}, as pooling data sources are.
 */
public final class DataSourceResourcePool implements ResourcePool, AutoCloseable {

    private static final Logger LOGGER = LogManager.getLogger(DataSourceResourcePool.class);

    private final DataSourceFactory factory;
    private final ConcurrentMap<String, DataSource> dataSources = new ConcurrentHashMap<>();

    public DataSourceResourcePool(DataSourceFactory factory) {
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
    }

    /**
     * A pool over HikariCP-pooled PostgreSQL data sources configured from each profile.
     */
    public static DataSourceResourcePool postgres() {
        return new DataSourceResourcePool(new HikariPgDataSourceFactory());
    }

    @Override
    public ResourceHandle acquire(ResourceProfile profile) {
        Objects.requireNonNull(profile, "profile must not be null");
        DataSource dataSource = dataSources.computeIfAbsent(profile.name(), name -> factory.create(profile));
        return new JdbcResourceHandle(profile.name(), dataSource);
    }

    @Override
    public boolean isPooling() {
        return factory.pooling();
    }

    @Override
    public void close() {
        for (var entry : dataSources.entrySet()) {
            if (entry.getValue() instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                } catch (Exception e) {
                    LOGGER.warn("Failed to close data source for resource {}: {}", entry.getKey(), e.getMessage());
                }
            }
        }
        dataSources.clear();
    }
}
