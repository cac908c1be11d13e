package org.javai.dbresilience.pool;

import javax.sql.DataSource;
import org.javai.dbresilience.profile.ResourceProfile;

/**
 * Creates the {@link DataSource} that serves one resource profile.
 */
@FunctionalInterface
public interface DataSourceFactory {

    DataSource create(ResourceProfile profile);

    /**
     * Whether the data sources this factory creates pool their connections.
     */
    default boolean pooling() {
        return false;
    }
}
