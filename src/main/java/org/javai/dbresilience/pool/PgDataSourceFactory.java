package org.javai.dbresilience.pool;

import javax.sql.DataSource;
import org.javai.dbresilience.profile.ResourceProfile;
import org.postgresql.ds.PGSimpleDataSource;

/**
 * Configures a PostgreSQL driver data source from a profile.
 *
 * <p>The driver data source opens a new connection on every borrow;
 * {@link HikariPgDataSourceFactory} pools it.
 */
public class PgDataSourceFactory implements DataSourceFactory {

    static final String APPLICATION_NAME = "db-resilience";

    @Override
    public DataSource create(ResourceProfile profile) {
        PGSimpleDataSource dataSource = new PGSimpleDataSource();
        dataSource.setURL(profile.url());
        if (profile.user() != null) {
            dataSource.setUser(profile.user());
        }
        if (profile.password() != null) {
            dataSource.setPassword(profile.password());
        }
        dataSource.setApplicationName(APPLICATION_NAME);
        dataSource.setConnectTimeout(seconds(profile.connectTimeout().getSeconds()));
        dataSource.setTcpKeepAlive(true);
        dataSource.setPrepareThreshold(profile.statementCacheMinUses());
        dataSource.setPreparedStatementCacheQueries(profile.maxCachedStatements());
        dataSource.setLoadBalanceHosts(profile.loadBalanceHosts());
        return dataSource;
    }

    private static int seconds(long value) {
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1, value));
    }
}
