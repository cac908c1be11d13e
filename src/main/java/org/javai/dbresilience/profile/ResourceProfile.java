package org.javai.dbresilience.profile;

import java.time.Duration;
import java.util.Objects;

/**
 * The enriched, validated parameters governing how a logical resource is accessed.
 * Instances are immutable and cached for the lifetime of the process by
 * {@link ConnectionProfileResolver}.
 *
 * @param name Logical resource name, the cache key
 * @param url JDBC URL of the data store
 * @param user User name (may be null when the URL carries it)
 * @param password Password (may be null); never included in {@link #toString()}
 * @param connectTimeout Bound on establishing a connection
 * @param operationTimeout Bound on a single statement
 * @param minPoolSize Minimum connections kept warm by the pool
 * @param maxPoolSize Maximum concurrent connections
 * @param idleLifetime How long an idle connection may live before eviction
 * @param pruningInterval How often the pool looks for idle connections
 * @param keepAlive Interval between keepalive messages
 * @param keepAliveProbeInterval Interval between keepalive probes once one is unanswered
 * @param maxCachedStatements Maximum prepared statements cached per connection
 * @param statementCacheMinUses Executions of a statement before it is prepared and cached
 * @param loadBalanceHosts Whether to spread connections across the URL's hosts
 */
public record ResourceProfile(
        String name,
        String url,
        String user,
        String password,
        Duration connectTimeout,
        Duration operationTimeout,
        int minPoolSize,
        int maxPoolSize,
        Duration idleLifetime,
        Duration pruningInterval,
        Duration keepAlive,
        Duration keepAliveProbeInterval,
        int maxCachedStatements,
        int statementCacheMinUses,
        boolean loadBalanceHosts
) {

    public ResourceProfile {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(url, "url must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        requirePositive(connectTimeout, "connectTimeout");
        requirePositive(operationTimeout, "operationTimeout");
        requirePositive(idleLifetime, "idleLifetime");
        requirePositive(pruningInterval, "pruningInterval");
        requirePositive(keepAlive, "keepAlive");
        requirePositive(keepAliveProbeInterval, "keepAliveProbeInterval");
        if (minPoolSize < 0) {
            throw new IllegalArgumentException("minPoolSize must be >= 0, was: " + minPoolSize);
        }
        if (maxPoolSize < 1) {
            throw new IllegalArgumentException("maxPoolSize must be >= 1, was: " + maxPoolSize);
        }
        if (minPoolSize > maxPoolSize) {
            throw new IllegalArgumentException(
                    "minPoolSize (" + minPoolSize + ") must not exceed maxPoolSize (" + maxPoolSize + ")");
        }
        if (maxCachedStatements < 0) {
            throw new IllegalArgumentException("maxCachedStatements must be >= 0, was: " + maxCachedStatements);
        }
        if (statementCacheMinUses < 1) {
            throw new IllegalArgumentException("statementCacheMinUses must be >= 1, was: " + statementCacheMinUses);
        }
    }

    private static void requirePositive(Duration value, String field) {
        Objects.requireNonNull(value, field + " must not be null");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(field + " must be > 0, was: " + value);
        }
    }

    @Override
    public String toString() {
        return "ResourceProfile[name=" + name
                + ", url=" + url
                + ", user=" + user
                + ", connectTimeout=" + connectTimeout
                + ", operationTimeout=" + operationTimeout
                + ", pool=[" + minPoolSize + "," + maxPoolSize + "]"
                + ", idleLifetime=" + idleLifetime
                + ", pruningInterval=" + pruningInterval
                + ", keepAlive=" + keepAlive + "/" + keepAliveProbeInterval
                + ", statementCache=" + maxCachedStatements + "@" + statementCacheMinUses
                + ", loadBalanceHosts=" + loadBalanceHosts + "]";
    }
}
