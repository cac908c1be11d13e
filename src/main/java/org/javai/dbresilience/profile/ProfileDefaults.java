package org.javai.dbresilience.profile;

import java.time.Duration;
import java.util.Objects;

/**
 * The enrichment policy applied to raw connection parameters.
 *
 * <p>Every field may be overridden per resource through the override keys named by
 * {@link OverrideKey}; see {@link ConnectionProfileResolver}.
 */
public record ProfileDefaults(
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

    private static final ProfileDefaults STANDARD = new ProfileDefaults(
            Duration.ofSeconds(30),
            Duration.ofSeconds(120),
            1,
            20,
            Duration.ofSeconds(300),
            Duration.ofSeconds(10),
            Duration.ofSeconds(30),
            Duration.ofSeconds(10),
            10,
            2,
            false
    );

    public ProfileDefaults {
        Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
        Objects.requireNonNull(operationTimeout, "operationTimeout must not be null");
        Objects.requireNonNull(idleLifetime, "idleLifetime must not be null");
        Objects.requireNonNull(pruningInterval, "pruningInterval must not be null");
        Objects.requireNonNull(keepAlive, "keepAlive must not be null");
        Objects.requireNonNull(keepAliveProbeInterval, "keepAliveProbeInterval must not be null");
    }

    /**
     * Connect 30s, operation 120s, pool [1,20], idle 300s, pruning 10s, keepalive 30s/10s,
     * 10 cached statements after 2 uses, no load balancing.
     */
    public static ProfileDefaults standard() {
        return STANDARD;
    }

    public static Builder builder() {
        return new Builder(STANDARD);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * The keys accepted in a resource's raw overrides. Durations are given in whole seconds.
     */
    public enum OverrideKey {
        CONNECT_TIMEOUT("connectTimeout"),
        OPERATION_TIMEOUT("operationTimeout"),
        MIN_POOL_SIZE("minPoolSize"),
        MAX_POOL_SIZE("maxPoolSize"),
        IDLE_LIFETIME("idleLifetime"),
        PRUNING_INTERVAL("pruningInterval"),
        KEEP_ALIVE("keepAlive"),
        KEEP_ALIVE_PROBE_INTERVAL("keepAliveProbeInterval"),
        MAX_CACHED_STATEMENTS("maxCachedStatements"),
        STATEMENT_CACHE_MIN_USES("statementCacheMinUses"),
        LOAD_BALANCE_HOSTS("loadBalanceHosts");

        private final String key;

        OverrideKey(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }
    }

    public static final class Builder {
        private Duration connectTimeout;
        private Duration operationTimeout;
        private int minPoolSize;
        private int maxPoolSize;
        private Duration idleLifetime;
        private Duration pruningInterval;
        private Duration keepAlive;
        private Duration keepAliveProbeInterval;
        private int maxCachedStatements;
        private int statementCacheMinUses;
        private boolean loadBalanceHosts;

        private Builder(ProfileDefaults from) {
            this.connectTimeout = from.connectTimeout;
            this.operationTimeout = from.operationTimeout;
            this.minPoolSize = from.minPoolSize;
            this.maxPoolSize = from.maxPoolSize;
            this.idleLifetime = from.idleLifetime;
            this.pruningInterval = from.pruningInterval;
            this.keepAlive = from.keepAlive;
            this.keepAliveProbeInterval = from.keepAliveProbeInterval;
            this.maxCachedStatements = from.maxCachedStatements;
            this.statementCacheMinUses = from.statementCacheMinUses;
            this.loadBalanceHosts = from.loadBalanceHosts;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder operationTimeout(Duration operationTimeout) {
            this.operationTimeout = operationTimeout;
            return this;
        }

        public Builder poolBounds(int min, int max) {
            this.minPoolSize = min;
            this.maxPoolSize = max;
            return this;
        }

        public Builder idleLifetime(Duration idleLifetime) {
            this.idleLifetime = idleLifetime;
            return this;
        }

        public Builder pruningInterval(Duration pruningInterval) {
            this.pruningInterval = pruningInterval;
            return this;
        }

        public Builder keepAlive(Duration keepAlive, Duration probeInterval) {
            this.keepAlive = keepAlive;
            this.keepAliveProbeInterval = probeInterval;
            return this;
        }

        public Builder statementCache(int maxCachedStatements, int minUses) {
            this.maxCachedStatements = maxCachedStatements;
            this.statementCacheMinUses = minUses;
            return this;
        }

        public Builder loadBalanceHosts(boolean loadBalanceHosts) {
            this.loadBalanceHosts = loadBalanceHosts;
            return this;
        }

        public ProfileDefaults build() {
            return new ProfileDefaults(connectTimeout, operationTimeout, minPoolSize, maxPoolSize,
                    idleLifetime, pruningInterval, keepAlive, keepAliveProbeInterval,
                    maxCachedStatements, statementCacheMinUses, loadBalanceHosts);
        }
    }
}
