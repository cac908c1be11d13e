package org.javai.dbresilience.profile;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.dbresilience.Failure;
import org.javai.dbresilience.Outcome;
import org.javai.dbresilience.classify.ErrorClassification;
import org.javai.dbresilience.classify.FaultKind;
import org.javai.dbresilience.classify.RawFailure;
import org.javai.dbresilience.profile.ProfileDefaults.OverrideKey;

/**
 * Maps a logical resource name to an enriched {@link ResourceProfile}.
 *
 * <p>Profiles are built once per name, on first successful resolution, and cached for the
 * lifetime of this resolver. Concurrent first resolutions of the same name may both build a
 * profile, but only one is published and every caller receives that one. Failed resolutions
 * are not cached.
 */
public final class ConnectionProfileResolver {

    static final String OPERATION = "resolve";

    private static final Logger LOGGER = LogManager.getLogger(ConnectionProfileResolver.class);

    private final ConnectionSource source;
    private final ProfileDefaults defaults;
    private final ConcurrentMap<String, ResourceProfile> cache = new ConcurrentHashMap<>();

    public ConnectionProfileResolver(ConnectionSource source) {
        this(source, ProfileDefaults.standard());
    }

    public ConnectionProfileResolver(ConnectionSource source, ProfileDefaults defaults) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
    }

    /**
     * Resolves a resource name to its profile.
     *
     * @param name Logical resource name
     * @return Ok with the cached profile, or a permanent Fail if the name is blank, unknown,
     *         or its parameters do not form a valid profile
     */
    public Outcome<ResourceProfile> resolve(String name) {
        if (name == null || name.isBlank()) {
            return failure(String.valueOf(name), FaultKind.INVALID_REQUEST, "invalid_request",
                    "Resource name must not be empty");
        }

        ResourceProfile cached = cache.get(name);
        if (cached != null) {
            return Outcome.ok(cached);
        }

        Optional<RawConnectionParameters> raw = source.lookup(name);
        if (raw.isEmpty()) {
            return failure(name, FaultKind.NOT_FOUND, "resource_not_found",
                    "No connection string found for database '" + name
                            + "'. Available databases can be listed with listAvailableDatabases()");
        }

        ResourceProfile profile;
        try {
            profile = enrich(name, raw.get());
        } catch (IllegalArgumentException e) {
            return failure(name, FaultKind.INVALID_PROFILE, "invalid_profile",
                    "Invalid connection settings for database '" + name + "': " + e.getMessage());
        }

        ResourceProfile published = cache.putIfAbsent(name, profile);
        if (published == null) {
            LOGGER.debug("Resolved profile {}", profile);
            return Outcome.ok(profile);
        }
        return Outcome.ok(published);
    }

    /**
     * Names of all configured resources.
     */
    public Set<String> availableResources() {
        return source.names();
    }

    public ProfileDefaults defaults() {
        return defaults;
    }

    private ResourceProfile enrich(String name, RawConnectionParameters raw) {
        Map<String, String> overrides = raw.overrides();
        for (String key : overrides.keySet()) {
            if (!isKnownKey(key)) {
                LOGGER.debug("Ignoring unknown override '{}' for resource {}", key, name);
            }
        }

        return new ResourceProfile(
                name,
                raw.url(),
                raw.user(),
                raw.password(),
                seconds(overrides, OverrideKey.CONNECT_TIMEOUT, defaults.connectTimeout()),
                seconds(overrides, OverrideKey.OPERATION_TIMEOUT, defaults.operationTimeout()),
                integer(overrides, OverrideKey.MIN_POOL_SIZE, defaults.minPoolSize()),
                integer(overrides, OverrideKey.MAX_POOL_SIZE, defaults.maxPoolSize()),
                seconds(overrides, OverrideKey.IDLE_LIFETIME, defaults.idleLifetime()),
                seconds(overrides, OverrideKey.PRUNING_INTERVAL, defaults.pruningInterval()),
                seconds(overrides, OverrideKey.KEEP_ALIVE, defaults.keepAlive()),
                seconds(overrides, OverrideKey.KEEP_ALIVE_PROBE_INTERVAL, defaults.keepAliveProbeInterval()),
                integer(overrides, OverrideKey.MAX_CACHED_STATEMENTS, defaults.maxCachedStatements()),
                integer(overrides, OverrideKey.STATEMENT_CACHE_MIN_USES, defaults.statementCacheMinUses()),
                bool(overrides, OverrideKey.LOAD_BALANCE_HOSTS, defaults.loadBalanceHosts())
        );
    }

    private static boolean isKnownKey(String key) {
        for (OverrideKey known : OverrideKey.values()) {
            if (known.key().equals(key)) {
                return true;
            }
        }
        return false;
    }

    private static Duration seconds(Map<String, String> overrides, OverrideKey key, Duration fallback) {
        String value = overrides.get(key.key());
        return value == null ? fallback : Duration.ofSeconds(parseLong(key, value));
    }

    private static int integer(Map<String, String> overrides, OverrideKey key, int fallback) {
        String value = overrides.get(key.key());
        if (value == null) {
            return fallback;
        }
        long parsed = parseLong(key, value);
        if (parsed < Integer.MIN_VALUE || parsed > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(key.key() + " is out of range: " + value);
        }
        return (int) parsed;
    }

    private static boolean bool(Map<String, String> overrides, OverrideKey key, boolean fallback) {
        String value = overrides.get(key.key());
        if (value == null) {
            return fallback;
        }
        String normalized = value.trim().toLowerCase();
        if (normalized.equals("true") || normalized.equals("false")) {
            return Boolean.parseBoolean(normalized);
        }
        throw new IllegalArgumentException(key.key() + " must be true or false, was: " + value);
    }

    private static long parseLong(OverrideKey key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key.key() + " must be a whole number, was: " + value);
        }
    }

    private static Outcome<ResourceProfile> failure(String name, FaultKind kind, String reason, String message) {
        RawFailure raw = RawFailure.of(kind, message);
        return Outcome.fail(Failure.of(raw, ErrorClassification.permanentFailure(null, reason), 1, OPERATION, name));
    }
}
