package org.javai.dbresilience.profile;

import java.util.Map;
import java.util.Objects;

/**
 * Connection parameters for one resource as found in configuration, before enrichment.
 *
 * @param url JDBC URL
 * @param user User name (may be null)
 * @param password Password (may be null)
 * @param overrides Per-resource overrides of {@link ProfileDefaults}, keyed by
 *                  {@link ProfileDefaults.OverrideKey#key()}
 */
public record RawConnectionParameters(String url, String user, String password, Map<String, String> overrides) {

    public RawConnectionParameters {
        Objects.requireNonNull(url, "url must not be null");
        overrides = overrides == null ? Map.of() : Map.copyOf(overrides);
    }

    public static RawConnectionParameters ofUrl(String url) {
        return new RawConnectionParameters(url, null, null, Map.of());
    }

    @Override
    public String toString() {
        return "RawConnectionParameters[url=" + url + ", user=" + user + ", overrides=" + overrides + "]";
    }
}
