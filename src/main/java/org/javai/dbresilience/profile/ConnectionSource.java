package org.javai.dbresilience.profile;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Supplies raw connection parameters by logical resource name.
 * Implementations only look values up; enrichment is done by {@link ConnectionProfileResolver}.
 */
public interface ConnectionSource {

    /**
     * Looks up the raw parameters for a resource.
     *
     * @param name Logical resource name
     * @return The parameters, or empty if this source does not know the name
     */
    Optional<RawConnectionParameters> lookup(String name);

    /**
     * Names of all resources this source knows, in a stable order.
     */
    Set<String> names();

    /**
     * A source backed by a fixed map.
     */
    static ConnectionSource of(Map<String, RawConnectionParameters> parameters) {
        Map<String, RawConnectionParameters> copy = Map.copyOf(parameters);
        return new ConnectionSource() {
            @Override
            public Optional<RawConnectionParameters> lookup(String name) {
                return Optional.ofNullable(copy.get(name));
            }

            @Override
            public Set<String> names() {
                return new TreeSet<>(copy.keySet());
            }
        };
    }

    /**
     * A source that knows no resources.
     */
    static ConnectionSource empty() {
        return of(Map.of());
    }
}
