package org.javai.dbresilience.profile;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Combines sources into layers. Later layers override earlier ones for the same name.
 */
public final class LayeredConnectionSource implements ConnectionSource {

    private final List<ConnectionSource> layers;

    private LayeredConnectionSource(List<ConnectionSource> layers) {
        this.layers = List.copyOf(layers);
    }

    /**
     * Creates a layered source; the last layer has the highest priority.
     */
    public static LayeredConnectionSource of(ConnectionSource... layers) {
        return new LayeredConnectionSource(Arrays.asList(layers));
    }

    @Override
    public Optional<RawConnectionParameters> lookup(String name) {
        List<ConnectionSource> byPriority = new ArrayList<>(layers);
        Collections.reverse(byPriority);
        for (ConnectionSource layer : byPriority) {
            Optional<RawConnectionParameters> found = layer.lookup(name);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    @Override
    public Set<String> names() {
        Set<String> names = new TreeSet<>();
        for (ConnectionSource layer : layers) {
            names.addAll(layer.names());
        }
        return names;
    }

    public int size() {
        return layers.size();
    }
}
