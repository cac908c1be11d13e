package org.javai.dbresilience.pool;

import org.javai.dbresilience.health.ResourceHandle;
import org.javai.dbresilience.profile.ResourceProfile;

/**
 * Hands out attempt-scoped handles for a resource. The pool itself lives outside this library;
 * implementations adapt an existing pool.
 */
@FunctionalInterface
public interface ResourcePool {

    /**
     * Creates a new, not yet opened, handle for the profile's resource.
     * Callers must close the handle on every exit path.
     */
    ResourceHandle acquire(ResourceProfile profile);

    /**
     * Whether released handles return their connections to a pool rather than closing them.
     */
    default boolean isPooling() {
        return false;
    }
}
