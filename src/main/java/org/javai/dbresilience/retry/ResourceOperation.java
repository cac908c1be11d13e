package org.javai.dbresilience.retry;

import java.sql.Connection;
import org.javai.dbresilience.profile.ResourceProfile;

/**
 * A unit of work run against a live connection.
 *
 * <p>The operation must bound itself, typically with a statement timeout taken from
 * {@link ResourceProfile#operationTimeout()}; the executor never cancels an attempt in flight.
 *
 * @param <T> The type of value produced
 */
@FunctionalInterface
public interface ResourceOperation<T> {

    T apply(Connection connection, ResourceProfile profile) throws Exception;
}
