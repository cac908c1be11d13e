package org.javai.dbresilience.boundary;

import org.javai.dbresilience.classify.RawFailure;

/**
 * Maps a collaborator's exception into the {@link RawFailure} vocabulary.
 * This is the single point where exceptions are translated into the outcome world.
 */
@FunctionalInterface
public interface FaultTranslator {

    /**
     * Translates an exception, and its cause chain, into a raw failure chain.
     *
     * @param throwable The exception raised during an attempt
     * @return The equivalent raw failure, never null
     */
    RawFailure translate(Throwable throwable);
}
