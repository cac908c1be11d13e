package org.javai.dbresilience.classify;

/**
 * Decides whether a failure is worth retrying.
 * Implementations must be pure: identical input yields identical output.
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * Classifies a raw failure.
     *
     * @param failure The failure reported for an attempt
     * @return Exactly one classification for the failure
     */
    ErrorClassification classify(RawFailure failure);
}
