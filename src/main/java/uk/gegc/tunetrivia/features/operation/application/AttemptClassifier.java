package uk.gegc.tunetrivia.features.operation.application;

/**
 * Decides whether a failed attempt is worth repeating.
 */
@FunctionalInterface
public interface AttemptClassifier {

    boolean isRetryable(Throwable error);
}
