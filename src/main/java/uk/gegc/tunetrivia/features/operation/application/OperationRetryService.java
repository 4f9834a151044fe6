package uk.gegc.tunetrivia.features.operation.application;

import uk.gegc.tunetrivia.features.operation.domain.model.Operation;
import uk.gegc.tunetrivia.features.operation.domain.model.OperationResult;

import java.util.concurrent.Callable;

/**
 * Runs persistence calls with bounded retries and exponential backoff.
 */
public interface OperationRetryService {

    /**
     * Apply an operation, retrying failures the classifier deems transient.
     *
     * @throws uk.gegc.tunetrivia.shared.exception.TransientStoreException when every attempt failed
     *         with a retryable error
     * @throws uk.gegc.tunetrivia.shared.exception.PermanentStoreException on the first non-retryable error
     */
    OperationResult applyWithRetry(Operation operation, AttemptClassifier classifier, String ownerId);

    /**
     * Same as {@link #applyWithRetry(Operation, AttemptClassifier, String)} with the default classifier.
     */
    OperationResult applyWithRetry(Operation operation, String ownerId);

    /**
     * Retry loop for an arbitrary persistence call.
     */
    <T> T executeWithRetry(String operationName, Callable<T> attempt, AttemptClassifier classifier, String ownerId);

    /**
     * Delay before attempt {@code attempt + 1}: {@code min(base * multiplier^(attempt-1), cap)}.
     */
    long calculateDelay(int attempt);
}
