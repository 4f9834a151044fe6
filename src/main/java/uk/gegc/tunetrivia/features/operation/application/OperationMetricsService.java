package uk.gegc.tunetrivia.features.operation.application;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Observations emitted by the retry loop and the failed-operation queue.
 */
public interface OperationMetricsService {

    void recordRecovered(String operationName, int attempts, Duration recoveryTime);

    void recordExhausted(String operationName, int attempts);

    void recordPermanentFailure(String operationName);

    void recordEnqueued(String operationName);

    void recordReplaySucceeded(String operationName);

    void recordRequeued(String operationName);

    void recordDiscarded(String operationName, String reason);

    void registerQueueSizeGauge(Supplier<Number> queueSize);
}
