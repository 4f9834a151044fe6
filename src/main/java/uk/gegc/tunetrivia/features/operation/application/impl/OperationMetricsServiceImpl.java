package uk.gegc.tunetrivia.features.operation.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.tunetrivia.features.operation.application.OperationMetricsService;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Micrometer counters for the retry loop and the failed-operation queue.
 * Operation names are not used as tags to keep cardinality bounded; they go to the debug log instead.
 */
@Slf4j
@Service
public class OperationMetricsServiceImpl implements OperationMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter recoveredCounter;
    private final Counter exhaustedCounter;
    private final Counter permanentFailureCounter;
    private final Counter enqueuedCounter;
    private final Counter replaySucceededCounter;
    private final Counter requeuedCounter;
    private final DistributionSummary attemptsSummary;
    private final Timer recoveryTimer;

    public OperationMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.recoveredCounter = Counter.builder("operations.retry.recovered")
                .description("Operations that succeeded after at least one failed attempt")
                .register(meterRegistry);
        this.exhaustedCounter = Counter.builder("operations.retry.exhausted")
                .description("Operations that failed every attempt with retryable errors")
                .register(meterRegistry);
        this.permanentFailureCounter = Counter.builder("operations.retry.permanent")
                .description("Operations aborted on a non-retryable error")
                .register(meterRegistry);
        this.enqueuedCounter = Counter.builder("operations.queue.enqueued")
                .description("Operations added to the failed-operation queue")
                .register(meterRegistry);
        this.replaySucceededCounter = Counter.builder("operations.queue.replayed")
                .description("Queued operations applied successfully during a drain")
                .register(meterRegistry);
        this.requeuedCounter = Counter.builder("operations.queue.requeued")
                .description("Queued operations put back after another failed replay")
                .register(meterRegistry);
        this.attemptsSummary = DistributionSummary.builder("operations.retry.attempts")
                .description("Attempts used by recovered operations")
                .register(meterRegistry);
        this.recoveryTimer = Timer.builder("operations.retry.recovery.time")
                .description("Time from the first attempt to the successful one, backoff included")
                .register(meterRegistry);
    }

    @Override
    public void recordRecovered(String operationName, int attempts, Duration recoveryTime) {
        recoveredCounter.increment();
        attemptsSummary.record(attempts);
        recoveryTimer.record(recoveryTime);
        log.debug("Metric: {} recovered after {} attempts in {} ms", operationName, attempts, recoveryTime.toMillis());
    }

    @Override
    public void recordExhausted(String operationName, int attempts) {
        exhaustedCounter.increment();
        log.debug("Metric: {} exhausted {} attempts", operationName, attempts);
    }

    @Override
    public void recordPermanentFailure(String operationName) {
        permanentFailureCounter.increment();
        log.debug("Metric: {} failed permanently", operationName);
    }

    @Override
    public void recordEnqueued(String operationName) {
        enqueuedCounter.increment();
        log.debug("Metric: {} enqueued for background retry", operationName);
    }

    @Override
    public void recordReplaySucceeded(String operationName) {
        replaySucceededCounter.increment();
        log.debug("Metric: {} replayed successfully", operationName);
    }

    @Override
    public void recordRequeued(String operationName) {
        requeuedCounter.increment();
        log.debug("Metric: {} requeued", operationName);
    }

    @Override
    public void recordDiscarded(String operationName, String reason) {
        Counter.builder("operations.queue.discarded")
                .description("Queued operations dropped without being applied")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
        log.debug("Metric: {} discarded ({})", operationName, reason);
    }

    @Override
    public void registerQueueSizeGauge(Supplier<Number> queueSize) {
        Gauge.builder("operations.queue.size", queueSize)
                .description("Operations currently waiting for background retry")
                .register(meterRegistry);
    }
}
