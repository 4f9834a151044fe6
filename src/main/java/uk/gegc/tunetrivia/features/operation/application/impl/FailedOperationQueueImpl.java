package uk.gegc.tunetrivia.features.operation.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.tunetrivia.features.operation.application.FailedOperationQueue;
import uk.gegc.tunetrivia.features.operation.application.OperationMetricsService;
import uk.gegc.tunetrivia.features.operation.application.OperationRetryService;
import uk.gegc.tunetrivia.features.operation.config.OperationRetryProperties;
import uk.gegc.tunetrivia.features.operation.domain.model.DrainReport;
import uk.gegc.tunetrivia.features.operation.domain.model.Operation;
import uk.gegc.tunetrivia.features.operation.domain.model.QueuedOperation;
import uk.gegc.tunetrivia.shared.exception.PermanentStoreException;
import uk.gegc.tunetrivia.shared.exception.TransientStoreException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

@Service
@Slf4j
public class FailedOperationQueueImpl implements FailedOperationQueue {

    static final String REASON_EXHAUSTED = "exhausted";
    static final String REASON_PERMANENT = "permanent";
    static final String REASON_EXPIRED = "expired";
    static final String REASON_EVICTED = "evicted";

    private final OperationRetryService retryService;
    private final OperationRetryProperties retryProperties;
    private final OperationMetricsService metricsService;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<QueuedOperation> entries = new ArrayList<>();

    public FailedOperationQueueImpl(OperationRetryService retryService,
                                    OperationRetryProperties retryProperties,
                                    OperationMetricsService metricsService,
                                    Clock clock) {
        this.retryService = retryService;
        this.retryProperties = retryProperties;
        this.metricsService = metricsService;
        this.clock = clock;
        metricsService.registerQueueSizeGauge(this::size);
    }

    @Override
    public QueuedOperation enqueueFailed(Operation operation, String ownerId, String correlationId) {
        Objects.requireNonNull(operation, "operation");
        QueuedOperation queued = QueuedOperation.first(operation, ownerId, correlationId,
                clock.instant(), Math.max(1, retryProperties.getMaxAttempts()));
        append(queued);
        metricsService.recordEnqueued(operation.describe());
        log.info("Queued {} for owner {} for background retry (correlation {})",
                operation.describe(), ownerId, correlationId);
        return queued;
    }

    @Override
    public DrainReport drainQueue() {
        List<QueuedOperation> batch;
        lock.lock();
        try {
            if (entries.isEmpty()) {
                return DrainReport.empty();
            }
            batch = new ArrayList<>(entries);
            entries.clear();
        } finally {
            lock.unlock();
        }

        log.info("Draining {} queued operations", batch.size());
        int succeeded = 0;
        int requeued = 0;
        int discarded = 0;

        for (QueuedOperation queued : batch) {
            String name = queued.operation().describe();
            if (queued.isExhausted()) {
                log.warn("Discarding {} for owner {}: no attempts left", name, queued.ownerId());
                metricsService.recordDiscarded(name, REASON_EXHAUSTED);
                discarded++;
                continue;
            }
            try {
                retryService.applyWithRetry(queued.operation(), queued.ownerId());
                metricsService.recordReplaySucceeded(name);
                succeeded++;
            } catch (TransientStoreException e) {
                QueuedOperation next = queued.nextAttempt();
                if (next.attemptsSoFar() < next.maxAttempts()) {
                    append(next);
                    metricsService.recordRequeued(name);
                    requeued++;
                    log.warn("Replay of {} failed, requeued ({}/{})",
                            name, next.attemptsSoFar(), next.maxAttempts());
                } else {
                    metricsService.recordDiscarded(name, REASON_EXHAUSTED);
                    discarded++;
                    log.error("Replay of {} for owner {} failed for the last time, discarding",
                            name, queued.ownerId(), e);
                }
            } catch (PermanentStoreException e) {
                metricsService.recordDiscarded(name, REASON_PERMANENT);
                discarded++;
                log.error("Replay of {} for owner {} failed permanently, discarding",
                        name, queued.ownerId(), e);
            }
        }

        DrainReport report = new DrainReport(batch.size(), succeeded, requeued, discarded);
        log.info("Drain finished: {}", report);
        return report;
    }

    @Override
    public int cleanup() {
        Instant now = clock.instant();
        Duration maxAge = retryProperties.getMaxAge();
        int capacity = Math.max(0, retryProperties.getQueueCapacity());
        int expired = 0;
        int evicted = 0;

        lock.lock();
        try {
            Iterator<QueuedOperation> it = entries.iterator();
            while (it.hasNext()) {
                QueuedOperation queued = it.next();
                if (queued.age(now).compareTo(maxAge) >= 0) {
                    it.remove();
                    metricsService.recordDiscarded(queued.operation().describe(), REASON_EXPIRED);
                    expired++;
                }
            }

            if (entries.size() > capacity) {
                entries.sort(Comparator.comparing(QueuedOperation::enqueuedAt));
                while (entries.size() > capacity) {
                    QueuedOperation oldest = entries.remove(0);
                    metricsService.recordDiscarded(oldest.operation().describe(), REASON_EVICTED);
                    evicted++;
                }
            }
        } finally {
            lock.unlock();
        }

        if (expired + evicted > 0) {
            log.info("Queue cleanup removed {} expired and {} evicted operations", expired, evicted);
        }
        return expired + evicted;
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<QueuedOperation> snapshot() {
        lock.lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Instant> oldestEnqueuedAt() {
        lock.lock();
        try {
            return entries.stream()
                    .map(QueuedOperation::enqueuedAt)
                    .min(Comparator.naturalOrder());
        } finally {
            lock.unlock();
        }
    }

    private void append(QueuedOperation queued) {
        lock.lock();
        try {
            entries.add(queued);
        } finally {
            lock.unlock();
        }
    }
}
