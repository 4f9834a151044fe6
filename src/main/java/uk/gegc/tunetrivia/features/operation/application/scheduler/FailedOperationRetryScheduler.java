package uk.gegc.tunetrivia.features.operation.application.scheduler;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import uk.gegc.tunetrivia.features.operation.application.FailedOperationQueue;
import uk.gegc.tunetrivia.features.operation.config.OperationRetryProperties;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Background loop replaying the failed-operation queue.
 * Each tick drains the queue and then runs cleanup; fixed-delay scheduling keeps ticks from overlapping.
 */
@Component
@Slf4j
public class FailedOperationRetryScheduler {

    private final FailedOperationQueue queue;
    private final OperationRetryProperties retryProperties;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private ScheduledFuture<?> scheduledTick;

    public FailedOperationRetryScheduler(FailedOperationQueue queue,
                                         OperationRetryProperties retryProperties,
                                         @Qualifier("taskScheduler") TaskScheduler taskScheduler,
                                         Clock clock) {
        this.queue = queue;
        this.retryProperties = retryProperties;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startOnApplicationReady() {
        if (retryProperties.isBackgroundEnabled()) {
            startBackgroundRetry(retryProperties.getDrainInterval());
        } else {
            log.info("Background operation retry is disabled");
        }
    }

    /**
     * Start the loop, replacing any schedule already running.
     */
    public synchronized void startBackgroundRetry(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Retry interval must be positive");
        }
        cancelTick();
        scheduledTick = taskScheduler.scheduleWithFixedDelay(this::tick, clock.instant().plus(interval), interval);
        log.info("Background operation retry started with interval {} ms", interval.toMillis());
    }

    public synchronized void stopBackgroundRetry() {
        if (cancelTick()) {
            log.info("Background operation retry stopped");
        }
    }

    public synchronized boolean isRunning() {
        return scheduledTick != null && !scheduledTick.isDone();
    }

    @PreDestroy
    public void shutdown() {
        stopBackgroundRetry();
    }

    void tick() {
        try {
            if (queue.size() > 0) {
                queue.drainQueue();
            }
        } catch (Exception e) {
            log.error("Error while draining the failed-operation queue", e);
        }
        try {
            queue.cleanup();
        } catch (Exception e) {
            log.error("Error while cleaning up the failed-operation queue", e);
        }
    }

    private boolean cancelTick() {
        if (scheduledTick == null) {
            return false;
        }
        scheduledTick.cancel(false);
        scheduledTick = null;
        return true;
    }
}
