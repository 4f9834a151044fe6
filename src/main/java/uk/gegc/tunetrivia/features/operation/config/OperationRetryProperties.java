package uk.gegc.tunetrivia.features.operation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for persistence retries and the failed-operation queue
 */
@Component
@ConfigurationProperties(prefix = "operations.retry")
@Data
public class OperationRetryProperties {

    /**
     * Maximum number of attempts per applyWithRetry call, and per queued operation
     */
    private int maxAttempts = 3;

    /**
     * Delay before the second attempt
     */
    private long baseDelayMs = 1000;

    /**
     * Growth factor of the delay between consecutive attempts
     */
    private double backoffMultiplier = 2.0;

    /**
     * Cap for the delay between attempts
     */
    private long maxDelayMs = 10000;

    /**
     * Queue size kept by a cleanup pass; the oldest entries beyond it are evicted
     */
    private int queueCapacity = 1000;

    /**
     * Queued operations older than this are dropped by cleanup
     */
    private Duration maxAge = Duration.ofHours(24);

    /**
     * Delay between two background drain + cleanup ticks
     */
    private Duration drainInterval = Duration.ofSeconds(30);

    /**
     * Start the background retry loop when the application is ready
     */
    private boolean backgroundEnabled = true;
}
