package uk.gegc.tunetrivia.features.operation.application.impl;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OperationMetricsServiceImpl Tests")
class OperationMetricsServiceImplTest {

    private SimpleMeterRegistry meterRegistry;
    private OperationMetricsServiceImpl metricsService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metricsService = new OperationMetricsServiceImpl(meterRegistry);
    }

    @Test
    @DisplayName("recordRecovered: counts the operation, its attempts and the recovery time")
    void recordRecovered() {
        metricsService.recordRecovered("INSERT songs", 3, Duration.ofMillis(3000));
        metricsService.recordRecovered("INSERT songs", 2, Duration.ofMillis(1000));

        assertThat(meterRegistry.get("operations.retry.recovered").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("operations.retry.attempts").summary().totalAmount()).isEqualTo(5.0);
        assertThat(meterRegistry.get("operations.retry.recovery.time").timer().totalTime(TimeUnit.MILLISECONDS))
                .isEqualTo(4000.0);
    }

    @Test
    @DisplayName("recordDiscarded: tags the counter with the reason")
    void recordDiscarded() {
        metricsService.recordDiscarded("INSERT songs", "expired");
        metricsService.recordDiscarded("INSERT songs", "expired");
        metricsService.recordDiscarded("UPDATE youtube_urls u-1", "permanent");

        assertThat(meterRegistry.get("operations.queue.discarded").tag("reason", "expired").counter().count())
                .isEqualTo(2.0);
        assertThat(meterRegistry.get("operations.queue.discarded").tag("reason", "permanent").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("registerQueueSizeGauge: reports the live queue size")
    void queueSizeGauge() {
        AtomicInteger size = new AtomicInteger(4);
        metricsService.registerQueueSizeGauge(size::get);

        size.set(7);

        assertThat(meterRegistry.get("operations.queue.size").gauge().value()).isEqualTo(7.0);
    }
}
