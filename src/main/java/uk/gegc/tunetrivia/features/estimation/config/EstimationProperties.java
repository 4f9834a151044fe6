package uk.gegc.tunetrivia.features.estimation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tuning knobs for the completion-time estimator.
 */
@Component
@ConfigurationProperties(prefix = "estimation")
@Data
public class EstimationProperties {

    /**
     * Weight of the newest measurement in exponential smoothing (0..1)
     */
    private double smoothingFactor = 0.3;

    /**
     * Rate samples required before smoothing kicks in; below this the raw value is used
     */
    private int minSamples = 3;

    /**
     * Completed item count at which the sample part of the confidence score saturates
     */
    private int confidenceSampleCap = 10;

    /**
     * Session age over which the recency part of the confidence score decays to its floor
     */
    private Duration confidenceHorizon = Duration.ofMinutes(30);

    /**
     * Sessions without updates for this long are swept
     */
    private Duration sessionTtl = Duration.ofHours(1);

    /**
     * Interval of the inactive-session sweep
     */
    private Duration cleanupInterval = Duration.ofMinutes(30);
}
