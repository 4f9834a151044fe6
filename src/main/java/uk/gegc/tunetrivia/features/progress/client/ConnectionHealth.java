package uk.gegc.tunetrivia.features.progress.client;

import java.time.Duration;
import java.time.Instant;

/**
 * How fresh the last received progress is.
 */
public enum ConnectionHealth {
    UNKNOWN,
    EXCELLENT,
    GOOD,
    POOR,
    STALE;

    private static final Duration EXCELLENT_BELOW = Duration.ofSeconds(5);
    private static final Duration GOOD_BELOW = Duration.ofSeconds(15);
    private static final Duration POOR_BELOW = Duration.ofSeconds(30);

    public static ConnectionHealth classify(Instant lastUpdate, Instant now) {
        if (lastUpdate == null) {
            return UNKNOWN;
        }
        Duration sinceUpdate = Duration.between(lastUpdate, now);
        if (sinceUpdate.compareTo(EXCELLENT_BELOW) < 0) {
            return EXCELLENT;
        }
        if (sinceUpdate.compareTo(GOOD_BELOW) < 0) {
            return GOOD;
        }
        if (sinceUpdate.compareTo(POOR_BELOW) < 0) {
            return POOR;
        }
        return STALE;
    }
}
