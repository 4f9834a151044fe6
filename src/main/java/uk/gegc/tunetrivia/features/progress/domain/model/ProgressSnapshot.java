package uk.gegc.tunetrivia.features.progress.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Last event stored for an owner whose push channel was not listening.
 */
public record ProgressSnapshot(String ownerId, ProgressEvent event, Instant storedAt) {

    public boolean isOlderThan(Duration ttl, Instant now) {
        return Duration.between(storedAt, now).compareTo(ttl) > 0;
    }
}
