package uk.gegc.tunetrivia.features.operation.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * An operation that exhausted its inline retries, waiting for background replay.
 *
 * @param correlationId optional job/session id the operation belongs to
 * @param enqueuedAt    time of the first enqueue; replays keep it so the age limit holds
 */
public record QueuedOperation(
        Operation operation,
        String ownerId,
        String correlationId,
        Instant enqueuedAt,
        int attemptsSoFar,
        int maxAttempts
) {

    public QueuedOperation {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(enqueuedAt, "enqueuedAt");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (attemptsSoFar < 0 || attemptsSoFar > maxAttempts) {
            throw new IllegalArgumentException(
                    "attemptsSoFar must be within [0, " + maxAttempts + "] but was " + attemptsSoFar);
        }
    }

    public static QueuedOperation first(Operation operation, String ownerId, String correlationId,
                                        Instant enqueuedAt, int maxAttempts) {
        return new QueuedOperation(operation, ownerId, correlationId, enqueuedAt, 0, maxAttempts);
    }

    public QueuedOperation nextAttempt() {
        return new QueuedOperation(operation, ownerId, correlationId, enqueuedAt, attemptsSoFar + 1, maxAttempts);
    }

    public boolean isExhausted() {
        return attemptsSoFar >= maxAttempts;
    }

    public Duration age(Instant now) {
        return Duration.between(enqueuedAt, now);
    }
}
