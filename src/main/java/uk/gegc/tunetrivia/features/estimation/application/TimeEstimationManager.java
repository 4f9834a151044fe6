package uk.gegc.tunetrivia.features.estimation.application;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.tunetrivia.features.estimation.config.EstimationProperties;
import uk.gegc.tunetrivia.features.estimation.domain.model.ProcessingStats;
import uk.gegc.tunetrivia.features.progress.domain.model.ProgressEvent;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Per-owner completion-time estimator.
 * <p>
 * A session starts with the first event whose {@code current} is zero. Every later event with a
 * strictly larger {@code current} yields an instantaneous rate ({@code current / elapsedMinutes});
 * once enough samples exist the rate and the time per item are exponentially smoothed.
 * Events that do not advance {@code current}, or that arrive with no elapsed time, are skipped.
 */
@Slf4j
public class TimeEstimationManager {

    private static final double MILLIS_PER_MINUTE = 60_000.0;
    private static final double CONFIDENCE_FLOOR = 0.5;

    private final Clock clock;
    private final EstimationProperties properties;
    private final Map<String, Session> sessions = new HashMap<>();

    public TimeEstimationManager(Clock clock, EstimationProperties properties) {
        if (properties.getSmoothingFactor() <= 0 || properties.getSmoothingFactor() > 1) {
            throw new IllegalArgumentException("Smoothing factor must be in (0, 1]: " + properties.getSmoothingFactor());
        }
        this.clock = clock;
        this.properties = properties;
    }

    public synchronized Optional<ProcessingStats> updateStats(String ownerId, ProgressEvent event) {
        Instant now = clock.instant();
        Session session = sessions.get(ownerId);

        if (session == null) {
            if (event.current() != 0) {
                return Optional.empty();
            }
            session = new Session(now, event.total().isKnown() ? event.total().count() : null);
            sessions.put(ownerId, session);
            log.debug("Estimation session started for owner {}", ownerId);
            return Optional.of(snapshot(session, now));
        }

        int newCompleted = event.current();
        if (newCompleted <= session.completedCount) {
            return Optional.of(snapshot(session, now));
        }

        double elapsedMinutes = Duration.between(session.startTime, now).toMillis() / MILLIS_PER_MINUTE;
        if (elapsedMinutes <= 0) {
            return Optional.of(snapshot(session, now));
        }

        double instantRate = newCompleted / elapsedMinutes;
        double instantTimePerItem = elapsedMinutes / newCompleted;

        if (session.sampleCount >= properties.getMinSamples()) {
            session.rate = smooth(session.rate, instantRate);
            session.averageTimePerItem = smooth(session.averageTimePerItem, instantTimePerItem);
        } else {
            session.rate = instantRate;
            session.averageTimePerItem = instantTimePerItem;
        }
        session.sampleCount++;
        session.completedCount = newCompleted;
        session.lastUpdatedAt = now;

        if (event.total().isKnown()) {
            session.totalCount = event.total().count();
        }

        if (session.totalCount != null && session.totalCount > 0 && session.rate > 0) {
            double remainingMinutes = Math.max(0, session.totalCount - session.completedCount) / session.rate;
            session.estimatedCompletionTime = now.plusMillis(Math.round(remainingMinutes * MILLIS_PER_MINUTE));
        }

        return Optional.of(snapshot(session, now));
    }

    public synchronized Optional<ProcessingStats> getProcessingStats(String ownerId) {
        Session session = sessions.get(ownerId);
        return session == null ? Optional.empty() : Optional.of(snapshot(session, clock.instant()));
    }

    /**
     * Minutes left at the current rate, or empty while rate or total is unknown.
     */
    public synchronized Optional<Double> getEstimatedRemainingMinutes(String ownerId) {
        Session session = sessions.get(ownerId);
        if (session == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(remainingMinutes(session));
    }

    public synchronized void clearSession(String ownerId) {
        if (sessions.remove(ownerId) != null) {
            log.debug("Estimation session cleared for owner {}", ownerId);
        }
    }

    /**
     * Drops sessions that have not been updated within the configured TTL.
     *
     * @return number of sessions removed
     */
    public synchronized int cleanupInactiveSessions() {
        Instant cutoff = clock.instant().minus(properties.getSessionTtl());
        int removed = 0;
        Iterator<Map.Entry<String, Session>> it = sessions.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue().lastUpdatedAt.isBefore(cutoff)) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Removed {} inactive estimation sessions", removed);
        }
        return removed;
    }

    public synchronized int activeSessionCount() {
        return sessions.size();
    }

    private double smooth(double oldValue, double newValue) {
        double alpha = properties.getSmoothingFactor();
        return oldValue * (1 - alpha) + newValue * alpha;
    }

    private Double remainingMinutes(Session session) {
        if (session.rate <= 0 || session.totalCount == null || session.totalCount == 0) {
            return null;
        }
        int remaining = session.totalCount - session.completedCount;
        return remaining <= 0 ? 0.0 : remaining / session.rate;
    }

    private double confidence(Session session, Instant now) {
        double sampleConfidence = Math.min((double) session.completedCount / properties.getConfidenceSampleCap(), 1.0);
        double horizonMillis = properties.getConfidenceHorizon().toMillis();
        double age = Duration.between(session.startTime, now).toMillis();
        double timeConfidence = Math.max(CONFIDENCE_FLOOR, 1 - age / horizonMillis);
        return sampleConfidence * timeConfidence;
    }

    private ProcessingStats snapshot(Session session, Instant now) {
        return new ProcessingStats(
                session.startTime,
                session.lastUpdatedAt,
                session.completedCount,
                session.totalCount,
                session.averageTimePerItem,
                session.rate,
                session.estimatedCompletionTime,
                remainingMinutes(session),
                confidence(session, now),
                session.sampleCount
        );
    }

    private static final class Session {
        private final Instant startTime;
        private Instant lastUpdatedAt;
        private int completedCount;
        private Integer totalCount;
        private double averageTimePerItem;
        private double rate;
        private Instant estimatedCompletionTime;
        private int sampleCount;

        private Session(Instant startTime, Integer totalCount) {
            this.startTime = startTime;
            this.lastUpdatedAt = startTime;
            this.totalCount = totalCount;
        }
    }
}
