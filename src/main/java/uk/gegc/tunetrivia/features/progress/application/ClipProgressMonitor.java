package uk.gegc.tunetrivia.features.progress.application;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import uk.gegc.tunetrivia.features.progress.config.ProgressProperties;
import uk.gegc.tunetrivia.features.progress.domain.model.ClipMonitoring;
import uk.gegc.tunetrivia.features.progress.domain.model.Completion;
import uk.gegc.tunetrivia.features.progress.domain.model.ProgressEvent;
import uk.gegc.tunetrivia.features.progress.domain.model.ProgressTotal;
import uk.gegc.tunetrivia.shared.util.RecentFiles;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Reports clip progress by counting finished clip files while the job is busy cutting.
 * Each owner has at most one polling schedule; starting again replaces it.
 */
@Service
@Slf4j
public class ClipProgressMonitor {

    private final ProgressBroadcastHub broadcastHub;
    private final ProgressSnapshotStore snapshotStore;
    private final ProgressProperties progressProperties;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private final Map<String, MonitorSession> sessions = new ConcurrentHashMap<>();

    public ClipProgressMonitor(ProgressBroadcastHub broadcastHub,
                               ProgressSnapshotStore snapshotStore,
                               ProgressProperties progressProperties,
                               @Qualifier("taskScheduler") TaskScheduler taskScheduler,
                               Clock clock) {
        this.broadcastHub = broadcastHub;
        this.snapshotStore = snapshotStore;
        this.progressProperties = progressProperties;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    /**
     * Start polling for the owner. The first scan runs right away.
     *
     * @param totalExpected expected number of clips, or null while unknown
     */
    public void start(String ownerId, Integer totalExpected) {
        Integer expected = totalExpected != null && totalExpected > 0 ? totalExpected : null;
        MonitorSession session = new MonitorSession(expected);
        MonitorSession previous = sessions.put(ownerId, session);
        if (previous != null) {
            previous.stop();
        }

        session.future = taskScheduler.scheduleWithFixedDelay(
                () -> pollSafely(ownerId, session),
                clock.instant(),
                progressProperties.getClipMonitor().getPollInterval()
        );
        if (sessions.get(ownerId) != session) {
            // completed or replaced before the future was assigned
            session.stop();
        }
        log.info("Clip monitoring started for {} (expected: {})", ownerId, expected != null ? expected : "unknown");
    }

    /**
     * Stop polling and forget the owner's last-value snapshot.
     */
    public void stop(String ownerId) {
        MonitorSession session = sessions.remove(ownerId);
        if (session != null) {
            // waits for a tick that is publishing right now, later ticks see the stop
            session.stop();
            log.info("Clip monitoring stopped for {}", ownerId);
        }
        snapshotStore.remove(ownerId);
    }

    public boolean isMonitoring(String ownerId) {
        return sessions.containsKey(ownerId);
    }

    @PreDestroy
    public void shutdown() {
        sessions.values().forEach(MonitorSession::stop);
        sessions.clear();
    }

    /**
     * Scan once and publish the result. Reaching the expected total publishes a completion
     * and ends monitoring for the owner. Nothing is published once the session was stopped
     * or replaced.
     */
    Optional<ProgressEvent> poll(String ownerId, MonitorSession session) {
        int clips = countRecentClips();
        ProgressEvent event = toEvent(clips, session.expected, clock.instant());
        synchronized (session) {
            if (session.stopped || sessions.get(ownerId) != session) {
                session.stop();
                return Optional.empty();
            }
            broadcastHub.publish(ownerId, event);
        }

        if (event.isCompletion()) {
            if (sessions.remove(ownerId, session)) {
                session.stop();
            }
            log.info("Clip monitoring completed for {}: {}/{} clips", ownerId, clips, session.expected);
        } else {
            log.debug("Clip monitoring for {}: {} clips, expected {}", ownerId, clips, session.expected);
        }
        return Optional.of(event);
    }

    /**
     * Clips with the configured extension modified within the recent window.
     * A missing or unreadable directory counts as zero.
     */
    public int countRecentClips() {
        ProgressProperties.ClipMonitor settings = progressProperties.getClipMonitor();
        Path directory = Paths.get(settings.getClipsDirectory());
        Instant threshold = clock.instant().minus(settings.getRecentWindow());
        try {
            return RecentFiles.list(directory, settings.getClipExtension(), threshold).size();
        } catch (IOException e) {
            log.warn("Cannot scan clips directory {}: {}", directory, e.getMessage());
            return 0;
        }
    }

    public ProgressEvent toEvent(int clips, Integer expected, Instant now) {
        ProgressProperties.ClipMonitor settings = progressProperties.getClipMonitor();

        if (expected != null && clips >= expected) {
            return new Completion(
                    clips,
                    ProgressTotal.of(expected),
                    100.0,
                    "Completed",
                    "All clips finished (" + clips + "/" + expected + ")",
                    now,
                    clips,
                    0,
                    null,
                    null,
                    Map.of()
            );
        }

        double percent = expected != null
                ? Math.round((double) clips / expected * 1000.0) / 10.0
                : Math.min(settings.getUnknownTotalPercentCap(), clips * settings.getUnknownTotalPercentPerClip());
        String stage = clips == 0 ? "Waiting for clips" : "Creating clips (" + clips + " done)";
        String label;
        if (clips == 0) {
            label = "Waiting for the first clip...";
        } else if (expected != null) {
            label = clips + "/" + expected + " clips finished";
        } else {
            label = clips + " clips finished (total still being analysed)";
        }

        return new ClipMonitoring(
                clips,
                expected != null ? ProgressTotal.of(expected) : ProgressTotal.unknown(),
                percent,
                stage,
                label,
                now,
                clips,
                Map.of()
        );
    }

    private void pollSafely(String ownerId, MonitorSession session) {
        if (sessions.get(ownerId) != session) {
            session.stop();
            return;
        }
        try {
            poll(ownerId, session);
        } catch (Exception e) {
            log.error("Clip monitoring tick failed for {}", ownerId, e);
        }
    }

    static final class MonitorSession {

        private final Integer expected;
        private volatile ScheduledFuture<?> future;
        private boolean stopped;

        MonitorSession(Integer expected) {
            this.expected = expected;
        }

        Integer expected() {
            return expected;
        }

        synchronized void stop() {
            stopped = true;
            ScheduledFuture<?> current = future;
            if (current != null) {
                current.cancel(false);
            }
        }
    }
}
