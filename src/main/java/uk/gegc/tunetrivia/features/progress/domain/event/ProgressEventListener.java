package uk.gegc.tunetrivia.features.progress.domain.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import uk.gegc.tunetrivia.features.progress.application.ClipProgressMonitor;
import uk.gegc.tunetrivia.features.progress.application.ProgressBroadcastHub;
import uk.gegc.tunetrivia.features.progress.application.ProgressSnapshotStore;

/**
 * Hands job-side progress requests over to the hub and the clip monitor.
 * All handlers share the single-threaded progress executor, so requests for one owner
 * are handled in the order they were published. Failures are logged and dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProgressEventListener {

    private final ProgressBroadcastHub broadcastHub;
    private final ProgressSnapshotStore snapshotStore;
    private final ClipProgressMonitor clipProgressMonitor;

    @Async("progressTaskExecutor")
    @EventListener
    public void onPublishRequested(ProgressPublishRequestedEvent event) {
        try {
            broadcastHub.publish(event.getOwnerId(), event.getProgressEvent());
        } catch (Exception e) {
            log.error("Failed to publish progress for {}", event.getOwnerId(), e);
        }
    }

    @Async("progressTaskExecutor")
    @EventListener
    public void onDisposalRequested(ProgressDisposalRequestedEvent event) {
        try {
            snapshotStore.remove(event.getOwnerId());
        } catch (Exception e) {
            log.error("Failed to dispose progress of {}", event.getOwnerId(), e);
        }
    }

    @Async("progressTaskExecutor")
    @EventListener
    public void onClipMonitoringRequested(ClipMonitoringRequestedEvent event) {
        try {
            clipProgressMonitor.start(event.getOwnerId(), event.getTotalExpected());
        } catch (Exception e) {
            log.error("Failed to start clip monitoring for {}", event.getOwnerId(), e);
        }
    }

    @Async("progressTaskExecutor")
    @EventListener
    public void onClipMonitoringStopRequested(ClipMonitoringStopRequestedEvent event) {
        try {
            clipProgressMonitor.stop(event.getOwnerId());
        } catch (Exception e) {
            log.error("Failed to stop clip monitoring for {}", event.getOwnerId(), e);
        }
    }
}
