package uk.gegc.tunetrivia.features.progress.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.tunetrivia.features.progress.config.ProgressProperties;

/**
 * Drops last-value snapshots nobody came back for.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProgressSnapshotSweepScheduler {

    private final ProgressSnapshotStore snapshotStore;
    private final ProgressProperties progressProperties;

    @Scheduled(fixedDelayString = "${progress.snapshot-sweep-interval:PT10M}")
    public void sweepExpiredSnapshots() {
        try {
            int removed = snapshotStore.removeOlderThan(progressProperties.getSnapshotTtl());
            if (removed > 0) {
                log.info("Swept {} expired progress snapshot(s)", removed);
            }
        } catch (Exception e) {
            log.error("Error during progress snapshot sweep", e);
        }
    }
}
