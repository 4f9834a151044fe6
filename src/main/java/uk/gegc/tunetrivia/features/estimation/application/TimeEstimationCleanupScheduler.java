package uk.gegc.tunetrivia.features.estimation.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops estimation sessions nobody has updated for a while.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TimeEstimationCleanupScheduler {

    private final TimeEstimationManager timeEstimationManager;

    @Scheduled(fixedDelayString = "${estimation.cleanup-interval:PT30M}")
    public void cleanupInactiveSessions() {
        log.debug("Running scheduled cleanup of inactive estimation sessions");
        try {
            timeEstimationManager.cleanupInactiveSessions();
        } catch (Exception e) {
            log.error("Error during scheduled cleanup of estimation sessions", e);
        }
    }
}
