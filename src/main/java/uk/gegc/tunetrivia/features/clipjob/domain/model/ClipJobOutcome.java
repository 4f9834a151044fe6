package uk.gegc.tunetrivia.features.clipjob.domain.model;

/**
 * Result of a clip job run.
 *
 * @param processCompleted whether the external process exited normally
 * @param successCount     songs stored
 * @param failureCount     persistence operations that failed, plus the URLs when the process itself failed
 * @param queuedCount      failed operations handed to background retry
 */
public record ClipJobOutcome(String sessionId, boolean processCompleted, int successCount, int failureCount,
                             int queuedCount) {
}
