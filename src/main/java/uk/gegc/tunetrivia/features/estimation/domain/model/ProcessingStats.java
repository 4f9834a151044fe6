package uk.gegc.tunetrivia.features.estimation.domain.model;

import java.time.Instant;

/**
 * Read-only view of one owner's estimation session.
 *
 * @param averageTimePerItem minutes per completed item
 * @param rate               completed items per minute
 * @param totalCount         {@code null} while the job total is unknown
 * @param estimatedCompletionTime {@code null} until a total and a positive rate are known
 * @param estimatedRemainingMinutes {@code null} until a total and a positive rate are known
 * @param confidence         heuristic trust in the estimate, 0..1
 */
public record ProcessingStats(
        Instant startTime,
        Instant lastUpdatedAt,
        int completedCount,
        Integer totalCount,
        double averageTimePerItem,
        double rate,
        Instant estimatedCompletionTime,
        Double estimatedRemainingMinutes,
        double confidence,
        int sampleCount
) {
}
