package uk.gegc.tunetrivia.features.progress.client;

import uk.gegc.tunetrivia.features.estimation.domain.model.ProcessingStats;
import uk.gegc.tunetrivia.features.progress.domain.model.ProgressEvent;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A progress event as the UI sees it, with the estimator's view attached when there is one.
 *
 * @param stats      null when estimation is off or the estimator has no session for the owner
 * @param receivedAt when the channel accepted the event
 */
public record EnhancedProgress(ProgressEvent event, ProcessingStats stats, Instant receivedAt) {

    public EnhancedProgress {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(receivedAt, "receivedAt");
    }

    public Optional<ProcessingStats> processingStats() {
        return Optional.ofNullable(stats);
    }

    public Optional<Instant> estimatedCompletionTime() {
        return processingStats().map(ProcessingStats::estimatedCompletionTime);
    }

    public boolean isCompletion() {
        return event.isCompletion();
    }
}
