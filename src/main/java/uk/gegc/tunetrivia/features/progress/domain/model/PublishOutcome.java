package uk.gegc.tunetrivia.features.progress.domain.model;

/**
 * Result of a publish.
 *
 * @param delivered         connections that accepted the frame
 * @param storedAsLastValue whether the event went to the last-value store instead
 */
public record PublishOutcome(int delivered, boolean storedAsLastValue) {

    public boolean wasDelivered() {
        return delivered > 0;
    }
}
