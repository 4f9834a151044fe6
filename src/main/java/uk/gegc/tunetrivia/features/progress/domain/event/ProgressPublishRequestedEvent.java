package uk.gegc.tunetrivia.features.progress.domain.event;

import org.springframework.context.ApplicationEvent;
import uk.gegc.tunetrivia.features.progress.domain.model.ProgressEvent;

/**
 * Published by a job that wants a progress event delivered to its owner.
 * Delivery happens on the progress executor, never on the publishing thread.
 */
public class ProgressPublishRequestedEvent extends ApplicationEvent {

    private final String ownerId;
    private final ProgressEvent progressEvent;

    public ProgressPublishRequestedEvent(Object source, String ownerId, ProgressEvent progressEvent) {
        super(source);
        this.ownerId = ownerId;
        this.progressEvent = progressEvent;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public ProgressEvent getProgressEvent() {
        return progressEvent;
    }
}
