package uk.gegc.tunetrivia.features.progress.domain.event;

import org.springframework.context.ApplicationEvent;

/**
 * Asks for the owner's last-value snapshot to be discarded.
 */
public class ProgressDisposalRequestedEvent extends ApplicationEvent {

    private final String ownerId;

    public ProgressDisposalRequestedEvent(Object source, String ownerId) {
        super(source);
        this.ownerId = ownerId;
    }

    public String getOwnerId() {
        return ownerId;
    }
}
