package uk.gegc.tunetrivia.features.progress.domain.event;

import org.springframework.context.ApplicationEvent;

public class ClipMonitoringStopRequestedEvent extends ApplicationEvent {

    private final String ownerId;

    public ClipMonitoringStopRequestedEvent(Object source, String ownerId) {
        super(source);
        this.ownerId = ownerId;
    }

    public String getOwnerId() {
        return ownerId;
    }
}
