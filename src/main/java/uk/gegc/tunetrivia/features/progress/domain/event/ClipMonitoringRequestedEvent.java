package uk.gegc.tunetrivia.features.progress.domain.event;

import org.springframework.context.ApplicationEvent;

public class ClipMonitoringRequestedEvent extends ApplicationEvent {

    private final String ownerId;
    private final Integer totalExpected;

    public ClipMonitoringRequestedEvent(Object source, String ownerId, Integer totalExpected) {
        super(source);
        this.ownerId = ownerId;
        this.totalExpected = totalExpected;
    }

    public String getOwnerId() {
        return ownerId;
    }

    /**
     * @return expected clip count, null while unknown
     */
    public Integer getTotalExpected() {
        return totalExpected;
    }
}
