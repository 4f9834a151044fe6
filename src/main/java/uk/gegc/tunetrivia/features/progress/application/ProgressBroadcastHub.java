package uk.gegc.tunetrivia.features.progress.application;

import uk.gegc.tunetrivia.features.progress.domain.model.ProgressEvent;
import uk.gegc.tunetrivia.features.progress.domain.model.PublishOutcome;

/**
 * Fans progress events out to the live connections of each owner.
 */
public interface ProgressBroadcastHub {

    /**
     * Deliver the event to every open connection of the owner, in publish order.
     * Connections that fail or are closed are dropped. When no connection received the
     * event it is kept as the owner's last value for polling clients.
     */
    PublishOutcome publish(String ownerId, ProgressEvent event);

    /**
     * Register a connection and acknowledge it with a {@code connection_established} frame.
     * A connection that cannot take the acknowledgment is dropped again.
     *
     * @return whether the connection is registered after the acknowledgment
     */
    boolean subscribe(String ownerId, ProgressConnection connection);

    void unsubscribe(String ownerId, ProgressConnection connection);

    /**
     * Push an {@code error} frame to every open connection of the owner.
     *
     * @return connections that received it
     */
    int sendError(String ownerId, String message);

    int connectionCount(String ownerId);

    /**
     * Close every connection and clear the registry.
     */
    void close();
}
