package uk.gegc.tunetrivia.features.progress.client;

import uk.gegc.tunetrivia.features.progress.domain.model.ProgressEvent;

import java.util.Optional;

/**
 * HTTP access to the server's last-value snapshot of an owner.
 */
public interface ProgressSnapshotClient {

    /**
     * @return the snapshot, or empty when the server has none
     */
    Optional<ProgressEvent> fetch(String ownerId);

    void clear(String ownerId);
}
