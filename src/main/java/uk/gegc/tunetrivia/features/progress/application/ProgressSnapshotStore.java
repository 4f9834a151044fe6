package uk.gegc.tunetrivia.features.progress.application;

import uk.gegc.tunetrivia.features.progress.domain.model.ProgressEvent;
import uk.gegc.tunetrivia.features.progress.domain.model.ProgressSnapshot;

import java.time.Duration;
import java.util.Optional;

/**
 * Last-value store read by clients that poll instead of holding a push connection.
 */
public interface ProgressSnapshotStore {

    void put(String ownerId, ProgressEvent event);

    Optional<ProgressSnapshot> get(String ownerId);

    /**
     * @return whether a snapshot was removed
     */
    boolean remove(String ownerId);

    /**
     * @return number of snapshots removed
     */
    int removeOlderThan(Duration ttl);
}
