package uk.gegc.tunetrivia.features.operation.application;

import uk.gegc.tunetrivia.features.operation.domain.model.DrainReport;
import uk.gegc.tunetrivia.features.operation.domain.model.Operation;
import uk.gegc.tunetrivia.features.operation.domain.model.QueuedOperation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * In-process queue of operations that exhausted their inline retries.
 */
public interface FailedOperationQueue {

    QueuedOperation enqueueFailed(Operation operation, String ownerId, String correlationId);

    /**
     * Snapshot and clear the queue, then replay every entry. Operations enqueued while a drain
     * runs are left for the next drain.
     */
    DrainReport drainQueue();

    /**
     * Drop entries past the maximum age, then evict the oldest beyond capacity.
     *
     * @return number of entries removed
     */
    int cleanup();

    int size();

    List<QueuedOperation> snapshot();

    Optional<Instant> oldestEnqueuedAt();
}
