package uk.gegc.tunetrivia.features.progress.infra;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.tunetrivia.features.progress.application.ProgressSnapshotStore;
import uk.gegc.tunetrivia.features.progress.domain.model.ProgressEvent;
import uk.gegc.tunetrivia.features.progress.domain.model.ProgressSnapshot;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
@RequiredArgsConstructor
public class InMemoryProgressSnapshotStore implements ProgressSnapshotStore {

    private final Clock clock;
    private final Map<String, ProgressSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public void put(String ownerId, ProgressEvent event) {
        snapshots.put(ownerId, new ProgressSnapshot(ownerId, event, clock.instant()));
    }

    @Override
    public Optional<ProgressSnapshot> get(String ownerId) {
        return Optional.ofNullable(snapshots.get(ownerId));
    }

    @Override
    public boolean remove(String ownerId) {
        return snapshots.remove(ownerId) != null;
    }

    @Override
    public int removeOlderThan(Duration ttl) {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, ProgressSnapshot> entry : snapshots.entrySet()) {
            if (entry.getValue().isOlderThan(ttl, now) && snapshots.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }
}
