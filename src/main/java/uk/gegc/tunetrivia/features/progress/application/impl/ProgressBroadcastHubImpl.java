package uk.gegc.tunetrivia.features.progress.application.impl;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.tunetrivia.features.progress.application.ProgressBroadcastHub;
import uk.gegc.tunetrivia.features.progress.application.ProgressConnection;
import uk.gegc.tunetrivia.features.progress.application.ProgressSnapshotStore;
import uk.gegc.tunetrivia.features.progress.domain.model.ProgressEvent;
import uk.gegc.tunetrivia.features.progress.domain.model.ProgressFrame;
import uk.gegc.tunetrivia.features.progress.domain.model.PublishOutcome;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Registry of live connections per owner.
 * <p>
 * Lock order is always owner monitor first, then {@code registryLock}. The registry lock
 * guards every mutation of the map and the connection sets; the owner monitor serialises
 * writes to the owner's connections so frames arrive in publish order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProgressBroadcastHubImpl implements ProgressBroadcastHub {

    private final ProgressSnapshotStore snapshotStore;
    private final Clock clock;

    private final Object registryLock = new Object();
    private final Map<String, OwnerConnections> registry = new HashMap<>();

    @Override
    public PublishOutcome publish(String ownerId, ProgressEvent event) {
        int delivered = dispatch(ownerId, ProgressFrame.progressUpdate(event, clock.instant()));
        if (delivered > 0) {
            log.debug("Progress for {} delivered to {} connection(s)", ownerId, delivered);
            return new PublishOutcome(delivered, false);
        }
        snapshotStore.put(ownerId, event);
        log.debug("No live connection for {}, stored progress as last value", ownerId);
        return new PublishOutcome(0, true);
    }

    @Override
    public boolean subscribe(String ownerId, ProgressConnection connection) {
        while (true) {
            OwnerConnections owner;
            synchronized (registryLock) {
                owner = registry.computeIfAbsent(ownerId, OwnerConnections::new);
            }

            // registered and acknowledged under the owner monitor, so no update can overtake the ack
            synchronized (owner) {
                synchronized (registryLock) {
                    if (registry.get(ownerId) != owner) {
                        // emptied and retired in between, take the current entry
                        continue;
                    }
                    owner.connections.add(connection);
                }
                log.info("Progress connection {} subscribed for {}", connection.id(), ownerId);

                try {
                    connection.send(ProgressFrame.connectionEstablished(ownerId, clock.instant()));
                    return true;
                } catch (Exception e) {
                    log.warn("Acknowledgment to connection {} of {} failed, dropping it: {}",
                            connection.id(), ownerId, e.getMessage());
                    remove(ownerId, List.of(connection));
                    return false;
                }
            }
        }
    }

    @Override
    public void unsubscribe(String ownerId, ProgressConnection connection) {
        if (remove(ownerId, List.of(connection)) > 0) {
            log.info("Progress connection {} unsubscribed for {}", connection.id(), ownerId);
        }
    }

    @Override
    public int sendError(String ownerId, String message) {
        return dispatch(ownerId, ProgressFrame.error(message, clock.instant()));
    }

    @Override
    public int connectionCount(String ownerId) {
        synchronized (registryLock) {
            OwnerConnections owner = registry.get(ownerId);
            return owner == null ? 0 : owner.connections.size();
        }
    }

    @Override
    @PreDestroy
    public void close() {
        List<ProgressConnection> all = new ArrayList<>();
        synchronized (registryLock) {
            registry.values().forEach(owner -> all.addAll(owner.connections));
            registry.clear();
        }
        for (ProgressConnection connection : all) {
            try {
                connection.close();
            } catch (Exception e) {
                log.warn("Failed to close progress connection {}: {}", connection.id(), e.getMessage());
            }
        }
        if (!all.isEmpty()) {
            log.info("Closed {} progress connection(s)", all.size());
        }
    }

    private int dispatch(String ownerId, ProgressFrame frame) {
        OwnerConnections owner;
        synchronized (registryLock) {
            owner = registry.get(ownerId);
        }
        if (owner == null) {
            return 0;
        }

        synchronized (owner) {
            List<ProgressConnection> targets;
            synchronized (registryLock) {
                targets = List.copyOf(owner.connections);
            }

            int delivered = 0;
            List<ProgressConnection> stale = new ArrayList<>();
            for (ProgressConnection connection : targets) {
                if (!connection.isOpen()) {
                    stale.add(connection);
                    continue;
                }
                try {
                    connection.send(frame);
                    delivered++;
                } catch (Exception e) {
                    log.warn("Failed to send {} to connection {} of {}: {}",
                            frame.type().wireName(), connection.id(), ownerId, e.getMessage());
                    stale.add(connection);
                }
            }

            if (!stale.isEmpty()) {
                int removed = remove(ownerId, stale);
                log.debug("Pruned {} dead connection(s) of {}", removed, ownerId);
            }
            return delivered;
        }
    }

    private int remove(String ownerId, List<ProgressConnection> connections) {
        synchronized (registryLock) {
            OwnerConnections owner = registry.get(ownerId);
            if (owner == null) {
                return 0;
            }
            int removed = 0;
            for (ProgressConnection connection : connections) {
                if (owner.connections.remove(connection)) {
                    removed++;
                }
            }
            if (owner.connections.isEmpty()) {
                registry.remove(ownerId);
            }
            return removed;
        }
    }

    private static final class OwnerConnections {

        private final String ownerId;
        private final Set<ProgressConnection> connections = new LinkedHashSet<>();

        private OwnerConnections(String ownerId) {
            this.ownerId = ownerId;
        }

        @Override
        public String toString() {
            return "OwnerConnections[" + ownerId + "]";
        }
    }
}
