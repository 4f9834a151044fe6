package uk.gegc.tunetrivia.features.progress.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.gegc.tunetrivia.features.progress.domain.model.DownloadProgress;
import uk.gegc.tunetrivia.features.progress.domain.model.ProgressEvent;
import uk.gegc.tunetrivia.features.progress.domain.model.ProgressFrame;
import uk.gegc.tunetrivia.features.progress.domain.model.ProgressFrameType;
import uk.gegc.tunetrivia.features.progress.domain.model.ProgressTotal;
import uk.gegc.tunetrivia.features.progress.domain.model.PublishOutcome;
import uk.gegc.tunetrivia.features.progress.infra.InMemoryProgressSnapshotStore;
import uk.gegc.tunetrivia.testsupport.MutableClock;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ProgressBroadcastHubImpl Tests")
class ProgressBroadcastHubImplTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private static final String OWNER = "user-1";

    private InMemoryProgressSnapshotStore snapshotStore;
    private ProgressBroadcastHubImpl hub;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        snapshotStore = new InMemoryProgressSnapshotStore(clock);
        hub = new ProgressBroadcastHubImpl(snapshotStore, clock);
    }

    private ProgressEvent progress(int current) {
        return DownloadProgress.of(current, ProgressTotal.of(5), current * 20.0, "Downloading", "song " + current, NOW);
    }

    @Nested
    @DisplayName("subscribe")
    class Subscribe {

        @Test
        @DisplayName("sends a connection_established frame carrying the owner id")
        void sendsAcknowledgment() {
            RecordingConnection connection = new RecordingConnection("c1");

            boolean subscribed = hub.subscribe(OWNER, connection);

            assertThat(subscribed).isTrue();
            assertThat(connection.frames()).singleElement().satisfies(frame -> {
                assertThat(frame.type()).isEqualTo(ProgressFrameType.CONNECTION_ESTABLISHED);
                assertThat(frame.ownerId()).isEqualTo(OWNER);
                assertThat(frame.timestamp()).isEqualTo(NOW);
            });
            assertThat(hub.connectionCount(OWNER)).isEqualTo(1);
        }

        @Test
        @DisplayName("a failed acknowledgment leaves the connection unregistered")
        void failedAcknowledgmentUnregisters() {
            boolean subscribed = hub.subscribe(OWNER, RecordingConnection.failing("c1"));

            assertThat(subscribed).isFalse();
            assertThat(hub.connectionCount(OWNER)).isZero();
        }

        @Test
        @DisplayName("unsubscribe removes the connection and the empty owner entry")
        void unsubscribeRemovesConnection() {
            RecordingConnection connection = new RecordingConnection("c1");
            hub.subscribe(OWNER, connection);

            hub.unsubscribe(OWNER, connection);
            hub.unsubscribe(OWNER, connection);

            assertThat(hub.connectionCount(OWNER)).isZero();
        }

        @Test
        @DisplayName("concurrent publishes never reach a new connection before its acknowledgment")
        void acknowledgmentPrecedesConcurrentUpdates() throws InterruptedException {
            // Given
            hub.subscribe(OWNER, new RecordingConnection("existing"));
            AtomicBoolean running = new AtomicBoolean(true);
            Thread publisher = new Thread(() -> {
                while (running.get()) {
                    hub.publish(OWNER, progress(1));
                }
            });
            publisher.start();

            // When
            List<RecordingConnection> joined = new ArrayList<>();
            try {
                for (int i = 0; i < 200; i++) {
                    RecordingConnection connection = new RecordingConnection("c" + i);
                    hub.subscribe(OWNER, connection);
                    joined.add(connection);
                }
            } finally {
                running.set(false);
                publisher.join(5000);
            }

            // Then
            assertThat(joined).allSatisfy(connection -> assertThat(connection.frames().get(0).type())
                    .isEqualTo(ProgressFrameType.CONNECTION_ESTABLISHED));
        }
    }

    @Nested
    @DisplayName("publish")
    class Publish {

        @Test
        @DisplayName("delivers to every open connection of the owner only")
        void deliversToOwnerConnections() {
            // Given
            RecordingConnection first = new RecordingConnection("c1");
            RecordingConnection second = new RecordingConnection("c2");
            RecordingConnection other = new RecordingConnection("c3");
            hub.subscribe(OWNER, first);
            hub.subscribe(OWNER, second);
            hub.subscribe("user-2", other);

            // When
            PublishOutcome outcome = hub.publish(OWNER, progress(1));

            // Then
            assertThat(outcome.delivered()).isEqualTo(2);
            assertThat(outcome.storedAsLastValue()).isFalse();
            assertThat(first.frames()).hasSize(2);
            assertThat(second.frames()).hasSize(2);
            assertThat(other.frames()).hasSize(1);
            assertThat(snapshotStore.get(OWNER)).isEmpty();
        }

        @Test
        @DisplayName("frames reach a connection in publish order")
        void preservesOrder() {
            RecordingConnection connection = new RecordingConnection("c1");
            hub.subscribe(OWNER, connection);

            for (int i = 1; i <= 5; i++) {
                hub.publish(OWNER, progress(i));
            }

            assertThat(connection.frames())
                    .filteredOn(frame -> frame.type() == ProgressFrameType.PROGRESS_UPDATE)
                    .extracting(frame -> frame.data().current())
                    .containsExactly(1, 2, 3, 4, 5);
        }

        @Test
        @DisplayName("closed and failing connections are pruned; healthy ones still receive")
        void prunesDeadConnections() {
            // Given
            RecordingConnection healthy = new RecordingConnection("healthy");
            RecordingConnection closed = new RecordingConnection("closed");
            RecordingConnection broken = new RecordingConnection("broken");
            hub.subscribe(OWNER, healthy);
            hub.subscribe(OWNER, closed);
            hub.subscribe(OWNER, broken);
            closed.drop();
            broken.failFromNowOn();

            // When
            PublishOutcome outcome = hub.publish(OWNER, progress(1));

            // Then
            assertThat(outcome.delivered()).isEqualTo(1);
            assertThat(hub.connectionCount(OWNER)).isEqualTo(1);
            assertThat(healthy.frames()).extracting(ProgressFrame::type)
                    .containsExactly(ProgressFrameType.CONNECTION_ESTABLISHED, ProgressFrameType.PROGRESS_UPDATE);
        }

        @Test
        @DisplayName("nothing delivered: the event is stored as the owner's last value")
        void storesLastValueWhenUndelivered() {
            // When
            PublishOutcome outcome = null;
            for (int i = 1; i <= 5; i++) {
                outcome = hub.publish(OWNER, progress(i));
            }

            // Then
            assertThat(outcome.wasDelivered()).isFalse();
            assertThat(outcome.storedAsLastValue()).isTrue();
            assertThat(snapshotStore.get(OWNER)).hasValueSatisfying(snapshot -> {
                assertThat(snapshot.event().current()).isEqualTo(5);
                assertThat(snapshot.storedAt()).isEqualTo(NOW);
            });
        }

        @Test
        @DisplayName("all connections dead: the event falls back to the last-value store")
        void fallsBackWhenAllConnectionsDead() {
            RecordingConnection connection = new RecordingConnection("c1");
            hub.subscribe(OWNER, connection);
            connection.drop();

            PublishOutcome outcome = hub.publish(OWNER, progress(3));

            assertThat(outcome.storedAsLastValue()).isTrue();
            assertThat(hub.connectionCount(OWNER)).isZero();
            assertThat(snapshotStore.get(OWNER)).isPresent();
        }
    }

    @Test
    @DisplayName("sendError delivers an error frame and reports the delivery count")
    void sendError() {
        RecordingConnection connection = new RecordingConnection("c1");
        hub.subscribe(OWNER, connection);

        int delivered = hub.sendError(OWNER, "Clip job failed");

        assertThat(delivered).isEqualTo(1);
        assertThat(connection.frames()).last().satisfies(frame -> {
            assertThat(frame.type()).isEqualTo(ProgressFrameType.ERROR);
            assertThat(frame.error()).isEqualTo("Clip job failed");
        });
        assertThat(hub.sendError("nobody", "x")).isZero();
    }

    @Test
    @DisplayName("close closes and forgets every connection")
    void closeClosesConnections() {
        RecordingConnection first = new RecordingConnection("c1");
        RecordingConnection second = new RecordingConnection("c2");
        hub.subscribe(OWNER, first);
        hub.subscribe("user-2", second);

        hub.close();

        assertThat(first.wasClosed()).isTrue();
        assertThat(second.wasClosed()).isTrue();
        assertThat(hub.connectionCount(OWNER)).isZero();
    }
}
