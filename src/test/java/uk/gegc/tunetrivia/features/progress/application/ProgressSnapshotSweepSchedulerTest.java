package uk.gegc.tunetrivia.features.progress.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.tunetrivia.features.progress.config.ProgressProperties;

import java.time.Duration;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ProgressSnapshotSweepScheduler Tests")
class ProgressSnapshotSweepSchedulerTest {

    @Mock
    private ProgressSnapshotStore snapshotStore;

    @Test
    @DisplayName("sweep: removes snapshots older than the configured TTL")
    void sweepUsesConfiguredTtl() {
        // Given
        ProgressProperties properties = new ProgressProperties();
        properties.setSnapshotTtl(Duration.ofMinutes(45));
        ProgressSnapshotSweepScheduler scheduler = new ProgressSnapshotSweepScheduler(snapshotStore, properties);
        when(snapshotStore.removeOlderThan(Duration.ofMinutes(45))).thenReturn(2);

        // When
        scheduler.sweepExpiredSnapshots();

        // Then
        verify(snapshotStore).removeOlderThan(Duration.ofMinutes(45));
    }

    @Test
    @DisplayName("sweep: a failing store does not propagate")
    void sweepSurvivesFailure() {
        ProgressSnapshotSweepScheduler scheduler =
                new ProgressSnapshotSweepScheduler(snapshotStore, new ProgressProperties());
        when(snapshotStore.removeOlderThan(Duration.ofHours(1))).thenThrow(new RuntimeException("boom"));

        scheduler.sweepExpiredSnapshots();

        verify(snapshotStore).removeOlderThan(Duration.ofHours(1));
    }
}
