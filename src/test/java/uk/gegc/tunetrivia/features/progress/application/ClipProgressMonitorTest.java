package uk.gegc.tunetrivia.features.progress.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import uk.gegc.tunetrivia.features.progress.config.ProgressProperties;
import uk.gegc.tunetrivia.features.progress.domain.model.ClipMonitoring;
import uk.gegc.tunetrivia.features.progress.domain.model.Completion;
import uk.gegc.tunetrivia.features.progress.domain.model.ProgressEvent;
import uk.gegc.tunetrivia.testsupport.ManualTaskScheduler;
import uk.gegc.tunetrivia.testsupport.MutableClock;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("ClipProgressMonitor Tests")
class ClipProgressMonitorTest {

    private static final String OWNER = "user-1";

    @TempDir
    Path clipsDirectory;

    @Mock
    private ProgressBroadcastHub broadcastHub;

    @Mock
    private ProgressSnapshotStore snapshotStore;

    private MutableClock clock;
    private ManualTaskScheduler taskScheduler;
    private ClipProgressMonitor monitor;

    @BeforeEach
    void setUp() {
        ProgressProperties properties = new ProgressProperties();
        properties.getClipMonitor().setClipsDirectory(clipsDirectory.toString());
        clock = new MutableClock(Instant.now());
        taskScheduler = new ManualTaskScheduler(clock);
        monitor = new ClipProgressMonitor(broadcastHub, snapshotStore, properties, taskScheduler, clock);
    }

    private void createClip(String name) throws IOException {
        Files.writeString(clipsDirectory.resolve(name), "clip");
    }

    @Nested
    @DisplayName("toEvent")
    class ToEvent {

        @Test
        @DisplayName("known total: percentage rounded to one decimal")
        void knownTotal() {
            ProgressEvent event = monitor.toEvent(1, 3, clock.instant());

            assertThat(event).isInstanceOfSatisfying(ClipMonitoring.class, monitoring -> {
                assertThat(monitoring.percent()).isEqualTo(33.3);
                assertThat(monitoring.clipsCompleted()).isEqualTo(1);
                assertThat(monitoring.total().count()).isEqualTo(3);
            });
        }

        @Test
        @DisplayName("unknown total: three percent per clip, capped at 85")
        void unknownTotal() {
            assertThat(monitor.toEvent(10, null, clock.instant()).percent()).isEqualTo(30.0);
            assertThat(monitor.toEvent(40, null, clock.instant()).percent()).isEqualTo(85.0);
            assertThat(monitor.toEvent(0, null, clock.instant()).total().isKnown()).isFalse();
        }

        @Test
        @DisplayName("reaching the expected total yields a completion")
        void completion() {
            ProgressEvent event = monitor.toEvent(5, 5, clock.instant());

            assertThat(event).isInstanceOfSatisfying(Completion.class, completion -> {
                assertThat(completion.percent()).isEqualTo(100.0);
                assertThat(completion.successCount()).isEqualTo(5);
                assertThat(completion.failureCount()).isZero();
            });
        }
    }

    @Test
    @DisplayName("countRecentClips: only recent files with the clip extension count")
    void countRecentClips() throws IOException {
        createClip("a_clip.mp3");
        createClip("b_clip.mp3");
        createClip("notes.txt");
        Path old = clipsDirectory.resolve("old_clip.mp3");
        Files.writeString(old, "clip");
        Files.setLastModifiedTime(old, FileTime.from(clock.instant().minus(Duration.ofHours(1))));

        assertThat(monitor.countRecentClips()).isEqualTo(2);
    }

    @Test
    @DisplayName("countRecentClips: a missing directory counts as zero")
    void missingDirectory() throws IOException {
        Files.delete(clipsDirectory);

        assertThat(monitor.countRecentClips()).isZero();
    }

    @Test
    @DisplayName("polls until the expected clips exist, then completes and stops")
    void pollsUntilComplete() throws IOException {
        // Given
        monitor.start(OWNER, 2);

        // When
        taskScheduler.runDueTasks();
        createClip("first_clip.mp3");
        taskScheduler.advance(Duration.ofSeconds(2));
        createClip("second_clip.mp3");
        taskScheduler.advance(Duration.ofSeconds(2));
        taskScheduler.advance(Duration.ofSeconds(10));

        // Then
        ArgumentCaptor<ProgressEvent> captor = ArgumentCaptor.forClass(ProgressEvent.class);
        verify(broadcastHub, times(3)).publish(eq(OWNER), captor.capture());
        assertThat(captor.getAllValues()).extracting(ProgressEvent::current).containsExactly(0, 1, 2);
        assertThat(captor.getAllValues().get(1).percent()).isEqualTo(50.0);
        assertThat(captor.getAllValues().get(2)).isInstanceOf(Completion.class);
        assertThat(monitor.isMonitoring(OWNER)).isFalse();
        assertThat(taskScheduler.pendingTaskCount()).isZero();
    }

    @Test
    @DisplayName("start again replaces the previous schedule")
    void restartReplacesSchedule() {
        monitor.start(OWNER, 10);
        monitor.start(OWNER, 20);

        assertThat(taskScheduler.pendingTaskCount()).isEqualTo(1);
        assertThat(monitor.isMonitoring(OWNER)).isTrue();
    }

    @Test
    @DisplayName("stop cancels polling and clears the owner's snapshot")
    void stopCancels() {
        monitor.start(OWNER, null);

        monitor.stop(OWNER);
        taskScheduler.advance(Duration.ofSeconds(10));

        assertThat(monitor.isMonitoring(OWNER)).isFalse();
        assertThat(taskScheduler.pendingTaskCount()).isZero();
        verify(snapshotStore).remove(OWNER);
        verify(broadcastHub, never()).publish(eq(OWNER), any());
    }

    @Test
    @DisplayName("a tick already under way when stop arrives publishes nothing")
    void stopDuringTickSuppressesPublish() {
        // Given
        ProgressProperties properties = new ProgressProperties();
        properties.getClipMonitor().setClipsDirectory(clipsDirectory.toString());
        InterceptingClock interceptingClock = new InterceptingClock(Instant.now());
        TaskScheduler scheduler = mock(TaskScheduler.class);
        ClipProgressMonitor stoppable = new ClipProgressMonitor(
                broadcastHub, snapshotStore, properties, scheduler, interceptingClock);
        stoppable.start(OWNER, 3);

        ArgumentCaptor<Runnable> tick = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).scheduleWithFixedDelay(tick.capture(), any(Instant.class), any(Duration.class));

        // the tick reads the clock while scanning, after its ownership check
        interceptingClock.onNextRead(() -> stoppable.stop(OWNER));

        // When
        tick.getValue().run();

        // Then
        assertThat(stoppable.isMonitoring(OWNER)).isFalse();
        verify(snapshotStore).remove(OWNER);
        verify(broadcastHub, never()).publish(eq(OWNER), any());
    }

    private static final class InterceptingClock extends MutableClock {

        private volatile Runnable nextRead;

        private InterceptingClock(Instant start) {
            super(start);
        }

        void onNextRead(Runnable action) {
            nextRead = action;
        }

        @Override
        public Instant instant() {
            Runnable action = nextRead;
            nextRead = null;
            if (action != null) {
                action.run();
            }
            return super.instant();
        }
    }
}
