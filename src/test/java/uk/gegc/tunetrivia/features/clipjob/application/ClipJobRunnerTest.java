package uk.gegc.tunetrivia.features.clipjob.application;

import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import uk.gegc.tunetrivia.features.clipjob.config.ClipJobProperties;
import uk.gegc.tunetrivia.features.clipjob.domain.model.ClipJobOutcome;
import uk.gegc.tunetrivia.features.clipjob.domain.model.ClipJobRequest;
import uk.gegc.tunetrivia.features.operation.application.FailedOperationQueue;
import uk.gegc.tunetrivia.features.operation.application.OperationRetryService;
import uk.gegc.tunetrivia.features.operation.domain.model.InsertRecord;
import uk.gegc.tunetrivia.features.operation.domain.model.Operation;
import uk.gegc.tunetrivia.features.operation.domain.model.OperationResult;
import uk.gegc.tunetrivia.features.operation.domain.model.UpdateStatus;
import uk.gegc.tunetrivia.features.progress.domain.event.ClipMonitoringRequestedEvent;
import uk.gegc.tunetrivia.features.progress.domain.event.ClipMonitoringStopRequestedEvent;
import uk.gegc.tunetrivia.features.progress.domain.event.ProgressDisposalRequestedEvent;
import uk.gegc.tunetrivia.features.progress.domain.event.ProgressPublishRequestedEvent;
import uk.gegc.tunetrivia.features.progress.domain.model.Completion;
import uk.gegc.tunetrivia.features.progress.domain.model.DownloadProgress;
import uk.gegc.tunetrivia.features.progress.domain.model.PlaylistExtracted;
import uk.gegc.tunetrivia.shared.exception.PermanentStoreException;
import uk.gegc.tunetrivia.shared.exception.TransientStoreException;
import uk.gegc.tunetrivia.testsupport.ManualTaskScheduler;
import uk.gegc.tunetrivia.testsupport.MutableClock;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ClipJobRunner Tests")
class ClipJobRunnerTest {

    private static final String OWNER = "user-1";
    private static final String SESSION = "session_1_abc";

    @TempDir
    Path tempDir;

    @Mock
    private OperationRetryService retryService;

    @Mock
    private FailedOperationQueue failedOperationQueue;

    private final List<Object> publishedEvents = new ArrayList<>();
    private final List<String> urlsSeenByProcess = new ArrayList<>();
    private Path urlsFile;
    private FakeProcess process;
    private boolean launchFails;

    private Path clipsDirectory;
    private ManualTaskScheduler taskScheduler;
    private ClipJobRunner runner;

    @BeforeEach
    void setUp() throws IOException {
        clipsDirectory = Files.createDirectories(tempDir.resolve("clips"));
        // real time, so that freshly written clips count as recent
        MutableClock clock = new MutableClock(Instant.now());
        taskScheduler = new ManualTaskScheduler(clock);

        ClipJobProperties properties = new ClipJobProperties();
        properties.setClipsDirectory(clipsDirectory.toString());
        properties.setWorkingDirectory(tempDir.toString());
        properties.setTimeout(Duration.ofMinutes(5));

        ApplicationEventPublisher publisher = publishedEvents::add;
        ProgressLineParser parser = new ProgressLineParser(JsonMapper.builder().findAndAddModules().build());

        runner = new ClipJobRunner(
                (command, workingDirectory) -> {
                    if (launchFails) {
                        throw new IOException("python not found");
                    }
                    urlsFile = Path.of(command.get(command.size() - 1));
                    urlsSeenByProcess.addAll(Files.readAllLines(urlsFile));
                    return process;
                },
                parser, retryService, failedOperationQueue, publisher, taskScheduler, properties, clock);
    }

    private ClipJobRequest request() {
        return new ClipJobRequest(SESSION, OWNER,
                List.of("https://youtu.be/a", "https://youtu.be/b"), List.of("url-1"));
    }

    private void writeClip(String name, Instant modified) throws IOException {
        Path clip = Files.writeString(clipsDirectory.resolve(name), "mp3");
        Files.setLastModifiedTime(clip, FileTime.from(modified));
    }

    private void storeSucceeds() {
        when(retryService.applyWithRetry(any(Operation.class), eq(OWNER)))
                .thenAnswer(invocation -> new OperationResult(invocation.getArgument(0), List.of(), 1));
    }

    private Completion lastCompletion() {
        Object last = publishedEvents.get(publishedEvents.size() - 1);
        assertThat(last).isInstanceOf(ProgressPublishRequestedEvent.class);
        return (Completion) ((ProgressPublishRequestedEvent) last).getProgressEvent();
    }

    @Nested
    @DisplayName("successful process")
    class SuccessfulProcess {

        @BeforeEach
        void output() {
            process = new FakeProcess(0, true, String.join("\n",
                    "Resolving playlist...",
                    "PROGRESS: {\"type\":\"playlist_extracted\",\"current\":0,\"total\":\"unknown\","
                            + "\"percentage\":0,\"step\":\"Playlist extracted\",\"total_videos\":2}",
                    "PROGRESS: {\"type\":\"progress\",\"current\":1,\"total\":2,\"percentage\":50.0,"
                            + "\"step\":\"Downloading\",\"song_title\":\"Song A\"}",
                    "PROGRESS: {broken",
                    "Done"));
        }

        @Test
        @DisplayName("relays progress, stores songs and finishes with a completion")
        void run_happyPath_publishesAndPersists() throws IOException {
            // Given
            writeClip("Song_A_clip.mp3", Instant.now());
            writeClip("Song_B_clip.mp3", Instant.now());
            writeClip("old_clip.mp3", Instant.now().minus(Duration.ofHours(2)));
            writeClip("notes.txt", Instant.now());
            storeSucceeds();

            // When
            ClipJobOutcome outcome = runner.run(request());

            // Then
            assertThat(outcome).isEqualTo(new ClipJobOutcome(SESSION, true, 2, 0, 0));
            assertThat(urlsSeenByProcess).containsExactly("https://youtu.be/a", "https://youtu.be/b");
            assertThat(urlsFile).doesNotExist();

            assertThat(publishedEvents).hasSize(6);
            assertThat(publishedEvents.get(0)).isInstanceOfSatisfying(ProgressDisposalRequestedEvent.class,
                    e -> assertThat(e.getOwnerId()).isEqualTo(OWNER));
            assertThat(publishedEvents.get(1)).isInstanceOfSatisfying(ClipMonitoringRequestedEvent.class, e -> {
                assertThat(e.getOwnerId()).isEqualTo(OWNER);
                assertThat(e.getTotalExpected()).isEqualTo(2);
            });
            assertThat(((ProgressPublishRequestedEvent) publishedEvents.get(2)).getProgressEvent())
                    .isInstanceOf(PlaylistExtracted.class);
            assertThat(((ProgressPublishRequestedEvent) publishedEvents.get(3)).getProgressEvent())
                    .isInstanceOf(DownloadProgress.class);
            assertThat(publishedEvents.get(4)).isInstanceOf(ClipMonitoringStopRequestedEvent.class);

            Completion completion = lastCompletion();
            assertThat(completion.successCount()).isEqualTo(2);
            assertThat(completion.failureCount()).isZero();
            assertThat(completion.currentItemLabel()).isEqualTo("2 songs ready");

            verify(retryService).applyWithRetry(UpdateStatus.urlProcessed("url-1", true), OWNER);
            verifyNoInteractions(failedOperationQueue);
        }

        @Test
        @DisplayName("watchdog is cancelled once the process ends")
        void run_cancelsWatchdog() {
            // When
            runner.run(new ClipJobRequest(SESSION, OWNER, List.of("https://youtu.be/a"), List.of()));

            // Then
            assertThat(taskScheduler.pendingTaskCount()).isZero();
            assertThat(process.destroyed).isFalse();
        }

        @Test
        @DisplayName("transient store failure queues the operation and counts as failed")
        void run_transientFailure_queuesOperation() throws IOException {
            // Given
            writeClip("Song_A_clip.mp3", Instant.now());
            writeClip("Song_B_clip.mp3", Instant.now());
            List<Operation> failed = new ArrayList<>();
            when(retryService.applyWithRetry(any(Operation.class), eq(OWNER))).thenAnswer(invocation -> {
                Operation operation = invocation.getArgument(0);
                if (operation instanceof InsertRecord insert && "Song B".equals(insert.payload().get("title"))) {
                    failed.add(operation);
                    throw new TransientStoreException(operation.describe(), 3, new IOException("timeout"));
                }
                return new OperationResult(operation, List.of(), 1);
            });

            // When
            ClipJobOutcome outcome = runner.run(request());

            // Then
            assertThat(outcome).isEqualTo(new ClipJobOutcome(SESSION, true, 1, 1, 1));
            ArgumentCaptor<Operation> queued = ArgumentCaptor.forClass(Operation.class);
            verify(failedOperationQueue).enqueueFailed(queued.capture(), eq(OWNER), eq(SESSION));
            assertThat(queued.getValue()).isSameAs(failed.get(0));
            assertThat(((InsertRecord) queued.getValue()).payload().get("id").toString()).startsWith("song_");
            assertThat(lastCompletion().failureCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("permanent store failure is counted but never queued")
        void run_permanentFailure_notQueued() {
            // Given
            when(retryService.applyWithRetry(any(Operation.class), eq(OWNER)))
                    .thenThrow(new PermanentStoreException("UPDATE youtube_urls url-1", 1,
                            new IllegalStateException("constraint")));

            // When
            ClipJobOutcome outcome = runner.run(request());

            // Then
            assertThat(outcome).isEqualTo(new ClipJobOutcome(SESSION, true, 0, 1, 0));
            verifyNoInteractions(failedOperationQueue);
        }
    }

    @Nested
    @DisplayName("failed process")
    class FailedProcess {

        @Test
        @DisplayName("non-zero exit reports every URL as failed and stores nothing")
        void run_nonZeroExit_reportsFailure() throws IOException {
            // Given
            process = new FakeProcess(1, true, "Traceback (most recent call last):");
            writeClip("Song_A_clip.mp3", Instant.now());

            // When
            ClipJobOutcome outcome = runner.run(request());

            // Then
            assertThat(outcome).isEqualTo(new ClipJobOutcome(SESSION, false, 0, 2, 0));
            verifyNoInteractions(retryService, failedOperationQueue);
            Completion completion = lastCompletion();
            assertThat(completion.failureCount()).isEqualTo(2);
            assertThat(completion.currentItemLabel()).isEqualTo("Processing failed");
            assertThat(publishedEvents.get(publishedEvents.size() - 2))
                    .isInstanceOf(ClipMonitoringStopRequestedEvent.class);
        }

        @Test
        @DisplayName("process that outlives the timeout is killed")
        void run_timeout_killsProcess() {
            // Given
            process = new FakeProcess(0, false, "");

            // When
            ClipJobOutcome outcome = runner.run(request());

            // Then
            assertThat(outcome.processCompleted()).isFalse();
            assertThat(process.destroyed).isTrue();
        }

        @Test
        @DisplayName("launch failure still publishes a completion")
        void run_launchFailure_reportsFailure() {
            // Given
            launchFails = true;

            // When
            ClipJobOutcome outcome = runner.run(request());

            // Then
            assertThat(outcome.processCompleted()).isFalse();
            assertThat(outcome.failureCount()).isEqualTo(2);
            assertThat(lastCompletion().successCount()).isZero();
            assertThat(publishedEvents).first().isInstanceOf(ProgressDisposalRequestedEvent.class);
        }
    }

    @Test
    @DisplayName("songPayload: derives the title from the clip file name")
    void songPayload_derivesTitle() {
        Map<String, Object> payload = runner.songPayload(Path.of("Never_Gonna_Give_clip.mp3"), OWNER);

        assertThat(payload)
                .containsEntry("title", "Never Gonna Give")
                .containsEntry("clip_path", "/clips/Never_Gonna_Give_clip.mp3")
                .containsEntry("artist", "Unknown")
                .containsEntry("duration", 180)
                .containsEntry("clip_start", 30)
                .containsEntry("clip_end", 40)
                .containsEntry("created_by", OWNER)
                .containsEntry("full_path", null);
    }

    private static final class FakeProcess extends Process {

        private final int exitCode;
        private final boolean finishes;
        private final byte[] output;
        private volatile boolean destroyed;

        private FakeProcess(int exitCode, boolean finishes, String output) {
            this.exitCode = exitCode;
            this.finishes = finishes;
            this.output = output.getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public OutputStream getOutputStream() {
            return OutputStream.nullOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return new ByteArrayInputStream(output);
        }

        @Override
        public InputStream getErrorStream() {
            return InputStream.nullInputStream();
        }

        @Override
        public int waitFor() {
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) {
            return finishes;
        }

        @Override
        public int exitValue() {
            if (!finishes && !destroyed) {
                throw new IllegalThreadStateException("still running");
            }
            return exitCode;
        }

        @Override
        public boolean isAlive() {
            return !finishes && !destroyed;
        }

        @Override
        public void destroy() {
            destroyed = true;
        }

        @Override
        public Process destroyForcibly() {
            destroyed = true;
            return this;
        }
    }
}
