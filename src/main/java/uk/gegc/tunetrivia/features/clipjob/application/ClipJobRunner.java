package uk.gegc.tunetrivia.features.clipjob.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import uk.gegc.tunetrivia.features.clipjob.config.ClipJobProperties;
import uk.gegc.tunetrivia.features.clipjob.domain.model.ClipJobOutcome;
import uk.gegc.tunetrivia.features.clipjob.domain.model.ClipJobRequest;
import uk.gegc.tunetrivia.features.clipjob.infra.ClipProcessLauncher;
import uk.gegc.tunetrivia.features.operation.application.FailedOperationQueue;
import uk.gegc.tunetrivia.features.operation.application.OperationRetryService;
import uk.gegc.tunetrivia.features.operation.domain.model.InsertRecord;
import uk.gegc.tunetrivia.features.operation.domain.model.Operation;
import uk.gegc.tunetrivia.features.operation.domain.model.RecordKind;
import uk.gegc.tunetrivia.features.operation.domain.model.UpdateStatus;
import uk.gegc.tunetrivia.features.progress.domain.event.ClipMonitoringRequestedEvent;
import uk.gegc.tunetrivia.features.progress.domain.event.ClipMonitoringStopRequestedEvent;
import uk.gegc.tunetrivia.features.progress.domain.event.ProgressDisposalRequestedEvent;
import uk.gegc.tunetrivia.features.progress.domain.event.ProgressPublishRequestedEvent;
import uk.gegc.tunetrivia.features.progress.domain.model.Completion;
import uk.gegc.tunetrivia.features.progress.domain.model.PlaylistExtracted;
import uk.gegc.tunetrivia.features.progress.domain.model.ProcessingStart;
import uk.gegc.tunetrivia.features.progress.domain.model.ProgressEvent;
import uk.gegc.tunetrivia.shared.exception.PermanentStoreException;
import uk.gegc.tunetrivia.shared.exception.TransientStoreException;
import uk.gegc.tunetrivia.shared.util.RecentFiles;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one clip job: runs the external process, relays its progress, then persists what it produced.
 * <p>
 * Progress goes out through application events only, so a slow or broken push channel never
 * stalls the job. A run first discards the owner's stored snapshot so pollers never see the result
 * of an earlier job. Persistence goes through the retry service; operations that still fail with
 * a transient error are queued for background replay and counted as failures in the completion event.
 */
@Service
@Slf4j
public class ClipJobRunner {

    private static final String CLIP_SUFFIX = "_clip";

    private final ClipProcessLauncher processLauncher;
    private final ProgressLineParser lineParser;
    private final OperationRetryService retryService;
    private final FailedOperationQueue failedOperationQueue;
    private final ApplicationEventPublisher eventPublisher;
    private final TaskScheduler taskScheduler;
    private final ClipJobProperties properties;
    private final Clock clock;

    public ClipJobRunner(ClipProcessLauncher processLauncher,
                         ProgressLineParser lineParser,
                         OperationRetryService retryService,
                         FailedOperationQueue failedOperationQueue,
                         ApplicationEventPublisher eventPublisher,
                         @Qualifier("taskScheduler") TaskScheduler taskScheduler,
                         ClipJobProperties properties,
                         Clock clock) {
        this.processLauncher = processLauncher;
        this.lineParser = lineParser;
        this.retryService = retryService;
        this.failedOperationQueue = failedOperationQueue;
        this.eventPublisher = eventPublisher;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.clock = clock;
    }

    @Async("generalTaskExecutor")
    public void runAsync(ClipJobRequest request) {
        try {
            run(request);
        } catch (Exception e) {
            log.error("Clip job {} for {} crashed", request.sessionId(), request.ownerId(), e);
        }
    }

    public ClipJobOutcome run(ClipJobRequest request) {
        String ownerId = request.ownerId();
        Instant startedAt = clock.instant();
        log.info("Clip job {} started for {} with {} URL(s)", request.sessionId(), ownerId, request.urls().size());
        // the owner may still have the completion of an earlier job stored
        eventPublisher.publishEvent(new ProgressDisposalRequestedEvent(this, ownerId));

        boolean processCompleted = runProcess(request);

        int successCount = 0;
        int failureCount = 0;
        int queuedCount = 0;

        if (processCompleted) {
            for (String urlId : request.youtubeUrlIds()) {
                PersistResult result = persist(UpdateStatus.urlProcessed(urlId, true), request);
                failureCount += result.failed ? 1 : 0;
                queuedCount += result.queued ? 1 : 0;
            }
            for (Path clip : recentClips()) {
                PersistResult result = persist(InsertRecord.of(RecordKind.SONG, songPayload(clip, ownerId), clock), request);
                if (result.failed) {
                    failureCount++;
                    queuedCount += result.queued ? 1 : 0;
                } else {
                    successCount++;
                }
            }
        } else {
            failureCount = request.urls().size();
        }

        // stop first: stopping also clears the snapshot the completion may land in
        eventPublisher.publishEvent(new ClipMonitoringStopRequestedEvent(this, ownerId));
        String label = processCompleted
                ? successCount + " songs ready"
                : "Processing failed";
        publishProgress(ownerId, Completion.of(successCount, failureCount, label, clock.instant()));

        ClipJobOutcome outcome = new ClipJobOutcome(request.sessionId(), processCompleted,
                successCount, failureCount, queuedCount);
        log.info("Clip job {} finished in {} s: {}", request.sessionId(),
                Duration.between(startedAt, clock.instant()).toSeconds(), outcome);
        return outcome;
    }

    private boolean runProcess(ClipJobRequest request) {
        Path urlsFile = null;
        Process process = null;
        ScheduledFuture<?> watchdog = null;
        AtomicBoolean timedOut = new AtomicBoolean(false);
        try {
            urlsFile = Files.createTempFile("temp_urls_" + safeFilePart(request.ownerId()) + "_", ".txt");
            Files.write(urlsFile, request.urls(), StandardCharsets.UTF_8);

            List<String> command = new ArrayList<>(properties.getCommand());
            command.add(urlsFile.toAbsolutePath().toString());
            process = processLauncher.start(command, Paths.get(properties.getWorkingDirectory()));

            Process running = process;
            watchdog = taskScheduler.schedule(() -> {
                if (running.isAlive()) {
                    timedOut.set(true);
                    log.warn("Clip job {} exceeded {} and is being killed", request.sessionId(), properties.getTimeout());
                    running.destroyForcibly();
                }
            }, clock.instant().plus(properties.getTimeout()));

            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    handleOutputLine(request, line);
                }
            }

            if (!process.waitFor(properties.getTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                timedOut.set(true);
                process.destroyForcibly();
            }
            if (timedOut.get()) {
                log.error("Clip job {} timed out", request.sessionId());
                return false;
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                log.error("Clip job {} exited with code {}", request.sessionId(), exitCode);
                return false;
            }
            return true;
        } catch (IOException e) {
            log.error("Clip job {} could not be run", request.sessionId(), e);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Clip job {} interrupted", request.sessionId());
            if (process != null) {
                process.destroyForcibly();
            }
            return false;
        } finally {
            if (watchdog != null) {
                watchdog.cancel(false);
            }
            deleteQuietly(urlsFile);
        }
    }

    private void handleOutputLine(ClipJobRequest request, String line) {
        if (!line.startsWith(ProgressLineParser.PREFIX)) {
            log.debug("[{}] {}", request.sessionId(), line);
            return;
        }
        lineParser.parse(line).ifPresent(event -> {
            if (event instanceof PlaylistExtracted extracted && extracted.totalVideos() != null) {
                eventPublisher.publishEvent(
                        new ClipMonitoringRequestedEvent(this, request.ownerId(), extracted.totalVideos()));
            } else if (event instanceof ProcessingStart start && start.totalSongs() != null) {
                eventPublisher.publishEvent(
                        new ClipMonitoringRequestedEvent(this, request.ownerId(), start.totalSongs()));
            }
            publishProgress(request.ownerId(), event);
        });
    }

    private PersistResult persist(Operation operation, ClipJobRequest request) {
        try {
            retryService.applyWithRetry(operation, request.ownerId());
            return PersistResult.OK;
        } catch (TransientStoreException e) {
            failedOperationQueue.enqueueFailed(operation, request.ownerId(), request.sessionId());
            return PersistResult.QUEUED;
        } catch (PermanentStoreException e) {
            log.error("{} rejected for job {}: {}", operation.describe(), request.sessionId(), e.getMessage());
            return PersistResult.REJECTED;
        }
    }

    private List<Path> recentClips() {
        Instant threshold = clock.instant().minus(properties.getRecentWindow());
        Path directory = Paths.get(properties.getClipsDirectory());
        try {
            return RecentFiles.list(directory, ".mp3", threshold);
        } catch (IOException e) {
            log.error("Cannot list clips in {}", directory, e);
            return List.of();
        }
    }

    Map<String, Object> songPayload(Path clip, String ownerId) {
        ClipJobProperties.SongDefaults defaults = properties.getSongDefaults();
        String fileName = clip.getFileName().toString();
        String baseName = fileName.endsWith(".mp3") ? fileName.substring(0, fileName.length() - 4) : fileName;
        if (baseName.endsWith(CLIP_SUFFIX)) {
            baseName = baseName.substring(0, baseName.length() - CLIP_SUFFIX.length());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", baseName.replace('_', ' '));
        payload.put("artist", defaults.getArtist());
        payload.put("album", defaults.getAlbum());
        payload.put("clip_path", properties.getClipPathPrefix() + fileName);
        payload.put("full_path", null);
        payload.put("duration", defaults.getDurationSeconds());
        payload.put("clip_start", defaults.getClipStartSeconds());
        payload.put("clip_end", defaults.getClipEndSeconds());
        payload.put("created_by", ownerId);
        return payload;
    }

    private void publishProgress(String ownerId, ProgressEvent event) {
        eventPublisher.publishEvent(new ProgressPublishRequestedEvent(this, ownerId, event));
    }

    private void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete temp file {}: {}", file, e.getMessage());
        }
    }

    private static String safeFilePart(String value) {
        return value.replaceAll("[^A-Za-z0-9-]", "_");
    }

    private enum PersistResult {
        OK(false, false),
        QUEUED(true, true),
        REJECTED(true, false);

        private final boolean failed;
        private final boolean queued;

        PersistResult(boolean failed, boolean queued) {
            this.failed = failed;
            this.queued = queued;
        }
    }
}
