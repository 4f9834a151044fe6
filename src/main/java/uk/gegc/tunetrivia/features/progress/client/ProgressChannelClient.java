package uk.gegc.tunetrivia.features.progress.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import uk.gegc.tunetrivia.features.estimation.application.TimeEstimationManager;
import uk.gegc.tunetrivia.features.estimation.domain.model.ProcessingStats;
import uk.gegc.tunetrivia.features.progress.domain.model.ProgressEvent;
import uk.gegc.tunetrivia.features.progress.domain.model.ProgressFrame;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Client side of the progress push channel for one owner.
 * <p>
 * Reconnects automatically a bounded number of times, then stays in {@link ChannelState#FAILED}
 * until {@link #reconnect()} is called. While the push connection is down the last-value
 * snapshot is polled instead, and polled events go through the same processing as pushed ones.
 * All state transitions happen under this object's monitor.
 */
@Slf4j
public class ProgressChannelClient implements AutoCloseable {

    static final String RECONNECT_EXHAUSTED_MESSAGE =
            "Connection to the progress server was lost. Please reconnect.";

    private final String ownerId;
    private final ProgressTransport transport;
    private final ProgressSnapshotClient snapshotClient;
    private final TimeEstimationManager estimationManager;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final ProgressClientProperties properties;
    private final ObjectMapper objectMapper;
    private final ProgressChannelListener listener;

    private ChannelState state = ChannelState.IDLE;
    private boolean manuallyDisconnected;
    private int reconnectAttempts;
    private long generation;
    private ProgressTransport.Session session;
    private ScheduledFuture<?> reconnectTimer;
    private ScheduledFuture<?> pollTimer;
    private EnhancedProgress currentProgress;
    private String error;

    public ProgressChannelClient(String ownerId,
                                 ProgressTransport transport,
                                 ProgressSnapshotClient snapshotClient,
                                 TimeEstimationManager estimationManager,
                                 TaskScheduler taskScheduler,
                                 Clock clock,
                                 ProgressClientProperties properties,
                                 ObjectMapper objectMapper,
                                 ProgressChannelListener listener) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId must not be blank");
        }
        this.ownerId = ownerId;
        this.transport = transport;
        this.snapshotClient = snapshotClient;
        this.estimationManager = estimationManager;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.listener = listener != null ? listener : new ProgressChannelListener() {
        };
    }

    public synchronized void connect() {
        if (state == ChannelState.CONNECTED || state == ChannelState.CONNECTING) {
            return;
        }
        manuallyDisconnected = false;
        cancelReconnectTimer();
        stopPolling();
        changeState(ChannelState.CONNECTING);

        long attemptGeneration = ++generation;
        try {
            session = transport.open(ownerId, new GenerationListener(attemptGeneration));
        } catch (RuntimeException e) {
            log.warn("Opening progress connection for {} failed: {}", ownerId, e.getMessage());
            onConnectionLost(attemptGeneration, e.getMessage());
        }
    }

    /**
     * Close the channel and forget all local state. Safe to call repeatedly.
     */
    public synchronized void disconnect() {
        manuallyDisconnected = true;
        generation++;
        cancelReconnectTimer();
        stopPolling();
        closeSession();

        currentProgress = null;
        error = null;
        reconnectAttempts = 0;
        estimationManager.clearSession(ownerId);

        if (state != ChannelState.DISCONNECTED) {
            changeState(ChannelState.DISCONNECTED);
            log.info("Progress channel for {} disconnected", ownerId);
        }
    }

    /**
     * Manual retry after {@link ChannelState#FAILED}: start over with a fresh attempt counter.
     */
    public synchronized void reconnect() {
        disconnect();
        connect();
    }

    @Override
    public void close() {
        disconnect();
    }

    public synchronized ChannelState state() {
        return state;
    }

    public synchronized boolean isConnected() {
        return state == ChannelState.CONNECTED;
    }

    public synchronized Optional<EnhancedProgress> currentProgress() {
        return Optional.ofNullable(currentProgress);
    }

    public synchronized Optional<String> error() {
        return Optional.ofNullable(error);
    }

    public synchronized int reconnectAttempts() {
        return reconnectAttempts;
    }

    public synchronized boolean isPolling() {
        return pollTimer != null;
    }

    public Optional<Double> estimatedRemainingMinutes() {
        return estimationManager.getEstimatedRemainingMinutes(ownerId);
    }

    public Optional<ProcessingStats> processingStats() {
        return estimationManager.getProcessingStats(ownerId);
    }

    public synchronized ConnectionHealth connectionHealth() {
        return ConnectionHealth.classify(
                currentProgress != null ? currentProgress.receivedAt() : null,
                clock.instant()
        );
    }

    public String ownerId() {
        return ownerId;
    }

    private synchronized void onOpen(long attemptGeneration) {
        if (attemptGeneration != generation || manuallyDisconnected) {
            return;
        }
        reconnectAttempts = 0;
        error = null;
        stopPolling();
        changeState(ChannelState.CONNECTED);
        log.info("Progress channel for {} connected", ownerId);
    }

    private synchronized void onMessage(long attemptGeneration, String payload) {
        if (attemptGeneration != generation || manuallyDisconnected) {
            return;
        }
        ProgressFrame frame;
        try {
            frame = objectMapper.readValue(payload, ProgressFrame.class);
        } catch (JsonProcessingException e) {
            log.warn("Dropping unparseable progress frame for {}: {}", ownerId, e.getOriginalMessage());
            return;
        }

        switch (frame.type()) {
            case CONNECTION_ESTABLISHED -> log.debug("Progress server acknowledged channel for {}", ownerId);
            case PROGRESS_UPDATE -> {
                if (frame.data() != null) {
                    processEvent(frame.data());
                } else {
                    log.warn("Progress update for {} without data", ownerId);
                }
            }
            case ERROR -> {
                error = frame.error();
                listener.onError(frame.error());
            }
            default -> log.warn("Ignoring progress frame of unknown type for {}", ownerId);
        }
    }

    private synchronized void onConnectionLost(long attemptGeneration, String reason) {
        if (attemptGeneration != generation || manuallyDisconnected) {
            return;
        }
        // Close and error can both be reported for one failure; only the first one counts.
        generation++;
        session = null;

        if (reconnectAttempts < properties.getMaxReconnectAttempts()) {
            reconnectAttempts++;
            changeState(ChannelState.RECONNECT_PENDING);
            log.info("Progress channel for {} lost ({}), reconnect {}/{} in {} ms", ownerId, reason,
                    reconnectAttempts, properties.getMaxReconnectAttempts(),
                    properties.getReconnectInterval().toMillis());
            cancelReconnectTimer();
            reconnectTimer = taskScheduler.schedule(this::reconnectFromTimer,
                    clock.instant().plus(properties.getReconnectInterval()));
        } else {
            error = RECONNECT_EXHAUSTED_MESSAGE;
            changeState(ChannelState.FAILED);
            log.warn("Progress channel for {} gave up after {} reconnect attempts", ownerId, reconnectAttempts);
            listener.onError(error);
        }
        startPolling();
    }

    private synchronized void reconnectFromTimer() {
        reconnectTimer = null;
        if (manuallyDisconnected || state != ChannelState.RECONNECT_PENDING) {
            return;
        }
        connect();
    }

    private void poll() {
        synchronized (this) {
            if (manuallyDisconnected || pollTimer == null) {
                return;
            }
        }
        Optional<ProgressEvent> snapshot;
        try {
            snapshot = snapshotClient.fetch(ownerId);
        } catch (Exception e) {
            log.debug("Progress poll for {} failed: {}", ownerId, e.getMessage());
            return;
        }
        snapshot.ifPresent(this::processPolledEvent);
    }

    private synchronized void processPolledEvent(ProgressEvent event) {
        if (manuallyDisconnected || state == ChannelState.CONNECTED) {
            return;
        }
        processEvent(event);
    }

    private void processEvent(ProgressEvent event) {
        ProcessingStats stats = properties.isTimeEstimationEnabled()
                ? estimationManager.updateStats(ownerId, event).orElse(null)
                : null;
        EnhancedProgress progress = new EnhancedProgress(event, stats, clock.instant());
        currentProgress = progress;
        listener.onProgress(progress);

        if (event.isCompletion()) {
            listener.onCompletion(progress);
            disposeServerSnapshot();
        }
    }

    private void disposeServerSnapshot() {
        taskScheduler.schedule(() -> {
            try {
                snapshotClient.clear(ownerId);
            } catch (Exception e) {
                log.debug("Clearing progress snapshot for {} failed: {}", ownerId, e.getMessage());
            }
        }, clock.instant());
    }

    private void startPolling() {
        if (pollTimer != null || manuallyDisconnected) {
            return;
        }
        pollTimer = taskScheduler.scheduleWithFixedDelay(this::poll,
                clock.instant().plus(properties.getPollInterval()), properties.getPollInterval());
        log.debug("Polling progress snapshot for {} every {} ms", ownerId, properties.getPollInterval().toMillis());
    }

    private void stopPolling() {
        if (pollTimer != null) {
            pollTimer.cancel(false);
            pollTimer = null;
        }
    }

    private void cancelReconnectTimer() {
        if (reconnectTimer != null) {
            reconnectTimer.cancel(false);
            reconnectTimer = null;
        }
    }

    private void closeSession() {
        ProgressTransport.Session current = session;
        session = null;
        if (current != null) {
            try {
                current.close();
            } catch (RuntimeException e) {
                log.debug("Closing progress session for {} failed: {}", ownerId, e.getMessage());
            }
        }
    }

    private void changeState(ChannelState newState) {
        if (state == newState) {
            return;
        }
        state = newState;
        listener.onStateChanged(newState);
    }

    private final class GenerationListener implements ProgressTransport.Listener {

        private final long attemptGeneration;

        private GenerationListener(long attemptGeneration) {
            this.attemptGeneration = attemptGeneration;
        }

        @Override
        public void onOpen() {
            ProgressChannelClient.this.onOpen(attemptGeneration);
        }

        @Override
        public void onMessage(String payload) {
            ProgressChannelClient.this.onMessage(attemptGeneration, payload);
        }

        @Override
        public void onClose(String reason) {
            ProgressChannelClient.this.onConnectionLost(attemptGeneration, reason);
        }

        @Override
        public void onError(Throwable error) {
            ProgressChannelClient.this.onConnectionLost(attemptGeneration,
                    error != null ? error.getMessage() : "transport error");
        }
    }
}
