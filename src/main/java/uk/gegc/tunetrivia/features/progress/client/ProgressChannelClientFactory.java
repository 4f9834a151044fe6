package uk.gegc.tunetrivia.features.progress.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import uk.gegc.tunetrivia.features.estimation.application.TimeEstimationManager;

import java.time.Clock;

/**
 * Builds {@link ProgressChannelClient}s wired to the configured server.
 */
@Component
public class ProgressChannelClientFactory {

    private final ProgressClientProperties properties;
    private final TimeEstimationManager estimationManager;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final ProgressTransport transport;
    private final ProgressSnapshotClient snapshotClient;

    public ProgressChannelClientFactory(ProgressClientProperties properties,
                                        TimeEstimationManager estimationManager,
                                        @Qualifier("taskScheduler") TaskScheduler taskScheduler,
                                        Clock clock,
                                        ObjectMapper objectMapper,
                                        RestClient.Builder restClientBuilder) {
        this.properties = properties;
        this.estimationManager = estimationManager;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.transport = new StandardWebSocketProgressTransport(new StandardWebSocketClient(), properties.getWebsocketUrl());
        this.snapshotClient = new RestClientProgressSnapshotClient(restClientBuilder.baseUrl(properties.getBaseUrl()).build());
    }

    public ProgressChannelClient create(String ownerId, ProgressChannelListener listener) {
        return new ProgressChannelClient(ownerId, transport, snapshotClient, estimationManager,
                taskScheduler, clock, properties, objectMapper, listener);
    }

    /**
     * Create a client and connect it right away.
     */
    public ProgressChannelClient connect(String ownerId, ProgressChannelListener listener) {
        ProgressChannelClient client = create(ownerId, listener);
        client.connect();
        return client;
    }
}
