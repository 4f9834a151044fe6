package uk.gegc.tunetrivia.features.progress.client;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for progress channel clients
 */
@Component
@ConfigurationProperties(prefix = "progress.client")
@Data
public class ProgressClientProperties {

    /**
     * Base URL of the server hosting the snapshot endpoint
     */
    private String baseUrl = "http://localhost:8080";

    /**
     * WebSocket URL of the push endpoint, without the owner parameter
     */
    private String websocketUrl = "ws://localhost:8080/ws/progress";

    /**
     * Delay before an automatic reconnect
     */
    private Duration reconnectInterval = Duration.ofSeconds(3);

    /**
     * Automatic reconnects before the channel gives up and waits for a manual reconnect
     */
    private int maxReconnectAttempts = 5;

    /**
     * Delay between two snapshot polls while the push connection is down
     */
    private Duration pollInterval = Duration.ofSeconds(2);

    /**
     * Attach rate and ETA estimates to received events
     */
    private boolean timeEstimationEnabled = true;
}
