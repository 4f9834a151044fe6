package uk.gegc.tunetrivia.features.progress.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the progress push channel, the last-value store and the clip monitor
 */
@Component
@ConfigurationProperties(prefix = "progress")
@Data
public class ProgressProperties {

    /**
     * Path of the WebSocket endpoint
     */
    private String websocketPath = "/ws/progress";

    /**
     * Origins allowed to open the WebSocket; empty means same origin only
     */
    private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));

    /**
     * Last-value snapshots older than this are swept
     */
    private Duration snapshotTtl = Duration.ofHours(1);

    /**
     * Delay between two snapshot sweeps
     */
    private Duration snapshotSweepInterval = Duration.ofMinutes(10);

    private ClipMonitor clipMonitor = new ClipMonitor();

    @Data
    public static class ClipMonitor {

        /**
         * Directory the clip job writes finished clips to
         */
        private String clipsDirectory = "public/clips";

        /**
         * Extension of a finished clip file
         */
        private String clipExtension = ".mp3";

        /**
         * Delay between two directory scans
         */
        private Duration pollInterval = Duration.ofSeconds(2);

        /**
         * Only clips modified within this window count towards progress
         */
        private Duration recentWindow = Duration.ofMinutes(30);

        /**
         * Percent ceiling while the expected total is unknown
         */
        private double unknownTotalPercentCap = 85.0;

        /**
         * Percent credited per clip while the expected total is unknown
         */
        private double unknownTotalPercentPerClip = 3.0;
    }
}
