package uk.gegc.tunetrivia.features.clipjob.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the external clip job
 */
@Component
@ConfigurationProperties(prefix = "clip-job")
@Data
public class ClipJobProperties {

    /**
     * Command that starts the job; the path of the URL list file is appended as last argument
     */
    private List<String> command = new ArrayList<>(List.of("./venv312/bin/python", "create_clips.py"));

    /**
     * Working directory of the job process
     */
    private String workingDirectory = "scripts";

    /**
     * Directory the job writes finished clips to
     */
    private String clipsDirectory = "public/clips";

    /**
     * Public path prefix stored with each song
     */
    private String clipPathPrefix = "/clips/";

    /**
     * The job is killed when it runs longer than this
     */
    private Duration timeout = Duration.ofMinutes(30);

    /**
     * Clips modified within this window before the job ends are stored as songs
     */
    private Duration recentWindow = Duration.ofMinutes(30);

    private SongDefaults songDefaults = new SongDefaults();

    /**
     * Values stored for songs whose metadata the job does not report
     */
    @Data
    public static class SongDefaults {
        private String artist = "Unknown";
        private String album = "Unknown";
        private int durationSeconds = 180;
        private int clipStartSeconds = 30;
        private int clipEndSeconds = 40;
    }
}
