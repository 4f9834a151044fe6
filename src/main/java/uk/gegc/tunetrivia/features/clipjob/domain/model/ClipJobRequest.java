package uk.gegc.tunetrivia.features.clipjob.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * One run of the clip job.
 *
 * @param sessionId     correlation id for logs and queued operations
 * @param youtubeUrlIds stored URL records to mark processed once the job finishes
 */
public record ClipJobRequest(String sessionId, String ownerId, List<String> urls, List<String> youtubeUrlIds) {

    public ClipJobRequest {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(ownerId, "ownerId");
        if (urls == null || urls.isEmpty()) {
            throw new IllegalArgumentException("At least one URL is required");
        }
        urls = List.copyOf(urls);
        youtubeUrlIds = youtubeUrlIds == null ? List.of() : List.copyOf(youtubeUrlIds);
    }
}
