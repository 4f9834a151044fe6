package uk.gegc.tunetrivia.features.progress.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import uk.gegc.tunetrivia.shared.util.LenientInstantDeserializer;

import java.time.Instant;
import java.util.Map;

/**
 * Per-item progress printed by the clip job while downloading and cutting.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DownloadProgress(
        @JsonProperty("current") int current,
        @JsonProperty("total") ProgressTotal total,
        @JsonProperty("percentage") double percent,
        @JsonProperty("step") String stage,
        @JsonProperty("song_title") String currentItemLabel,
        @JsonProperty("timestamp") @JsonDeserialize(using = LenientInstantDeserializer.class) Instant timestamp,
        @JsonProperty("estimated_remaining_seconds") Long estimatedRemainingSeconds,
        @JsonProperty("extra") @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, Object> extra
) implements ProgressEvent {

    public DownloadProgress {
        total = ProgressEvent.totalOrUnknown(total);
        extra = ProgressEvent.extraOrEmpty(extra);
    }

    public static DownloadProgress of(int current, ProgressTotal total, double percent, String stage,
                                      String currentItemLabel, Instant timestamp) {
        return new DownloadProgress(current, total, percent, stage, currentItemLabel, timestamp, null, Map.of());
    }

    @Override
    public ProgressEventKind kind() {
        return ProgressEventKind.DOWNLOAD_PROGRESS;
    }
}
