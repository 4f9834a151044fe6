package uk.gegc.tunetrivia.features.progress.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import uk.gegc.tunetrivia.shared.util.LenientInstantDeserializer;

import java.time.Instant;
import java.util.Map;

/**
 * Progress derived from counting finished clip files on disk.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClipMonitoring(
        @JsonProperty("current") int current,
        @JsonProperty("total") ProgressTotal total,
        @JsonProperty("percentage") double percent,
        @JsonProperty("step") String stage,
        @JsonProperty("song_title") String currentItemLabel,
        @JsonProperty("timestamp") @JsonDeserialize(using = LenientInstantDeserializer.class) Instant timestamp,
        @JsonProperty("clips_completed") int clipsCompleted,
        @JsonProperty("extra") @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, Object> extra
) implements ProgressEvent {

    public ClipMonitoring {
        total = ProgressEvent.totalOrUnknown(total);
        extra = ProgressEvent.extraOrEmpty(extra);
    }

    @Override
    public ProgressEventKind kind() {
        return ProgressEventKind.CLIP_MONITORING;
    }
}
