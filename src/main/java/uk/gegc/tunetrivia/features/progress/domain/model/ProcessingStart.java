package uk.gegc.tunetrivia.features.progress.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import uk.gegc.tunetrivia.shared.util.LenientInstantDeserializer;

import java.time.Instant;
import java.util.Map;

/**
 * Emitted when the job knows how many songs it is about to process.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessingStart(
        @JsonProperty("current") int current,
        @JsonProperty("total") ProgressTotal total,
        @JsonProperty("percentage") double percent,
        @JsonProperty("step") String stage,
        @JsonProperty("song_title") String currentItemLabel,
        @JsonProperty("timestamp") @JsonDeserialize(using = LenientInstantDeserializer.class) Instant timestamp,
        @JsonProperty("total_songs") Integer totalSongs,
        @JsonProperty("extra") @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, Object> extra
) implements ProgressEvent {

    public ProcessingStart {
        total = ProgressEvent.totalOrUnknown(total);
        extra = ProgressEvent.extraOrEmpty(extra);
    }

    /**
     * Resets the counters so that the estimator starts a fresh session from this event.
     */
    public ProcessingStart normalized() {
        if (totalSongs == null || totalSongs <= 0) {
            return this;
        }
        return new ProcessingStart(
                0,
                ProgressTotal.of(totalSongs),
                0.0,
                "Preparing downloads",
                "Starting " + totalSongs + " songs",
                timestamp,
                totalSongs,
                extra
        );
    }

    @Override
    public ProgressEventKind kind() {
        return ProgressEventKind.PROCESSING_START;
    }
}
