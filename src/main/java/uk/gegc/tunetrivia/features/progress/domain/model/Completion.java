package uk.gegc.tunetrivia.features.progress.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import uk.gegc.tunetrivia.shared.util.LenientInstantDeserializer;

import java.time.Instant;
import java.util.Map;

/**
 * Terminal event of a job. Persistence failures are reported through {@code failureCount}
 * rather than as an error, so partial successes stay visible.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Completion(
        @JsonProperty("current") int current,
        @JsonProperty("total") ProgressTotal total,
        @JsonProperty("percentage") double percent,
        @JsonProperty("step") String stage,
        @JsonProperty("song_title") String currentItemLabel,
        @JsonProperty("timestamp") @JsonDeserialize(using = LenientInstantDeserializer.class) Instant timestamp,
        @JsonProperty("successful") int successCount,
        @JsonProperty("failed") int failureCount,
        @JsonProperty("game_id") String gameId,
        @JsonProperty("quick_play") Boolean quickPlay,
        @JsonProperty("extra") @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, Object> extra
) implements ProgressEvent {

    public Completion {
        total = ProgressEvent.totalOrUnknown(total);
        extra = ProgressEvent.extraOrEmpty(extra);
    }

    public static Completion of(int successCount, int failureCount, String label, Instant timestamp) {
        int processed = successCount + failureCount;
        return new Completion(
                successCount,
                ProgressTotal.of(Math.max(processed, 1)),
                100.0,
                "Completed",
                label,
                timestamp,
                successCount,
                failureCount,
                null,
                null,
                Map.of()
        );
    }

    @Override
    public ProgressEventKind kind() {
        return ProgressEventKind.COMPLETION;
    }
}
