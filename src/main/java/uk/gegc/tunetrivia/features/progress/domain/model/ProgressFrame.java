package uk.gegc.tunetrivia.features.progress.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import uk.gegc.tunetrivia.shared.util.LenientInstantDeserializer;

import java.time.Instant;
import java.util.Objects;

/**
 * One message on the push channel. Only the fields relevant to {@link #type()} are set.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressFrame(
        @JsonProperty("type") ProgressFrameType type,
        @JsonProperty("userId") String ownerId,
        @JsonProperty("data") ProgressEvent data,
        @JsonProperty("error") String error,
        @JsonProperty("timestamp") @JsonDeserialize(using = LenientInstantDeserializer.class) Instant timestamp
) {

    public ProgressFrame {
        type = Objects.requireNonNullElse(type, ProgressFrameType.UNKNOWN);
    }

    public static ProgressFrame connectionEstablished(String ownerId, Instant timestamp) {
        return new ProgressFrame(ProgressFrameType.CONNECTION_ESTABLISHED, ownerId, null, null, timestamp);
    }

    public static ProgressFrame progressUpdate(ProgressEvent event, Instant timestamp) {
        return new ProgressFrame(ProgressFrameType.PROGRESS_UPDATE, null, event, null, timestamp);
    }

    public static ProgressFrame error(String message, Instant timestamp) {
        return new ProgressFrame(ProgressFrameType.ERROR, null, null, message, timestamp);
    }
}
