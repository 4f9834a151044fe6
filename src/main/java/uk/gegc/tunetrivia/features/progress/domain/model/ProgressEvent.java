package uk.gegc.tunetrivia.features.progress.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of a clip job at one point in time.
 * <p>
 * One variant per event kind; the {@code type} property on the wire selects the variant,
 * and a missing or unrecognised type reads as {@link DownloadProgress}.
 * Field names on the wire follow the job's progress line format
 * ({@code percentage}, {@code step}, {@code song_title}, ...).
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type",
        defaultImpl = DownloadProgress.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = DownloadProgress.class, name = "progress"),
        @JsonSubTypes.Type(value = PlaylistExtracted.class, name = "playlist_extracted"),
        @JsonSubTypes.Type(value = ProcessingStart.class, name = "processing_start"),
        @JsonSubTypes.Type(value = ClipMonitoring.class, name = "clip_monitoring"),
        @JsonSubTypes.Type(value = Completion.class, name = "completion")
})
public sealed interface ProgressEvent
        permits DownloadProgress, PlaylistExtracted, ProcessingStart, ClipMonitoring, Completion {

    int current();

    ProgressTotal total();

    double percent();

    String stage();

    String currentItemLabel();

    Instant timestamp();

    Map<String, Object> extra();

    @JsonIgnore
    ProgressEventKind kind();

    @JsonIgnore
    default boolean isCompletion() {
        return kind() == ProgressEventKind.COMPLETION;
    }

    static ProgressTotal totalOrUnknown(ProgressTotal total) {
        return total != null ? total : ProgressTotal.unknown();
    }

    static Map<String, Object> extraOrEmpty(Map<String, Object> extra) {
        return extra != null ? Collections.unmodifiableMap(new LinkedHashMap<>(extra)) : Map.of();
    }
}
