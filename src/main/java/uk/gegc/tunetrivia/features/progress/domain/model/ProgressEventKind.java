package uk.gegc.tunetrivia.features.progress.domain.model;

public enum ProgressEventKind {
    DOWNLOAD_PROGRESS("progress"),
    PLAYLIST_EXTRACTED("playlist_extracted"),
    PROCESSING_START("processing_start"),
    CLIP_MONITORING("clip_monitoring"),
    COMPLETION("completion");

    private final String wireName;

    ProgressEventKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
