package uk.gegc.tunetrivia.features.progress.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Message types sent over the progress push channel.
 */
public enum ProgressFrameType {
    CONNECTION_ESTABLISHED("connection_established"),
    PROGRESS_UPDATE("progress_update"),
    ERROR("error"),
    UNKNOWN("unknown");

    private final String wireName;

    ProgressFrameType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ProgressFrameType fromWire(String value) {
        for (ProgressFrameType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
