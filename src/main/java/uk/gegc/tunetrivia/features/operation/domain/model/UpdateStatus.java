package uk.gegc.tunetrivia.features.operation.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Updates columns of one existing record, {@code youtube_urls} unless another kind is given.
 */
public record UpdateStatus(RecordKind kind, String id, Map<String, Object> fields) implements Operation {

    public UpdateStatus {
        Objects.requireNonNull(kind, "kind");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Record id must not be blank");
        }
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("At least one field must be updated");
        }
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public UpdateStatus(String id, Map<String, Object> fields) {
        this(RecordKind.YOUTUBE_URL, id, fields);
    }

    public static UpdateStatus urlProcessed(String urlId, boolean processed) {
        return new UpdateStatus(urlId, Map.of("processed", processed));
    }

    @Override
    public String describe() {
        return "UPDATE " + kind.tableName() + " " + id;
    }
}
