package uk.gegc.tunetrivia.features.operation.domain.model;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One row insert. The payload always carries its {@code id}, so every retry or replay
 * of the same operation targets the same row.
 */
public record InsertRecord(RecordKind kind, Map<String, Object> payload) implements Operation {

    public InsertRecord {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(payload, "payload");
        requireId(payload);
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * Builds the insert, assigning a fresh id when the payload has none.
     */
    public static InsertRecord of(RecordKind kind, Map<String, Object> payload, Clock clock) {
        return new InsertRecord(kind, withId(kind, payload, clock));
    }

    @Override
    public String describe() {
        return "INSERT " + kind.tableName();
    }

    static Map<String, Object> withId(RecordKind kind, Map<String, Object> payload, Clock clock) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(payload, "payload");
        if (payload.get("id") != null) {
            return payload;
        }
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", kind.newId(clock));
        payload.forEach((column, value) -> {
            if (!"id".equals(column)) {
                row.put(column, value);
            }
        });
        return row;
    }

    static void requireId(Map<String, Object> payload) {
        Object id = payload.get("id");
        if (id == null || id.toString().isBlank()) {
            throw new IllegalArgumentException("Insert payload must carry an id");
        }
    }
}
