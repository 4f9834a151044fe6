package uk.gegc.tunetrivia.features.operation.domain.model;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Several rows of one kind applied all-or-nothing; the whole batch is one retry unit.
 */
public record InsertBatch(RecordKind kind, List<Map<String, Object>> payloads) implements Operation {

    public InsertBatch {
        Objects.requireNonNull(kind, "kind");
        if (payloads == null || payloads.isEmpty()) {
            throw new IllegalArgumentException("Batch must contain at least one row");
        }
        payloads.forEach(InsertRecord::requireId);
        payloads = payloads.stream()
                .map(row -> Collections.unmodifiableMap(new LinkedHashMap<>(row)))
                .toList();
    }

    /**
     * Builds the batch, assigning a fresh id to every row that has none.
     */
    public static InsertBatch of(RecordKind kind, List<Map<String, Object>> payloads, Clock clock) {
        Objects.requireNonNull(payloads, "payloads");
        return new InsertBatch(kind, payloads.stream()
                .map(row -> InsertRecord.withId(kind, row, clock))
                .toList());
    }

    @Override
    public String describe() {
        return "INSERT " + kind.tableName() + " x" + payloads.size();
    }
}
