package uk.gegc.tunetrivia.features.operation.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a successful {@code applyWithRetry}.
 *
 * @param rows     rows written or touched, as sent to the store (including generated ids)
 * @param attempts attempts used, 1 when the first call succeeded
 */
public record OperationResult(Operation operation, List<Map<String, Object>> rows, int attempts) {

    public OperationResult {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public boolean recovered() {
        return attempts > 1;
    }
}
