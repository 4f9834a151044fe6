package uk.gegc.tunetrivia.features.operation.application;

import uk.gegc.tunetrivia.features.operation.domain.model.Operation;

import java.util.List;
import java.util.Map;

/**
 * Applies one {@link Operation} as a single atomic call against the store.
 * Implementations must never leave an operation partially applied.
 */
@FunctionalInterface
public interface OperationApplier {

    /**
     * @return rows written or touched, including generated identifiers
     */
    List<Map<String, Object>> apply(Operation operation);
}
