package uk.gegc.tunetrivia.features.operation.domain.model;

/**
 * A persistence side effect that must be applied at least once.
 * Each variant maps to exactly one atomic call against the store.
 */
public sealed interface Operation permits InsertRecord, UpdateStatus, InsertBatch {

    RecordKind kind();

    /**
     * Short label used in logs and metrics, e.g. {@code INSERT songs}.
     */
    String describe();
}
