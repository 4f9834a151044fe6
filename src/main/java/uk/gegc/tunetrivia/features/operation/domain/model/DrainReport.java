package uk.gegc.tunetrivia.features.operation.domain.model;

public record DrainReport(int replayed, int succeeded, int requeued, int discarded) {

    public static DrainReport empty() {
        return new DrainReport(0, 0, 0, 0);
    }
}
