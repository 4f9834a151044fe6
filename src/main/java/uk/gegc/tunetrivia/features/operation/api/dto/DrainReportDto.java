package uk.gegc.tunetrivia.features.operation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.tunetrivia.features.operation.domain.model.DrainReport;

@Schema(name = "DrainReportDto", description = "Outcome of one drain of the failed-operation queue")
public record DrainReportDto(
        @Schema(description = "Entries taken from the queue", example = "4")
        int replayed,

        @Schema(description = "Entries applied successfully", example = "2")
        int succeeded,

        @Schema(description = "Entries put back for another attempt", example = "1")
        int requeued,

        @Schema(description = "Entries dropped for good", example = "1")
        int discarded
) {

    public static DrainReportDto from(DrainReport report) {
        return new DrainReportDto(report.replayed(), report.succeeded(), report.requeued(), report.discarded());
    }
}
