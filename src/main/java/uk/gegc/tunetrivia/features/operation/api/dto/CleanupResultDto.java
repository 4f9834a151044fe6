package uk.gegc.tunetrivia.features.operation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "CleanupResultDto", description = "Outcome of a queue cleanup pass")
public record CleanupResultDto(
        @Schema(description = "Entries removed because they expired or exceeded capacity", example = "5")
        int removed,

        @Schema(description = "Entries left in the queue", example = "12")
        int remaining
) {
}
