package uk.gegc.tunetrivia.features.operation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(name = "QueueStatusDto", description = "Current state of the failed-operation queue")
public record QueueStatusDto(
        @Schema(description = "Operations waiting for background retry", example = "3")
        int size,

        @Schema(description = "Whether the background retry loop is scheduled", example = "true")
        boolean backgroundRunning,

        @Schema(description = "Enqueue time of the oldest waiting operation, null when the queue is empty")
        Instant oldestEnqueuedAt
) {
}
