package uk.gegc.tunetrivia.features.clipjob.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "ClipJobAcceptedDto", description = "Handle of a started clip job")
public record ClipJobAcceptedDto(
        @Schema(description = "Session id of the job", example = "session_1718000000000_k3j9x0a1b")
        String sessionId,

        @Schema(description = "Owner whose progress channel reports the job")
        String ownerId
) {
}
