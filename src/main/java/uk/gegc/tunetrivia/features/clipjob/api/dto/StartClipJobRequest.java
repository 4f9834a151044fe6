package uk.gegc.tunetrivia.features.clipjob.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

@Schema(name = "StartClipJobRequest", description = "YouTube links to turn into clips")
public record StartClipJobRequest(
        @Schema(description = "Owner the job runs for; progress is published under this id",
                example = "2f1c9a6e-5b7d-4d8e-9c1a-3b2e4f5a6b7c")
        @NotBlank(message = "ownerId must not be blank")
        String ownerId,

        @Schema(description = "Video or playlist URLs", example = "[\"https://www.youtube.com/watch?v=dQw4w9WgXcQ\"]")
        @NotEmpty(message = "At least one URL is required")
        @Size(max = 50, message = "At most 50 URLs per job")
        List<@NotBlank(message = "URL must not be blank") String> urls,

        @Schema(description = "Stored URL records to mark processed when the job finishes")
        List<String> youtubeUrlIds
) {
}
