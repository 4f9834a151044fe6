package uk.gegc.tunetrivia.features.clipjob.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.tunetrivia.features.clipjob.api.dto.ClipJobAcceptedDto;
import uk.gegc.tunetrivia.features.clipjob.api.dto.StartClipJobRequest;
import uk.gegc.tunetrivia.features.clipjob.application.ClipJobService;

@Tag(name = "Clip Jobs", description = "Turn YouTube links into song clips")
@RestController
@RequestMapping("/api/v1/clip-jobs")
@RequiredArgsConstructor
public class ClipJobController {

    private final ClipJobService clipJobService;

    @Operation(
            summary = "Start a clip job",
            description = "Runs the clip job in the background. Progress is pushed on /ws/progress?userId={ownerId} "
                    + "and kept at /api/progress/{ownerId} while nobody listens.",
            tags = {"Clip Jobs"}
    )
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Job started"),
            @ApiResponse(responseCode = "400", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<ClipJobAcceptedDto> startJob(@RequestBody @Valid StartClipJobRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(clipJobService.startJob(request));
    }
}
