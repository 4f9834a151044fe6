package uk.gegc.tunetrivia.features.progress.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.tunetrivia.features.progress.application.ProgressSnapshotStore;
import uk.gegc.tunetrivia.features.progress.domain.exception.ProgressNotFoundException;
import uk.gegc.tunetrivia.features.progress.domain.model.ProgressEvent;
import uk.gegc.tunetrivia.features.progress.domain.model.ProgressSnapshot;

@Tag(
        name = "Progress",
        description = "Last-value progress snapshots for clients that poll instead of holding a WebSocket"
)
@RestController
@RequestMapping("/api/progress")
@RequiredArgsConstructor
@Slf4j
public class ProgressController {

    private final ProgressSnapshotStore snapshotStore;

    @Operation(
            summary = "Get the last progress event",
            description = "Returns the last event that could not be pushed to a live connection",
            tags = {"Progress"}
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Progress event returned"),
            @ApiResponse(responseCode = "404", description = "No progress stored for the owner",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{ownerId}")
    public ResponseEntity<ProgressEvent> getProgress(
            @Parameter(description = "Owner the job runs for", required = true)
            @PathVariable String ownerId
    ) {
        ProgressSnapshot snapshot = snapshotStore.get(ownerId)
                .orElseThrow(() -> new ProgressNotFoundException(ownerId));
        return ResponseEntity.ok(snapshot.event());
    }

    @Operation(summary = "Store a progress event", tags = {"Progress"})
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Progress stored"),
            @ApiResponse(responseCode = "400", description = "Malformed event",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{ownerId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void storeProgress(
            @Parameter(description = "Owner the job runs for", required = true)
            @PathVariable String ownerId,
            @RequestBody ProgressEvent event
    ) {
        snapshotStore.put(ownerId, event);
        log.debug("Stored {} progress for {}", event.kind().wireName(), ownerId);
    }

    @Operation(summary = "Clear the stored progress", tags = {"Progress"})
    @ApiResponse(responseCode = "204", description = "Progress cleared, or there was none")
    @DeleteMapping("/{ownerId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void clearProgress(
            @Parameter(description = "Owner the job runs for", required = true)
            @PathVariable String ownerId
    ) {
        snapshotStore.remove(ownerId);
    }
}
