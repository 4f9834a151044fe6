package uk.gegc.tunetrivia.features.operation.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.tunetrivia.features.operation.api.dto.CleanupResultDto;
import uk.gegc.tunetrivia.features.operation.api.dto.DrainReportDto;
import uk.gegc.tunetrivia.features.operation.api.dto.QueueStatusDto;
import uk.gegc.tunetrivia.features.operation.application.FailedOperationQueue;
import uk.gegc.tunetrivia.features.operation.application.scheduler.FailedOperationRetryScheduler;

import java.time.Duration;

@Tag(
        name = "Operation Queue",
        description = "Inspection and control of the background retry queue for failed persistence operations"
)
@RestController
@RequestMapping("/api/v1/operations/queue")
@RequiredArgsConstructor
@Validated
public class OperationQueueController {

    private final FailedOperationQueue failedOperationQueue;
    private final FailedOperationRetryScheduler retryScheduler;

    @Operation(summary = "Get queue status", tags = {"Operation Queue"})
    @ApiResponse(responseCode = "200", description = "Queue status returned")
    @GetMapping
    public ResponseEntity<QueueStatusDto> getStatus() {
        return ResponseEntity.ok(currentStatus());
    }

    @Operation(
            summary = "Drain the queue now",
            description = "Replay every queued operation once, outside the background schedule",
            tags = {"Operation Queue"}
    )
    @ApiResponse(responseCode = "200", description = "Drain finished")
    @PostMapping("/drain")
    public ResponseEntity<DrainReportDto> drain() {
        return ResponseEntity.ok(DrainReportDto.from(failedOperationQueue.drainQueue()));
    }

    @Operation(
            summary = "Clean up the queue",
            description = "Drop expired operations and evict the oldest ones beyond capacity",
            tags = {"Operation Queue"}
    )
    @ApiResponse(responseCode = "200", description = "Cleanup finished")
    @PostMapping("/cleanup")
    public ResponseEntity<CleanupResultDto> cleanup() {
        int removed = failedOperationQueue.cleanup();
        return ResponseEntity.ok(new CleanupResultDto(removed, failedOperationQueue.size()));
    }

    @Operation(
            summary = "Start background retry",
            description = "Start the drain and cleanup loop, replacing a running one",
            tags = {"Operation Queue"}
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Background retry started"),
            @ApiResponse(responseCode = "400", description = "Invalid interval",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/background/start")
    public ResponseEntity<QueueStatusDto> startBackgroundRetry(
            @Parameter(description = "Delay between ticks in milliseconds", example = "30000")
            @RequestParam(defaultValue = "30000") @Min(100) long intervalMs
    ) {
        retryScheduler.startBackgroundRetry(Duration.ofMillis(intervalMs));
        return ResponseEntity.ok(currentStatus());
    }

    @Operation(summary = "Stop background retry", tags = {"Operation Queue"})
    @ApiResponse(responseCode = "200", description = "Background retry stopped")
    @PostMapping("/background/stop")
    public ResponseEntity<QueueStatusDto> stopBackgroundRetry() {
        retryScheduler.stopBackgroundRetry();
        return ResponseEntity.ok(currentStatus());
    }

    private QueueStatusDto currentStatus() {
        return new QueueStatusDto(
                failedOperationQueue.size(),
                retryScheduler.isRunning(),
                failedOperationQueue.oldestEnqueuedAt().orElse(null)
        );
    }
}
