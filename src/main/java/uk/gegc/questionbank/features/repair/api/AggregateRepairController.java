package uk.gegc.questionbank.features.repair.api;

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
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import uk.gegc.questionbank.features.repair.api.dto.RepairStatusDto;
import uk.gegc.questionbank.features.repair.application.ConsistencyRepairWorkflow;
import uk.gegc.questionbank.features.repair.domain.model.RepairTarget;

import java.util.List;
import java.util.UUID;

@Tag(
        name = "Aggregate Repair",
        description = "Admin operations that rebuild aggregate indexes from the primary store"
)
@Slf4j
@RestController
@RequestMapping("/api/v1/admin/aggregates/repairs")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
public class AggregateRepairController {

    private final ConsistencyRepairWorkflow repairWorkflow;

    @Operation(
            summary = "Start a repair run",
            description = "Clears and rebuilds the aggregates of the target in the background. "
                    + "Unfinished runs that are not running are superseded.",
            tags = {"Aggregate Repair"}
    )
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Run accepted"),
            @ApiResponse(responseCode = "403", description = "Forbidden",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Another run is in progress",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<RepairStatusDto> startRepair(
            @Parameter(description = "Aggregates to rebuild")
            @RequestParam(defaultValue = "ALL") RepairTarget target,
            Authentication authentication
    ) {
        log.info("Repair of {} requested by {}", target, authentication.getName());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(repairWorkflow.startRepair(target));
    }

    @Operation(
            summary = "Start a repair run for one user",
            description = "Clears and rebuilds the answered, incorrect and bookmarked aggregates of the user "
                    + "from that user's facts, leaving every other namespace untouched.",
            tags = {"Aggregate Repair"}
    )
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Run accepted"),
            @ApiResponse(responseCode = "403", description = "Forbidden",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Another run is in progress",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/users/{userId}")
    public ResponseEntity<RepairStatusDto> startUserRepair(
            @Parameter(description = "Opaque id of the user", required = true)
            @PathVariable String userId,
            Authentication authentication
    ) {
        log.info("Repair of user {} requested by {}", userId, authentication.getName());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(repairWorkflow.startUserRepair(userId));
    }

    @Operation(summary = "List recent repair runs", tags = {"Aggregate Repair"})
    @GetMapping
    public ResponseEntity<List<RepairStatusDto>> listRuns() {
        return ResponseEntity.ok(repairWorkflow.listRecentRuns());
    }

    @Operation(summary = "Get repair run status", tags = {"Aggregate Repair"})
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Status returned"),
            @ApiResponse(responseCode = "404", description = "Run not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{runId}")
    public ResponseEntity<RepairStatusDto> getRun(
            @Parameter(description = "UUID of the repair run", required = true)
            @PathVariable UUID runId
    ) {
        return ResponseEntity.ok(repairWorkflow.getRepairStatus(runId));
    }

    @Operation(
            summary = "Resume a repair run",
            description = "Continues an unfinished run from its last committed page",
            tags = {"Aggregate Repair"}
    )
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Run resumed"),
            @ApiResponse(responseCode = "404", description = "Run not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Run already finished",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{runId}/resume")
    public ResponseEntity<RepairStatusDto> resumeRun(
            @Parameter(description = "UUID of the repair run", required = true)
            @PathVariable UUID runId
    ) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(repairWorkflow.resumeRepair(runId));
    }

    @Operation(
            summary = "Cancel a repair run",
            description = "Stops the run after the page in progress; it can be resumed later",
            tags = {"Aggregate Repair"}
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Cancellation recorded"),
            @ApiResponse(responseCode = "404", description = "Run not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Run already finished",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{runId}/cancel")
    public ResponseEntity<RepairStatusDto> cancelRun(
            @Parameter(description = "UUID of the repair run", required = true)
            @PathVariable UUID runId
    ) {
        return ResponseEntity.ok(repairWorkflow.cancelRepair(runId));
    }
}
