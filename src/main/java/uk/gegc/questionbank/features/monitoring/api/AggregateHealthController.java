package uk.gegc.questionbank.features.monitoring.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.questionbank.features.monitoring.api.dto.AggregateOverviewDto;
import uk.gegc.questionbank.features.monitoring.api.dto.UserAggregatesDto;
import uk.gegc.questionbank.features.monitoring.api.dto.UserHealthDto;
import uk.gegc.questionbank.features.monitoring.application.AggregateHealthService;

@Tag(
        name = "Aggregate Health",
        description = "Admin checks comparing aggregate counts with the primary store"
)
@RestController
@RequestMapping("/api/v1/admin/aggregates/health")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
public class AggregateHealthController {

    private final AggregateHealthService healthService;

    @Operation(
            summary = "Check question aggregates",
            description = "Compares the global question total and every theme, subtheme and group count "
                    + "with a recount of the questions table",
            tags = {"Aggregate Health"}
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Checks returned; status is HEALTHY or MISMATCH"),
            @ApiResponse(responseCode = "403", description = "Forbidden",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping
    public ResponseEntity<AggregateOverviewDto> getOverview() {
        return ResponseEntity.ok(healthService.getOverview());
    }

    @Operation(
            summary = "Check the aggregates of one user",
            description = "Compares every answered, incorrect and bookmarked aggregate of the user with the user's facts",
            tags = {"Aggregate Health"}
    )
    @GetMapping("/users/{userId}")
    public ResponseEntity<UserHealthDto> checkUser(
            @Parameter(description = "Opaque id of the user", required = true)
            @PathVariable String userId
    ) {
        return ResponseEntity.ok(healthService.checkUser(userId));
    }

    @Operation(summary = "Get the aggregate counts of one user", tags = {"Aggregate Health"})
    @GetMapping("/users/{userId}/aggregates")
    public ResponseEntity<UserAggregatesDto> getUserAggregates(
            @Parameter(description = "Opaque id of the user", required = true)
            @PathVariable String userId
    ) {
        return ResponseEntity.ok(healthService.getUserAggregates(userId));
    }
}
