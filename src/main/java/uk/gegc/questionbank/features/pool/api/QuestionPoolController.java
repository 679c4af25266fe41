package uk.gegc.questionbank.features.pool.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.questionbank.features.pool.api.dto.PoolBreakdownResponse;
import uk.gegc.questionbank.features.pool.api.dto.PoolCountResponse;
import uk.gegc.questionbank.features.pool.api.dto.PoolCountsResponse;
import uk.gegc.questionbank.features.pool.api.dto.QuestionPoolRequest;
import uk.gegc.questionbank.features.pool.api.dto.QuestionSampleResponse;
import uk.gegc.questionbank.features.pool.application.QuestionPoolService;
import uk.gegc.questionbank.shared.security.CurrentUserResolver;

@Tag(
        name = "Question Pool",
        description = "Count and sample questions by taxonomy selection and personal history"
)
@RestController
@RequestMapping("/api/v1/question-pool")
@RequiredArgsConstructor
public class QuestionPoolController {

    private final QuestionPoolService questionPoolService;
    private final CurrentUserResolver currentUserResolver;

    @Operation(
            summary = "Count questions",
            description = "Counts questions matching the selection under one filter. "
                    + "Filters other than ALL require an authenticated user.",
            tags = {"Question Pool"}
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Count returned; zero for an empty or unknown selection"),
            @ApiResponse(responseCode = "400", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/count")
    public ResponseEntity<PoolCountResponse> count(
            Authentication authentication,
            @RequestBody @Valid QuestionPoolRequest request
    ) {
        return ResponseEntity.ok(questionPoolService.count(request, currentUserResolver.resolveUserId(authentication)));
    }

    @Operation(
            summary = "Count questions for every filter",
            description = "Counts the selection under every filter available to the caller",
            tags = {"Question Pool"}
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Counts returned")
    })
    @PostMapping("/counts")
    public ResponseEntity<PoolCountsResponse> counts(
            Authentication authentication,
            @RequestBody @Valid QuestionPoolRequest request
    ) {
        return ResponseEntity.ok(
                questionPoolService.countAllModes(request, currentUserResolver.resolveUserId(authentication)));
    }

    @Operation(
            summary = "Break a selection down",
            description = "Returns the non-overlapping slices the selection resolves to, with a count for each",
            tags = {"Question Pool"}
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Breakdown returned"),
            @ApiResponse(responseCode = "400", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/breakdown")
    public ResponseEntity<PoolBreakdownResponse> breakdown(
            Authentication authentication,
            @RequestBody @Valid QuestionPoolRequest request
    ) {
        return ResponseEntity.ok(
                questionPoolService.breakdown(request, currentUserResolver.resolveUserId(authentication)));
    }

    @Operation(
            summary = "Sample questions",
            description = "Draws up to `count` distinct random question ids from the selection. "
                    + "A shorter list means the pool holds fewer questions.",
            tags = {"Question Pool"}
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Question ids returned"),
            @ApiResponse(responseCode = "400", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/sample")
    public ResponseEntity<QuestionSampleResponse> sample(
            Authentication authentication,
            @RequestBody @Valid QuestionPoolRequest request
    ) {
        return ResponseEntity.ok(
                questionPoolService.sampleQuestions(request, currentUserResolver.resolveUserId(authentication)));
    }
}
