package uk.gegc.questionbank.features.pool.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.questionbank.features.scope.domain.model.FilterMode;

import java.util.List;

@Schema(description = "Randomly drawn question ids; may hold fewer than requested when the pool is small")
public record QuestionSampleResponse(FilterMode filter, int requested, List<String> questionIds) {
}
