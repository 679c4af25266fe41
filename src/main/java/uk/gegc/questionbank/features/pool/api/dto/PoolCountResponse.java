package uk.gegc.questionbank.features.pool.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.questionbank.features.scope.domain.model.FilterMode;

@Schema(description = "Number of questions matching a selection")
public record PoolCountResponse(FilterMode filter, long count) {
}
