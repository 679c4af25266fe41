package uk.gegc.questionbank.features.pool.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.questionbank.features.scope.domain.model.FilterMode;

import java.util.Map;

@Schema(description = "Counts for every filter mode available to the caller")
public record PoolCountsResponse(Map<FilterMode, Long> counts) {
}
