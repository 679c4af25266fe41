package uk.gegc.questionbank.features.monitoring.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;

import java.util.Map;

public record UserAggregatesDto(
        String userId,
        @Schema(description = "Entries of the user per aggregate, summed over the user's namespaces")
        Map<AggregateName, Long> counts
) {
}
