package uk.gegc.questionbank.features.pool.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.questionbank.features.scope.domain.model.FilterMode;

import java.util.List;

@Schema(description = "Per-slice counts of a resolved selection; the slices never overlap")
public record PoolBreakdownResponse(FilterMode filter, long total, List<DescriptorCountDto> slices) {
}
