package uk.gegc.questionbank.features.repair.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;
import uk.gegc.questionbank.features.repair.domain.model.RepairMismatch;
import uk.gegc.questionbank.features.repair.domain.model.RepairState;
import uk.gegc.questionbank.features.repair.domain.model.RepairTable;
import uk.gegc.questionbank.features.repair.domain.model.RepairTarget;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Schema(description = "Progress of an aggregate repair run")
public record RepairStatusDto(
        UUID id,
        RepairTarget target,
        @Schema(description = "User whose aggregates a USER run rebuilds")
        String userId,
        RepairState state,
        @Schema(description = "Whether this instance is currently driving the run")
        boolean active,
        boolean cancelRequested,
        AggregateName clearAggregate,
        String clearCursor,
        RepairTable currentTable,
        @Schema(description = "Id of the last primary-store row rebuilt in the current table")
        String lastCursor,
        long pagesProcessed,
        long rowsProcessed,
        @Schema(description = "Entries written so far, per aggregate")
        Map<AggregateName, Long> countsSoFar,
        long mismatchCount,
        List<RepairMismatch> mismatches,
        String errorMessage,
        Instant startedAt,
        Instant updatedAt,
        Instant completedAt
) {
}
