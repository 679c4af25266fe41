package uk.gegc.questionbank.features.repair.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;
import uk.gegc.questionbank.features.repair.api.dto.RepairStatusDto;
import uk.gegc.questionbank.features.repair.domain.model.RepairRun;

import java.util.List;
import java.util.Map;

@Component
public class RepairStatusMapper {

    /**
     * @param countsSoFar entries written by the run, per aggregate
     */
    public RepairStatusDto toDto(RepairRun run, Map<AggregateName, Long> countsSoFar, boolean active) {
        return new RepairStatusDto(
                run.getId(),
                run.getTarget(),
                run.getUserId(),
                run.getState(),
                active,
                run.isCancelRequested(),
                run.getClearAggregate(),
                run.getClearCursor(),
                run.getCurrentTable(),
                run.getLastCursor(),
                run.getPagesProcessed(),
                run.getRowsProcessed(),
                countsSoFar,
                run.getMismatchCount(),
                run.getMismatches() == null ? List.of() : List.copyOf(run.getMismatches()),
                run.getErrorMessage(),
                run.getStartedAt(),
                run.getUpdatedAt(),
                run.getCompletedAt()
        );
    }
}
