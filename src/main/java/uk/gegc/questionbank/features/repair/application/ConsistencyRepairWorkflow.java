package uk.gegc.questionbank.features.repair.application;

import uk.gegc.questionbank.features.repair.api.dto.RepairStatusDto;
import uk.gegc.questionbank.features.repair.domain.model.RepairTarget;

import java.util.List;
import java.util.UUID;

/**
 * Rebuilds aggregates from the primary store: CLEARING, then REBUILDING page by page, then
 * VERIFYING, ending in DONE or FAILED. Runs execute in the background.
 */
public interface ConsistencyRepairWorkflow {

    /**
     * Creates a run and starts driving it. Unfinished runs no instance is driving are superseded.
     *
     * @throws IllegalStateException if another run is being driven by this instance
     * @throws uk.gegc.questionbank.shared.exception.ValidationException for {@link RepairTarget#USER}
     */
    RepairStatusDto startRepair(RepairTarget target);

    /**
     * Clears and rebuilds only the user-scoped aggregates of one user from that user's facts.
     * Otherwise behaves like {@link #startRepair}.
     */
    RepairStatusDto startUserRepair(String userId);

    RepairStatusDto getRepairStatus(UUID runId);

    /**
     * Continues an unfinished run from its last committed page. Clears a pending cancellation.
     */
    RepairStatusDto resumeRepair(UUID runId);

    /**
     * Asks the run to stop after the page in progress. The run keeps its cursors and can be resumed.
     */
    RepairStatusDto cancelRepair(UUID runId);

    List<RepairStatusDto> listRecentRuns();
}
