package uk.gegc.questionbank.features.repair.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import uk.gegc.questionbank.features.aggregate.config.AggregateProperties;
import uk.gegc.questionbank.features.repair.domain.model.RepairRun;
import uk.gegc.questionbank.features.repair.domain.model.RepairState;
import uk.gegc.questionbank.features.repair.domain.model.RepairTarget;
import uk.gegc.questionbank.features.repair.domain.repository.RepairRunRepository;

import java.util.List;

/**
 * Picks up repair runs left unfinished by a previous process.
 * <p>
 * A persisted index keeps what earlier pages wrote, so those runs resume. An in-memory index
 * starts empty, so unfinished runs are failed and, if configured, a full rebuild is started.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RepairStartupListener {

    private final RepairRunRepository repairRunRepository;
    private final RepairStepService stepService;
    private final ConsistencyRepairWorkflow workflow;
    private final AggregateProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        List<RepairRun> unfinished = repairRunRepository.findByStateInOrderByStartedAtAsc(RepairState.unfinished());
        AggregateProperties.Repair repair = properties.getRepair();

        if (properties.getStorage() == AggregateProperties.Storage.MEMORY) {
            for (RepairRun run : unfinished) {
                stepService.markFailed(run.getId(), "In-memory aggregate index was lost on restart");
            }
            if (repair.isRebuildMemoryIndexOnStartup()) {
                log.info("Rebuilding in-memory aggregate index from the primary store");
                workflow.startRepair(RepairTarget.ALL);
            }
            return;
        }

        if (!repair.isResumeOnStartup() || unfinished.isEmpty()) {
            return;
        }
        // only the newest run is resumed; older ones are superseded by it
        RepairRun latest = unfinished.get(unfinished.size() - 1);
        for (RepairRun run : unfinished) {
            if (run != latest) {
                stepService.markFailed(run.getId(), "Superseded by repair run " + latest.getId());
            }
        }
        if (latest.isCancelRequested()) {
            log.info("Repair run {} was cancelled before shutdown; leaving it for a manual resume", latest.getId());
            return;
        }
        try {
            workflow.resumeRepair(latest.getId());
        } catch (IllegalStateException e) {
            log.error("Could not resume repair run {} on startup", latest.getId(), e);
        }
    }
}
