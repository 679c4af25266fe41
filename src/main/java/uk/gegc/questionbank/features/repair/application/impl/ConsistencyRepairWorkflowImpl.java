package uk.gegc.questionbank.features.repair.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.questionbank.features.aggregate.config.AggregateProperties;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;
import uk.gegc.questionbank.features.repair.api.dto.RepairStatusDto;
import uk.gegc.questionbank.features.repair.application.ConsistencyRepairWorkflow;
import uk.gegc.questionbank.features.repair.application.RepairStepResult;
import uk.gegc.questionbank.features.repair.application.RepairStepService;
import uk.gegc.questionbank.features.repair.domain.model.RepairCounterTotal;
import uk.gegc.questionbank.features.repair.domain.model.RepairRun;
import uk.gegc.questionbank.features.repair.domain.model.RepairState;
import uk.gegc.questionbank.features.repair.domain.model.RepairTarget;
import uk.gegc.questionbank.features.repair.domain.repository.RepairCounterRepository;
import uk.gegc.questionbank.features.repair.domain.repository.RepairRunRepository;
import uk.gegc.questionbank.features.repair.infra.mapping.RepairStatusMapper;
import uk.gegc.questionbank.shared.exception.ResourceNotFoundException;
import uk.gegc.questionbank.shared.exception.ValidationException;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

@Service
public class ConsistencyRepairWorkflowImpl implements ConsistencyRepairWorkflow {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyRepairWorkflowImpl.class);

    private final RepairStepService stepService;
    private final RepairRunRepository repairRunRepository;
    private final RepairCounterRepository counterRepository;
    private final RepairStatusMapper statusMapper;
    private final AggregateProperties properties;
    private final Executor repairTaskExecutor;

    private final Set<UUID> activeRuns = ConcurrentHashMap.newKeySet();

    public ConsistencyRepairWorkflowImpl(
            RepairStepService stepService,
            RepairRunRepository repairRunRepository,
            RepairCounterRepository counterRepository,
            RepairStatusMapper statusMapper,
            AggregateProperties properties,
            @Qualifier("repairTaskExecutor") Executor repairTaskExecutor
    ) {
        this.stepService = stepService;
        this.repairRunRepository = repairRunRepository;
        this.counterRepository = counterRepository;
        this.statusMapper = statusMapper;
        this.properties = properties;
        this.repairTaskExecutor = repairTaskExecutor;
    }

    @Override
    public RepairStatusDto startRepair(RepairTarget target) {
        if (target.isUserScoped()) {
            throw new ValidationException("Target " + target + " needs a user id");
        }
        return start(target, null);
    }

    @Override
    public RepairStatusDto startUserRepair(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("User id is required");
        }
        return start(RepairTarget.USER, userId.trim());
    }

    private RepairStatusDto start(RepairTarget target, String userId) {
        if (!activeRuns.isEmpty()) {
            throw new IllegalStateException("Repair run " + activeRuns.iterator().next() + " is still in progress");
        }
        for (RepairRun abandoned : repairRunRepository.findByStateInOrderByStartedAtAsc(RepairState.unfinished())) {
            stepService.markFailed(abandoned.getId(), "Superseded by a new repair run");
        }
        RepairRun run = stepService.createRun(target, userId);
        launch(run.getId());
        return getRepairStatus(run.getId());
    }

    @Override
    @Transactional(readOnly = true)
    public RepairStatusDto getRepairStatus(UUID runId) {
        return statusMapper.toDto(load(runId), countsSoFar(runId), activeRuns.contains(runId));
    }

    @Override
    public RepairStatusDto resumeRepair(UUID runId) {
        RepairRun run = load(runId);
        if (run.getState().isTerminal()) {
            throw new IllegalStateException("Repair run " + runId + " already finished in state " + run.getState());
        }
        stepService.setCancelRequested(runId, false);
        if (launch(runId)) {
            log.info("Resuming repair run {} in state {} from cursor {}", runId, run.getState(), run.getLastCursor());
        }
        return getRepairStatus(runId);
    }

    @Override
    public RepairStatusDto cancelRepair(UUID runId) {
        RepairRun run = load(runId);
        if (run.getState().isTerminal()) {
            throw new IllegalStateException("Repair run " + runId + " already finished in state " + run.getState());
        }
        stepService.setCancelRequested(runId, true);
        log.info("Cancellation requested for repair run {}", runId);
        return getRepairStatus(runId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<RepairStatusDto> listRecentRuns() {
        return repairRunRepository.findTop20ByOrderByStartedAtDesc().stream()
                .map(run -> statusMapper.toDto(run, countsSoFar(run.getId()), activeRuns.contains(run.getId())))
                .toList();
    }

    /**
     * @return false when this instance is already driving the run
     */
    private boolean launch(UUID runId) {
        if (!activeRuns.add(runId)) {
            return false;
        }
        try {
            repairTaskExecutor.execute(() -> drive(runId));
        } catch (RejectedExecutionException e) {
            activeRuns.remove(runId);
            throw new IllegalStateException("Repair executor rejected run " + runId, e);
        }
        return true;
    }

    private void drive(UUID runId) {
        log.info("Repair run {} started on {}", runId, Thread.currentThread().getName());
        try {
            RepairStepResult result;
            do {
                result = withRetry(() -> stepService.advance(runId), runId);
            } while (result == RepairStepResult.CONTINUE);
            log.info("Repair run {} stopped: {}", runId, result);
        } catch (RuntimeException e) {
            log.error("Repair run {} failed", runId, e);
            try {
                stepService.markFailed(runId, e.getClass().getSimpleName() + ": " + e.getMessage());
            } catch (RuntimeException markFailure) {
                log.error("Could not record failure of repair run {}", runId, markFailure);
            }
        } finally {
            activeRuns.remove(runId);
        }
    }

    // A page that lost a race with live writes or with a cancel request is replayed; insertIfAbsent
    // makes the replay idempotent.
    private RepairStepResult withRetry(Supplier<RepairStepResult> step, UUID runId) {
        int maxRetries = properties.getRepair().getPageRetries();
        for (int attempt = 0; ; attempt++) {
            try {
                return step.get();
            } catch (DataIntegrityViolationException e) {
                log.info("Repair run {} page hit a concurrent insert, retrying (attempt {})", runId, attempt + 1);
                if (attempt >= maxRetries - 1) throw e;
                sleepBackoff(attempt + 1);
            } catch (OptimisticLockingFailureException e) {
                log.warn("Repair run {} optimistic lock conflict, retrying (attempt {})", runId, attempt + 1);
                if (attempt >= maxRetries - 1) throw e;
                sleepBackoff(attempt + 1);
            }
        }
    }

    private void sleepBackoff(int attempt) {
        try {
            Thread.sleep(50L * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Map<AggregateName, Long> countsSoFar(UUID runId) {
        Map<AggregateName, Long> counts = new EnumMap<>(AggregateName.class);
        for (RepairCounterTotal total : counterRepository.sumByAggregate(runId)) {
            counts.put(total.aggregate(), total.total());
        }
        return counts;
    }

    private RepairRun load(UUID runId) {
        return repairRunRepository.findById(runId)
                .orElseThrow(() -> new ResourceNotFoundException("Repair run " + runId + " not found"));
    }
}
