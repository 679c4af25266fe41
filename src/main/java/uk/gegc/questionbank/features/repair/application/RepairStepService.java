package uk.gegc.questionbank.features.repair.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.questionbank.features.aggregate.application.AggregateMetrics;
import uk.gegc.questionbank.features.aggregate.application.NamespaceRegistry;
import uk.gegc.questionbank.features.aggregate.application.OrderedAggregateIndex;
import uk.gegc.questionbank.features.aggregate.application.UserNamespaces;
import uk.gegc.questionbank.features.aggregate.config.AggregateProperties;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateEntry;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;
import uk.gegc.questionbank.features.aggregate.domain.model.IndexedRecord;
import uk.gegc.questionbank.features.repair.application.source.RepairSource;
import uk.gegc.questionbank.features.repair.application.source.RepairSourceRegistry;
import uk.gegc.questionbank.features.repair.application.source.ScanPage;
import uk.gegc.questionbank.features.repair.domain.model.RepairCounter;
import uk.gegc.questionbank.features.repair.domain.model.RepairCounterId;
import uk.gegc.questionbank.features.repair.domain.model.RepairMismatch;
import uk.gegc.questionbank.features.repair.domain.model.RepairRun;
import uk.gegc.questionbank.features.repair.domain.model.RepairState;
import uk.gegc.questionbank.features.repair.domain.model.RepairTable;
import uk.gegc.questionbank.features.repair.domain.model.RepairTarget;
import uk.gegc.questionbank.features.repair.domain.repository.RepairCounterRepository;
import uk.gegc.questionbank.features.repair.domain.repository.RepairRunRepository;
import uk.gegc.questionbank.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Units of work of a repair run. Each public method commits on its own, so a run interrupted
 * at any point resumes from the last page it committed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RepairStepService {

    private final RepairRunRepository repairRunRepository;
    private final RepairCounterRepository counterRepository;
    private final RepairSourceRegistry sourceRegistry;
    private final OrderedAggregateIndex index;
    private final NamespaceRegistry namespaceRegistry;
    private final UserNamespaces userNamespaces;
    private final AggregateProperties properties;
    private final AggregateMetrics metrics;
    private final Clock clock;

    /**
     * @param userId owner of the aggregates for a {@link RepairTarget#USER} run, {@code null} otherwise
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public RepairRun createRun(RepairTarget target, String userId) {
        if (target.isUserScoped() != (userId != null)) {
            throw new IllegalArgumentException("Target " + target + (userId == null
                    ? " needs a user id" : " does not take a user id"));
        }
        Instant now = Instant.now(clock);
        RepairRun run = new RepairRun();
        run.setTarget(target);
        run.setUserId(userId);
        run.setState(RepairState.CLEARING);
        run.setClearAggregate(target.aggregates().get(0));
        run.setCurrentTable(target.getTables().get(0));
        run.setStartedAt(now);
        run.setUpdatedAt(now);
        RepairRun saved = repairRunRepository.save(run);
        log.info("Repair run {} created for target {}{}", saved.getId(), target,
                userId == null ? "" : " of user " + userId);
        return saved;
    }

    /**
     * Runs the next unit of work for the run's current state.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public RepairStepResult advance(UUID runId) {
        RepairRun run = load(runId);
        if (run.getState().isTerminal()) {
            return RepairStepResult.FINISHED;
        }
        if (run.isCancelRequested()) {
            log.info("Repair run {} stopped on request in state {}", runId, run.getState());
            return RepairStepResult.CANCELLED;
        }
        RepairStepResult result = switch (run.getState()) {
            case CLEARING -> clearPage(run);
            case REBUILDING -> rebuildPage(run);
            case VERIFYING -> verify(run);
            default -> RepairStepResult.FINISHED;
        };
        run.setUpdatedAt(Instant.now(clock));
        repairRunRepository.save(run);
        metrics.repairPage();
        return result;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID runId, String message) {
        RepairRun run = load(runId);
        if (run.getState().isTerminal()) {
            return;
        }
        run.fail(message, Instant.now(clock));
        repairRunRepository.save(run);
        log.warn("Repair run {} marked FAILED: {}", runId, message);
    }

    /**
     * @return the run after the flag is applied
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public RepairRun setCancelRequested(UUID runId, boolean cancelRequested) {
        RepairRun run = load(runId);
        if (run.getState().isTerminal() || run.isCancelRequested() == cancelRequested) {
            return run;
        }
        run.setCancelRequested(cancelRequested);
        run.setUpdatedAt(Instant.now(clock));
        return repairRunRepository.save(run);
    }

    private RepairStepResult clearPage(RepairRun run) {
        AggregateName aggregate = run.getClearAggregate();
        int batchSize = properties.getRepair().getClearBatchSize();
        List<String> namespaces;
        String nextCursor;
        boolean more;
        if (run.getUserId() == null) {
            namespaces = index.namespaces(aggregate, run.getClearCursor(), batchSize);
            nextCursor = namespaces.isEmpty() ? null : namespaces.get(namespaces.size() - 1);
            more = namespaces.size() == batchSize;
        } else {
            UserNamespaces.Page page = userNamespaces.page(aggregate, run.getUserId(), run.getClearCursor(), batchSize);
            namespaces = page.namespaces();
            nextCursor = page.nextCursor();
            more = !page.done();
        }
        long removed = 0;
        for (String namespace : namespaces) {
            removed += index.clear(aggregate, namespace);
        }
        log.debug("Repair run {} cleared {} namespaces ({} entries) of {}",
                run.getId(), namespaces.size(), removed, aggregate);

        if (more) {
            run.setClearCursor(nextCursor);
            return RepairStepResult.CONTINUE;
        }
        List<AggregateName> aggregates = run.getTarget().aggregates();
        int position = aggregates.indexOf(aggregate);
        run.setClearCursor(null);
        if (position + 1 < aggregates.size()) {
            run.setClearAggregate(aggregates.get(position + 1));
        } else {
            run.setClearAggregate(null);
            run.setState(RepairState.REBUILDING);
            log.info("Repair run {} finished clearing {} aggregates", run.getId(), aggregates.size());
        }
        return RepairStepResult.CONTINUE;
    }

    private RepairStepResult rebuildPage(RepairRun run) {
        RepairTable table = run.getCurrentTable();
        RepairSource source = sourceRegistry.get(table);
        int pageSize = properties.getRepair().getPageSize();
        ScanPage page = run.getUserId() == null
                ? source.scan(run.getLastCursor(), pageSize)
                : source.scanUser(run.getUserId(), run.getLastCursor(), pageSize);
        Map<RepairCounterId, Long> written = new LinkedHashMap<>();
        for (IndexedRecord row : page.rows()) {
            for (AggregateEntry entry : namespaceRegistry.entriesFor(row)) {
                index.insertIfAbsent(entry);
                written.merge(new RepairCounterId(run.getId(), entry.aggregate(), entry.namespace()), 1L, Long::sum);
            }
        }
        addToCounters(written);
        run.setLastCursor(page.nextCursor());
        run.setPagesProcessed(run.getPagesProcessed() + 1);
        run.setRowsProcessed(run.getRowsProcessed() + page.rows().size());

        if (!page.done()) {
            return RepairStepResult.CONTINUE;
        }
        List<RepairTable> tables = run.getTarget().getTables();
        int position = tables.indexOf(table);
        run.setLastCursor(null);
        if (position + 1 < tables.size()) {
            run.setCurrentTable(tables.get(position + 1));
            log.info("Repair run {} rebuilt {}; moving on to {}", run.getId(), table, tables.get(position + 1));
        } else {
            run.setCurrentTable(null);
            run.setState(RepairState.VERIFYING);
            log.info("Repair run {} rebuilt {} rows in {} pages", run.getId(), run.getRowsProcessed(),
                    run.getPagesProcessed());
        }
        return RepairStepResult.CONTINUE;
    }

    private RepairStepResult verify(RepairRun run) {
        Map<RepairCounterId, Long> expected = new HashMap<>();
        for (RepairCounter counter : counterRepository.findByIdRunId(run.getId())) {
            expected.put(counter.getId(), counter.getExpectedCount());
        }
        int limit = properties.getRepair().getMaxRecordedMismatches();
        List<RepairMismatch> recorded = new ArrayList<>();
        long mismatches = 0;
        Set<RepairCounterId> checked = new HashSet<>();

        int batchSize = properties.getRepair().getClearBatchSize();
        for (AggregateName aggregate : run.getTarget().aggregates()) {
            if (run.getUserId() != null) {
                for (String namespace : userNamespaces.all(aggregate, run.getUserId(), batchSize)) {
                    RepairCounterId key = new RepairCounterId(run.getId(), aggregate, namespace);
                    checked.add(key);
                    if (compare(run, aggregate, namespace, expected.getOrDefault(key, 0L), recorded, limit)) {
                        mismatches++;
                    }
                }
                continue;
            }
            String after = null;
            List<String> namespaces;
            do {
                namespaces = index.namespaces(aggregate, after, batchSize);
                for (String namespace : namespaces) {
                    RepairCounterId key = new RepairCounterId(run.getId(), aggregate, namespace);
                    checked.add(key);
                    if (compare(run, aggregate, namespace, expected.getOrDefault(key, 0L), recorded, limit)) {
                        mismatches++;
                    }
                }
                after = namespaces.isEmpty() ? after : namespaces.get(namespaces.size() - 1);
            } while (namespaces.size() == batchSize);
        }
        // namespaces that were counted during the rebuild but are empty now
        for (Map.Entry<RepairCounterId, Long> counter : expected.entrySet()) {
            if (checked.contains(counter.getKey())) {
                continue;
            }
            RepairCounterId key = counter.getKey();
            if (compare(run, key.getAggregate(), key.getNamespace(), counter.getValue(), recorded, limit)) {
                mismatches++;
            }
        }

        run.setMismatchCount(mismatches);
        run.setMismatches(recorded);
        run.setState(RepairState.DONE);
        run.setCompletedAt(Instant.now(clock));
        if (mismatches > 0) {
            metrics.repairMismatches(mismatches);
            log.warn("Repair run {} verified with {} mismatched namespaces", run.getId(), mismatches);
        } else {
            log.info("Repair run {} verified {} namespaces without mismatches", run.getId(), checked.size());
        }
        return RepairStepResult.FINISHED;
    }

    private boolean compare(RepairRun run, AggregateName aggregate, String namespace, long expected,
                            List<RepairMismatch> recorded, int limit) {
        long actual = index.count(aggregate, namespace);
        if (actual == expected) {
            return false;
        }
        log.warn("Repair run {} count mismatch: aggregate={}, namespace={}, expected={}, actual={}",
                run.getId(), aggregate, namespace, expected, actual);
        if (recorded.size() < limit) {
            recorded.add(new RepairMismatch(aggregate, namespace, expected, actual));
        }
        return true;
    }

    // only the counters of namespaces this page wrote to are read and written back
    private void addToCounters(Map<RepairCounterId, Long> written) {
        if (written.isEmpty()) {
            return;
        }
        Map<RepairCounterId, RepairCounter> existing = new HashMap<>();
        for (RepairCounter counter : counterRepository.findAllById(written.keySet())) {
            existing.put(counter.getId(), counter);
        }
        List<RepairCounter> changed = new ArrayList<>(written.size());
        written.forEach((id, delta) -> {
            RepairCounter counter = existing.getOrDefault(id, new RepairCounter(id, 0));
            counter.setExpectedCount(counter.getExpectedCount() + delta);
            changed.add(counter);
        });
        counterRepository.saveAll(changed);
    }

    private RepairRun load(UUID runId) {
        return repairRunRepository.findById(runId)
                .orElseThrow(() -> new ResourceNotFoundException("Repair run " + runId + " not found"));
    }
}
