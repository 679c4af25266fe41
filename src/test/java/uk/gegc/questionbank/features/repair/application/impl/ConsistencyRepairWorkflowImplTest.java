package uk.gegc.questionbank.features.repair.application.impl;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import uk.gegc.questionbank.features.aggregate.application.AggregateMetrics;
import uk.gegc.questionbank.features.aggregate.application.NamespaceRegistry;
import uk.gegc.questionbank.features.aggregate.application.UserNamespaces;
import uk.gegc.questionbank.features.aggregate.config.AggregateProperties;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateEntry;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateSource;
import uk.gegc.questionbank.features.aggregate.domain.model.IndexedRecord;
import uk.gegc.questionbank.features.aggregate.infra.memory.InMemoryOrderedAggregateIndex;
import uk.gegc.questionbank.features.repair.api.dto.RepairStatusDto;
import uk.gegc.questionbank.features.repair.application.RepairStepResult;
import uk.gegc.questionbank.features.repair.application.RepairStepService;
import uk.gegc.questionbank.features.repair.application.source.RepairSourceRegistry;
import uk.gegc.questionbank.features.repair.domain.model.RepairCounter;
import uk.gegc.questionbank.features.repair.domain.model.RepairCounterId;
import uk.gegc.questionbank.features.repair.domain.model.RepairRun;
import uk.gegc.questionbank.features.repair.domain.model.RepairState;
import uk.gegc.questionbank.features.repair.domain.model.RepairTable;
import uk.gegc.questionbank.features.repair.domain.model.RepairTarget;
import uk.gegc.questionbank.features.repair.domain.repository.RepairCounterRepository;
import uk.gegc.questionbank.features.repair.domain.repository.RepairRunRepository;
import uk.gegc.questionbank.features.repair.infra.mapping.RepairStatusMapper;
import uk.gegc.questionbank.shared.exception.ResourceNotFoundException;
import uk.gegc.questionbank.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("ConsistencyRepairWorkflowImpl")
class ConsistencyRepairWorkflowImplTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-05-01T10:00:00Z"), ZoneOffset.UTC);
    private static final int QUESTION_COUNT = 1000;

    private final Queue<Runnable> queued = new ArrayDeque<>();
    private final Executor queueingExecutor = queued::add;

    private List<IndexedRecord> questionRows;
    private List<IndexedRecord> factRows;
    private AggregateProperties properties;

    @BeforeEach
    void setUp() {
        properties = new AggregateProperties();
        properties.getRepair().setPageSize(100);
        properties.getRepair().setClearBatchSize(2);

        questionRows = new ArrayList<>();
        for (int i = 0; i < QUESTION_COUNT; i++) {
            String theme = "T" + (i % 4);
            String subtheme = i % 3 == 0 ? null : "S" + (i % 7);
            String group = subtheme != null && i % 2 == 0 ? "G" + (i % 5) : null;
            questionRows.add(IndexedRecord.question(String.format("q%04d", i), theme, subtheme, group));
        }
        factRows = new ArrayList<>();
        for (int i = 0; i < 150; i++) {
            IndexedRecord question = questionRows.get(i * 5 + 1);
            AggregateSource source = i % 3 == 0 ? AggregateSource.ANSWERED
                    : i % 3 == 1 ? AggregateSource.INCORRECT : AggregateSource.BOOKMARKED;
            factRows.add(IndexedRecord.fact(source, "user" + (i % 4), question.entityKey(),
                    question.themeId(), question.subthemeId(), question.groupId()));
        }
    }

    @Nested
    @DisplayName("full run")
    class FullRun {

        @Test
        @DisplayName("rebuilds a 1000-row store so that global rank access yields 1000 distinct ids")
        void fullRepair_globalCountAndRanks() {
            Harness harness = new Harness(Runnable::run);
            harness.index.insert(new AggregateEntry(AggregateName.QUESTIONS_TOTAL, "global", "stale", "stale"));
            harness.index.insert(new AggregateEntry(AggregateName.ANSWERED_BY_USER, "ghost", "q0001", "q0001"));

            RepairStatusDto status = harness.workflow.startRepair(RepairTarget.ALL);

            RepairStatusDto finished = harness.workflow.getRepairStatus(status.id());
            assertThat(finished.state()).isEqualTo(RepairState.DONE);
            assertThat(finished.active()).isFalse();
            assertThat(finished.mismatchCount()).isZero();
            assertThat(finished.rowsProcessed()).isEqualTo(QUESTION_COUNT + factRows.size());
            assertThat(finished.countsSoFar()).containsEntry(AggregateName.QUESTIONS_TOTAL, (long) QUESTION_COUNT);

            assertThat(harness.index.count(AggregateName.QUESTIONS_TOTAL, "global")).isEqualTo(QUESTION_COUNT);
            Set<String> ids = new HashSet<>();
            for (int rank = 0; rank < QUESTION_COUNT; rank++) {
                ids.add(harness.index.at(AggregateName.QUESTIONS_TOTAL, "global", rank).entityKey());
            }
            assertThat(ids).hasSize(QUESTION_COUNT).doesNotContain("stale");
            assertThat(harness.index.count(AggregateName.ANSWERED_BY_USER, "ghost")).isZero();
        }

        @Test
        @DisplayName("every aggregate matches a fresh recount of the primary rows")
        void fullRepair_convergesToRecount() {
            Harness harness = new Harness(Runnable::run);

            harness.workflow.startRepair(RepairTarget.ALL);

            assertThat(snapshot(harness)).isEqualTo(recount());
        }

        @Test
        @DisplayName("counts that drift during the rebuild are recorded as mismatches")
        void liveWriteDuringRebuild_isReportedAsMismatch() {
            Harness harness = new Harness(Runnable::run);
            harness.questions.beforeScan(scan -> {
                if (scan == 5) {
                    harness.index.insert(new AggregateEntry(AggregateName.QUESTIONS_TOTAL, "global", "late", "late"));
                }
            });

            RepairStatusDto status = harness.workflow.startRepair(RepairTarget.QUESTIONS);

            RepairStatusDto finished = harness.workflow.getRepairStatus(status.id());
            assertThat(finished.state()).isEqualTo(RepairState.DONE);
            assertThat(finished.mismatchCount()).isEqualTo(1);
            assertThat(finished.mismatches()).singleElement().satisfies(mismatch -> {
                assertThat(mismatch.aggregate()).isEqualTo(AggregateName.QUESTIONS_TOTAL);
                assertThat(mismatch.expected()).isEqualTo(QUESTION_COUNT);
                assertThat(mismatch.actual()).isEqualTo(QUESTION_COUNT + 1L);
            });
        }
    }

    @Nested
    @DisplayName("resume and cancel")
    class ResumeAndCancel {

        @Test
        @DisplayName("a run interrupted after a committed page resumes to the same final counts")
        void interruptedRun_resumesToSameCounts() {
            Harness harness = new Harness(Runnable::run);
            RepairRun run = harness.stepService.createRun(RepairTarget.ALL, null);
            RepairStepResult result;
            do {
                result = harness.stepService.advance(run.getId());
            } while (result == RepairStepResult.CONTINUE && run.getPagesProcessed() < 4);
            assertThat(run.getState()).isEqualTo(RepairState.REBUILDING);
            assertThat(run.getLastCursor()).isEqualTo("q0399");

            harness.workflow.resumeRepair(run.getId());

            assertThat(harness.workflow.getRepairStatus(run.getId()).state()).isEqualTo(RepairState.DONE);
            assertThat(run.getRowsProcessed()).isEqualTo(QUESTION_COUNT + factRows.size());
            assertThat(snapshot(harness)).isEqualTo(recount());
        }

        @Test
        @DisplayName("cancel stops after the current page and resume finishes the run")
        void cancelThenResume() {
            Harness harness = new Harness(Runnable::run);
            UUID[] runId = new UUID[1];
            harness.questions.beforeScan(scan -> {
                if (scan == 3) {
                    harness.workflow.cancelRepair(runId[0]);
                }
            });
            RepairRun created = harness.stepService.createRun(RepairTarget.QUESTIONS, null);
            runId[0] = created.getId();

            harness.workflow.resumeRepair(runId[0]);

            RepairStatusDto cancelled = harness.workflow.getRepairStatus(runId[0]);
            assertThat(cancelled.state()).isEqualTo(RepairState.REBUILDING);
            assertThat(cancelled.cancelRequested()).isTrue();
            assertThat(cancelled.pagesProcessed()).isEqualTo(3);
            assertThat(cancelled.lastCursor()).isEqualTo("q0299");

            harness.questions.beforeScan(scan -> {
            });
            harness.workflow.resumeRepair(runId[0]);

            RepairStatusDto finished = harness.workflow.getRepairStatus(runId[0]);
            assertThat(finished.state()).isEqualTo(RepairState.DONE);
            assertThat(finished.cancelRequested()).isFalse();
            assertThat(harness.index.count(AggregateName.QUESTIONS_TOTAL, "global")).isEqualTo(QUESTION_COUNT);
        }

        @Test
        @DisplayName("finished runs can be neither resumed nor cancelled")
        void finishedRun_rejectsResumeAndCancel() {
            Harness harness = new Harness(Runnable::run);
            UUID runId = harness.workflow.startRepair(RepairTarget.QUESTIONS).id();

            assertThatThrownBy(() -> harness.workflow.resumeRepair(runId)).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> harness.workflow.cancelRepair(runId)).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("unknown runs are reported as not found")
        void unknownRun_throwsNotFound() {
            Harness harness = new Harness(Runnable::run);

            assertThatThrownBy(() -> harness.workflow.getRepairStatus(UUID.randomUUID()))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("start")
    class Start {

        @Test
        @DisplayName("a second start while a run is in progress is rejected")
        void startWhileActive_throws() {
            Harness harness = new Harness(queueingExecutor);
            RepairStatusDto first = harness.workflow.startRepair(RepairTarget.ALL);
            assertThat(first.active()).isTrue();

            assertThatThrownBy(() -> harness.workflow.startRepair(RepairTarget.QUESTIONS))
                    .isInstanceOf(IllegalStateException.class);

            queued.poll().run();
            assertThat(harness.workflow.getRepairStatus(first.id()).state()).isEqualTo(RepairState.DONE);
        }

        @Test
        @DisplayName("unfinished runs nobody is driving are superseded")
        void startSupersedesAbandonedRuns() {
            Harness harness = new Harness(Runnable::run);
            RepairRun abandoned = harness.stepService.createRun(RepairTarget.ALL, null);

            harness.workflow.startRepair(RepairTarget.ALL);

            RepairStatusDto old = harness.workflow.getRepairStatus(abandoned.getId());
            assertThat(old.state()).isEqualTo(RepairState.FAILED);
            assertThat(old.errorMessage()).contains("Superseded");
            assertThat(harness.workflow.listRecentRuns()).hasSize(2);
        }

        @Test
        @DisplayName("a failing page marks the run FAILED and frees the slot")
        void failingPage_marksRunFailed() {
            Harness harness = new Harness(Runnable::run);
            harness.questions.beforeScan(scan -> {
                throw new IllegalArgumentException("corrupt row");
            });

            UUID runId = harness.workflow.startRepair(RepairTarget.QUESTIONS).id();

            RepairStatusDto failed = harness.workflow.getRepairStatus(runId);
            assertThat(failed.state()).isEqualTo(RepairState.FAILED);
            assertThat(failed.errorMessage()).contains("corrupt row");
            assertThat(failed.active()).isFalse();
        }

        @Test
        @DisplayName("a page that hits a concurrent insert is retried")
        void integrityViolation_isRetried() {
            Harness harness = new Harness(Runnable::run);
            harness.questions.beforeScan(scan -> {
                if (scan == 2) {
                    throw new DataIntegrityViolationException("uq_aggregate_entry");
                }
            });

            UUID runId = harness.workflow.startRepair(RepairTarget.QUESTIONS).id();

            assertThat(harness.workflow.getRepairStatus(runId).state()).isEqualTo(RepairState.DONE);
            assertThat(harness.index.count(AggregateName.QUESTIONS_TOTAL, "global")).isEqualTo(QUESTION_COUNT);
        }
    }

    @Nested
    @DisplayName("counters")
    class Counters {

        @Test
        @DisplayName("each rebuild page adds its entries to the run's counters")
        void counters_growPerPage() {
            Harness harness = new Harness(Runnable::run);
            RepairRun run = harness.stepService.createRun(RepairTarget.QUESTIONS, null);
            do {
                harness.stepService.advance(run.getId());
            } while (run.getPagesProcessed() < 2);

            assertThat(harness.workflow.getRepairStatus(run.getId()).countsSoFar())
                    .containsEntry(AggregateName.QUESTIONS_TOTAL, 200L);
            verify(harness.counters, times(2)).saveAll(anyIterable());
            List<RepairCounter> global = harness.counters.findAllById(
                    List.of(new RepairCounterId(run.getId(), AggregateName.QUESTIONS_TOTAL, "global")));
            assertThat(global).singleElement()
                    .satisfies(counter -> assertThat(counter.getExpectedCount()).isEqualTo(200));
        }

        @Test
        @DisplayName("counters of different runs are kept apart")
        void counters_arePerRun() {
            Harness harness = new Harness(Runnable::run);

            UUID first = harness.workflow.startRepair(RepairTarget.QUESTIONS).id();
            UUID second = harness.workflow.startRepair(RepairTarget.QUESTIONS).id();

            assertThat(harness.workflow.getRepairStatus(first).countsSoFar())
                    .containsEntry(AggregateName.QUESTIONS_TOTAL, (long) QUESTION_COUNT);
            assertThat(harness.workflow.getRepairStatus(second).countsSoFar())
                    .containsEntry(AggregateName.QUESTIONS_TOTAL, (long) QUESTION_COUNT);
            assertThat(harness.workflow.getRepairStatus(second).mismatchCount()).isZero();
        }
    }

    @Nested
    @DisplayName("user repair")
    class UserRepair {

        @Test
        @DisplayName("rebuilds one user's aggregates and leaves every other namespace alone")
        void userRepair_touchesOnlyThatUser() {
            IndexedRecord question = questionRows.get(2);
            factRows.add(IndexedRecord.fact(AggregateSource.INCORRECT, "user1_x", question.entityKey(),
                    question.themeId(), question.subthemeId(), question.groupId()));
            Harness harness = new Harness(Runnable::run);
            harness.workflow.startRepair(RepairTarget.ALL);
            Map<String, Long> before = snapshot(harness);

            harness.index.clear(AggregateName.ANSWERED_BY_USER, "user1");
            harness.index.insert(new AggregateEntry(AggregateName.INCORRECT_BY_THEME_BY_USER, "user1_T0", "ghost", "ghost"));
            harness.index.insert(new AggregateEntry(AggregateName.BOOKMARKED_BY_USER, "user0", "stray", "stray"));

            RepairStatusDto status = harness.workflow.startUserRepair("user1");

            RepairStatusDto finished = harness.workflow.getRepairStatus(status.id());
            assertThat(finished.state()).isEqualTo(RepairState.DONE);
            assertThat(finished.target()).isEqualTo(RepairTarget.USER);
            assertThat(finished.userId()).isEqualTo("user1");
            assertThat(finished.mismatchCount()).isZero();
            assertThat(finished.rowsProcessed())
                    .isEqualTo(factRows.stream().filter(row -> "user1".equals(row.userId())).count());

            Map<String, Long> expected = new TreeMap<>(before);
            expected.merge(key(AggregateName.BOOKMARKED_BY_USER, "user0"), 1L, Long::sum);
            assertThat(snapshot(harness)).isEqualTo(expected);
        }

        @Test
        @DisplayName("the user target needs a user id")
        void userTarget_requiresUser() {
            Harness harness = new Harness(Runnable::run);

            assertThatThrownBy(() -> harness.workflow.startRepair(RepairTarget.USER))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> harness.workflow.startUserRepair("  "))
                    .isInstanceOf(ValidationException.class);
            assertThat(harness.workflow.listRecentRuns()).isEmpty();
        }
    }

    private static String key(AggregateName aggregate, String namespace) {
        return aggregate.name() + "|" + namespace;
    }

    private Map<String, Long> snapshot(Harness harness) {
        Map<String, Long> counts = new TreeMap<>();
        for (AggregateName aggregate : AggregateName.values()) {
            for (String namespace : harness.index.namespaces(aggregate, null, Integer.MAX_VALUE)) {
                counts.put(key(aggregate, namespace), harness.index.count(aggregate, namespace));
            }
        }
        return counts;
    }

    private Map<String, Long> recount() {
        NamespaceRegistry registry = new NamespaceRegistry();
        Map<String, Long> counts = new TreeMap<>();
        List<IndexedRecord> all = new ArrayList<>(questionRows);
        all.addAll(factRows);
        for (IndexedRecord row : all) {
            for (AggregateEntry entry : registry.entriesFor(row)) {
                counts.merge(key(entry.aggregate(), entry.namespace()), 1L, Long::sum);
            }
        }
        return counts;
    }

    private final class Harness {

        final InMemoryOrderedAggregateIndex index = new InMemoryOrderedAggregateIndex();
        final FakeRepairSource questions = new FakeRepairSource(RepairTable.QUESTIONS, questionRows);
        final FakeRepairSource facts = new FakeRepairSource(RepairTable.USER_FACTS, factRows);
        final RepairCounterRepository counters = InMemoryRepairCounters.create();
        final RepairStepService stepService;
        final ConsistencyRepairWorkflowImpl workflow;

        Harness(Executor executor) {
            RepairRunRepository repository = InMemoryRepairRuns.create();
            AggregateMetrics metrics = new AggregateMetrics(new SimpleMeterRegistry());
            stepService = new RepairStepService(repository, counters, new RepairSourceRegistry(List.of(questions, facts)),
                    index, new NamespaceRegistry(), new UserNamespaces(index), properties, metrics, CLOCK);
            workflow = new ConsistencyRepairWorkflowImpl(stepService, repository, counters, new RepairStatusMapper(),
                    properties, executor);
        }
    }
}
