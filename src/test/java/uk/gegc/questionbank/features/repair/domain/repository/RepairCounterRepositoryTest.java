package uk.gegc.questionbank.features.repair.domain.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;
import uk.gegc.questionbank.features.repair.domain.model.RepairCounter;
import uk.gegc.questionbank.features.repair.domain.model.RepairCounterId;
import uk.gegc.questionbank.features.repair.domain.model.RepairCounterTotal;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@DisplayName("RepairCounterRepository")
class RepairCounterRepositoryTest {

    private static final UUID RUN = UUID.fromString("00000000-0000-0000-0000-0000000000a1");
    private static final UUID OTHER_RUN = UUID.fromString("00000000-0000-0000-0000-0000000000b2");

    @Autowired
    private RepairCounterRepository repository;

    @Test
    @DisplayName("findByIdRunId returns the counters of one run only")
    void findByRun_isolatesRuns() {
        repository.saveAll(List.of(
                counter(RUN, AggregateName.QUESTIONS_BY_THEME, "t1", 4),
                counter(RUN, AggregateName.QUESTIONS_BY_THEME, "t2", 2),
                counter(OTHER_RUN, AggregateName.QUESTIONS_BY_THEME, "t1", 9)));

        List<RepairCounter> counters = repository.findByIdRunId(RUN);

        assertThat(counters).extracting(c -> c.getId().getNamespace() + "=" + c.getExpectedCount())
                .containsExactlyInAnyOrder("t1=4", "t2=2");
    }

    @Test
    @DisplayName("sumByAggregate totals each aggregate across its namespaces")
    void sumByAggregate_groupsByAggregate() {
        repository.saveAll(List.of(
                counter(RUN, AggregateName.QUESTIONS_TOTAL, "global", 7),
                counter(RUN, AggregateName.QUESTIONS_BY_THEME, "t1", 4),
                counter(RUN, AggregateName.QUESTIONS_BY_THEME, "t2", 3),
                counter(OTHER_RUN, AggregateName.QUESTIONS_TOTAL, "global", 100)));

        List<RepairCounterTotal> totals = repository.sumByAggregate(RUN);

        assertThat(totals).containsExactlyInAnyOrder(
                new RepairCounterTotal(AggregateName.QUESTIONS_TOTAL, 7L),
                new RepairCounterTotal(AggregateName.QUESTIONS_BY_THEME, 7L));
    }

    @Test
    @DisplayName("a saved counter with the same id replaces the stored count")
    void save_sameId_updatesCount() {
        repository.saveAndFlush(counter(RUN, AggregateName.ANSWERED_BY_USER, "alice", 1));
        repository.saveAndFlush(counter(RUN, AggregateName.ANSWERED_BY_USER, "alice", 5));

        assertThat(repository.findByIdRunId(RUN)).singleElement()
                .extracting(RepairCounter::getExpectedCount).isEqualTo(5L);
    }

    private static RepairCounter counter(UUID runId, AggregateName aggregate, String namespace, long count) {
        return new RepairCounter(new RepairCounterId(runId, aggregate, namespace), count);
    }
}
