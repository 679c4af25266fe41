package uk.gegc.questionbank.features.repair.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.questionbank.features.repair.domain.model.RepairCounter;
import uk.gegc.questionbank.features.repair.domain.model.RepairCounterId;
import uk.gegc.questionbank.features.repair.domain.model.RepairCounterTotal;

import java.util.List;
import java.util.UUID;

@Repository
public interface RepairCounterRepository extends JpaRepository<RepairCounter, RepairCounterId> {

    List<RepairCounter> findByIdRunId(UUID runId);

    @Query("SELECT new uk.gegc.questionbank.features.repair.domain.model.RepairCounterTotal(c.id.aggregate, SUM(c.expectedCount)) " +
            "FROM RepairCounter c WHERE c.id.runId = :runId GROUP BY c.id.aggregate")
    List<RepairCounterTotal> sumByAggregate(@Param("runId") UUID runId);
}
