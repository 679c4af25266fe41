package uk.gegc.questionbank.features.repair.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.questionbank.features.repair.domain.model.RepairRun;
import uk.gegc.questionbank.features.repair.domain.model.RepairState;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface RepairRunRepository extends JpaRepository<RepairRun, UUID> {

    List<RepairRun> findTop20ByOrderByStartedAtDesc();

    List<RepairRun> findByStateInOrderByStartedAtAsc(Collection<RepairState> states);
}
