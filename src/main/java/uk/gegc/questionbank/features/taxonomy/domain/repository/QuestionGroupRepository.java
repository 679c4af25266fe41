package uk.gegc.questionbank.features.taxonomy.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.questionbank.features.taxonomy.domain.model.QuestionGroup;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface QuestionGroupRepository extends JpaRepository<QuestionGroup, UUID> {

    List<QuestionGroup> findByIdIn(Collection<UUID> ids);

    List<QuestionGroup> findBySubthemeId(UUID subthemeId);
}
