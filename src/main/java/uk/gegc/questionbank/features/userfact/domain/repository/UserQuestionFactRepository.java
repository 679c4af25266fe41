package uk.gegc.questionbank.features.userfact.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.questionbank.features.userfact.domain.model.FactKind;
import uk.gegc.questionbank.features.userfact.domain.model.UserQuestionFact;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserQuestionFactRepository extends JpaRepository<UserQuestionFact, UUID> {

    Optional<UserQuestionFact> findByUserIdAndQuestionIdAndKind(String userId, UUID questionId, FactKind kind);

    List<UserQuestionFact> findByQuestionId(UUID questionId);

    List<UserQuestionFact> findAllByOrderByIdAsc(Pageable pageable);

    List<UserQuestionFact> findByIdGreaterThanOrderByIdAsc(UUID id, Pageable pageable);

    List<UserQuestionFact> findByUserIdOrderByIdAsc(String userId, Pageable pageable);

    List<UserQuestionFact> findByUserIdAndIdGreaterThanOrderByIdAsc(String userId, UUID id, Pageable pageable);

    long countByUserIdAndKind(String userId, FactKind kind);

    long countByUserIdAndKindAndSubthemeIdIsNotNullAndGroupIdIsNull(String userId, FactKind kind);
}
