package uk.gegc.questionbank.features.question.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.questionbank.features.question.domain.model.Question;

import java.util.List;
import java.util.UUID;

@Repository
public interface QuestionRepository extends JpaRepository<Question, UUID> {

    List<Question> findAllByOrderByIdAsc(Pageable pageable);

    List<Question> findByIdGreaterThanOrderByIdAsc(UUID id, Pageable pageable);

    long countByThemeId(UUID themeId);

    long countBySubthemeId(UUID subthemeId);

    long countByGroupId(UUID groupId);
}
