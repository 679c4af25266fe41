package uk.gegc.questionbank.features.taxonomy.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.questionbank.features.taxonomy.domain.model.Subtheme;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface SubthemeRepository extends JpaRepository<Subtheme, UUID> {

    List<Subtheme> findByIdIn(Collection<UUID> ids);

    List<Subtheme> findByThemeId(UUID themeId);
}
