package uk.gegc.questionbank.features.taxonomy.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.questionbank.features.taxonomy.domain.model.Theme;

import java.util.UUID;

@Repository
public interface ThemeRepository extends JpaRepository<Theme, UUID> {
}
