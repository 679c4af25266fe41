package uk.gegc.questionbank.features.taxonomy.application;

import uk.gegc.questionbank.features.taxonomy.domain.model.QuestionGroup;
import uk.gegc.questionbank.features.taxonomy.domain.model.Subtheme;
import uk.gegc.questionbank.features.taxonomy.domain.model.Theme;

import java.util.UUID;

public interface TaxonomyService {

    Theme createTheme(String name);

    Subtheme createSubtheme(UUID themeId, String name);

    QuestionGroup createGroup(UUID subthemeId, String name);

    Theme getTheme(UUID themeId);

    Subtheme getSubtheme(UUID subthemeId);

    QuestionGroup getGroup(UUID groupId);
}
