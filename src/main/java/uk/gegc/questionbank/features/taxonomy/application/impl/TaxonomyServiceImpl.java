package uk.gegc.questionbank.features.taxonomy.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.questionbank.features.scope.application.TaxonomyParentLookup;
import uk.gegc.questionbank.features.taxonomy.application.TaxonomyService;
import uk.gegc.questionbank.features.taxonomy.domain.model.QuestionGroup;
import uk.gegc.questionbank.features.taxonomy.domain.model.Subtheme;
import uk.gegc.questionbank.features.taxonomy.domain.model.Theme;
import uk.gegc.questionbank.features.taxonomy.domain.repository.QuestionGroupRepository;
import uk.gegc.questionbank.features.taxonomy.domain.repository.SubthemeRepository;
import uk.gegc.questionbank.features.taxonomy.domain.repository.ThemeRepository;
import uk.gegc.questionbank.shared.exception.ResourceNotFoundException;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class TaxonomyServiceImpl implements TaxonomyService, TaxonomyParentLookup {

    private final ThemeRepository themeRepository;
    private final SubthemeRepository subthemeRepository;
    private final QuestionGroupRepository questionGroupRepository;

    @Override
    @Transactional
    public Theme createTheme(String name) {
        Theme theme = new Theme();
        theme.setName(name);
        Theme saved = themeRepository.save(theme);
        log.info("Created theme {} ({})", saved.getId(), name);
        return saved;
    }

    @Override
    @Transactional
    public Subtheme createSubtheme(UUID themeId, String name) {
        getTheme(themeId);
        Subtheme subtheme = new Subtheme();
        subtheme.setName(name);
        subtheme.setThemeId(themeId);
        Subtheme saved = subthemeRepository.save(subtheme);
        log.info("Created subtheme {} under theme {}", saved.getId(), themeId);
        return saved;
    }

    @Override
    @Transactional
    public QuestionGroup createGroup(UUID subthemeId, String name) {
        getSubtheme(subthemeId);
        QuestionGroup group = new QuestionGroup();
        group.setName(name);
        group.setSubthemeId(subthemeId);
        QuestionGroup saved = questionGroupRepository.save(group);
        log.info("Created group {} under subtheme {}", saved.getId(), subthemeId);
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Theme getTheme(UUID themeId) {
        return themeRepository.findById(themeId)
                .orElseThrow(() -> new ResourceNotFoundException("Theme " + themeId + " not found"));
    }

    @Override
    @Transactional(readOnly = true)
    public Subtheme getSubtheme(UUID subthemeId) {
        return subthemeRepository.findById(subthemeId)
                .orElseThrow(() -> new ResourceNotFoundException("Subtheme " + subthemeId + " not found"));
    }

    @Override
    @Transactional(readOnly = true)
    public QuestionGroup getGroup(UUID groupId) {
        return questionGroupRepository.findById(groupId)
                .orElseThrow(() -> new ResourceNotFoundException("Group " + groupId + " not found"));
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, String> themesOfSubthemes(Collection<String> subthemeIds) {
        Set<UUID> ids = parseIds(subthemeIds);
        Map<String, String> parents = new HashMap<>();
        if (ids.isEmpty()) {
            return parents;
        }
        for (Subtheme subtheme : subthemeRepository.findByIdIn(ids)) {
            parents.put(subtheme.getId().toString(), subtheme.getThemeId().toString());
        }
        return parents;
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, String> subthemesOfGroups(Collection<String> groupIds) {
        Set<UUID> ids = parseIds(groupIds);
        Map<String, String> parents = new HashMap<>();
        if (ids.isEmpty()) {
            return parents;
        }
        for (QuestionGroup group : questionGroupRepository.findByIdIn(ids)) {
            parents.put(group.getId().toString(), group.getSubthemeId().toString());
        }
        return parents;
    }

    // Ids that are not UUIDs cannot exist in the store; they resolve to empty namespaces.
    private static Set<UUID> parseIds(Collection<String> raw) {
        Set<UUID> ids = new LinkedHashSet<>();
        for (String value : raw) {
            try {
                ids.add(UUID.fromString(value));
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring non-UUID taxonomy id '{}'", value);
            }
        }
        return ids;
    }
}
