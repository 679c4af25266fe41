package uk.gegc.questionbank.features.scope.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.questionbank.features.aggregate.application.NamespaceRegistry;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateSource;
import uk.gegc.questionbank.features.aggregate.domain.model.TaxonomyLevel;
import uk.gegc.questionbank.features.scope.application.ScopeResolver;
import uk.gegc.questionbank.features.scope.application.TaxonomyParentLookup;
import uk.gegc.questionbank.features.scope.domain.model.AggregateTarget;
import uk.gegc.questionbank.features.scope.domain.model.FilterMode;
import uk.gegc.questionbank.features.scope.domain.model.ResolvedScope;
import uk.gegc.questionbank.features.scope.domain.model.ScopeDescriptor;
import uk.gegc.questionbank.features.scope.domain.model.ScopeNode;
import uk.gegc.questionbank.features.scope.domain.model.ScopeSelection;
import uk.gegc.questionbank.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class ScopeResolverImpl implements ScopeResolver {

    private final TaxonomyParentLookup taxonomyParentLookup;
    private final NamespaceRegistry namespaceRegistry;

    @Override
    public List<ScopeNode> resolveNodes(ScopeSelection selection) {
        if (selection == null || selection.isEmpty()) {
            return List.of(ScopeNode.GLOBAL);
        }

        Set<String> explicitSubthemes = selection.subthemeIds();
        Map<String, String> themeBySubtheme = new HashMap<>(
                taxonomyParentLookup.themesOfSubthemes(explicitSubthemes));
        Map<String, String> subthemeByGroup = taxonomyParentLookup.subthemesOfGroups(selection.groupIds());

        Map<String, List<String>> groupsBySubtheme = new LinkedHashMap<>();
        List<String> orphanGroups = new ArrayList<>();
        for (String groupId : selection.groupIds()) {
            String subthemeId = subthemeByGroup.get(groupId);
            if (subthemeId == null) {
                orphanGroups.add(groupId);
            } else {
                groupsBySubtheme.computeIfAbsent(subthemeId, id -> new ArrayList<>()).add(groupId);
            }
        }

        Set<String> implied = new LinkedHashSet<>(groupsBySubtheme.keySet());
        implied.removeAll(explicitSubthemes);
        if (!implied.isEmpty()) {
            themeBySubtheme.putAll(taxonomyParentLookup.themesOfSubthemes(implied));
        }

        Set<String> processing = new LinkedHashSet<>(explicitSubthemes);
        processing.addAll(implied);

        List<ScopeNode> nodes = new ArrayList<>();
        Set<String> overriddenThemes = new HashSet<>();
        for (String subthemeId : processing) {
            String themeId = themeBySubtheme.get(subthemeId);
            if (themeId != null) {
                overriddenThemes.add(themeId);
            }
            boolean explicit = explicitSubthemes.contains(subthemeId);
            List<String> groups = groupsBySubtheme.getOrDefault(subthemeId, List.of());
            if (!groups.isEmpty()) {
                for (String groupId : groups) {
                    nodes.add(new ScopeNode(TaxonomyLevel.GROUP, groupId));
                }
                if (explicit) {
                    nodes.add(new ScopeNode(TaxonomyLevel.SUBTHEME_UNGROUPED, subthemeId));
                }
            } else if (explicit) {
                nodes.add(new ScopeNode(TaxonomyLevel.SUBTHEME, subthemeId));
            }
        }

        // groups with no known parent still resolve, to an empty namespace
        for (String groupId : orphanGroups) {
            nodes.add(new ScopeNode(TaxonomyLevel.GROUP, groupId));
        }

        for (String themeId : selection.themeIds()) {
            if (!overriddenThemes.contains(themeId)) {
                nodes.add(new ScopeNode(TaxonomyLevel.THEME, themeId));
            }
        }

        log.debug("Resolved selection themes={} subthemes={} groups={} into {} nodes",
                selection.themeIds().size(), explicitSubthemes.size(), selection.groupIds().size(), nodes.size());
        return nodes;
    }

    @Override
    public ResolvedScope resolve(ScopeSelection selection, FilterMode mode, String userId) {
        requireUserIfNeeded(mode, userId);
        return bind(resolveNodes(selection), mode, userId);
    }

    @Override
    public ResolvedScope bind(List<ScopeNode> nodes, FilterMode mode, String userId) {
        requireUserIfNeeded(mode, userId);
        List<ScopeDescriptor> descriptors = new ArrayList<>();
        for (ScopeNode node : nodes) {
            AggregateTarget target = target(mode.getSource(), node, userId);
            AggregateTarget exclusion = mode.getExclusion() == null ? null : target(mode.getExclusion(), node, userId);
            descriptors.add(new ScopeDescriptor(node, target, exclusion));
        }
        return new ResolvedScope(mode, descriptors);
    }

    private static void requireUserIfNeeded(FilterMode mode, String userId) {
        if (mode == null) {
            throw new ValidationException("Filter mode is required");
        }
        if (mode.requiresUser() && (userId == null || userId.isBlank())) {
            throw new ValidationException("Filter mode " + mode + " requires an authenticated user");
        }
    }

    private AggregateTarget target(AggregateSource source, ScopeNode node, String userId) {
        try {
            String namespace = namespaceRegistry.namespaceForScope(source, node.level(), node.taxonomyId(),
                    source.isUserScoped() ? userId : null);
            return new AggregateTarget(AggregateName.of(source, node.level()), namespace);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid taxonomy id: " + node.taxonomyId(), e);
        }
    }
}
