package uk.gegc.questionbank.features.scope.domain.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Taxonomy ids picked by a user. Any of the sets may be empty; iteration order follows the
 * order the ids were supplied in. UUID ids are normalised to their lower-case form so they
 * match the keys of parent lookups and the namespaces built from stored rows.
 */
public record ScopeSelection(Set<String> themeIds, Set<String> subthemeIds, Set<String> groupIds) {

    public ScopeSelection {
        themeIds = copy(themeIds);
        subthemeIds = copy(subthemeIds);
        groupIds = copy(groupIds);
    }

    public static ScopeSelection of(Collection<String> themeIds, Collection<String> subthemeIds,
                                    Collection<String> groupIds) {
        return new ScopeSelection(copy(themeIds), copy(subthemeIds), copy(groupIds));
    }

    public static ScopeSelection everything() {
        return new ScopeSelection(Set.of(), Set.of(), Set.of());
    }

    public boolean isEmpty() {
        return themeIds.isEmpty() && subthemeIds.isEmpty() && groupIds.isEmpty();
    }

    private static Set<String> copy(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> copy = new LinkedHashSet<>();
        for (String id : ids) {
            if (id != null && !id.isBlank()) {
                copy.add(canonical(id.trim()));
            }
        }
        return Collections.unmodifiableSet(copy);
    }

    // Stored ids and namespaces use the lower-case UUID form; other values pass through unchanged.
    static String canonical(String id) {
        try {
            return UUID.fromString(id).toString();
        } catch (IllegalArgumentException e) {
            return id;
        }
    }
}
