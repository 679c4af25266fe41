package uk.gegc.questionbank.features.scope.application;

import java.util.Collection;
import java.util.Map;

/**
 * Batch parent lookups. Unknown ids are absent from the returned maps.
 */
public interface TaxonomyParentLookup {

    Map<String, String> themesOfSubthemes(Collection<String> subthemeIds);

    Map<String, String> subthemesOfGroups(Collection<String> groupIds);
}
