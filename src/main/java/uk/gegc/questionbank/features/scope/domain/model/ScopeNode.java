package uk.gegc.questionbank.features.scope.domain.model;

import uk.gegc.questionbank.features.aggregate.domain.model.TaxonomyLevel;

/**
 * A taxonomy slice before it is bound to a filter mode. {@code taxonomyId} is null for
 * {@link TaxonomyLevel#GLOBAL}.
 */
public record ScopeNode(TaxonomyLevel level, String taxonomyId) {

    public static final ScopeNode GLOBAL = new ScopeNode(TaxonomyLevel.GLOBAL, null);
}
