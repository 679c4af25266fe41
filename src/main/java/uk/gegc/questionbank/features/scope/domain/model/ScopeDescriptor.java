package uk.gegc.questionbank.features.scope.domain.model;

/**
 * A resolved slice bound to the aggregate it is read from. When {@code exclusion} is present,
 * entities also found in the exclusion namespace are not part of the slice.
 */
public record ScopeDescriptor(ScopeNode node, AggregateTarget target, AggregateTarget exclusion) {

    public boolean hasExclusion() {
        return exclusion != null;
    }
}
