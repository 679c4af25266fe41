package uk.gegc.questionbank.features.scope.domain.model;

import uk.gegc.questionbank.features.aggregate.domain.model.AggregateSource;

/**
 * How a taxonomy selection is narrowed by the requesting user's history.
 */
public enum FilterMode {
    ALL(AggregateSource.QUESTION, null),
    UNANSWERED(AggregateSource.QUESTION, AggregateSource.ANSWERED),
    INCORRECT(AggregateSource.INCORRECT, null),
    BOOKMARKED(AggregateSource.BOOKMARKED, null);

    private final AggregateSource source;
    private final AggregateSource exclusion;

    FilterMode(AggregateSource source, AggregateSource exclusion) {
        this.source = source;
        this.exclusion = exclusion;
    }

    public AggregateSource getSource() {
        return source;
    }

    public AggregateSource getExclusion() {
        return exclusion;
    }

    public boolean requiresUser() {
        return source.isUserScoped() || exclusion != null;
    }
}
