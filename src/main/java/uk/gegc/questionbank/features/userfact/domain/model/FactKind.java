package uk.gegc.questionbank.features.userfact.domain.model;

import uk.gegc.questionbank.features.aggregate.domain.model.AggregateSource;

public enum FactKind {
    ANSWERED(AggregateSource.ANSWERED),
    INCORRECT(AggregateSource.INCORRECT),
    BOOKMARKED(AggregateSource.BOOKMARKED);

    private final AggregateSource source;

    FactKind(AggregateSource source) {
        this.source = source;
    }

    public AggregateSource getSource() {
        return source;
    }
}
