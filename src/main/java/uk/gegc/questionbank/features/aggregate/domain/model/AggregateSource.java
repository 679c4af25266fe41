package uk.gegc.questionbank.features.aggregate.domain.model;

/**
 * Table-level origin of aggregate entries. Question entries come from the question bank itself,
 * the other sources from per-user facts of the matching kind.
 */
public enum AggregateSource {
    QUESTION(false),
    ANSWERED(true),
    INCORRECT(true),
    BOOKMARKED(true);

    private final boolean userScoped;

    AggregateSource(boolean userScoped) {
        this.userScoped = userScoped;
    }

    public boolean isUserScoped() {
        return userScoped;
    }
}
