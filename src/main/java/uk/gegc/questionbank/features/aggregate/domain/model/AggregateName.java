package uk.gegc.questionbank.features.aggregate.domain.model;

import java.util.Arrays;
import java.util.List;

/**
 * Logical aggregates maintained in the index. Each one is a partitioned order-statistics store
 * for a single (source, taxonomy level) pair.
 */
public enum AggregateName {
    QUESTIONS_TOTAL(AggregateSource.QUESTION, TaxonomyLevel.GLOBAL),
    QUESTIONS_BY_THEME(AggregateSource.QUESTION, TaxonomyLevel.THEME),
    QUESTIONS_BY_SUBTHEME(AggregateSource.QUESTION, TaxonomyLevel.SUBTHEME),
    QUESTIONS_BY_SUBTHEME_UNGROUPED(AggregateSource.QUESTION, TaxonomyLevel.SUBTHEME_UNGROUPED),
    QUESTIONS_BY_GROUP(AggregateSource.QUESTION, TaxonomyLevel.GROUP),

    ANSWERED_BY_USER(AggregateSource.ANSWERED, TaxonomyLevel.GLOBAL),
    ANSWERED_BY_THEME_BY_USER(AggregateSource.ANSWERED, TaxonomyLevel.THEME),
    ANSWERED_BY_SUBTHEME_BY_USER(AggregateSource.ANSWERED, TaxonomyLevel.SUBTHEME),
    ANSWERED_BY_SUBTHEME_UNGROUPED_BY_USER(AggregateSource.ANSWERED, TaxonomyLevel.SUBTHEME_UNGROUPED),
    ANSWERED_BY_GROUP_BY_USER(AggregateSource.ANSWERED, TaxonomyLevel.GROUP),

    INCORRECT_BY_USER(AggregateSource.INCORRECT, TaxonomyLevel.GLOBAL),
    INCORRECT_BY_THEME_BY_USER(AggregateSource.INCORRECT, TaxonomyLevel.THEME),
    INCORRECT_BY_SUBTHEME_BY_USER(AggregateSource.INCORRECT, TaxonomyLevel.SUBTHEME),
    INCORRECT_BY_SUBTHEME_UNGROUPED_BY_USER(AggregateSource.INCORRECT, TaxonomyLevel.SUBTHEME_UNGROUPED),
    INCORRECT_BY_GROUP_BY_USER(AggregateSource.INCORRECT, TaxonomyLevel.GROUP),

    BOOKMARKED_BY_USER(AggregateSource.BOOKMARKED, TaxonomyLevel.GLOBAL),
    BOOKMARKED_BY_THEME_BY_USER(AggregateSource.BOOKMARKED, TaxonomyLevel.THEME),
    BOOKMARKED_BY_SUBTHEME_BY_USER(AggregateSource.BOOKMARKED, TaxonomyLevel.SUBTHEME),
    BOOKMARKED_BY_SUBTHEME_UNGROUPED_BY_USER(AggregateSource.BOOKMARKED, TaxonomyLevel.SUBTHEME_UNGROUPED),
    BOOKMARKED_BY_GROUP_BY_USER(AggregateSource.BOOKMARKED, TaxonomyLevel.GROUP);

    private final AggregateSource source;
    private final TaxonomyLevel level;

    AggregateName(AggregateSource source, TaxonomyLevel level) {
        this.source = source;
        this.level = level;
    }

    public AggregateSource getSource() {
        return source;
    }

    public TaxonomyLevel getLevel() {
        return level;
    }

    public static AggregateName of(AggregateSource source, TaxonomyLevel level) {
        for (AggregateName name : values()) {
            if (name.source == source && name.level == level) {
                return name;
            }
        }
        throw new IllegalArgumentException("No aggregate for " + source + "/" + level);
    }

    public static List<AggregateName> forSource(AggregateSource source) {
        return Arrays.stream(values())
                .filter(name -> name.source == source)
                .toList();
    }
}
