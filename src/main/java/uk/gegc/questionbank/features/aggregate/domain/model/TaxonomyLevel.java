package uk.gegc.questionbank.features.aggregate.domain.model;

public enum TaxonomyLevel {
    GLOBAL,
    THEME,
    SUBTHEME,
    /**
     * Records of a subtheme that are not assigned to any group.
     */
    SUBTHEME_UNGROUPED,
    GROUP
}
