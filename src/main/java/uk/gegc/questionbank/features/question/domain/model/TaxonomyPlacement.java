package uk.gegc.questionbank.features.question.domain.model;

import java.util.UUID;

/**
 * Where a question sits in the taxonomy. {@code themeId} is always set; a group implies its
 * subtheme.
 */
public record TaxonomyPlacement(UUID themeId, UUID subthemeId, UUID groupId) {
}
