package uk.gegc.questionbank.features.userfact.application;

import uk.gegc.questionbank.features.question.domain.model.TaxonomyPlacement;
import uk.gegc.questionbank.features.userfact.domain.model.FactKind;

import java.util.UUID;

public interface UserFactService {

    /**
     * Records an answer. A wrong answer marks the question incorrect; a correct one clears that mark.
     */
    void recordAnswer(String userId, UUID questionId, boolean correct);

    /**
     * @return whether the question is bookmarked after the call
     */
    boolean toggleBookmark(String userId, UUID questionId);

    boolean removeFact(String userId, UUID questionId, FactKind kind);

    /**
     * Copies a question's new placement onto its facts and re-keys their index entries.
     *
     * @return number of facts moved
     */
    int moveFacts(UUID questionId, TaxonomyPlacement placement);

    int removeFactsForQuestion(UUID questionId);
}
