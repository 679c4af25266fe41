package uk.gegc.questionbank.features.question.application;

import uk.gegc.questionbank.features.question.domain.model.Question;
import uk.gegc.questionbank.features.question.domain.model.TaxonomyPlacement;

import java.util.UUID;

/**
 * Question writes. Every write keeps the aggregate index in step with the stored row.
 */
public interface QuestionService {

    Question createQuestion(String questionText, TaxonomyPlacement placement);

    Question getQuestion(UUID questionId);

    /**
     * Moves a question; its index entries and those of every user fact about it are re-keyed.
     */
    Question changeTaxonomy(UUID questionId, TaxonomyPlacement placement);

    void deleteQuestion(UUID questionId);
}
