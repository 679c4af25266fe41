package uk.gegc.questionbank.features.question.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.questionbank.features.aggregate.application.AggregateSyncService;
import uk.gegc.questionbank.features.aggregate.domain.model.IndexedRecord;
import uk.gegc.questionbank.features.question.application.QuestionService;
import uk.gegc.questionbank.features.question.domain.model.Question;
import uk.gegc.questionbank.features.question.domain.model.TaxonomyPlacement;
import uk.gegc.questionbank.features.question.domain.repository.QuestionRepository;
import uk.gegc.questionbank.features.taxonomy.application.TaxonomyService;
import uk.gegc.questionbank.features.taxonomy.domain.model.QuestionGroup;
import uk.gegc.questionbank.features.taxonomy.domain.model.Subtheme;
import uk.gegc.questionbank.features.userfact.application.UserFactService;
import uk.gegc.questionbank.shared.exception.ResourceNotFoundException;
import uk.gegc.questionbank.shared.exception.ValidationException;

import java.util.Objects;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class QuestionServiceImpl implements QuestionService {

    private final QuestionRepository questionRepository;
    private final TaxonomyService taxonomyService;
    private final AggregateSyncService aggregateSyncService;
    private final UserFactService userFactService;

    @Override
    @Transactional
    public Question createQuestion(String questionText, TaxonomyPlacement placement) {
        if (questionText == null || questionText.isBlank()) {
            throw new ValidationException("Question text is required");
        }
        TaxonomyPlacement resolved = resolvePlacement(placement);

        Question question = new Question();
        question.setQuestionText(questionText);
        question.setThemeId(resolved.themeId());
        question.setSubthemeId(resolved.subthemeId());
        question.setGroupId(resolved.groupId());
        Question saved = questionRepository.save(question);

        aggregateSyncService.onCreated(saved.toIndexedRecord());
        log.info("Created question {} in theme {}", saved.getId(), saved.getThemeId());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Question getQuestion(UUID questionId) {
        return questionRepository.findById(questionId)
                .orElseThrow(() -> new ResourceNotFoundException("Question " + questionId + " not found"));
    }

    @Override
    @Transactional
    public Question changeTaxonomy(UUID questionId, TaxonomyPlacement placement) {
        Question question = getQuestion(questionId);
        TaxonomyPlacement resolved = resolvePlacement(placement);
        if (Objects.equals(question.getThemeId(), resolved.themeId())
                && Objects.equals(question.getSubthemeId(), resolved.subthemeId())
                && Objects.equals(question.getGroupId(), resolved.groupId())) {
            return question;
        }

        IndexedRecord before = question.toIndexedRecord();
        question.setThemeId(resolved.themeId());
        question.setSubthemeId(resolved.subthemeId());
        question.setGroupId(resolved.groupId());
        Question saved = questionRepository.save(question);

        aggregateSyncService.onChanged(before, saved.toIndexedRecord());
        int facts = userFactService.moveFacts(saved.getId(), resolved);
        log.info("Moved question {} to theme={} subtheme={} group={} ({} user facts re-keyed)",
                questionId, resolved.themeId(), resolved.subthemeId(), resolved.groupId(), facts);
        return saved;
    }

    @Override
    @Transactional
    public void deleteQuestion(UUID questionId) {
        Question question = getQuestion(questionId);
        int facts = userFactService.removeFactsForQuestion(questionId);
        aggregateSyncService.onDeleted(question.toIndexedRecord());
        questionRepository.delete(question);
        log.info("Deleted question {} and {} user facts", questionId, facts);
    }

    /**
     * Fills in parents implied by the most specific id and rejects contradicting parents.
     */
    TaxonomyPlacement resolvePlacement(TaxonomyPlacement placement) {
        if (placement == null) {
            throw new ValidationException("Taxonomy placement is required");
        }
        UUID themeId = placement.themeId();
        UUID subthemeId = placement.subthemeId();
        UUID groupId = placement.groupId();

        if (groupId != null) {
            QuestionGroup group = taxonomyService.getGroup(groupId);
            if (subthemeId != null && !subthemeId.equals(group.getSubthemeId())) {
                throw new ValidationException("Group " + groupId + " does not belong to subtheme " + subthemeId);
            }
            subthemeId = group.getSubthemeId();
        }
        if (subthemeId != null) {
            Subtheme subtheme = taxonomyService.getSubtheme(subthemeId);
            if (themeId != null && !themeId.equals(subtheme.getThemeId())) {
                throw new ValidationException("Subtheme " + subthemeId + " does not belong to theme " + themeId);
            }
            themeId = subtheme.getThemeId();
        }
        if (themeId == null) {
            throw new ValidationException("A question needs a theme, subtheme or group");
        }
        taxonomyService.getTheme(themeId);
        return new TaxonomyPlacement(themeId, subthemeId, groupId);
    }
}
