package uk.gegc.questionbank.features.userfact.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.questionbank.features.aggregate.application.AggregateSyncService;
import uk.gegc.questionbank.features.aggregate.domain.model.IndexedRecord;
import uk.gegc.questionbank.features.question.domain.model.Question;
import uk.gegc.questionbank.features.question.domain.model.TaxonomyPlacement;
import uk.gegc.questionbank.features.question.domain.repository.QuestionRepository;
import uk.gegc.questionbank.features.userfact.application.UserFactService;
import uk.gegc.questionbank.features.userfact.domain.model.FactKind;
import uk.gegc.questionbank.features.userfact.domain.model.UserQuestionFact;
import uk.gegc.questionbank.features.userfact.domain.repository.UserQuestionFactRepository;
import uk.gegc.questionbank.shared.exception.ResourceNotFoundException;
import uk.gegc.questionbank.shared.exception.ValidationException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserFactServiceImpl implements UserFactService {

    private final UserQuestionFactRepository factRepository;
    private final QuestionRepository questionRepository;
    private final AggregateSyncService aggregateSyncService;

    @Override
    @Transactional
    public void recordAnswer(String userId, UUID questionId, boolean correct) {
        Question question = requireQuestion(userId, questionId);
        addFact(userId, question, FactKind.ANSWERED);
        if (correct) {
            removeFact(userId, questionId, FactKind.INCORRECT);
        } else {
            addFact(userId, question, FactKind.INCORRECT);
        }
    }

    @Override
    @Transactional
    public boolean toggleBookmark(String userId, UUID questionId) {
        Question question = requireQuestion(userId, questionId);
        if (removeFact(userId, questionId, FactKind.BOOKMARKED)) {
            return false;
        }
        addFact(userId, question, FactKind.BOOKMARKED);
        return true;
    }

    @Override
    @Transactional
    public boolean removeFact(String userId, UUID questionId, FactKind kind) {
        Optional<UserQuestionFact> existing = factRepository.findByUserIdAndQuestionIdAndKind(userId, questionId, kind);
        if (existing.isEmpty()) {
            return false;
        }
        UserQuestionFact fact = existing.get();
        aggregateSyncService.onDeleted(fact.toIndexedRecord());
        factRepository.delete(fact);
        log.debug("Removed {} fact for user {} on question {}", kind, userId, questionId);
        return true;
    }

    @Override
    @Transactional
    public int moveFacts(UUID questionId, TaxonomyPlacement placement) {
        List<UserQuestionFact> facts = factRepository.findByQuestionId(questionId);
        for (UserQuestionFact fact : facts) {
            IndexedRecord before = fact.toIndexedRecord();
            fact.setThemeId(placement.themeId());
            fact.setSubthemeId(placement.subthemeId());
            fact.setGroupId(placement.groupId());
            aggregateSyncService.onChanged(before, fact.toIndexedRecord());
        }
        factRepository.saveAll(facts);
        return facts.size();
    }

    @Override
    @Transactional
    public int removeFactsForQuestion(UUID questionId) {
        List<UserQuestionFact> facts = factRepository.findByQuestionId(questionId);
        for (UserQuestionFact fact : facts) {
            aggregateSyncService.onDeleted(fact.toIndexedRecord());
        }
        factRepository.deleteAll(facts);
        return facts.size();
    }

    private void addFact(String userId, Question question, FactKind kind) {
        if (factRepository.findByUserIdAndQuestionIdAndKind(userId, question.getId(), kind).isPresent()) {
            return;
        }
        UserQuestionFact fact = new UserQuestionFact();
        fact.setUserId(userId);
        fact.setQuestionId(question.getId());
        fact.setKind(kind);
        fact.setThemeId(question.getThemeId());
        fact.setSubthemeId(question.getSubthemeId());
        fact.setGroupId(question.getGroupId());
        UserQuestionFact saved = factRepository.save(fact);
        aggregateSyncService.onCreated(saved.toIndexedRecord());
        log.debug("Recorded {} fact for user {} on question {}", kind, userId, question.getId());
    }

    private Question requireQuestion(String userId, UUID questionId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("User id is required");
        }
        return questionRepository.findById(questionId)
                .orElseThrow(() -> new ResourceNotFoundException("Question " + questionId + " not found"));
    }
}
