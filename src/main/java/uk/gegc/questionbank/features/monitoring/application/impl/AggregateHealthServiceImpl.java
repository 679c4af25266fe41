package uk.gegc.questionbank.features.monitoring.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.questionbank.features.aggregate.application.AggregateMetrics;
import uk.gegc.questionbank.features.aggregate.application.NamespaceRegistry;
import uk.gegc.questionbank.features.aggregate.application.OrderedAggregateIndex;
import uk.gegc.questionbank.features.aggregate.application.UserNamespaces;
import uk.gegc.questionbank.features.aggregate.config.AggregateProperties;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;
import uk.gegc.questionbank.features.aggregate.domain.model.TaxonomyLevel;
import uk.gegc.questionbank.features.monitoring.api.dto.AggregateOverviewDto;
import uk.gegc.questionbank.features.monitoring.api.dto.CountCheckDto;
import uk.gegc.questionbank.features.monitoring.api.dto.HealthStatus;
import uk.gegc.questionbank.features.monitoring.api.dto.UserAggregatesDto;
import uk.gegc.questionbank.features.monitoring.api.dto.UserHealthDto;
import uk.gegc.questionbank.features.monitoring.application.AggregateHealthService;
import uk.gegc.questionbank.features.question.domain.repository.QuestionRepository;
import uk.gegc.questionbank.features.taxonomy.domain.model.QuestionGroup;
import uk.gegc.questionbank.features.taxonomy.domain.model.Subtheme;
import uk.gegc.questionbank.features.taxonomy.domain.model.Theme;
import uk.gegc.questionbank.features.taxonomy.domain.repository.QuestionGroupRepository;
import uk.gegc.questionbank.features.taxonomy.domain.repository.SubthemeRepository;
import uk.gegc.questionbank.features.taxonomy.domain.repository.ThemeRepository;
import uk.gegc.questionbank.features.userfact.domain.model.FactKind;
import uk.gegc.questionbank.features.userfact.domain.repository.UserQuestionFactRepository;
import uk.gegc.questionbank.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AggregateHealthServiceImpl implements AggregateHealthService {

    private final OrderedAggregateIndex index;
    private final UserNamespaces userNamespaces;
    private final QuestionRepository questionRepository;
    private final ThemeRepository themeRepository;
    private final SubthemeRepository subthemeRepository;
    private final QuestionGroupRepository groupRepository;
    private final UserQuestionFactRepository factRepository;
    private final AggregateProperties properties;
    private final AggregateMetrics metrics;

    @Override
    public AggregateOverviewDto getOverview() {
        List<CountCheckDto> checks = new ArrayList<>();
        long totalQuestions = index.count(AggregateName.QUESTIONS_TOTAL, NamespaceRegistry.GLOBAL);
        checks.add(CountCheckDto.of(AggregateName.QUESTIONS_TOTAL, NamespaceRegistry.GLOBAL,
                totalQuestions, questionRepository.count()));
        for (Theme theme : themeRepository.findAll()) {
            String namespace = theme.getId().toString();
            checks.add(CountCheckDto.of(AggregateName.QUESTIONS_BY_THEME, namespace,
                    index.count(AggregateName.QUESTIONS_BY_THEME, namespace),
                    questionRepository.countByThemeId(theme.getId())));
        }
        for (Subtheme subtheme : subthemeRepository.findAll()) {
            String namespace = subtheme.getId().toString();
            checks.add(CountCheckDto.of(AggregateName.QUESTIONS_BY_SUBTHEME, namespace,
                    index.count(AggregateName.QUESTIONS_BY_SUBTHEME, namespace),
                    questionRepository.countBySubthemeId(subtheme.getId())));
        }
        for (QuestionGroup group : groupRepository.findAll()) {
            String namespace = group.getId().toString();
            checks.add(CountCheckDto.of(AggregateName.QUESTIONS_BY_GROUP, namespace,
                    index.count(AggregateName.QUESTIONS_BY_GROUP, namespace),
                    questionRepository.countByGroupId(group.getId())));
        }
        long mismatches = report("question aggregates", checks);
        return new AggregateOverviewDto(HealthStatus.of(checks), totalQuestions, mismatches, checks);
    }

    @Override
    public UserHealthDto checkUser(String userId) {
        String user = requireUser(userId);
        List<CountCheckDto> checks = new ArrayList<>();
        for (FactKind kind : FactKind.values()) {
            long facts = factRepository.countByUserIdAndKind(user, kind);
            for (AggregateName aggregate : AggregateName.forSource(kind.getSource())) {
                // every fact lands in exactly one namespace per level, except the ungrouped level
                long stored = aggregate.getLevel() == TaxonomyLevel.SUBTHEME_UNGROUPED
                        ? factRepository.countByUserIdAndKindAndSubthemeIdIsNotNullAndGroupIdIsNull(user, kind)
                        : facts;
                checks.add(CountCheckDto.of(aggregate, user, indexedForUser(aggregate, user), stored));
            }
        }
        long mismatches = report("aggregates of user " + user, checks);
        return new UserHealthDto(user, HealthStatus.of(checks), mismatches, checks);
    }

    @Override
    public UserAggregatesDto getUserAggregates(String userId) {
        String user = requireUser(userId);
        Map<AggregateName, Long> counts = new EnumMap<>(AggregateName.class);
        for (AggregateName aggregate : AggregateName.values()) {
            if (aggregate.getSource().isUserScoped()) {
                counts.put(aggregate, indexedForUser(aggregate, user));
            }
        }
        return new UserAggregatesDto(user, counts);
    }

    private long indexedForUser(AggregateName aggregate, String userId) {
        long total = 0;
        for (String namespace : userNamespaces.all(aggregate, userId, properties.getRepair().getClearBatchSize())) {
            total += index.count(aggregate, namespace);
        }
        return total;
    }

    private long report(String subject, List<CountCheckDto> checks) {
        long mismatches = 0;
        for (CountCheckDto check : checks) {
            if (!check.match()) {
                mismatches++;
                log.warn("Health check mismatch: aggregate={}, scope={}, indexed={}, stored={}",
                        check.aggregate(), check.scope(), check.indexed(), check.stored());
            }
        }
        if (mismatches > 0) {
            metrics.healthMismatches(mismatches);
        } else {
            log.debug("Health check of {} passed {} checks", subject, checks.size());
        }
        return mismatches;
    }

    private static String requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("User id is required");
        }
        return userId.trim();
    }
}
