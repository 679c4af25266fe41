package uk.gegc.questionbank.features.pool.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.questionbank.features.pool.api.dto.DescriptorCountDto;
import uk.gegc.questionbank.features.pool.api.dto.PoolBreakdownResponse;
import uk.gegc.questionbank.features.pool.api.dto.PoolCountResponse;
import uk.gegc.questionbank.features.pool.api.dto.PoolCountsResponse;
import uk.gegc.questionbank.features.pool.api.dto.QuestionPoolRequest;
import uk.gegc.questionbank.features.pool.api.dto.QuestionSampleResponse;
import uk.gegc.questionbank.features.pool.application.QuestionCountService;
import uk.gegc.questionbank.features.pool.application.QuestionPoolService;
import uk.gegc.questionbank.features.pool.application.SamplingEngine;
import uk.gegc.questionbank.features.pool.domain.model.DescriptorCount;
import uk.gegc.questionbank.features.scope.application.ScopeResolver;
import uk.gegc.questionbank.features.scope.domain.model.FilterMode;
import uk.gegc.questionbank.features.scope.domain.model.ResolvedScope;
import uk.gegc.questionbank.shared.exception.ValidationException;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class QuestionPoolServiceImpl implements QuestionPoolService {

    private final ScopeResolver scopeResolver;
    private final QuestionCountService questionCountService;
    private final SamplingEngine samplingEngine;

    @Override
    public PoolCountResponse count(QuestionPoolRequest request, String userId) {
        FilterMode mode = request.filterOrDefault();
        ResolvedScope scope = scopeResolver.resolve(request.toSelection(), mode, userId);
        return new PoolCountResponse(mode, questionCountService.count(scope));
    }

    @Override
    public PoolCountsResponse countAllModes(QuestionPoolRequest request, String userId) {
        return new PoolCountsResponse(questionCountService.countAllModes(request.toSelection(), userId));
    }

    @Override
    public PoolBreakdownResponse breakdown(QuestionPoolRequest request, String userId) {
        FilterMode mode = request.filterOrDefault();
        ResolvedScope scope = scopeResolver.resolve(request.toSelection(), mode, userId);
        List<DescriptorCount> counts = questionCountService.breakdown(scope);
        long total = counts.stream().mapToLong(DescriptorCount::count).sum();
        return new PoolBreakdownResponse(mode, total, counts.stream().map(DescriptorCountDto::from).toList());
    }

    @Override
    public QuestionSampleResponse sampleQuestions(QuestionPoolRequest request, String userId) {
        if (request.count() == null) {
            throw new ValidationException("Count is required when sampling questions");
        }
        FilterMode mode = request.filterOrDefault();
        ResolvedScope scope = scopeResolver.resolve(request.toSelection(), mode, userId);
        List<String> ids = samplingEngine.sampleAcrossScopes(scope.descriptors(), request.count(), null);
        log.debug("Sampled {} of {} questions ({}) for user {}", ids.size(), request.count(), mode, userId);
        return new QuestionSampleResponse(mode, request.count(), ids);
    }
}
