package uk.gegc.questionbank.features.pool.application;

import uk.gegc.questionbank.features.pool.api.dto.PoolBreakdownResponse;
import uk.gegc.questionbank.features.pool.api.dto.PoolCountResponse;
import uk.gegc.questionbank.features.pool.api.dto.PoolCountsResponse;
import uk.gegc.questionbank.features.pool.api.dto.QuestionPoolRequest;
import uk.gegc.questionbank.features.pool.api.dto.QuestionSampleResponse;

public interface QuestionPoolService {

    PoolCountResponse count(QuestionPoolRequest request, String userId);

    PoolCountsResponse countAllModes(QuestionPoolRequest request, String userId);

    PoolBreakdownResponse breakdown(QuestionPoolRequest request, String userId);

    QuestionSampleResponse sampleQuestions(QuestionPoolRequest request, String userId);
}
