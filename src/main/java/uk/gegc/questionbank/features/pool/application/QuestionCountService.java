package uk.gegc.questionbank.features.pool.application;

import uk.gegc.questionbank.features.pool.domain.model.DescriptorCount;
import uk.gegc.questionbank.features.scope.domain.model.FilterMode;
import uk.gegc.questionbank.features.scope.domain.model.ResolvedScope;
import uk.gegc.questionbank.features.scope.domain.model.ScopeDescriptor;
import uk.gegc.questionbank.features.scope.domain.model.ScopeSelection;

import java.util.List;
import java.util.Map;

/**
 * Question counts per filter mode. Descriptors of a resolved scope never overlap, so totals are
 * plain sums.
 */
public interface QuestionCountService {

    long count(ResolvedScope scope);

    /**
     * Count of a single descriptor. With an exclusion it is {@code max(0, total - excluded)}.
     */
    long count(ScopeDescriptor descriptor);

    List<DescriptorCount> breakdown(ResolvedScope scope);

    /**
     * Counts for every filter mode the caller can use. Anonymous callers only get {@link FilterMode#ALL}.
     */
    Map<FilterMode, Long> countAllModes(ScopeSelection selection, String userId);
}
