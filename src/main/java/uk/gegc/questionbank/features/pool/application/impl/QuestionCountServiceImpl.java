package uk.gegc.questionbank.features.pool.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.questionbank.features.aggregate.application.OrderedAggregateIndex;
import uk.gegc.questionbank.features.pool.application.QuestionCountService;
import uk.gegc.questionbank.features.pool.domain.model.DescriptorCount;
import uk.gegc.questionbank.features.scope.application.ScopeResolver;
import uk.gegc.questionbank.features.scope.domain.model.AggregateTarget;
import uk.gegc.questionbank.features.scope.domain.model.FilterMode;
import uk.gegc.questionbank.features.scope.domain.model.ResolvedScope;
import uk.gegc.questionbank.features.scope.domain.model.ScopeDescriptor;
import uk.gegc.questionbank.features.scope.domain.model.ScopeNode;
import uk.gegc.questionbank.features.scope.domain.model.ScopeSelection;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class QuestionCountServiceImpl implements QuestionCountService {

    private final OrderedAggregateIndex index;
    private final ScopeResolver scopeResolver;

    @Override
    public long count(ResolvedScope scope) {
        long total = 0;
        for (ScopeDescriptor descriptor : scope.descriptors()) {
            total += count(descriptor);
        }
        return total;
    }

    @Override
    public long count(ScopeDescriptor descriptor) {
        long total = count(descriptor.target());
        if (!descriptor.hasExclusion() || total == 0) {
            return total;
        }
        // facts written before their question was indexed can push this below zero
        return Math.max(0, total - count(descriptor.exclusion()));
    }

    @Override
    public List<DescriptorCount> breakdown(ResolvedScope scope) {
        return scope.descriptors().stream()
                .map(descriptor -> new DescriptorCount(descriptor, count(descriptor)))
                .toList();
    }

    @Override
    public Map<FilterMode, Long> countAllModes(ScopeSelection selection, String userId) {
        Map<FilterMode, Long> counts = new EnumMap<>(FilterMode.class);
        List<ScopeNode> nodes = scopeResolver.resolveNodes(selection);
        for (FilterMode mode : FilterMode.values()) {
            if (mode.requiresUser() && userId == null) {
                continue;
            }
            counts.put(mode, count(scopeResolver.bind(nodes, mode, userId)));
        }
        log.debug("Counted {} modes over {} nodes for user {}", counts.size(), nodes.size(), userId);
        return counts;
    }

    private long count(AggregateTarget target) {
        return index.count(target.aggregate(), target.namespace());
    }
}
