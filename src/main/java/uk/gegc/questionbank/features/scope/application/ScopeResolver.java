package uk.gegc.questionbank.features.scope.application;

import uk.gegc.questionbank.features.scope.domain.model.FilterMode;
import uk.gegc.questionbank.features.scope.domain.model.ResolvedScope;
import uk.gegc.questionbank.features.scope.domain.model.ScopeNode;
import uk.gegc.questionbank.features.scope.domain.model.ScopeSelection;

import java.util.List;

public interface ScopeResolver {

    /**
     * Applies group &gt; subtheme &gt; theme precedence so that the returned nodes never overlap.
     * An empty selection yields the single global node.
     */
    List<ScopeNode> resolveNodes(ScopeSelection selection);

    /**
     * Resolves the selection and binds every node to the aggregates the filter mode reads.
     *
     * @param userId required for every mode except {@link FilterMode#ALL}
     * @throws uk.gegc.questionbank.shared.exception.ValidationException when a user-scoped mode has no user
     */
    ResolvedScope resolve(ScopeSelection selection, FilterMode mode, String userId);

    /**
     * Binds already resolved nodes to a filter mode, so one resolution can serve several modes.
     */
    ResolvedScope bind(List<ScopeNode> nodes, FilterMode mode, String userId);
}
