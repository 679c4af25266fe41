package uk.gegc.questionbank.features.pool.application;

import uk.gegc.questionbank.features.scope.domain.model.AggregateTarget;
import uk.gegc.questionbank.features.scope.domain.model.ScopeDescriptor;

import java.util.List;
import java.util.Optional;

/**
 * Uniform random draws from aggregate namespaces. Results may be shorter than requested when the
 * scope holds fewer entities or entries vanish under concurrent deletes; that is never an error.
 */
public interface SamplingEngine {

    Optional<String> sampleOne(AggregateTarget target);

    /**
     * Up to {@code k} distinct entity keys from the descriptor, drawn without replacement.
     */
    List<String> sampleK(ScopeDescriptor descriptor, int k);

    /**
     * Entities that the descriptor can still yield: its count, minus its exclusion count when it has one.
     */
    long available(ScopeDescriptor descriptor);

    /**
     * Samples every descriptor concurrently and merges the results.
     *
     * @param weights relative share per descriptor, or {@code null} for equal shares
     * @return up to {@code totalK} distinct entity keys in random order
     */
    List<String> sampleAcrossScopes(List<ScopeDescriptor> descriptors, int totalK, List<Double> weights);
}
