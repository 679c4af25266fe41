package uk.gegc.questionbank.features.scope.domain.model;

import java.util.List;

/**
 * Ordered descriptors covering a selection. No record is covered by more than one descriptor,
 * so per-descriptor counts can be summed.
 */
public record ResolvedScope(FilterMode mode, List<ScopeDescriptor> descriptors) {

    public ResolvedScope {
        descriptors = List.copyOf(descriptors);
    }
}
