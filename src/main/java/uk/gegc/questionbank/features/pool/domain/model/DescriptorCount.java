package uk.gegc.questionbank.features.pool.domain.model;

import uk.gegc.questionbank.features.scope.domain.model.ScopeDescriptor;

public record DescriptorCount(ScopeDescriptor descriptor, long count) {
}
