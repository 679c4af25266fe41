package uk.gegc.questionbank.features.aggregate.domain.model;

import java.util.Objects;

/**
 * Identity of an entry inside one aggregate namespace.
 */
public record AggregateKey(AggregateName aggregate, String namespace, String sortKey, String entityKey) {

    public AggregateKey {
        Objects.requireNonNull(aggregate, "aggregate");
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(sortKey, "sortKey");
        Objects.requireNonNull(entityKey, "entityKey");
    }
}
