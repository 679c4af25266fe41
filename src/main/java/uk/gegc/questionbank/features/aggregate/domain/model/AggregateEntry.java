package uk.gegc.questionbank.features.aggregate.domain.model;

import java.util.Objects;

/**
 * A single indexed entry. Entries are never mutated; a change of any key component is a
 * delete followed by an insert.
 */
public record AggregateEntry(AggregateName aggregate, String namespace, String sortKey, String entityKey) {

    public AggregateEntry {
        Objects.requireNonNull(aggregate, "aggregate");
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(sortKey, "sortKey");
        Objects.requireNonNull(entityKey, "entityKey");
    }

    public AggregateKey key() {
        return new AggregateKey(aggregate, namespace, sortKey, entityKey);
    }
}
