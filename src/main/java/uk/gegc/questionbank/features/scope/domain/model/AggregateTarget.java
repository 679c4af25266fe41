package uk.gegc.questionbank.features.scope.domain.model;

import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;

import java.util.Objects;

/**
 * One namespace of one aggregate: the unit counting and sampling read.
 */
public record AggregateTarget(AggregateName aggregate, String namespace) {

    public AggregateTarget {
        Objects.requireNonNull(aggregate, "aggregate");
        Objects.requireNonNull(namespace, "namespace");
    }

    @Override
    public String toString() {
        return aggregate + "/" + namespace;
    }
}
