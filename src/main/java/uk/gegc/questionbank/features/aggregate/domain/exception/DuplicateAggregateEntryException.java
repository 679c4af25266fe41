package uk.gegc.questionbank.features.aggregate.domain.exception;

import uk.gegc.questionbank.features.aggregate.domain.model.AggregateKey;

public class DuplicateAggregateEntryException extends RuntimeException {

    public DuplicateAggregateEntryException(AggregateKey key) {
        super("Entry " + key.entityKey() + " already present in " + key.aggregate() + "/" + key.namespace());
    }
}
