package uk.gegc.questionbank.features.aggregate.domain.exception;

import lombok.Getter;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;

/**
 * A namespace function was invoked on a record that structurally lacks the field the dimension
 * needs. This is a wiring error and is never retried.
 */
@Getter
public class MissingRequiredDimensionException extends RuntimeException {

    private final AggregateName aggregate;
    private final String field;

    public MissingRequiredDimensionException(AggregateName aggregate, String field, String entityKey) {
        super("Aggregate " + aggregate + " requires '" + field + "' but record " + entityKey + " has none");
        this.aggregate = aggregate;
        this.field = field;
    }
}
