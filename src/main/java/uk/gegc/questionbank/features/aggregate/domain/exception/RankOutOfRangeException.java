package uk.gegc.questionbank.features.aggregate.domain.exception;

import lombok.Getter;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;

/**
 * Thrown by {@code at} when the requested rank is outside {@code [0, count)}. Under concurrent
 * deletes this is a stale-rank race, so callers pick another rank instead of failing.
 */
@Getter
public class RankOutOfRangeException extends RuntimeException {

    private final AggregateName aggregate;
    private final String namespace;
    private final long rank;

    public RankOutOfRangeException(AggregateName aggregate, String namespace, long rank, long size) {
        super("Rank " + rank + " out of range for " + aggregate + "/" + namespace + " (size " + size + ")");
        this.aggregate = aggregate;
        this.namespace = namespace;
        this.rank = rank;
    }
}
