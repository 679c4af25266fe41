package uk.gegc.questionbank.features.aggregate.application;

import uk.gegc.questionbank.features.aggregate.domain.exception.DuplicateAggregateEntryException;
import uk.gegc.questionbank.features.aggregate.domain.exception.RankOutOfRangeException;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateEntry;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateKey;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;
import uk.gegc.questionbank.features.aggregate.domain.model.KeyBounds;

import java.util.List;

/**
 * Namespace-partitioned order-statistics store shared by every aggregate.
 * <p>
 * Entries inside a namespace are ordered by {@code (sortKey, entityKey)}. Reads observe every
 * write committed before the call started; readers and writers are not serialized against
 * each other, so a rank obtained from {@link #count} may be stale by the time {@link #at}
 * runs.
 */
public interface OrderedAggregateIndex {

    /**
     * @throws DuplicateAggregateEntryException if an entry with the same key already exists
     */
    void insert(AggregateEntry entry);

    /**
     * @return {@code true} if the entry was added, {@code false} if it was already present
     */
    boolean insertIfAbsent(AggregateEntry entry);

    /**
     * @return {@code true} if an entry was removed
     */
    boolean delete(AggregateKey key);

    boolean contains(AggregateKey key);

    long count(AggregateName aggregate, String namespace, KeyBounds bounds);

    default long count(AggregateName aggregate, String namespace) {
        return count(aggregate, namespace, KeyBounds.unbounded());
    }

    /**
     * @throws RankOutOfRangeException if {@code rank} is outside {@code [0, count)}
     */
    AggregateEntry at(AggregateName aggregate, String namespace, long rank);

    /**
     * @return number of removed entries
     */
    long clear(AggregateName aggregate, String namespace);

    /**
     * Namespaces holding at least one entry, in lexical order, strictly after {@code after}
     * (or from the start when {@code null}).
     */
    List<String> namespaces(AggregateName aggregate, String after, int limit);
}
