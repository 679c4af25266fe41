package uk.gegc.questionbank.features.aggregate.infra.memory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import uk.gegc.questionbank.features.aggregate.application.OrderedAggregateIndex;
import uk.gegc.questionbank.features.aggregate.domain.exception.DuplicateAggregateEntryException;
import uk.gegc.questionbank.features.aggregate.domain.exception.RankOutOfRangeException;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateEntry;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateKey;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;
import uk.gegc.questionbank.features.aggregate.domain.model.KeyBounds;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local index: one {@link OrderStatisticTreap} per namespace, published through an
 * {@link AtomicReference}. Writers retry on a lost compare-and-set; readers work on whatever
 * snapshot was current when they started.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "questionbank.aggregates", name = "storage", havingValue = "memory")
public class InMemoryOrderedAggregateIndex implements OrderedAggregateIndex {

    private final Map<AggregateName, ConcurrentNavigableMap<String, AtomicReference<OrderStatisticTreap>>> partitions;

    public InMemoryOrderedAggregateIndex() {
        Map<AggregateName, ConcurrentNavigableMap<String, AtomicReference<OrderStatisticTreap>>> map =
                new EnumMap<>(AggregateName.class);
        for (AggregateName name : AggregateName.values()) {
            map.put(name, new ConcurrentSkipListMap<>());
        }
        this.partitions = map;
        log.info("In-memory aggregate index initialised with {} aggregates", map.size());
    }

    @Override
    public void insert(AggregateEntry entry) {
        if (!insertIfAbsent(entry)) {
            throw new DuplicateAggregateEntryException(entry.key());
        }
    }

    @Override
    public boolean insertIfAbsent(AggregateEntry entry) {
        AtomicReference<OrderStatisticTreap> slot = slot(entry.aggregate(), entry.namespace());
        while (true) {
            OrderStatisticTreap current = slot.get();
            OrderStatisticTreap next = current.insert(entry.sortKey(), entry.entityKey());
            if (next == current) {
                return false;
            }
            if (slot.compareAndSet(current, next)) {
                return true;
            }
        }
    }

    @Override
    public boolean delete(AggregateKey key) {
        AtomicReference<OrderStatisticTreap> slot = existingSlot(key.aggregate(), key.namespace());
        if (slot == null) {
            return false;
        }
        while (true) {
            OrderStatisticTreap current = slot.get();
            OrderStatisticTreap next = current.remove(key.sortKey(), key.entityKey());
            if (next == current) {
                return false;
            }
            if (slot.compareAndSet(current, next)) {
                return true;
            }
        }
    }

    @Override
    public boolean contains(AggregateKey key) {
        return snapshot(key.aggregate(), key.namespace()).contains(key.sortKey(), key.entityKey());
    }

    @Override
    public long count(AggregateName aggregate, String namespace, KeyBounds bounds) {
        OrderStatisticTreap treap = snapshot(aggregate, namespace);
        if (bounds == null || bounds.isUnbounded()) {
            return treap.size();
        }
        long upto = bounds.upper() == null
                ? treap.size()
                : treap.countSortKeysBelow(bounds.upper(), bounds.upperInclusive());
        long before = bounds.lower() == null
                ? 0
                : treap.countSortKeysBelow(bounds.lower(), !bounds.lowerInclusive());
        return Math.max(0, upto - before);
    }

    @Override
    public AggregateEntry at(AggregateName aggregate, String namespace, long rank) {
        OrderStatisticTreap treap = snapshot(aggregate, namespace);
        String[] found = treap.select(rank);
        if (found == null) {
            throw new RankOutOfRangeException(aggregate, namespace, rank, treap.size());
        }
        return new AggregateEntry(aggregate, namespace, found[0], found[1]);
    }

    @Override
    public long clear(AggregateName aggregate, String namespace) {
        AtomicReference<OrderStatisticTreap> slot = existingSlot(aggregate, namespace);
        if (slot == null) {
            return 0;
        }
        long removed = slot.getAndSet(OrderStatisticTreap.EMPTY).size();
        log.debug("Cleared {} entries from {}/{}", removed, aggregate, namespace);
        return removed;
    }

    @Override
    public List<String> namespaces(AggregateName aggregate, String after, int limit) {
        ConcurrentNavigableMap<String, AtomicReference<OrderStatisticTreap>> partition = partitions.get(aggregate);
        NavigableMap<String, AtomicReference<OrderStatisticTreap>> view =
                after == null ? partition : partition.tailMap(after, false);
        List<String> result = new ArrayList<>(Math.min(limit, 64));
        for (Map.Entry<String, AtomicReference<OrderStatisticTreap>> e : view.entrySet()) {
            if (result.size() >= limit) {
                break;
            }
            if (!e.getValue().get().isEmpty()) {
                result.add(e.getKey());
            }
        }
        return result;
    }

    private OrderStatisticTreap snapshot(AggregateName aggregate, String namespace) {
        AtomicReference<OrderStatisticTreap> slot = existingSlot(aggregate, namespace);
        return slot == null ? OrderStatisticTreap.EMPTY : slot.get();
    }

    private AtomicReference<OrderStatisticTreap> existingSlot(AggregateName aggregate, String namespace) {
        return partitions.get(aggregate).get(namespace);
    }

    private AtomicReference<OrderStatisticTreap> slot(AggregateName aggregate, String namespace) {
        return partitions.get(aggregate)
                .computeIfAbsent(namespace, ns -> new AtomicReference<>(OrderStatisticTreap.EMPTY));
    }
}
