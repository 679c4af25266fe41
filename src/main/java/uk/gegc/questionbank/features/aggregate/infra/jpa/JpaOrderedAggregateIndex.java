package uk.gegc.questionbank.features.aggregate.infra.jpa;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.questionbank.features.aggregate.application.OrderedAggregateIndex;
import uk.gegc.questionbank.features.aggregate.domain.exception.DuplicateAggregateEntryException;
import uk.gegc.questionbank.features.aggregate.domain.exception.RankOutOfRangeException;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateEntry;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateKey;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;
import uk.gegc.questionbank.features.aggregate.domain.model.KeyBounds;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Persisted index backed by the {@code aggregate_entries} table plus per-namespace rank buckets
 * in {@code aggregate_rank_buckets}.
 * <p>
 * Every entry falls into the bucket named by the first characters of its sort key, and each
 * bucket keeps a count maintained in the writer's transaction. An unbounded count sums the
 * buckets of a namespace; {@link #at} skips whole buckets and only offsets inside the one that
 * holds the rank. Bounded counts still scan the requested key range.
 * <p>
 * A duplicate that slips in between the existence check and the flush surfaces as a
 * {@link DataIntegrityViolationException} from the unique constraint.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "questionbank.aggregates", name = "storage", havingValue = "jpa", matchIfMissing = true)
public class JpaOrderedAggregateIndex implements OrderedAggregateIndex {

    private final StoredAggregateEntryRepository repository;
    private final AggregateRankBucketRepository bucketRepository;
    private final AggregateRankBucketInitializer bucketInitializer;

    @Override
    @Transactional
    public void insert(AggregateEntry entry) {
        if (contains(entry.key())) {
            throw new DuplicateAggregateEntryException(entry.key());
        }
        store(entry);
    }

    @Override
    @Transactional
    public boolean insertIfAbsent(AggregateEntry entry) {
        if (contains(entry.key())) {
            return false;
        }
        store(entry);
        return true;
    }

    @Override
    @Transactional
    public boolean delete(AggregateKey key) {
        int removed = repository.deleteEntry(key.aggregate(), key.namespace(), key.sortKey(), key.entityKey());
        if (removed == 0) {
            return false;
        }
        bucketRepository.adjust(key.aggregate(), key.namespace(), AggregateRankBucket.bucketOf(key.sortKey()), -removed);
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean contains(AggregateKey key) {
        return repository.existsByAggregateAndNamespaceAndSortKeyAndEntityKey(
                key.aggregate(), key.namespace(), key.sortKey(), key.entityKey());
    }

    @Override
    @Transactional(readOnly = true)
    public long count(AggregateName aggregate, String namespace, KeyBounds bounds) {
        if (bounds == null || bounds.isUnbounded()) {
            return bucketRepository.totalCount(aggregate, namespace);
        }
        return repository.count(StoredAggregateEntrySpecifications.inRange(aggregate, namespace, bounds));
    }

    @Override
    @Transactional(readOnly = true)
    public AggregateEntry at(AggregateName aggregate, String namespace, long rank) {
        if (rank < 0) {
            throw new RankOutOfRangeException(aggregate, namespace, rank, count(aggregate, namespace));
        }
        long before = 0;
        for (RankBucketCount bucket : bucketRepository.findNonEmpty(aggregate, namespace)) {
            long size = bucket.entryCount();
            if (rank < before + size) {
                long offset = rank - before;
                List<StoredAggregateEntry> found = offset > Integer.MAX_VALUE
                        ? List.of()
                        : repository.findByAggregateAndNamespaceAndBucketOrderBySortKeyAscEntityKeyAsc(
                        aggregate, namespace, bucket.bucket(), PageRequest.of((int) offset, 1));
                if (found.isEmpty()) {
                    // the bucket lost entries after its count was read
                    throw new RankOutOfRangeException(aggregate, namespace, rank, before + size);
                }
                return found.get(0).toEntry();
            }
            before += size;
        }
        throw new RankOutOfRangeException(aggregate, namespace, rank, before);
    }

    @Override
    @Transactional
    public long clear(AggregateName aggregate, String namespace) {
        int removed = repository.deleteNamespace(aggregate, namespace);
        bucketRepository.resetNamespace(aggregate, namespace);
        log.debug("Cleared {} entries from {}/{}", removed, aggregate, namespace);
        return removed;
    }

    /**
     * Namespaces holding entries or a non-zero bucket count, so that clearing also reaches
     * counts that drifted away from their entries.
     */
    @Override
    @Transactional(readOnly = true)
    public List<String> namespaces(AggregateName aggregate, String after, int limit) {
        PageRequest page = PageRequest.of(0, limit);
        TreeSet<String> merged = new TreeSet<>();
        if (after == null) {
            merged.addAll(repository.findNamespaces(aggregate, page));
            merged.addAll(bucketRepository.findCountedNamespaces(aggregate, page));
        } else {
            merged.addAll(repository.findNamespacesAfter(aggregate, after, page));
            merged.addAll(bucketRepository.findCountedNamespacesAfter(aggregate, after, page));
        }
        List<String> result = new ArrayList<>(Math.min(limit, merged.size()));
        for (String namespace : merged) {
            if (result.size() >= limit) {
                break;
            }
            result.add(namespace);
        }
        return result;
    }

    private void store(AggregateEntry entry) {
        AggregateRankBucketId bucketId = new AggregateRankBucketId(
                entry.aggregate(), entry.namespace(), AggregateRankBucket.bucketOf(entry.sortKey()));
        if (!bucketRepository.existsById(bucketId)) {
            try {
                bucketInitializer.createIfMissing(bucketId);
            } catch (DataIntegrityViolationException e) {
                log.debug("Bucket {}/{}/{} was created concurrently", entry.aggregate(), entry.namespace(),
                        bucketId.getBucket());
            }
        }
        repository.saveAndFlush(StoredAggregateEntry.from(entry));
        if (bucketRepository.adjust(entry.aggregate(), entry.namespace(), bucketId.getBucket(), 1) != 1) {
            throw new IllegalStateException("Rank bucket " + bucketId.getBucket() + " missing for "
                    + entry.aggregate() + "/" + entry.namespace());
        }
    }
}
