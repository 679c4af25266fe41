package uk.gegc.questionbank.features.aggregate.infra.jpa;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Number of entries of one namespace whose sort key starts with {@link AggregateRankBucketId#getBucket()}.
 * Summing the buckets of a namespace gives its size; walking them in bucket order narrows a rank
 * lookup to a single bucket.
 * <p>
 * Rows are never deleted. Clearing a namespace resets its buckets to zero so that concurrent
 * writers always find the row they adjust.
 */
@Entity
@Table(name = "aggregate_rank_buckets")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class AggregateRankBucket {

    static final int PREFIX_LENGTH = 2;

    @EmbeddedId
    private AggregateRankBucketId id;

    @Column(name = "entry_count", nullable = false)
    private long entryCount;

    /**
     * Fixed-length prefix of a sort key. Truncation keeps lexical order, so bucket order followed by
     * sort-key order inside a bucket is the order of the whole namespace.
     */
    static String bucketOf(String sortKey) {
        return sortKey.length() <= PREFIX_LENGTH ? sortKey : sortKey.substring(0, PREFIX_LENGTH);
    }
}
