package uk.gegc.questionbank.features.aggregate.infra.jpa;

/**
 * Read-only view of a bucket count, detached from the persistence context so bulk count updates
 * in the same transaction are always visible.
 */
public record RankBucketCount(String bucket, long entryCount) {
}
