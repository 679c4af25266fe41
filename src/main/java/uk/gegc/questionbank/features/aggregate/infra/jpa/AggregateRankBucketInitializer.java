package uk.gegc.questionbank.features.aggregate.infra.jpa;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates bucket rows in their own transaction, so the writer's transaction only ever updates
 * rows that are already committed.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "questionbank.aggregates", name = "storage", havingValue = "jpa", matchIfMissing = true)
public class AggregateRankBucketInitializer {

    private final AggregateRankBucketRepository bucketRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void createIfMissing(AggregateRankBucketId id) {
        if (!bucketRepository.existsById(id)) {
            bucketRepository.saveAndFlush(new AggregateRankBucket(id, 0));
        }
    }
}
