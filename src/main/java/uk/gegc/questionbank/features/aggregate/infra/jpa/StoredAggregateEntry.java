package uk.gegc.questionbank.features.aggregate.infra.jpa;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateEntry;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;

import java.util.UUID;

@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(
        name = "aggregate_entries",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uq_aggregate_entry",
                        columnNames = {"aggregate_name", "namespace", "entity_key"}
                )
        },
        indexes = {
                @Index(name = "idx_aggregate_entry_order", columnList = "aggregate_name, namespace, sort_key, entity_key"),
                @Index(name = "idx_aggregate_entry_bucket",
                        columnList = "aggregate_name, namespace, bucket, sort_key, entity_key")
        }
)
public class StoredAggregateEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "aggregate_name", length = 64, nullable = false, updatable = false)
    private AggregateName aggregate;

    @Column(name = "namespace", length = 191, nullable = false, updatable = false)
    private String namespace;

    @Column(name = "sort_key", length = 191, nullable = false, updatable = false)
    private String sortKey;

    @Column(name = "entity_key", length = 64, nullable = false, updatable = false)
    private String entityKey;

    @Column(name = "bucket", length = 8, nullable = false, updatable = false)
    private String bucket;

    public static StoredAggregateEntry from(AggregateEntry entry) {
        StoredAggregateEntry stored = new StoredAggregateEntry();
        stored.setAggregate(entry.aggregate());
        stored.setNamespace(entry.namespace());
        stored.setSortKey(entry.sortKey());
        stored.setEntityKey(entry.entityKey());
        stored.setBucket(AggregateRankBucket.bucketOf(entry.sortKey()));
        return stored;
    }

    public AggregateEntry toEntry() {
        return new AggregateEntry(aggregate, namespace, sortKey, entityKey);
    }
}
