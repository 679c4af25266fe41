package uk.gegc.questionbank.features.aggregate.infra.jpa;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;

import java.util.List;

@Repository
public interface AggregateRankBucketRepository extends JpaRepository<AggregateRankBucket, AggregateRankBucketId> {

    @Modifying
    @Query("UPDATE AggregateRankBucket b SET b.entryCount = b.entryCount + :delta " +
            "WHERE b.id.aggregate = :aggregate AND b.id.namespace = :namespace AND b.id.bucket = :bucket")
    int adjust(@Param("aggregate") AggregateName aggregate,
               @Param("namespace") String namespace,
               @Param("bucket") String bucket,
               @Param("delta") long delta);

    @Query("SELECT COALESCE(SUM(b.entryCount), 0) FROM AggregateRankBucket b " +
            "WHERE b.id.aggregate = :aggregate AND b.id.namespace = :namespace")
    long totalCount(@Param("aggregate") AggregateName aggregate, @Param("namespace") String namespace);

    @Query("SELECT new uk.gegc.questionbank.features.aggregate.infra.jpa.RankBucketCount(b.id.bucket, b.entryCount) " +
            "FROM AggregateRankBucket b " +
            "WHERE b.id.aggregate = :aggregate AND b.id.namespace = :namespace AND b.entryCount > 0 " +
            "ORDER BY b.id.bucket")
    List<RankBucketCount> findNonEmpty(@Param("aggregate") AggregateName aggregate,
                                       @Param("namespace") String namespace);

    @Modifying
    @Query("UPDATE AggregateRankBucket b SET b.entryCount = 0 " +
            "WHERE b.id.aggregate = :aggregate AND b.id.namespace = :namespace")
    int resetNamespace(@Param("aggregate") AggregateName aggregate, @Param("namespace") String namespace);

    @Query("SELECT DISTINCT b.id.namespace FROM AggregateRankBucket b " +
            "WHERE b.id.aggregate = :aggregate AND b.entryCount <> 0 ORDER BY b.id.namespace")
    List<String> findCountedNamespaces(@Param("aggregate") AggregateName aggregate, Pageable pageable);

    @Query("SELECT DISTINCT b.id.namespace FROM AggregateRankBucket b " +
            "WHERE b.id.aggregate = :aggregate AND b.entryCount <> 0 AND b.id.namespace > :after " +
            "ORDER BY b.id.namespace")
    List<String> findCountedNamespacesAfter(@Param("aggregate") AggregateName aggregate,
                                            @Param("after") String after,
                                            Pageable pageable);
}
