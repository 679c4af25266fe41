package uk.gegc.questionbank.features.aggregate.infra.jpa;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;

import java.util.List;
import java.util.UUID;

@Repository
public interface StoredAggregateEntryRepository extends JpaRepository<StoredAggregateEntry, UUID>,
        JpaSpecificationExecutor<StoredAggregateEntry> {

    boolean existsByAggregateAndNamespaceAndSortKeyAndEntityKey(AggregateName aggregate,
                                                                 String namespace,
                                                                 String sortKey,
                                                                 String entityKey);

    List<StoredAggregateEntry> findByAggregateAndNamespaceAndBucketOrderBySortKeyAscEntityKeyAsc(
            AggregateName aggregate,
            String namespace,
            String bucket,
            Pageable pageable);

    @Modifying
    @Query("DELETE FROM StoredAggregateEntry e " +
            "WHERE e.aggregate = :aggregate AND e.namespace = :namespace " +
            "AND e.sortKey = :sortKey AND e.entityKey = :entityKey")
    int deleteEntry(@Param("aggregate") AggregateName aggregate,
                    @Param("namespace") String namespace,
                    @Param("sortKey") String sortKey,
                    @Param("entityKey") String entityKey);

    @Modifying
    @Query("DELETE FROM StoredAggregateEntry e WHERE e.aggregate = :aggregate AND e.namespace = :namespace")
    int deleteNamespace(@Param("aggregate") AggregateName aggregate, @Param("namespace") String namespace);

    @Query("SELECT DISTINCT e.namespace FROM StoredAggregateEntry e " +
            "WHERE e.aggregate = :aggregate ORDER BY e.namespace")
    List<String> findNamespaces(@Param("aggregate") AggregateName aggregate, Pageable pageable);

    @Query("SELECT DISTINCT e.namespace FROM StoredAggregateEntry e " +
            "WHERE e.aggregate = :aggregate AND e.namespace > :after ORDER BY e.namespace")
    List<String> findNamespacesAfter(@Param("aggregate") AggregateName aggregate,
                                     @Param("after") String after,
                                     Pageable pageable);
}
