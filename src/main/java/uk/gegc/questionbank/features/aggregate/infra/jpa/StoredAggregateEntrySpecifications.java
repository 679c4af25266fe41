package uk.gegc.questionbank.features.aggregate.infra.jpa;

import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;
import uk.gegc.questionbank.features.aggregate.domain.model.KeyBounds;

import java.util.ArrayList;
import java.util.List;

final class StoredAggregateEntrySpecifications {

    private StoredAggregateEntrySpecifications() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    static Specification<StoredAggregateEntry> inRange(AggregateName aggregate, String namespace, KeyBounds bounds) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            predicates.add(cb.equal(root.get("aggregate"), aggregate));
            predicates.add(cb.equal(root.get("namespace"), namespace));
            if (bounds.lower() != null) {
                predicates.add(bounds.lowerInclusive()
                        ? cb.greaterThanOrEqualTo(root.get("sortKey"), bounds.lower())
                        : cb.greaterThan(root.get("sortKey"), bounds.lower()));
            }
            if (bounds.upper() != null) {
                predicates.add(bounds.upperInclusive()
                        ? cb.lessThanOrEqualTo(root.get("sortKey"), bounds.upper())
                        : cb.lessThan(root.get("sortKey"), bounds.upper()));
            }
            return cb.and(predicates.toArray(Predicate[]::new));
        };
    }
}
