package uk.gegc.questionbank.features.aggregate.application;

import org.springframework.stereotype.Component;
import uk.gegc.questionbank.features.aggregate.domain.exception.MissingRequiredDimensionException;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateEntry;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateSource;
import uk.gegc.questionbank.features.aggregate.domain.model.IndexedRecord;
import uk.gegc.questionbank.features.aggregate.domain.model.TaxonomyLevel;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps records to the namespace they occupy in each aggregate, and query scopes to the
 * namespace they read. All functions are pure.
 * <p>
 * Namespaces: {@code "global"}, a theme id, a subtheme id or {@code "no-subtheme"}, a group id or
 * {@code "no-group"}, a user id, or {@code "{userId}_{taxonomyId}"} for user-scoped levels.
 */
@Component
public class NamespaceRegistry {

    public static final String GLOBAL = "global";
    public static final String NO_SUBTHEME = "no-subtheme";
    public static final String NO_GROUP = "no-group";
    public static final String DELIMITER = "_";

    /**
     * Whether a record belongs in the aggregate at all. Writers skip aggregates that do not apply.
     */
    public boolean applies(AggregateName aggregate, IndexedRecord record) {
        if (aggregate.getSource() != record.source()) {
            return false;
        }
        if (aggregate.getSource().isUserScoped() && record.userId() == null) {
            return false;
        }
        if (aggregate.getLevel() == TaxonomyLevel.SUBTHEME_UNGROUPED) {
            return record.hasSubtheme() && !record.hasGroup();
        }
        return true;
    }

    /**
     * @throws MissingRequiredDimensionException if the record lacks a field the aggregate needs
     */
    public String namespaceFor(AggregateName aggregate, IndexedRecord record) {
        if (record.themeId() == null) {
            throw new MissingRequiredDimensionException(aggregate, "themeId", record.entityKey());
        }
        String taxonomyNamespace = switch (aggregate.getLevel()) {
            case GLOBAL -> null;
            case THEME -> record.themeId();
            case SUBTHEME -> record.hasSubtheme() ? record.subthemeId() : NO_SUBTHEME;
            case GROUP -> record.hasGroup() ? record.groupId() : NO_GROUP;
            case SUBTHEME_UNGROUPED -> {
                if (!record.hasSubtheme()) {
                    throw new MissingRequiredDimensionException(aggregate, "subthemeId", record.entityKey());
                }
                yield record.subthemeId();
            }
        };
        if (!aggregate.getSource().isUserScoped()) {
            return taxonomyNamespace == null ? GLOBAL : taxonomyNamespace;
        }
        if (record.userId() == null) {
            throw new MissingRequiredDimensionException(aggregate, "userId", record.entityKey());
        }
        return taxonomyNamespace == null ? record.userId() : composite(record.userId(), taxonomyNamespace);
    }

    public String sortKeyFor(AggregateName aggregate, IndexedRecord record) {
        return record.entityKey();
    }

    public AggregateEntry entryFor(AggregateName aggregate, IndexedRecord record) {
        return new AggregateEntry(aggregate, namespaceFor(aggregate, record), sortKeyFor(aggregate, record),
                record.entityKey());
    }

    /**
     * Entries for every aggregate of the record's source that applies to it.
     */
    public List<AggregateEntry> entriesFor(IndexedRecord record) {
        List<AggregateEntry> entries = new ArrayList<>();
        for (AggregateName aggregate : AggregateName.forSource(record.source())) {
            if (applies(aggregate, record)) {
                entries.add(entryFor(aggregate, record));
            }
        }
        return entries;
    }

    /**
     * Namespace read by a query over one taxonomy node. {@code taxonomyId} is ignored for
     * {@link TaxonomyLevel#GLOBAL}; {@code userId} is required for user-scoped sources.
     */
    public String namespaceForScope(AggregateSource source, TaxonomyLevel level, String taxonomyId, String userId) {
        String taxonomyNamespace = level == TaxonomyLevel.GLOBAL ? null : taxonomyId;
        if (level != TaxonomyLevel.GLOBAL && taxonomyId == null) {
            throw new IllegalArgumentException("Taxonomy id is required for level " + level);
        }
        if (!source.isUserScoped()) {
            return taxonomyNamespace == null ? GLOBAL : taxonomyNamespace;
        }
        if (userId == null) {
            throw new IllegalArgumentException("User id is required for source " + source);
        }
        return taxonomyNamespace == null ? userId : composite(userId, taxonomyNamespace);
    }

    /**
     * Joins a parent id and a child taxonomy id. The child never contains the delimiter, so the
     * last delimiter always marks the boundary even when the parent does.
     */
    public String composite(String parentId, String childId) {
        if (childId.contains(DELIMITER)) {
            throw new IllegalArgumentException("Taxonomy id must not contain '" + DELIMITER + "': " + childId);
        }
        return parentId + DELIMITER + childId;
    }
}
