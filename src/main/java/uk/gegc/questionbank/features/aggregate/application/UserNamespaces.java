package uk.gegc.questionbank.features.aggregate.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.questionbank.features.aggregate.domain.model.AggregateName;
import uk.gegc.questionbank.features.aggregate.domain.model.TaxonomyLevel;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the namespaces one user owns in a user-scoped aggregate.
 * <p>
 * The per-user level has the single namespace {@code userId}. Taxonomy levels hold
 * {@code userId_taxonomyId} namespaces, which sort contiguously after {@code userId_}. Taxonomy
 * ids never contain the delimiter, so {@code a_b_x} belongs to user {@code a_b} and not to {@code a}.
 */
@Component
@RequiredArgsConstructor
public class UserNamespaces {

    private final OrderedAggregateIndex index;

    /**
     * @param after last namespace returned by the previous page, or {@code null} for the first page
     */
    public Page page(AggregateName aggregate, String userId, String after, int limit) {
        if (!aggregate.getSource().isUserScoped()) {
            throw new IllegalArgumentException("Aggregate " + aggregate + " is not user-scoped");
        }
        if (aggregate.getLevel() == TaxonomyLevel.GLOBAL) {
            return new Page(List.of(userId), userId, true);
        }
        String prefix = userId + NamespaceRegistry.DELIMITER;
        List<String> raw = index.namespaces(aggregate, after == null ? prefix : after, limit);
        List<String> owned = new ArrayList<>(raw.size());
        String cursor = after;
        for (String namespace : raw) {
            if (!namespace.startsWith(prefix)) {
                return new Page(owned, cursor, true);
            }
            if (!namespace.substring(prefix.length()).contains(NamespaceRegistry.DELIMITER)) {
                owned.add(namespace);
            }
            cursor = namespace;
        }
        return new Page(owned, cursor, raw.size() < limit);
    }

    public List<String> all(AggregateName aggregate, String userId, int batchSize) {
        List<String> namespaces = new ArrayList<>();
        String after = null;
        Page page;
        do {
            page = page(aggregate, userId, after, batchSize);
            namespaces.addAll(page.namespaces());
            after = page.nextCursor();
        } while (!page.done());
        return namespaces;
    }

    /**
     * @param nextCursor cursor for the following page; {@code done} means there is none
     */
    public record Page(List<String> namespaces, String nextCursor, boolean done) {
    }
}
