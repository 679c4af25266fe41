package uk.gegc.questionbank.features.aggregate.domain.model;

/**
 * Projection of a primary-store row onto the fields the namespace functions read.
 * Questions carry no user id; user facts carry the user id and the denormalized taxonomy
 * of their question. The entity key is always the question id.
 */
public record IndexedRecord(
        AggregateSource source,
        String entityKey,
        String userId,
        String themeId,
        String subthemeId,
        String groupId
) {

    public static IndexedRecord question(String questionId, String themeId, String subthemeId, String groupId) {
        return new IndexedRecord(AggregateSource.QUESTION, questionId, null, themeId, subthemeId, groupId);
    }

    public static IndexedRecord fact(AggregateSource source, String userId, String questionId,
                                     String themeId, String subthemeId, String groupId) {
        return new IndexedRecord(source, questionId, userId, themeId, subthemeId, groupId);
    }

    public boolean hasSubtheme() {
        return subthemeId != null;
    }

    public boolean hasGroup() {
        return groupId != null;
    }
}
