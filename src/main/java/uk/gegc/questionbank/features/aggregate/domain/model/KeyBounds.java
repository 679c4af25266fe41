package uk.gegc.questionbank.features.aggregate.domain.model;

/**
 * Optional range over sort keys. A {@code null} bound is open on that side.
 */
public record KeyBounds(String lower, boolean lowerInclusive, String upper, boolean upperInclusive) {

    private static final KeyBounds UNBOUNDED = new KeyBounds(null, true, null, true);

    public static KeyBounds unbounded() {
        return UNBOUNDED;
    }

    public static KeyBounds between(String lower, String upper) {
        return new KeyBounds(lower, true, upper, true);
    }

    public boolean isUnbounded() {
        return lower == null && upper == null;
    }

    public boolean contains(String sortKey) {
        if (lower != null) {
            int cmp = sortKey.compareTo(lower);
            if (cmp < 0 || (cmp == 0 && !lowerInclusive)) {
                return false;
            }
        }
        if (upper != null) {
            int cmp = sortKey.compareTo(upper);
            return cmp < 0 || (cmp == 0 && upperInclusive);
        }
        return true;
    }
}
