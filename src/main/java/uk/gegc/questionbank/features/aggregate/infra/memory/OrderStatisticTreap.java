package uk.gegc.questionbank.features.aggregate.infra.memory;

/**
 * Immutable treap ordered by {@code (sortKey, entityKey)} with subtree sizes, giving
 * O(log n) expected insert, delete, rank selection and range counting.
 * <p>
 * Updates copy only the search path and return a new instance, so a reference to a treap is a
 * stable snapshot that concurrent readers can traverse without coordination.
 */
final class OrderStatisticTreap {

    static final OrderStatisticTreap EMPTY = new OrderStatisticTreap(null);

    private final Node root;

    private OrderStatisticTreap(Node root) {
        this.root = root;
    }

    int size() {
        return size(root);
    }

    boolean isEmpty() {
        return root == null;
    }

    boolean contains(String sortKey, String entityKey) {
        Node node = root;
        while (node != null) {
            int cmp = compare(sortKey, entityKey, node);
            if (cmp == 0) {
                return true;
            }
            node = cmp < 0 ? node.left : node.right;
        }
        return false;
    }

    /**
     * @return a treap containing the key; {@code this} when the key is already present
     */
    OrderStatisticTreap insert(String sortKey, String entityKey) {
        if (contains(sortKey, entityKey)) {
            return this;
        }
        Node[] parts = split(root, sortKey, entityKey, false);
        Node single = new Node(sortKey, entityKey, priority(sortKey, entityKey), null, null);
        return new OrderStatisticTreap(merge(merge(parts[0], single), parts[1]));
    }

    /**
     * @return a treap without the key; {@code this} when the key is absent
     */
    OrderStatisticTreap remove(String sortKey, String entityKey) {
        if (!contains(sortKey, entityKey)) {
            return this;
        }
        Node[] lower = split(root, sortKey, entityKey, false);
        Node[] upper = split(lower[1], sortKey, entityKey, true);
        return new OrderStatisticTreap(merge(lower[0], upper[1]));
    }

    /**
     * Entry at zero-based {@code rank}, or {@code null} when out of range.
     */
    String[] select(long rank) {
        if (rank < 0 || rank >= size()) {
            return null;
        }
        Node node = root;
        long remaining = rank;
        while (node != null) {
            int leftSize = size(node.left);
            if (remaining < leftSize) {
                node = node.left;
            } else if (remaining == leftSize) {
                return new String[]{node.sortKey, node.entityKey};
            } else {
                remaining -= leftSize + 1;
                node = node.right;
            }
        }
        return null;
    }

    /**
     * Number of entries whose sort key is below {@code sortKey}, or at most {@code sortKey} when
     * {@code inclusive}.
     */
    long countSortKeysBelow(String sortKey, boolean inclusive) {
        long count = 0;
        Node node = root;
        while (node != null) {
            int cmp = node.sortKey.compareTo(sortKey);
            if (cmp < 0 || (cmp == 0 && inclusive)) {
                count += size(node.left) + 1L;
                node = node.right;
            } else {
                node = node.left;
            }
        }
        return count;
    }

    // Splits into keys before (key) and the rest; with takeEqual the key itself goes left.
    private static Node[] split(Node node, String sortKey, String entityKey, boolean takeEqual) {
        if (node == null) {
            return new Node[]{null, null};
        }
        int cmp = compare(sortKey, entityKey, node);
        boolean nodeGoesLeft = cmp > 0 || (cmp == 0 && takeEqual);
        if (nodeGoesLeft) {
            Node[] parts = split(node.right, sortKey, entityKey, takeEqual);
            return new Node[]{node.withRight(parts[0]), parts[1]};
        }
        Node[] parts = split(node.left, sortKey, entityKey, takeEqual);
        return new Node[]{parts[0], node.withLeft(parts[1])};
    }

    private static Node merge(Node left, Node right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        if (left.priority >= right.priority) {
            return left.withRight(merge(left.right, right));
        }
        return right.withLeft(merge(left, right.left));
    }

    private static int compare(String sortKey, String entityKey, Node node) {
        int cmp = sortKey.compareTo(node.sortKey);
        return cmp != 0 ? cmp : entityKey.compareTo(node.entityKey);
    }

    private static int size(Node node) {
        return node == null ? 0 : node.size;
    }

    private static int priority(String sortKey, String entityKey) {
        int h = entityKey.hashCode() * 31 + sortKey.hashCode();
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
    }

    private static final class Node {
        final String sortKey;
        final String entityKey;
        final int priority;
        final Node left;
        final Node right;
        final int size;

        Node(String sortKey, String entityKey, int priority, Node left, Node right) {
            this.sortKey = sortKey;
            this.entityKey = entityKey;
            this.priority = priority;
            this.left = left;
            this.right = right;
            this.size = size(left) + size(right) + 1;
        }

        Node withLeft(Node newLeft) {
            return new Node(sortKey, entityKey, priority, newLeft, right);
        }

        Node withRight(Node newRight) {
            return new Node(sortKey, entityKey, priority, left, newRight);
        }
    }
}
