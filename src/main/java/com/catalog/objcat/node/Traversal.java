package com.catalog.objcat.node;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;

/**
 * Order in which {@link CatalogNode#visit} reaches the nodes of a subtree.
 *
 * <p>
 * Depth-first traversals place every node among its children at a slot:
 * slot 0 is pre-order, slot {@code n} (after all {@code n} children) is
 * post-order, anything in between visits the node after that many children.
 */
public abstract class Traversal {

    public static final Traversal PREORDER = rootAt(0);
    public static final Traversal POSTORDER = rootAt(-1);
    public static final Traversal LEVEL = new Traversal("level") {
        @Override
        void walk(CatalogNode root, Consumer<CatalogNode> action) {
            Deque<CatalogNode> queue = new ArrayDeque<>();
            queue.add(root);
            while (!queue.isEmpty()) {
                CatalogNode node = queue.poll();
                action.accept(node);
                queue.addAll(node.children());
            }
        }
    };

    private final String description;

    private Traversal(String description) {
        this.description = description;
    }

    /**
     * Visits each node at slot {@code slot} among its children. Negative slots
     * count back from the end, so {@code -1} is post-order.
     */
    public static Traversal rootAt(int slot) {
        return new SlotTraversal("rootAt(" + slot + ")") {
            @Override
            int slotFor(int childCount) {
                return slot >= 0 ? slot : childCount + 1 + slot;
            }
        };
    }

    /**
     * Visits each node after the given fraction of its children. Negative
     * fractions count back from the end, so {@code -1.0} is post-order.
     */
    public static Traversal rootAtFraction(double fraction) {
        if (Double.isNaN(fraction) || fraction < -1.0 || fraction > 1.0) {
            throw new IllegalArgumentException("Traversal fraction must be in [-1, 1]: " + fraction);
        }
        return new SlotTraversal("rootAtFraction(" + fraction + ")") {
            @Override
            int slotFor(int childCount) {
                int offset = (int) (fraction * childCount);
                int slot = fraction >= 0 ? offset : childCount + 1 + offset;
                return Math.max(0, Math.min(childCount, slot));
            }
        };
    }

    /**
     * Parses {@code preorder}, {@code postorder}, {@code level}, an integer
     * slot or a fractional slot.
     */
    public static Traversal parse(String text) {
        String t = text.strip().toLowerCase(Locale.ROOT);
        switch (t) {
            case "preorder":
            case "pre":
                return PREORDER;
            case "postorder":
            case "post":
                return POSTORDER;
            case "level":
            case "breadthfirst":
                return LEVEL;
            default:
                break;
        }
        try {
            if (t.contains(".")) {
                return rootAtFraction(Double.parseDouble(t));
            }
            return rootAt(Integer.parseInt(t));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unrecognized traversal: " + text, e);
        }
    }

    abstract void walk(CatalogNode root, Consumer<CatalogNode> action);

    @Override
    public String toString() {
        return description;
    }

    private abstract static class SlotTraversal extends Traversal {

        SlotTraversal(String description) {
            super(description);
        }

        abstract int slotFor(int childCount);

        @Override
        void walk(CatalogNode node, Consumer<CatalogNode> action) {
            List<CatalogNode> children = node.children();
            int n = children.size();
            int slot = Math.max(0, Math.min(n, slotFor(n)));
            for (int i = 0; i < n; i++) {
                if (i == slot) {
                    action.accept(node);
                }
                walk(children.get(i), action);
            }
            if (slot == n) {
                action.accept(node);
            }
        }
    }
}
