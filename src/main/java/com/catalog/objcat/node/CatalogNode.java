package com.catalog.objcat.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

import com.catalog.objcat.api.CycleException;

import lombok.extern.log4j.Log4j2;

/**
 * Element of a catalog tree.
 *
 * <p>
 * A node owns its ordered children and refers back to its parent without
 * owning it. The tree never contains cycles: {@link #setParent} refuses to
 * make a node its own ancestor and leaves the tree untouched when it does.
 */
@Log4j2
public abstract class CatalogNode {
    private final List<CatalogNode> children = new ArrayList<>();
    private final List<CatalogNode> childrenView = Collections.unmodifiableList(children);
    private CatalogNode parent;

    protected CatalogNode(CatalogNode parent) {
        if (parent != null) {
            attach(parent);
        }
    }

    public CatalogNode parent() {
        return parent;
    }

    /**
     * Moves this node under {@code newParent}, appending it to the new
     * parent's children. {@code null} detaches the node.
     *
     * @throws CycleException if {@code newParent} is this node or one of its
     *                        descendants
     */
    public void setParent(CatalogNode newParent) {
        if (newParent == null) {
            if (parent != null) {
                detach();
                treeChanged();
            }
            return;
        }
        CatalogNode oldParent = parent;
        attach(newParent);
        if (oldParent != newParent) {
            treeChanged();
        }
    }

    private void attach(CatalogNode newParent) {
        for (CatalogNode n = newParent; n != null; n = n.parent) {
            if (n == this) {
                throw new CycleException("Setting parent of " + this + " to " + newParent + " would create a cycle");
            }
        }
        detach();
        newParent.children.add(this);
        parent = newParent;
        log.debug("Attached {} under {}", this, newParent);
    }

    private void detach() {
        if (parent != null) {
            parent.removeChild(this);
            parent = null;
        }
    }

    private void removeChild(CatalogNode child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                children.remove(i);
                return;
            }
        }
    }

    private void treeChanged() {
        onTreeChanged();
        for (CatalogNode child : children) {
            child.treeChanged();
        }
    }

    /** Called on every node of a subtree after the subtree moved. */
    protected void onTreeChanged() {
    }

    /** Unmodifiable, live, ordered view of the children. */
    public List<CatalogNode> children() {
        return childrenView;
    }

    public int childCount() {
        return children.size();
    }

    public CatalogNode child(int index) {
        return children.get(index);
    }

    public CatalogNode root() {
        CatalogNode node = this;
        while (node.parent != null) {
            node = node.parent;
        }
        return node;
    }

    public boolean isAncestorOf(CatalogNode other) {
        for (CatalogNode n = other == null ? null : other.parent; n != null; n = n.parent) {
            if (n == this) {
                return true;
            }
        }
        return false;
    }

    /**
     * Reorders the children: child {@code order[i]} becomes child {@code i}.
     *
     * @throws IllegalArgumentException unless {@code order} holds each child
     *                                  index exactly once
     */
    public void reorderChildren(int... order) {
        int n = children.size();
        if (order.length != n) {
            throw new IllegalArgumentException(
                    "Permutation has " + order.length + " entries for " + n + " children");
        }
        boolean[] seen = new boolean[n];
        List<CatalogNode> reordered = new ArrayList<>(n);
        for (int index : order) {
            if (index < 0 || index >= n) {
                throw new IllegalArgumentException("Permutation index " + index + " out of range");
            }
            if (seen[index]) {
                throw new IllegalArgumentException("Permutation repeats index " + index);
            }
            seen[index] = true;
            reordered.add(children.get(index));
        }
        children.clear();
        children.addAll(reordered);
    }

    public void reorderChildren(Comparator<? super CatalogNode> comparator) {
        children.sort(Objects.requireNonNull(comparator, "comparator"));
    }

    public void reverseChildren() {
        Collections.reverse(children);
    }

    /** Number of nodes in this subtree, this node included. */
    public int countNodes() {
        int count = 1;
        for (CatalogNode child : children) {
            count += child.countNodes();
        }
        return count;
    }

    public final <R> List<R> visit(Function<? super CatalogNode, ? extends R> visitor) {
        return visit(visitor, Traversal.POSTORDER, VisitFilter.none());
    }

    public final <R> List<R> visit(Function<? super CatalogNode, ? extends R> visitor, Traversal traversal) {
        return visit(visitor, traversal, VisitFilter.none());
    }

    /**
     * Calls {@code visitor} on every node of this subtree in {@code traversal}
     * order and collects the results.
     */
    public final <R> List<R> visit(Function<? super CatalogNode, ? extends R> visitor, Traversal traversal,
            VisitFilter<? super R> filter) {
        List<R> results = new ArrayList<>();
        traversal.walk(this, node -> {
            if (filter.admits(node)) {
                results.add(visitor.apply(node));
            }
        });
        if (filter.hasSentinel()) {
            results.removeIf(filter::rejectsResult);
        }
        return results;
    }

    /** Whether path qualifiers naming {@code qualifier} select this node. */
    public boolean matches(String qualifier) {
        return getClass().getSimpleName().equals(qualifier);
    }
}
