package com.catalog.objcat.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

import com.catalog.objcat.api.ChangeListener;
import com.catalog.objcat.api.LookupException;
import com.catalog.objcat.api.Subscription;
import com.catalog.objcat.api.UnresolvedDependencyException;
import com.catalog.objcat.node.CatalogNode;
import com.catalog.objcat.node.Field;
import com.catalog.objcat.node.FieldNode;
import com.catalog.objcat.source.Source;

import lombok.extern.log4j.Log4j2;

/**
 * Source of a derived value: the ordered list of fields it depends on.
 *
 * <p>
 * Each slot is either a direct reference to a {@link Field} or a
 * {@link PathExpression} resolved lazily against the path node. A resolved
 * path slot is dead when its field left its container or when the path node
 * changed; dead and unresolved slots are resolved again on the next read.
 * Every resolved field carries a subscription to the owner's change listener.
 *
 * <p>
 * Dependency sources are never interned; each gets a unique name.
 */
@Log4j2
public final class DependencySource extends Source {
    private static final AtomicInteger INSTANCES = new AtomicInteger();

    private final PathExpression[] paths;
    private final Field<?>[] fields;
    private final Subscription[] subscriptions;
    private final ChangeListener listener;
    private CatalogNode pathNode;

    /**
     * @param links    per slot, either a path string or a {@link Field}
     * @param pathNode node path strings are resolved from, may be null
     * @param listener registered on every resolved field, may be null
     */
    public DependencySource(List<?> links, CatalogNode pathNode, ChangeListener listener) {
        super("dependent" + INSTANCES.getAndIncrement(), null);
        int n = links.size();
        this.paths = new PathExpression[n];
        this.fields = new Field<?>[n];
        this.subscriptions = new Subscription[n];
        this.listener = listener;
        this.pathNode = pathNode;
        for (int i = 0; i < n; i++) {
            Object link = links.get(i);
            if (link instanceof Field<?> field) {
                link(i, field);
            } else if (link instanceof String path) {
                paths[i] = PathExpression.parse(path);
            } else {
                throw new IllegalArgumentException("Dependency " + i + " must be a path string or a Field, got "
                        + (link == null ? "null" : link.getClass().getName()));
            }
        }
    }

    public int size() {
        return fields.length;
    }

    public CatalogNode pathNode() {
        return pathNode;
    }

    /** Moves path resolution to {@code node}, dropping all path-resolved references. */
    public void setPathNode(CatalogNode node) {
        if (node == pathNode) {
            return;
        }
        pathNode = node;
        unlinkPaths();
    }

    /**
     * Drops the references resolved through paths.
     *
     * @return whether anything was dropped
     */
    public boolean unlinkPaths() {
        boolean dropped = false;
        for (int i = 0; i < fields.length; i++) {
            if (paths[i] != null && fields[i] != null) {
                unlink(i);
                dropped = true;
            }
        }
        return dropped;
    }

    /**
     * Cancels every subscription and forgets path-resolved fields. Direct
     * references are kept unsubscribed until {@link #resubscribe()}.
     */
    public void unlinkAll() {
        for (int i = 0; i < fields.length; i++) {
            if (subscriptions[i] != null) {
                subscriptions[i].cancel();
                subscriptions[i] = null;
            }
            if (paths[i] != null) {
                fields[i] = null;
            }
        }
        log.debug("{} released its dependencies", name());
    }

    /** Subscribes again to direct references dropped by {@link #unlinkAll()}. */
    public void resubscribe() {
        if (listener == null) {
            return;
        }
        for (int i = 0; i < fields.length; i++) {
            if (paths[i] == null && fields[i] != null && subscriptions[i] == null) {
                subscriptions[i] = fields[i].registerNotifier(listener);
            }
        }
    }

    /** Declared path per slot, null for direct field references. */
    public List<String> links() {
        List<String> out = new ArrayList<>(paths.length);
        for (PathExpression path : paths) {
            out.add(path == null ? null : path.text());
        }
        return Collections.unmodifiableList(out);
    }

    /** Whether every slot was declared as a path. */
    public boolean isPathOnly() {
        for (PathExpression path : paths) {
            if (path == null) {
                return false;
            }
        }
        return true;
    }

    public boolean isLive(int index) {
        Field<?> field = fields[index];
        if (field == null) {
            return false;
        }
        if (paths[index] == null) {
            return true;
        }
        FieldNode owner = field.node();
        return owner != null && owner.holds(field);
    }

    public boolean isResolved() {
        for (int i = 0; i < fields.length; i++) {
            if (!isLive(i)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Resolves every dead or unresolved slot. Slots that resolve are kept even
     * when others fail.
     *
     * @return the referenced fields in declaration order
     * @throws UnresolvedDependencyException naming the failed slots
     */
    public List<Field<?>> populateReferences() {
        List<Integer> failed = new ArrayList<>();
        LookupException firstCause = null;
        for (int i = 0; i < fields.length; i++) {
            if (isLive(i)) {
                continue;
            }
            if (paths[i] == null || pathNode == null) {
                failed.add(i);
                continue;
            }
            try {
                link(i, paths[i].resolve(pathNode));
            } catch (LookupException e) {
                failed.add(i);
                if (firstCause == null) {
                    firstCause = e;
                }
            }
        }
        if (!failed.isEmpty()) {
            int[] indices = failed.stream().mapToInt(Integer::intValue).toArray();
            String message = pathNode == null
                    ? "Missing or dead field(s) cannot be dereferenced without a catalog location"
                    : "Could not resolve dependencies " + failed + " of " + name() + " from " + pathNode;
            throw new UnresolvedDependencyException(message, indices, firstCause);
        }
        return List.of(fields);
    }

    /** The current value of each dependency in declaration order, resolving first if needed. */
    public List<Object> getDependencyValues() {
        if (!isResolved()) {
            populateReferences();
        }
        List<Object> values = new ArrayList<>(fields.length);
        for (Field<?> field : fields) {
            values.add(field.currentValue());
        }
        return values;
    }

    private void link(int index, Field<?> field) {
        Objects.requireNonNull(field, "field");
        if (subscriptions[index] != null) {
            subscriptions[index].cancel();
        }
        fields[index] = field;
        subscriptions[index] = listener == null ? null : field.registerNotifier(listener);
        log.debug("{} slot {} linked to field {}", name(), index, field.name());
    }

    private void unlink(int index) {
        if (subscriptions[index] != null) {
            subscriptions[index].cancel();
            subscriptions[index] = null;
        }
        fields[index] = null;
    }
}
