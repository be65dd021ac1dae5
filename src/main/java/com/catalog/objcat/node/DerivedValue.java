package com.catalog.objcat.node;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.catalog.objcat.api.CycleException;
import com.catalog.objcat.api.DuplicateOwnershipException;
import com.catalog.objcat.api.FailurePolicy;
import com.catalog.objcat.api.TypeConstraint;
import com.catalog.objcat.api.TypeMismatchException;
import com.catalog.objcat.api.UnresolvedDependencyException;
import com.catalog.objcat.config.CatalogSettings;
import com.catalog.objcat.engine.DependencySource;
import com.catalog.objcat.engine.InvalidationPass;
import com.catalog.objcat.fn.Fn1;
import com.catalog.objcat.fn.Fn2;
import com.catalog.objcat.fn.Fn3;
import com.catalog.objcat.fn.FnN;

import lombok.extern.log4j.Log4j2;

/**
 * Field value computed on demand from the current values of other fields.
 *
 * <p>
 * The result is cached until a dependency changes: every resolved dependency
 * field notifies this value, which then marks itself invalid and, while it is
 * the current entry of its own field, passes the notification on so that its
 * dependents go stale too. Nothing is recomputed until the next read.
 *
 * <p>
 * A derived value is bound to at most one field. Binding happens on first
 * insertion and cannot be undone.
 */
@Log4j2
public final class DerivedValue<T> implements FieldValue<T> {
    private final FnN<? extends T> fn;
    private final List<String> argNames;
    private final DependencySource dependencies;
    private final String recipe;
    private FailurePolicy failurePolicy;

    private T cached;
    private boolean valid;
    private boolean usable = true;
    private boolean computing;
    private Field<T> field;

    /**
     * @param fn            the derivation function, called with the dependency
     *                      values in declaration order
     * @param argNames      one name per dependency, used in failure reports
     * @param links         per dependency, a path string or a {@link Field}
     * @param pathNode      node paths are resolved from until the value is
     *                      bound to a field in a container, may be null
     * @param failurePolicy what a failed computation does
     * @param recipe        name of the recipe this value was built from, may be
     *                      null
     */
    public DerivedValue(FnN<? extends T> fn, List<String> argNames, List<?> links, CatalogNode pathNode,
            FailurePolicy failurePolicy, String recipe) {
        this.fn = Objects.requireNonNull(fn, "fn");
        if (argNames.size() != links.size()) {
            throw new IllegalArgumentException(
                    argNames.size() + " argument names given for " + links.size() + " dependencies");
        }
        this.argNames = List.copyOf(argNames);
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
        this.recipe = recipe;
        this.dependencies = new DependencySource(links, pathNode, (oldValue, newValue, pass) -> invalidate(pass));
    }

    @SuppressWarnings("unchecked")
    public static <A, T> DerivedValue<T> of(Fn1<A, ? extends T> fn, Object dep) {
        Objects.requireNonNull(fn, "fn");
        return build(args -> fn.apply((A) args[0]), dep);
    }

    @SuppressWarnings("unchecked")
    public static <A, B, T> DerivedValue<T> of(Fn2<A, B, ? extends T> fn, Object dep1, Object dep2) {
        Objects.requireNonNull(fn, "fn");
        return build(args -> fn.apply((A) args[0], (B) args[1]), dep1, dep2);
    }

    @SuppressWarnings("unchecked")
    public static <A, B, C, T> DerivedValue<T> of(Fn3<A, B, C, ? extends T> fn, Object dep1, Object dep2,
            Object dep3) {
        Objects.requireNonNull(fn, "fn");
        return build(args -> fn.apply((A) args[0], (B) args[1], (C) args[2]), dep1, dep2, dep3);
    }

    public static <T> DerivedValue<T> ofN(FnN<? extends T> fn, Object... deps) {
        return build(fn, deps);
    }

    private static <T> DerivedValue<T> build(FnN<? extends T> fn, Object... deps) {
        List<String> names = new ArrayList<>(deps.length);
        for (Object dep : deps) {
            names.add(dep instanceof Field<?> f ? f.name() : String.valueOf(dep));
        }
        return new DerivedValue<>(fn, names, Arrays.asList(deps), null,
                CatalogSettings.fromSystemProperties().getFailurePolicy(), null);
    }

    @Override
    public T value() {
        return value(failurePolicy);
    }

    /** Reads the value, handling a failed computation with {@code policy}. */
    public T value(FailurePolicy policy) {
        if (valid) {
            return cached;
        }
        if (computing) {
            return fail(policy, new CycleException("Derived value " + describe() + " depends on itself"));
        }
        computing = true;
        try {
            Object[] args = dependencies.getDependencyValues().toArray();
            T result = fn.apply(args);
            TypeConstraint constraint = constraint();
            if (result != null && !constraint.accepts(result)) {
                usable = false;
                throw new TypeMismatchException("Derived value " + result + " for " + describe()
                        + " is not of type " + constraint.describe());
            }
            usable = true;
            cached = result;
            valid = true;
            return result;
        } catch (UnresolvedDependencyException e) {
            return fail(policy, withArgumentNames(e));
        } catch (RuntimeException e) {
            return fail(policy, e);
        } finally {
            computing = false;
        }
    }

    private T fail(FailurePolicy policy, RuntimeException failure) {
        switch (policy) {
            case RAISE:
                throw failure;
            case WARN:
                log.warn("Problem encountered while deriving value for {}: {}", describe(), failure.getMessage());
                cached = null;
                valid = false;
                return null;
            case SKIP:
                cached = null;
                valid = false;
                return null;
            case IGNORE:
                cached = null;
                valid = true;
                return null;
            default:
                throw new IllegalStateException("Unknown failure policy " + policy);
        }
    }

    private UnresolvedDependencyException withArgumentNames(UnresolvedDependencyException e) {
        List<String> names = new ArrayList<>();
        for (int index : e.failedIndices()) {
            names.add(argNames.get(index));
        }
        String owner = field == null ? "unbound derived value" : "field " + field.name();
        return new UnresolvedDependencyException("Could not get dependent values " + names + " for " + owner
                + ": " + e.getMessage(), e.failedIndices(), names, e);
    }

    /** Marks the value stale and passes the change on to dependents. */
    public void invalidate() {
        invalidate(new InvalidationPass());
    }

    public void invalidate(InvalidationPass pass) {
        pass.enter(this);
        try {
            valid = false;
            Field<T> owner = field;
            if (owner != null && owner.isCurrent(this)) {
                owner.notifyValueChange(this, this, pass);
            }
        } finally {
            pass.exit(this);
        }
    }

    /** Drops path-resolved dependencies after the tree around them changed. */
    void relink() {
        if (dependencies.unlinkPaths()) {
            log.debug("Relinking {} after tree change", describe());
            invalidate();
        }
    }

    void markStale() {
        valid = false;
    }

    boolean canBindTo(Field<?> target) {
        return field == null || field == target;
    }

    void bindTo(Field<T> target) {
        if (!canBindTo(target)) {
            throw new DuplicateOwnershipException(describe() + " is already bound to field " + field.name());
        }
        field = target;
        valid = false;
        dependencies.resubscribe();
        if (target.node() != null) {
            dependencies.setPathNode(target.node());
        }
    }

    /** Stops listening to dependencies once the value left its field. */
    void release() {
        dependencies.unlinkAll();
        valid = false;
    }

    /** Points path resolution at {@code node}; resolved paths are dropped. */
    public void setPathNode(CatalogNode node) {
        dependencies.setPathNode(node);
        valid = false;
    }

    public CatalogNode pathNode() {
        return dependencies.pathNode();
    }

    private TypeConstraint constraint() {
        return field == null ? TypeConstraint.ANY : field.type();
    }

    @Override
    public DependencySource source() {
        return dependencies;
    }

    public boolean isValid() {
        return valid;
    }

    /** False after the last computed result failed the field's type check. */
    public boolean isUsable() {
        return usable;
    }

    public boolean isBound() {
        return field != null;
    }

    public Field<T> field() {
        return field;
    }

    public List<String> argumentNames() {
        return argNames;
    }

    /** Argument name to declared path, for path dependencies only. */
    public Map<String, String> links() {
        Map<String, String> out = new LinkedHashMap<>();
        List<String> paths = dependencies.links();
        for (int i = 0; i < paths.size(); i++) {
            if (paths.get(i) != null) {
                out.put(argNames.get(i), paths.get(i));
            }
        }
        return Collections.unmodifiableMap(out);
    }

    public Optional<String> recipe() {
        return Optional.ofNullable(recipe);
    }

    public FailurePolicy failurePolicy() {
        return failurePolicy;
    }

    public void setFailurePolicy(FailurePolicy failurePolicy) {
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
    }

    private String describe() {
        return recipe == null ? dependencies.name() : recipe + "/" + dependencies.name();
    }

    @Override
    public String toString() {
        return "Derived value " + describe() + (valid ? " = " + cached : " (stale)");
    }
}
