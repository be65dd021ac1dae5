package com.catalog.objcat.dsl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.catalog.objcat.api.FailurePolicy;
import com.catalog.objcat.config.CatalogSettings;
import com.catalog.objcat.fn.Fn1;
import com.catalog.objcat.fn.Fn2;
import com.catalog.objcat.fn.Fn3;
import com.catalog.objcat.fn.FnN;
import com.catalog.objcat.node.CatalogNode;
import com.catalog.objcat.node.DerivedValue;

/**
 * Named, storable declaration of a derived value: a function together with
 * its argument names and the path each argument links to by default.
 *
 * <pre>{@code
 * DerivationRecipe<Double> plusOne = DerivationRecipe.<Double>named("plusOne")
 *         .arg("num")
 *         .compute((Double num) -> num + 1);
 * }</pre>
 */
public final class DerivationRecipe<T> {
    private final String name;
    private final List<String> argNames;
    private final Map<String, String> defaultLinks;
    private final FnN<? extends T> fn;

    private DerivationRecipe(String name, List<String> argNames, Map<String, String> defaultLinks,
            FnN<? extends T> fn) {
        this.name = name;
        this.argNames = List.copyOf(argNames);
        this.defaultLinks = Collections.unmodifiableMap(new LinkedHashMap<>(defaultLinks));
        this.fn = fn;
    }

    public static <T> Builder<T> named(String name) {
        return new Builder<>(name);
    }

    public String name() {
        return name;
    }

    public List<String> argumentNames() {
        return argNames;
    }

    public Map<String, String> defaultLinks() {
        return defaultLinks;
    }

    public DerivedValue<T> instantiate() {
        return instantiate(null, Map.of());
    }

    public DerivedValue<T> instantiate(Map<String, String> linkOverrides) {
        return instantiate(null, linkOverrides);
    }

    public DerivedValue<T> instantiate(CatalogNode pathNode, Map<String, String> linkOverrides) {
        return instantiate(pathNode, linkOverrides, CatalogSettings.fromSystemProperties().getFailurePolicy());
    }

    /**
     * Builds a derived value linked to the default paths, except for the
     * arguments named in {@code linkOverrides}.
     */
    public DerivedValue<T> instantiate(CatalogNode pathNode, Map<String, String> linkOverrides,
            FailurePolicy policy) {
        Map<String, String> overrides = linkOverrides == null ? Map.of() : linkOverrides;
        for (String key : overrides.keySet()) {
            if (!argNames.contains(key)) {
                throw new IllegalArgumentException("Recipe " + name + " has no argument " + key);
            }
        }
        List<String> links = new ArrayList<>(argNames.size());
        for (String arg : argNames) {
            links.add(overrides.getOrDefault(arg, defaultLinks.get(arg)));
        }
        return new DerivedValue<>(fn, argNames, links, pathNode, policy, name);
    }

    @Override
    public String toString() {
        return "Recipe " + name + argNames;
    }

    /** Collects argument declarations, then takes the function. */
    public static final class Builder<T> {
        private final String name;
        private final List<String> argNames = new ArrayList<>();
        private final Map<String, String> links = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        /** Declares an argument linked by default to the same-named field on the node itself. */
        public Builder<T> arg(String argName) {
            return arg(argName, argName);
        }

        public Builder<T> arg(String argName, String defaultLink) {
            if (links.containsKey(argName)) {
                throw new IllegalArgumentException("Duplicate argument " + argName + " in recipe " + name);
            }
            argNames.add(argName);
            links.put(argName, Objects.requireNonNull(defaultLink, "defaultLink"));
            return this;
        }

        @SuppressWarnings("unchecked")
        public <A> DerivationRecipe<T> compute(Fn1<A, ? extends T> fn) {
            requireArity(1);
            return computeN(args -> fn.apply((A) args[0]));
        }

        @SuppressWarnings("unchecked")
        public <A, B> DerivationRecipe<T> compute(Fn2<A, B, ? extends T> fn) {
            requireArity(2);
            return computeN(args -> fn.apply((A) args[0], (B) args[1]));
        }

        @SuppressWarnings("unchecked")
        public <A, B, C> DerivationRecipe<T> compute(Fn3<A, B, C, ? extends T> fn) {
            requireArity(3);
            return computeN(args -> fn.apply((A) args[0], (B) args[1], (C) args[2]));
        }

        public DerivationRecipe<T> computeN(FnN<? extends T> fn) {
            Objects.requireNonNull(fn, "fn");
            return new DerivationRecipe<>(name, argNames, links, fn);
        }

        private void requireArity(int arity) {
            if (argNames.size() != arity) {
                throw new IllegalArgumentException("Recipe " + name + " declares " + argNames.size()
                        + " arguments but its function takes " + arity);
            }
        }
    }
}
