package com.catalog.objcat.dsl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.catalog.objcat.api.LookupException;
import com.catalog.objcat.api.TypeMismatchException;

/**
 * Registry mapping recipe names to {@link DerivationRecipe}s, used to rebuild
 * derived values from definitions and snapshots.
 */
public final class RecipeRegistry {
    private final Map<String, DerivationRecipe<?>> recipes = new LinkedHashMap<>();

    public RecipeRegistry() {
        registerBuiltIns();
    }

    private RecipeRegistry(boolean builtIns) {
        if (builtIns) {
            registerBuiltIns();
        }
    }

    public static RecipeRegistry empty() {
        return new RecipeRegistry(false);
    }

    public RecipeRegistry register(DerivationRecipe<?> recipe) {
        if (recipes.containsKey(recipe.name())) {
            throw new IllegalArgumentException("Duplicate recipe name: " + recipe.name());
        }
        recipes.put(recipe.name(), recipe);
        return this;
    }

    public DerivationRecipe<?> get(String name) {
        DerivationRecipe<?> recipe = recipes.get(name);
        if (recipe == null) {
            throw new LookupException("Unknown recipe: " + name);
        }
        return recipe;
    }

    public Optional<DerivationRecipe<?>> find(String name) {
        return Optional.ofNullable(recipes.get(name));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(recipes.keySet());
    }

    private void registerBuiltIns() {
        register(DerivationRecipe.<Double>named("sum").arg("a").arg("b")
                .compute((Object a, Object b) -> number(a) + number(b)));
        register(DerivationRecipe.<Double>named("difference").arg("a").arg("b")
                .compute((Object a, Object b) -> number(a) - number(b)));
        register(DerivationRecipe.<Double>named("product").arg("a").arg("b")
                .compute((Object a, Object b) -> number(a) * number(b)));
        register(DerivationRecipe.<Double>named("ratio").arg("a").arg("b")
                .compute((Object a, Object b) -> number(a) / number(b)));
        register(DerivationRecipe.<Double>named("negate").arg("x")
                .compute((Object x) -> -number(x)));
        register(DerivationRecipe.<Object>named("copy").arg("x")
                .compute((Object x) -> x));
    }

    private static double number(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new TypeMismatchException("Expected a number, got " + value);
    }
}
