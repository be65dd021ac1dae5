package com.catalog.objcat.dsl;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import com.catalog.objcat.api.TypeConstraint;

/**
 * Registered field layout of a structured entity type.
 *
 * <pre>{@code
 * NodeSchema star = NodeSchema.builder("Star")
 *         .field("name", TypeConstraints.instanceOf(String.class))
 *         .field("mag", TypeConstraints.instanceOf(Double.class), 0.0)
 *         .derived("flux", TypeConstraints.instanceOf(Double.class), fluxRecipe)
 *         .build();
 * }</pre>
 */
public final class NodeSchema {
    private final String name;
    private final List<FieldDescriptor> fields;

    private NodeSchema(String name, List<FieldDescriptor> fields) {
        this.name = name;
        this.fields = List.copyOf(fields);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public List<FieldDescriptor> fields() {
        return fields;
    }

    public Optional<FieldDescriptor> field(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
    }

    public List<String> fieldNames() {
        List<String> names = new ArrayList<>(fields.size());
        for (FieldDescriptor f : fields) {
            names.add(f.name());
        }
        return names;
    }

    @Override
    public String toString() {
        return "Schema " + name + fieldNames();
    }

    public static final class Builder {
        private final String name;
        private final List<FieldDescriptor> fields = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder field(String fieldName, TypeConstraint type) {
            return add(new FieldDescriptor(fieldName, type, null, false, null, null));
        }

        public Builder field(String fieldName, TypeConstraint type, Object defaultValue) {
            return add(new FieldDescriptor(fieldName, type, defaultValue, true, null, null));
        }

        public Builder derived(String fieldName, TypeConstraint type, DerivationRecipe<?> recipe) {
            return derived(fieldName, type, recipe, Map.of());
        }

        public Builder derived(String fieldName, TypeConstraint type, DerivationRecipe<?> recipe,
                Map<String, String> linkOverrides) {
            return add(new FieldDescriptor(fieldName, type, null, false,
                    Objects.requireNonNull(recipe, "recipe"), linkOverrides));
        }

        public Builder add(FieldDescriptor descriptor) {
            fields.add(descriptor);
            return this;
        }

        public NodeSchema build() {
            Set<String> seen = new LinkedHashSet<>();
            for (FieldDescriptor f : fields) {
                if (!seen.add(f.name())) {
                    throw new IllegalArgumentException("Duplicate field " + f.name() + " in schema " + name);
                }
            }
            return new NodeSchema(name, fields);
        }
    }
}
