package com.catalog.objcat.util;

import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

import com.catalog.objcat.api.TypeConstraint;

/**
 * Factory methods for common {@link TypeConstraint}s, and the names they are
 * written under in catalog definitions.
 */
public final class TypeConstraints {
    private static final Map<String, TypeConstraint> NAMED = new LinkedHashMap<>();

    static {
        NAMED.put("any", TypeConstraint.ANY);
        NAMED.put("string", instanceOf(String.class));
        NAMED.put("boolean", instanceOf(Boolean.class));
        NAMED.put("integer", instanceOf(Integer.class));
        NAMED.put("long", instanceOf(Long.class));
        NAMED.put("double", instanceOf(Double.class));
        NAMED.put("number", instanceOf(Number.class));
        NAMED.put("double[]", arrayOf(double.class));
        NAMED.put("int[]", arrayOf(int.class));
        NAMED.put("string[]", arrayOf(String.class));
    }

    private TypeConstraints() {
    }

    public static TypeConstraint any() {
        return TypeConstraint.ANY;
    }

    /** Accepts instances of {@code type}; primitive types accept their wrapper. */
    public static TypeConstraint instanceOf(Class<?> type) {
        return new InstanceOf(box(Objects.requireNonNull(type, "type")));
    }

    /** Accepts arrays whose component type is exactly {@code componentType}. */
    public static TypeConstraint arrayOf(Class<?> componentType) {
        return new ArrayOf(Objects.requireNonNull(componentType, "componentType"));
    }

    public static TypeConstraint anyOf(Class<?>... types) {
        TypeConstraint[] options = new TypeConstraint[types.length];
        for (int i = 0; i < types.length; i++) {
            options[i] = instanceOf(types[i]);
        }
        return anyOf(options);
    }

    public static TypeConstraint anyOf(TypeConstraint... options) {
        return new AnyOf(List.of(options));
    }

    public static TypeConstraint matching(Predicate<Object> check, String description) {
        Objects.requireNonNull(check, "check");
        return new TypeConstraint() {
            @Override
            public boolean accepts(Object value) {
                return check.test(value);
            }

            @Override
            public String describe() {
                return description;
            }
        };
    }

    /**
     * Resolves a definition type name: one of the built-in names,
     * {@code class:<binary name>} or {@code array:<component binary name>}.
     * Null or blank means {@code any}.
     */
    public static TypeConstraint named(String name) {
        if (name == null || name.isBlank()) {
            return TypeConstraint.ANY;
        }
        TypeConstraint builtIn = NAMED.get(name.strip());
        if (builtIn != null) {
            return builtIn;
        }
        if (name.startsWith("class:")) {
            return instanceOf(loadClass(name.substring("class:".length())));
        }
        if (name.startsWith("array:")) {
            return arrayOf(loadClass(name.substring("array:".length())));
        }
        throw new IllegalArgumentException("Unknown type name: " + name);
    }

    /** The definition name of {@code constraint}, empty for custom checks. */
    public static Optional<String> nameOf(TypeConstraint constraint) {
        for (Map.Entry<String, TypeConstraint> e : NAMED.entrySet()) {
            if (e.getValue().equals(constraint)) {
                return Optional.of(e.getKey());
            }
        }
        if (constraint instanceof InstanceOf io) {
            return Optional.of("class:" + io.type().getName());
        }
        if (constraint instanceof ArrayOf ao && !ao.componentType().isPrimitive()) {
            return Optional.of("array:" + ao.componentType().getName());
        }
        return Optional.empty();
    }

    private static Class<?> loadClass(String binaryName) {
        try {
            return Class.forName(binaryName.strip());
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Unknown class in type name: " + binaryName, e);
        }
    }

    private static Class<?> box(Class<?> type) {
        if (!type.isPrimitive()) {
            return type;
        }
        return Array.get(Array.newInstance(type, 1), 0).getClass();
    }

    private record InstanceOf(Class<?> type) implements TypeConstraint {
        @Override
        public boolean accepts(Object value) {
            return type.isInstance(value);
        }

        @Override
        public String describe() {
            return type.getSimpleName();
        }

        @Override
        public Optional<Class<?>> valueClass() {
            return Optional.of(type);
        }
    }

    private record ArrayOf(Class<?> componentType) implements TypeConstraint {
        @Override
        public boolean accepts(Object value) {
            return value != null && value.getClass().isArray()
                    && value.getClass().getComponentType() == componentType;
        }

        @Override
        public String describe() {
            return componentType.getSimpleName() + "[]";
        }

        @Override
        public Optional<Class<?>> valueClass() {
            return Optional.of(Array.newInstance(componentType, 0).getClass());
        }
    }

    private record AnyOf(List<TypeConstraint> options) implements TypeConstraint {
        @Override
        public boolean accepts(Object value) {
            for (TypeConstraint option : options) {
                if (option.accepts(value)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public String describe() {
            return Arrays.toString(options.stream().map(TypeConstraint::describe).toArray());
        }
    }
}
