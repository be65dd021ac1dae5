package com.catalog.objcat.node;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import com.catalog.objcat.api.DuplicateOwnershipException;
import com.catalog.objcat.api.LookupException;
import com.catalog.objcat.api.MissingPolicy;
import com.catalog.objcat.source.Source;

import lombok.extern.log4j.Log4j2;

/**
 * Catalog node owning a named, ordered set of {@link Field}s.
 */
@Log4j2
public class FieldNode extends CatalogNode {
    private final List<Field<?>> fields = new ArrayList<>();
    private final Map<String, Field<?>> byName = new HashMap<>();

    public FieldNode() {
        this(null);
    }

    public FieldNode(CatalogNode parent) {
        super(parent);
    }

    /**
     * @throws DuplicateOwnershipException if the name is taken or the field
     *                                     belongs to another container
     */
    public void addField(Field<?> field) {
        Objects.requireNonNull(field, "field");
        if (byName.containsKey(field.name())) {
            throw new DuplicateOwnershipException("Field \"" + field.name() + "\" already present in " + this);
        }
        if (field.node() != null) {
            throw new DuplicateOwnershipException(
                    "Field \"" + field.name() + "\" already resides in " + field.node());
        }
        fields.add(field);
        byName.put(field.name(), field);
        field.attachTo(this);
        log.debug("Added field {} to {}", field.name(), this);
    }

    /**
     * Removes the field, announcing to its listeners that it went empty so
     * dependents go stale.
     */
    public void delField(String name) {
        Field<?> field = field(name);
        field.detach();
        byName.remove(name);
        fields.remove(field);
        log.debug("Removed field {} from {}", name, this);
    }

    public boolean hasField(String name) {
        return byName.containsKey(name);
    }

    /** Whether {@code field} is the instance currently stored under its name. */
    public boolean holds(Field<?> field) {
        return byName.get(field.name()) == field;
    }

    @SuppressWarnings("unchecked")
    public <T> Field<T> field(String name) {
        Field<?> field = byName.get(name);
        if (field == null) {
            throw new LookupException("Field \"" + name + "\" not found in " + this);
        }
        return (Field<T>) field;
    }

    @SuppressWarnings("unchecked")
    public <T> Field<T> field(int index) {
        if (index < 0 || index >= fields.size()) {
            throw new LookupException("Field index " + index + " out of range for " + this);
        }
        return (Field<T>) fields.get(index);
    }

    /** Current value of the named field, null when it is empty. */
    public Object get(String name) {
        return field(name).currentValueOrNull();
    }

    public Object get(int index) {
        return field(index).currentValueOrNull();
    }

    /** Current value of the named field, failing when it is empty. */
    public Object require(String name) {
        return field(name).currentValue();
    }

    public <T> void setCurrent(String name, FieldValue<T> value) {
        this.<T>field(name).setCurrent(value);
    }

    /** Stores {@code literal} under {@code source} in the named field and makes it current. */
    public <T> void setCurrent(String name, T literal, Source source) {
        Field<T> field = this.<T>field(name);
        if (field.contains(source)) {
            field.put(source, literal);
            field.setCurrent(source);
        } else {
            field.setCurrent(new ObservedValue<>(literal, source));
        }
    }

    public List<Field<?>> fields() {
        return Collections.unmodifiableList(fields);
    }

    public List<String> fieldNames() {
        List<String> names = new ArrayList<>(fields.size());
        for (Field<?> f : fields) {
            names.add(f.name());
        }
        return names;
    }

    public List<Object> values() {
        List<Object> out = new ArrayList<>(fields.size());
        for (Field<?> f : fields) {
            out.add(f.currentValueOrNull());
        }
        return out;
    }

    public int size() {
        return fields.size();
    }

    /** Puts the named fields first, in the given order; others keep their relative order after them. */
    protected void reorderFields(List<String> leading) {
        List<Field<?>> reordered = new ArrayList<>(fields.size());
        for (String name : leading) {
            Field<?> f = byName.get(name);
            if (f != null && !reordered.contains(f)) {
                reordered.add(f);
            }
        }
        for (Field<?> f : fields) {
            if (!reordered.contains(f)) {
                reordered.add(f);
            }
        }
        fields.clear();
        fields.addAll(reordered);
    }

    @Override
    protected void onTreeChanged() {
        for (Field<?> f : fields) {
            f.relinkDerived();
        }
    }

    @Override
    public boolean matches(String qualifier) {
        if (super.matches(qualifier)) {
            return true;
        }
        Field<?> nameField = byName.get("name");
        return nameField != null && !nameField.isEmpty()
                && qualifier.equals(String.valueOf(nameField.currentValueOrNull()));
    }

    // ---- extraction ----

    public List<Object> extractField(String fieldName, Traversal traversal, MissingPolicy missing) {
        return extractField(this, fieldName, traversal, missing);
    }

    public Object[] extractArray(String fieldName, Traversal traversal, MissingPolicy missing) {
        return extractArray(this, fieldName, traversal, missing);
    }

    /**
     * Collects the current value of {@code fieldName} from every node below
     * {@code root} in traversal order.
     */
    public static List<Object> extractField(CatalogNode root, String fieldName, Traversal traversal,
            MissingPolicy missing) {
        Object absent = new Object();
        Function<CatalogNode, Object> reader = node -> {
            if (node instanceof FieldNode container && container.hasField(fieldName)) {
                return container.get(fieldName);
            }
            switch (missing) {
                case FAIL:
                    throw new LookupException("Node " + node + " has no field \"" + fieldName + "\"");
                case SKIP:
                    return absent;
                default:
                    return null;
            }
        };
        VisitFilter<Object> filter = missing == MissingPolicy.SKIP ? VisitFilter.excluding(absent)
                : VisitFilter.none();
        return root.visit(reader, traversal, filter);
    }

    /**
     * As {@link #extractField(CatalogNode, String, Traversal, MissingPolicy)},
     * as an array typed by the field's declared value class when every
     * element fits it.
     */
    public static Object[] extractArray(CatalogNode root, String fieldName, Traversal traversal,
            MissingPolicy missing) {
        List<Object> values = extractField(root, fieldName, traversal, missing);
        Class<?> component = declaredValueClass(root, fieldName)
                .filter(c -> !c.isPrimitive())
                .filter(c -> values.stream().allMatch(v -> v == null || c.isInstance(v)))
                .orElse(Object.class);
        Object[] out = (Object[]) Array.newInstance(component, values.size());
        return values.toArray(out);
    }

    private static Optional<Class<?>> declaredValueClass(CatalogNode root, String fieldName) {
        List<CatalogNode> nodes = root.visit(n -> n, Traversal.PREORDER);
        for (CatalogNode node : nodes) {
            if (node instanceof FieldNode container && container.hasField(fieldName)) {
                Field<?> declaring = container.field(fieldName);
                return declaring.type().valueClass();
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + " with fields " + fieldNames();
    }
}
