package com.catalog.objcat.dsl;

import java.util.Map;
import java.util.Objects;

import com.catalog.objcat.api.TypeConstraint;
import com.catalog.objcat.node.CatalogNode;
import com.catalog.objcat.node.DerivedValue;
import com.catalog.objcat.node.Field;

/**
 * Declaration of one field of a {@link NodeSchema}.
 *
 * @param recipe        recipe of the derived value placed in front of the
 *                      field, or null for a plain field
 * @param linkOverrides recipe arguments linked somewhere other than their
 *                      default path
 */
public record FieldDescriptor(String name, TypeConstraint type, Object defaultValue, boolean hasDefault,
        DerivationRecipe<?> recipe, Map<String, String> linkOverrides) {

    public FieldDescriptor {
        Objects.requireNonNull(name, "name");
        type = type == null ? TypeConstraint.ANY : type;
        linkOverrides = linkOverrides == null ? Map.of() : Map.copyOf(linkOverrides);
    }

    public boolean isDerived() {
        return recipe != null;
    }

    /** A fresh, empty-but-for-its-default field. */
    public Field<Object> newField() {
        Field<Object> field = new Field<>(name, type);
        if (hasDefault) {
            field.setDefault(defaultValue);
        }
        return field;
    }

    @SuppressWarnings("unchecked")
    public DerivedValue<Object> newDerivedValue(CatalogNode pathNode) {
        if (recipe == null) {
            throw new IllegalStateException("Field " + name + " is not derived");
        }
        return (DerivedValue<Object>) recipe.instantiate(pathNode, linkOverrides);
    }
}
