package com.catalog.objcat.node;

import com.catalog.objcat.api.CycleException;

/**
 * Root of a catalog tree. A catalog holds no fields and never has a parent:
 * {@link #setParent} with a non-null parent fails with {@link CycleException}.
 */
public class Catalog extends CatalogNode {
    private final String name;

    public Catalog() {
        this("default Catalog");
    }

    public Catalog(String name) {
        super(null);
        this.name = name;
    }

    public String name() {
        return name;
    }

    @Override
    public void setParent(CatalogNode newParent) {
        if (newParent != null) {
            throw new CycleException("Catalog " + name + " is always a root and cannot be placed under " + newParent);
        }
    }

    @Override
    public boolean matches(String qualifier) {
        return name.equals(qualifier) || super.matches(qualifier);
    }

    @Override
    public String toString() {
        return "Catalog " + name;
    }
}
