package com.catalog.objcat;

import com.catalog.objcat.biblio.BibliographicService;
import com.catalog.objcat.dsl.RecipeRegistry;
import com.catalog.objcat.dsl.SchemaRegistry;
import com.catalog.objcat.io.CatalogSnapshot;
import com.catalog.objcat.io.JsonCatalogCompiler;
import com.catalog.objcat.node.Catalog;
import com.catalog.objcat.source.LocationResolver;
import com.catalog.objcat.source.SourceRegistry;

/**
 * ObjCatalog: hierarchical catalogs of astronomical objects.
 *
 * <h2>Model</h2>
 * <ul>
 * <li><b>Nodes</b> form a tree rooted at a {@link Catalog}; field nodes own
 * named fields.</li>
 * <li><b>Fields</b> hold one value per {@link com.catalog.objcat.source.Source};
 * the first value is current.</li>
 * <li><b>Derived values</b> compute lazily from other fields, found by direct
 * reference or by tree path, and go stale when those fields change.</li>
 * </ul>
 *
 * <p>
 * The catalog is single-threaded: callers serialize access to a tree.
 */
public final class ObjCatalog {

    private ObjCatalog() {
        // Prevent instantiation of utility class
    }

    /**
     * Entry point: create a new, empty catalog.
     *
     * @param name The catalog name, usable in path qualifiers.
     * @return A new root node.
     */
    public static Catalog catalog(String name) {
        return new Catalog(name);
    }

    /** Compiler for JSON catalog definitions. */
    public static JsonCatalogCompiler compiler(SchemaRegistry schemas, RecipeRegistry recipes) {
        return new JsonCatalogCompiler(schemas, recipes);
    }

    /** Snapshot support using the configured derived-value policy. */
    public static CatalogSnapshot snapshots(SchemaRegistry schemas, RecipeRegistry recipes) {
        return new CatalogSnapshot(schemas, recipes);
    }

    /**
     * Routes {@code "name/locator"} source strings through {@code service} so
     * locators become canonical codes.
     */
    public static void useBibliographicService(BibliographicService service) {
        SourceRegistry.global().setLocationResolver(service.asLocationResolver());
    }

    /** Stores source locators verbatim again. */
    public static void useVerbatimLocations() {
        SourceRegistry.global().setLocationResolver(LocationResolver.VERBATIM);
    }
}
