package com.catalog.objcat.api;

/** How field extraction treats nodes that lack the requested field. */
public enum MissingPolicy {
    FAIL,
    SKIP,
    SUBSTITUTE_NULL
}
