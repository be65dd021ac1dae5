package com.catalog.objcat.api;

import java.util.Collections;
import java.util.List;

/**
 * One or more dependency slots of a derived value could not be resolved to a
 * field. Carries the indices of the failing slots and, when known, the names
 * of the matching function arguments.
 */
public class UnresolvedDependencyException extends LookupException {
    private final int[] failedIndices;
    private final List<String> failedNames;

    public UnresolvedDependencyException(String message, int[] failedIndices) {
        this(message, failedIndices, Collections.emptyList(), null);
    }

    public UnresolvedDependencyException(String message, int[] failedIndices, Throwable cause) {
        this(message, failedIndices, Collections.emptyList(), cause);
    }

    public UnresolvedDependencyException(String message, int[] failedIndices, List<String> failedNames,
            Throwable cause) {
        super(message, cause);
        this.failedIndices = failedIndices.clone();
        this.failedNames = List.copyOf(failedNames);
    }

    public int[] failedIndices() {
        return failedIndices.clone();
    }

    public List<String> failedNames() {
        return failedNames;
    }
}
