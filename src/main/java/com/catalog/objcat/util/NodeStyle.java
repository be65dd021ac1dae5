package com.catalog.objcat.util;

/** Rendering attributes of one node in an exported diagram. */
public record NodeStyle(String label, String shape) {
}
