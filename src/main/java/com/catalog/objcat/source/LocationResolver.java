package com.catalog.objcat.source;

/**
 * Turns the free-form locator written after a single {@code /} in a source
 * string into the location code stored on the {@link Source}.
 */
@FunctionalInterface
public interface LocationResolver {

    /** Keeps the locator as written. Blank locators become null. */
    LocationResolver VERBATIM = locator -> locator == null || locator.isBlank() ? null : locator.strip();

    String resolve(String locator);
}
