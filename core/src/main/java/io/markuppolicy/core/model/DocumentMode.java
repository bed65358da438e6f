package io.markuppolicy.core.model;

import io.markuppolicy.core.spi.DocumentContext;

/**
 * Fixed {@link DocumentContext} implementations for callers that already know
 * the document format.
 *
 * <ul>
 *   <li>{@link #STANDARD}: a regular document; base rules only.
 *   <li>{@link #RESTRICTED}: an email document; base rules plus the restricted
 *       additions.
 * </ul>
 */
public enum DocumentMode implements DocumentContext {
    STANDARD(false),
    RESTRICTED(true);

    private final boolean restricted;

    DocumentMode(boolean restricted) {
        this.restricted = restricted;
    }

    @Override
    public boolean isRestrictedContext() {
        return restricted;
    }

    /** Returns the mode matching the given flag. */
    public static DocumentMode of(boolean restricted) {
        return restricted ? RESTRICTED : STANDARD;
    }
}
