package io.markuppolicy.core.model;

/**
 * Attribute names and prefixes shared between the sanitiser, the binding
 * subsystem and the differ.
 */
public final class MarkerAttributes {

    /** Prefix of the rewritten form of {@code [attr]} binding attributes. */
    public static final String BIND_PREFIX = "data-amp-bind-";

    /** Unique pairing key written for nodes that must be replaced rather than diffed. */
    public static final String DIFF_KEY = "i-amphtml-key";

    /** Presence means the differ leaves the node untouched. */
    public static final String DIFF_IGNORE = "i-amphtml-ignore";

    /** Set by the binding subsystem on nodes that carry dynamic bindings. */
    public static final String BINDING = "i-amphtml-binding";

    /** Lowercase prefix of component (custom element) tag names. */
    public static final String COMPONENT_TAG_PREFIX = "amp-";

    /** Class-name prefix reserved for the runtime's own styling. */
    public static final String INTERNAL_CLASS_PREFIX = "i-amphtml-";

    /** Query parameter reserved for the runtime's CORS handshake. */
    public static final String SOURCE_ORIGIN = "__amp_source_origin";

    private MarkerAttributes() {
        // constants
    }
}
