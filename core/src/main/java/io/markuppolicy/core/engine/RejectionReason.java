package io.markuppolicy.core.engine;

/**
 * The rule that rejected an attribute, in evaluation order. Reported by
 * {@link AttributeValidator#evaluate} and used in rejection log entries.
 */
public enum RejectionReason {
    /** {@code on*} event-handler attribute. */
    EVENT_HANDLER,
    /** Value contains a denylisted substring such as a script URI scheme. */
    DENYLISTED_VALUE,
    /** {@code style} value uses {@code !important} or fixed/sticky positioning. */
    INLINE_STYLE,
    /** {@code class} value uses the reserved internal prefix. */
    INTERNAL_CLASS,
    /** URL value carries the reserved source-origin parameter. */
    SOURCE_ORIGIN,
    /** Attribute is denied outright on this tag. */
    DENYLISTED_ATTRIBUTE,
    /** Value matches a tag/attribute-scoped denylist pattern. */
    DENYLISTED_ATTRIBUTE_VALUE
}
