package io.markuppolicy.core.spi;

/**
 * Document-format capability consulted by the attribute validator.
 *
 * <p>
 * Implementations classify the document being sanitised as either a standard
 * document or a restricted-context (email) document. Restricted documents get
 * additional tag-scoped denylist rules on top of the standard ones.
 *
 * <p>
 * Implementations MUST be thread-safe. The validator queries this at most once
 * per attribute and only when a tag-scoped rule stage is reached.
 *
 * @see io.markuppolicy.core.model.DocumentMode
 */
@FunctionalInterface
public interface DocumentContext {

    /**
     * Returns {@code true} if the document is rendered in the restricted
     * (email) context.
     */
    boolean isRestrictedContext();
}
