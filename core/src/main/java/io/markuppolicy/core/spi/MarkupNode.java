package io.markuppolicy.core.spi;

/**
 * Narrow view of a markup element, as needed by the diff-strategy classifier.
 *
 * <p>
 * Any concrete tree representation (a W3C DOM element, a jsoup element, an
 * in-memory test node) can be adapted to this interface. The classifier only
 * reads through {@link #getTagName()} and {@link #hasAttribute(String)};
 * {@link #setAttribute(String, String)} is called when a
 * {@link io.markuppolicy.core.model.MarkerInstruction} is applied.
 *
 * <p>
 * Implementations need not be thread-safe: a node is classified and marked by a
 * single caller thread.
 */
public interface MarkupNode {

    /**
     * The element's tag name. Case is not significant; DOM implementations
     * typically report uppercase names for HTML elements.
     */
    String getTagName();

    /** Returns {@code true} if the element carries the named attribute. */
    boolean hasAttribute(String name);

    /** Sets (or replaces) the named attribute. */
    void setAttribute(String name, String value);
}
