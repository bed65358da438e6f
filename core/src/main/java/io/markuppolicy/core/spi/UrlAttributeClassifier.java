package io.markuppolicy.core.spi;

/**
 * Classifies attribute names as URL-bearing. Values of URL-bearing attributes
 * are checked for the reserved source-origin marker.
 *
 * <p>
 * The attribute name is already lowercased by the caller.
 *
 * @see io.markuppolicy.core.engine.UrlAttributes
 */
@FunctionalInterface
public interface UrlAttributeClassifier {

    /**
     * Returns {@code true} if the attribute carries a URL value.
     *
     * @param attrName lowercase attribute name
     */
    boolean isUrlBearingAttribute(String attrName);
}
