package io.markuppolicy.core.engine;

import io.markuppolicy.core.spi.UrlAttributeClassifier;

/**
 * Default {@link UrlAttributeClassifier}: {@code src}, {@code href},
 * {@code xlink:href} and {@code srcset} carry URLs.
 */
public final class UrlAttributes implements UrlAttributeClassifier {

    /** Shared instance. */
    public static final UrlAttributes INSTANCE = new UrlAttributes();

    private UrlAttributes() {}

    @Override
    public boolean isUrlBearingAttribute(String attrName) {
        return "src".equals(attrName)
                || "href".equals(attrName)
                || "xlink:href".equals(attrName)
                || "srcset".equals(attrName);
    }
}
