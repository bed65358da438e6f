package io.markuppolicy.core.engine;

import io.markuppolicy.core.model.MarkerAttributes;
import io.markuppolicy.core.policy.PolicyTables;
import io.markuppolicy.core.policy.TagRuleSet;
import io.markuppolicy.core.spi.DocumentContext;
import io.markuppolicy.core.spi.UrlAttributeClassifier;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether an attribute may be kept on a sanitised element.
 *
 * <p>
 * Rules are evaluated in a fixed order and the first rejection wins; an
 * attribute no rule rejects is accepted:
 * <ol>
 * <li>{@code on*} event handlers (except the {@code on} action attribute)</li>
 * <li>denylisted substrings in the normalised value</li>
 * <li>{@code style}: inline-style pattern, then stop</li>
 * <li>{@code class}: reserved internal prefix at a word boundary</li>
 * <li>URL-bearing attributes: reserved source-origin parameter</li>
 * <li>tag-scoped attribute denylist</li>
 * <li>tag-scoped value patterns</li>
 * </ol>
 * Steps 1 and 2 are skipped when {@code skipPurifyOverlap} is set, i.e. when a
 * general-purpose sanitiser upstream already performed them. Steps 6 and 7 use
 * the restricted-context rules when the document is restricted.
 *
 * <p>
 * Preconditions: {@code tagName} and {@code attrName} are non-null and
 * lowercase. They are not re-validated. A {@code null} value is treated as
 * empty and a {@code null} context as standard.
 *
 * <p>
 * Thread-safe: holds only immutable state.
 */
public final class AttributeValidator {

    private static final Logger LOG = LoggerFactory.getLogger(AttributeValidator.class);

    private static final Pattern INTERNAL_CLASS = Pattern.compile(
            "(^|\\W)" + Pattern.quote(MarkerAttributes.INTERNAL_CLASS_PREFIX), Pattern.CASE_INSENSITIVE);

    private final PolicyTables tables;
    private final UrlAttributeClassifier urlClassifier;

    /** Creates a validator over the built-in policy and URL classifier. */
    public AttributeValidator() {
        this(PolicyTables.defaults(), UrlAttributes.INSTANCE);
    }

    public AttributeValidator(PolicyTables tables, UrlAttributeClassifier urlClassifier) {
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
        this.urlClassifier = Objects.requireNonNull(urlClassifier, "urlClassifier must not be null");
    }

    /** Equivalent to {@code isValidAttribute(tagName, attrName, attrValue, context, false)}. */
    public boolean isValidAttribute(String tagName, String attrName, String attrValue, DocumentContext context) {
        return isValidAttribute(tagName, attrName, attrValue, context, false);
    }

    /**
     * Returns {@code true} if the attribute may be kept.
     *
     * @param tagName           lowercase tag name
     * @param attrName          lowercase attribute name
     * @param attrValue         attribute value, possibly empty
     * @param context           the document being sanitised
     * @param skipPurifyOverlap {@code true} to skip the event-handler and
     *                          value-substring checks already done upstream
     */
    public boolean isValidAttribute(
            String tagName, String attrName, String attrValue, DocumentContext context, boolean skipPurifyOverlap) {
        return check(tagName, attrName, attrValue, context, skipPurifyOverlap) == null;
    }

    /**
     * Same evaluation as {@link #isValidAttribute}, reporting the rule that
     * rejected the attribute.
     *
     * @return the rejection reason, or empty if the attribute is accepted
     */
    public Optional<RejectionReason> evaluate(
            String tagName, String attrName, String attrValue, DocumentContext context, boolean skipPurifyOverlap) {
        return Optional.ofNullable(check(tagName, attrName, attrValue, context, skipPurifyOverlap));
    }

    /** The policy this validator consults. */
    public PolicyTables tables() {
        return tables;
    }

    // --- Private helpers ---

    private RejectionReason check(
            String tagName, String attrName, String attrValue, DocumentContext context, boolean skipPurifyOverlap) {
        String value = attrValue != null ? attrValue : "";

        if (!skipPurifyOverlap) {
            if (attrName.startsWith("on") && !"on".equals(attrName)) {
                return reject(RejectionReason.EVENT_HANDLER, tagName, attrName);
            }
            if (!value.isEmpty() && containsDenylistedSubstring(value)) {
                return reject(RejectionReason.DENYLISTED_VALUE, tagName, attrName);
            }
        }

        if ("style".equals(attrName)) {
            return tables.inlineStyleDenylist().matcher(value).find()
                    ? reject(RejectionReason.INLINE_STYLE, tagName, attrName)
                    : null;
        }

        if ("class".equals(attrName) && !value.isEmpty() && INTERNAL_CLASS.matcher(value).find()) {
            return reject(RejectionReason.INTERNAL_CLASS, tagName, attrName);
        }

        if (urlClassifier.isUrlBearingAttribute(attrName) && value.contains(MarkerAttributes.SOURCE_ORIGIN)) {
            return reject(RejectionReason.SOURCE_ORIGIN, tagName, attrName);
        }

        boolean restricted = context != null && context.isRestrictedContext();
        TagRuleSet rules = tables.tagRules(restricted);

        if (rules.isDeniedAttribute(tagName, attrName)) {
            return reject(RejectionReason.DENYLISTED_ATTRIBUTE, tagName, attrName);
        }

        List<Pattern> patterns = rules.valuePatterns(tagName, attrName);
        for (int i = 0; i < patterns.size(); i++) {
            if (patterns.get(i).matcher(value).find()) {
                return reject(RejectionReason.DENYLISTED_ATTRIBUTE_VALUE, tagName, attrName);
            }
        }

        return null;
    }

    private boolean containsDenylistedSubstring(String value) {
        String normalized = PolicyTables.VALUE_NOISE.matcher(value.toLowerCase(Locale.ROOT)).replaceAll("");
        List<String> substrings = tables.valueSubstringDenylist();
        for (int i = 0; i < substrings.size(); i++) {
            if (normalized.contains(substrings.get(i))) {
                return true;
            }
        }
        return false;
    }

    /** Logs the rejection and returns the reason. Values are never logged. */
    private static RejectionReason reject(RejectionReason reason, String tagName, String attrName) {
        LOG.debug("attribute.rejected tag={} attr={} reason={}", tagName, attrName, reason);
        return reason;
    }
}
