package io.markuppolicy.core.policy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Tag-scoped deny rules for one document context: the attribute names that are
 * unconditionally rejected per tag, and the value patterns that reject an
 * attribute value per tag and attribute.
 *
 * <p>
 * {@link PolicyTables} holds two precomputed instances: the base rules for
 * standard documents, and the base rules merged with the restricted additions.
 * No merging happens per call.
 *
 * <p>
 * Thread-safe and immutable.
 *
 * @param attributeDenylist tag name → denied attribute names
 * @param valueDenylist     tag name → attribute name → patterns rejecting the
 *                          value when found anywhere in it
 */
public record TagRuleSet(
        Map<String, Set<String>> attributeDenylist, Map<String, Map<String, List<Pattern>>> valueDenylist) {

    private static final TagRuleSet EMPTY = new TagRuleSet(Map.of(), Map.of());

    public TagRuleSet {
        Objects.requireNonNull(attributeDenylist, "attributeDenylist must not be null");
        Objects.requireNonNull(valueDenylist, "valueDenylist must not be null");
        attributeDenylist = copySets(attributeDenylist);
        valueDenylist = copyPatterns(valueDenylist);
    }

    /** Returns a rule set with no rules. */
    public static TagRuleSet empty() {
        return EMPTY;
    }

    /**
     * Returns the union of two rule sets. Neither input is modified; a tag or
     * attribute present in both keeps every name and pattern from both.
     */
    public static TagRuleSet union(TagRuleSet base, TagRuleSet additions) {
        Map<String, Set<String>> attributes = new HashMap<>();
        base.attributeDenylist.forEach((tag, names) -> attributes.put(tag, new HashSet<>(names)));
        additions.attributeDenylist.forEach((tag, names) ->
                attributes.computeIfAbsent(tag, k -> new HashSet<>()).addAll(names));

        Map<String, Map<String, List<Pattern>>> values = new HashMap<>();
        for (TagRuleSet source : List.of(base, additions)) {
            source.valueDenylist.forEach((tag, byAttr) -> {
                Map<String, List<Pattern>> merged = values.computeIfAbsent(tag, k -> new HashMap<>());
                byAttr.forEach((attr, patterns) ->
                        merged.computeIfAbsent(attr, k -> new ArrayList<>()).addAll(patterns));
            });
        }
        return new TagRuleSet(attributes, values);
    }

    /** Returns {@code true} if {@code attrName} is denied outright on {@code tagName}. */
    public boolean isDeniedAttribute(String tagName, String attrName) {
        Set<String> denied = attributeDenylist.get(tagName);
        return denied != null && denied.contains(attrName);
    }

    /**
     * Returns the value patterns registered for the tag/attribute pair, or an
     * empty list.
     */
    public List<Pattern> valuePatterns(String tagName, String attrName) {
        Map<String, List<Pattern>> byAttr = valueDenylist.get(tagName);
        if (byAttr == null) {
            return List.of();
        }
        List<Pattern> patterns = byAttr.get(attrName);
        return patterns != null ? patterns : List.of();
    }

    // Collections.unmodifiable* rather than Map.copyOf: lookups with a null key must not throw.

    static Map<String, Set<String>> copySets(Map<String, ? extends Set<String>> source) {
        Map<String, Set<String>> copy = new HashMap<>();
        source.forEach((key, names) -> copy.put(key, Collections.unmodifiableSet(new HashSet<>(names))));
        return Collections.unmodifiableMap(copy);
    }

    static Map<String, Map<String, List<Pattern>>> copyPatterns(
            Map<String, ? extends Map<String, ? extends List<Pattern>>> source) {
        Map<String, Map<String, List<Pattern>>> copy = new HashMap<>();
        source.forEach((tag, byAttr) -> {
            Map<String, List<Pattern>> inner = new HashMap<>();
            byAttr.forEach((attr, patterns) -> inner.put(attr, List.copyOf(patterns)));
            copy.put(tag, Collections.unmodifiableMap(inner));
        });
        return Collections.unmodifiableMap(copy);
    }
}
