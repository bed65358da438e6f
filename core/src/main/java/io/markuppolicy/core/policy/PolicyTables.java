package io.markuppolicy.core.policy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable policy data consulted by the attribute validator, the diff-strategy
 * classifier and upstream sanitisation stages.
 *
 * <p>
 * All tables are keyed by lowercase tag and attribute names. Lookups are
 * case-sensitive: callers lowercase names before querying. The builder rejects
 * names that are not lowercase, so an instance can never hold a rule that no
 * lookup would reach.
 *
 * <p>
 * Restricted-context rules are stored as additions and are always unioned over
 * the base rules. Both effective rule sets are computed once at construction
 * and exposed through {@link #tagRules(boolean)}.
 *
 * <p>
 * Use {@link #defaults()} for the built-in policy, or {@link #toBuilder()} to
 * derive an extended policy from it. Thread-safe and immutable.
 */
public final class PolicyTables {

    /**
     * Characters stripped from a lowercased attribute value before the
     * value-substring denylist is consulted.
     */
    public static final Pattern VALUE_NOISE =
            Pattern.compile("[\\s,\\u0000\\uFEFF]+", Pattern.UNICODE_CHARACTER_CLASS);

    private final Set<String> deniedTags;
    private final Set<String> restrictedContextTags;
    private final List<String> tripleEscapeTags;
    private final Set<String> globalAttributes;
    private final Map<String, Set<String>> tagAttributes;
    private final Set<String> validTargets;
    private final List<String> valueSubstringDenylist;
    private final TagRuleSet baseRules;
    private final TagRuleSet restrictedAdditions;
    private final Pattern inlineStyleDenylist;
    private final Map<String, List<String>> diffableTags;

    private final TagRuleSet restrictedRules;

    private PolicyTables(Builder b) {
        this.deniedTags = unmodifiableSet(b.deniedTags);
        this.restrictedContextTags = unmodifiableSet(b.restrictedContextTags);
        this.tripleEscapeTags = Collections.unmodifiableList(new ArrayList<>(b.tripleEscapeTags));
        this.globalAttributes = unmodifiableSet(b.globalAttributes);
        this.tagAttributes = TagRuleSet.copySets(b.tagAttributes);
        this.validTargets = unmodifiableSet(b.validTargets);
        this.valueSubstringDenylist = Collections.unmodifiableList(new ArrayList<>(b.valueSubstrings));
        this.baseRules = new TagRuleSet(b.attributeDenylist, b.valueDenylist);
        this.restrictedAdditions = new TagRuleSet(b.restrictedAttributeDenylist, b.restrictedValueDenylist);
        this.inlineStyleDenylist = b.inlineStyleDenylist;
        Map<String, List<String>> diffable = new HashMap<>();
        b.diffableTags.forEach((tag, attrs) -> diffable.put(tag, List.copyOf(attrs)));
        this.diffableTags = Collections.unmodifiableMap(diffable);

        this.restrictedRules = TagRuleSet.union(baseRules, restrictedAdditions);
    }

    /** Returns the built-in policy. */
    public static PolicyTables defaults() {
        return PolicyDefaults.TABLES;
    }

    /** Returns an empty builder. */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-populated with every rule of this instance. */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.deniedTags.addAll(deniedTags);
        b.restrictedContextTags.addAll(restrictedContextTags);
        b.tripleEscapeTags.addAll(tripleEscapeTags);
        b.globalAttributes.addAll(globalAttributes);
        tagAttributes.forEach((tag, attrs) -> b.tagAttributes.put(tag, new LinkedHashSet<>(attrs)));
        b.validTargets.addAll(validTargets);
        b.valueSubstrings.addAll(valueSubstringDenylist);
        copyInto(baseRules, b.attributeDenylist, b.valueDenylist);
        copyInto(restrictedAdditions, b.restrictedAttributeDenylist, b.restrictedValueDenylist);
        b.inlineStyleDenylist = inlineStyleDenylist;
        diffableTags.forEach((tag, attrs) -> b.diffableTags.put(tag, new ArrayList<>(attrs)));
        return b;
    }

    // --- Queries ---

    /**
     * Returns {@code true} if the tag must be removed structurally, before any
     * attribute filtering.
     */
    public boolean isDeniedTag(String tagName) {
        return deniedTags.contains(tagName);
    }

    /** Returns {@code true} if the component tag is permitted in restricted-context documents. */
    public boolean isRestrictedContextTag(String tagName) {
        return restrictedContextTags.contains(tagName);
    }

    /** Returns {@code true} if the tag may appear in raw (unescaped) text interpolation. */
    public boolean isTripleEscapeTag(String tagName) {
        return tripleEscapeTags.contains(tagName);
    }

    /**
     * Returns {@code true} if the attribute is allowlisted for the tag, either
     * globally or through a tag-scoped entry. Presence check only; values are
     * not examined.
     */
    public boolean isAllowlistedAttribute(String tagName, String attrName) {
        if (globalAttributes.contains(attrName)) {
            return true;
        }
        Set<String> scoped = tagAttributes.get(tagName);
        return scoped != null && scoped.contains(attrName);
    }

    /** Returns {@code true} if the value is a permitted {@code target} value. */
    public boolean isValidTarget(String value) {
        return validTargets.contains(value);
    }

    /**
     * Returns the attributes whose change forces replacement of a diffable tag,
     * or an empty list if the tag is not diffable.
     */
    public List<String> diffableAttributes(String tagName) {
        List<String> attrs = diffableTags.get(tagName);
        return attrs != null ? attrs : List.of();
    }

    /** Returns {@code true} if the tag supports manual, attribute-scoped diffing. */
    public boolean isDiffableTag(String tagName) {
        return diffableTags.containsKey(tagName);
    }

    /**
     * Returns the effective tag-scoped rules for the given context: the base
     * rules, or the base rules unioned with the restricted additions.
     */
    public TagRuleSet tagRules(boolean restrictedContext) {
        return restrictedContext ? restrictedRules : baseRules;
    }

    // --- Table exports (unmodifiable) ---

    public Set<String> deniedTags() {
        return deniedTags;
    }

    public Set<String> restrictedContextTags() {
        return restrictedContextTags;
    }

    public List<String> tripleEscapeTags() {
        return tripleEscapeTags;
    }

    public Set<String> globalAttributes() {
        return globalAttributes;
    }

    public Map<String, Set<String>> tagAttributes() {
        return tagAttributes;
    }

    public Set<String> validTargets() {
        return validTargets;
    }

    public List<String> valueSubstringDenylist() {
        return valueSubstringDenylist;
    }

    /** Base tag-scoped rules, without restricted additions. */
    public TagRuleSet baseRules() {
        return baseRules;
    }

    /** Restricted-context additions on their own. */
    public TagRuleSet restrictedAdditions() {
        return restrictedAdditions;
    }

    public Pattern inlineStyleDenylist() {
        return inlineStyleDenylist;
    }

    public Map<String, List<String>> diffableTags() {
        return diffableTags;
    }

    // --- Private helpers ---

    private static Set<String> unmodifiableSet(Set<String> source) {
        return Collections.unmodifiableSet(new HashSet<>(source));
    }

    private static void copyInto(
            TagRuleSet rules, Map<String, Set<String>> attributes, Map<String, Map<String, List<Pattern>>> values) {
        rules.attributeDenylist().forEach((tag, names) -> attributes.put(tag, new LinkedHashSet<>(names)));
        rules.valueDenylist().forEach((tag, byAttr) -> {
            Map<String, List<Pattern>> inner = new HashMap<>();
            byAttr.forEach((attr, patterns) -> inner.put(attr, new ArrayList<>(patterns)));
            values.put(tag, inner);
        });
    }

    /**
     * Builder for {@link PolicyTables}. Every method adds to the tables; nothing
     * can be removed. Tag and attribute names must already be lowercase ASCII.
     */
    public static final class Builder {

        private final Set<String> deniedTags = new LinkedHashSet<>();
        private final Set<String> restrictedContextTags = new LinkedHashSet<>();
        private final List<String> tripleEscapeTags = new ArrayList<>();
        private final Set<String> globalAttributes = new LinkedHashSet<>();
        private final Map<String, Set<String>> tagAttributes = new HashMap<>();
        private final Set<String> validTargets = new LinkedHashSet<>();
        private final List<String> valueSubstrings = new ArrayList<>();
        private final Map<String, Set<String>> attributeDenylist = new HashMap<>();
        private final Map<String, Set<String>> restrictedAttributeDenylist = new HashMap<>();
        private final Map<String, Map<String, List<Pattern>>> valueDenylist = new HashMap<>();
        private final Map<String, Map<String, List<Pattern>>> restrictedValueDenylist = new HashMap<>();
        private final Map<String, List<String>> diffableTags = new HashMap<>();
        private Pattern inlineStyleDenylist = Pattern.compile("(?!)");

        private Builder() {}

        public Builder deniedTags(String... tagNames) {
            for (String tag : tagNames) {
                deniedTags.add(requireLowercase(tag, "denied tag"));
            }
            return this;
        }

        public Builder restrictedContextTags(String... tagNames) {
            for (String tag : tagNames) {
                restrictedContextTags.add(requireLowercase(tag, "restricted-context tag"));
            }
            return this;
        }

        /** Appends to the ordered triple-escape allowlist, skipping duplicates. */
        public Builder tripleEscapeTags(String... tagNames) {
            for (String tag : tagNames) {
                requireLowercase(tag, "triple-escape tag");
                if (!tripleEscapeTags.contains(tag)) {
                    tripleEscapeTags.add(tag);
                }
            }
            return this;
        }

        public Builder globalAttributes(String... attrNames) {
            for (String attr : attrNames) {
                globalAttributes.add(requireLowercase(attr, "global attribute"));
            }
            return this;
        }

        public Builder tagAttributes(String tagName, String... attrNames) {
            addNames(tagAttributes, tagName, attrNames, "tag-scoped attribute");
            return this;
        }

        public Builder validTargets(String... values) {
            for (String value : values) {
                validTargets.add(Objects.requireNonNull(value, "target value must not be null"));
            }
            return this;
        }

        /**
         * Appends to the ordered value-substring denylist. Entries are matched
         * against the lowercased value with whitespace, commas and NUL characters
         * removed, so they must be lowercase themselves and contain none of
         * the {@link #VALUE_NOISE} characters.
         */
        public Builder valueSubstrings(String... substrings) {
            for (String substring : substrings) {
                requireLowercase(substring, "value substring");
                if (VALUE_NOISE.matcher(substring).find()) {
                    throw new IllegalArgumentException(
                            "value substring must not contain whitespace, commas, NUL or BOM, got: '"
                                    + substring + "'");
                }
                if (!valueSubstrings.contains(substring)) {
                    valueSubstrings.add(substring);
                }
            }
            return this;
        }

        public Builder attributeDenylist(String tagName, String... attrNames) {
            addNames(attributeDenylist, tagName, attrNames, "denied attribute");
            return this;
        }

        public Builder restrictedAttributeDenylist(String tagName, String... attrNames) {
            addNames(restrictedAttributeDenylist, tagName, attrNames, "restricted denied attribute");
            return this;
        }

        public Builder valueDenylist(String tagName, String attrName, Pattern pattern) {
            addPattern(valueDenylist, tagName, attrName, pattern);
            return this;
        }

        public Builder restrictedValueDenylist(String tagName, String attrName, Pattern pattern) {
            addPattern(restrictedValueDenylist, tagName, attrName, pattern);
            return this;
        }

        /** Replaces the inline-style denylist pattern. */
        public Builder inlineStyleDenylist(Pattern pattern) {
            this.inlineStyleDenylist = Objects.requireNonNull(pattern, "inline style pattern must not be null");
            return this;
        }

        public Builder diffableTag(String tagName, String... attrNames) {
            requireLowercase(tagName, "diffable tag");
            List<String> attrs = diffableTags.computeIfAbsent(tagName, k -> new ArrayList<>());
            for (String attr : attrNames) {
                requireLowercase(attr, "diffable attribute");
                if (!attrs.contains(attr)) {
                    attrs.add(attr);
                }
            }
            return this;
        }

        public PolicyTables build() {
            return new PolicyTables(this);
        }

        private static void addNames(
                Map<String, Set<String>> target, String tagName, String[] attrNames, String what) {
            requireLowercase(tagName, what + " tag");
            Set<String> names = target.computeIfAbsent(tagName, k -> new LinkedHashSet<>());
            for (String attr : attrNames) {
                names.add(requireLowercase(attr, what));
            }
        }

        private static void addPattern(
                Map<String, Map<String, List<Pattern>>> target, String tagName, String attrName, Pattern pattern) {
            requireLowercase(tagName, "value denylist tag");
            requireLowercase(attrName, "value denylist attribute");
            Objects.requireNonNull(pattern, "value denylist pattern must not be null");
            target.computeIfAbsent(tagName, k -> new HashMap<>())
                    .computeIfAbsent(attrName, k -> new ArrayList<>())
                    .add(pattern);
        }

        private static String requireLowercase(String name, String what) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException(what + " must not be null or empty");
            }
            if (!name.equals(name.toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException(what + " must be lowercase, got: '" + name + "'");
            }
            return name;
        }
    }
}
