package io.markuppolicy.core.policy;

import java.util.regex.Pattern;

/** Built-in policy returned by {@link PolicyTables#defaults()}. */
final class PolicyDefaults {

    /** Form-association attributes that let a free-standing control submit elsewhere. */
    private static final String[] FORM_FIELD_ATTRIBUTES = {
        "form", "formaction", "formmethod", "formtarget", "formnovalidate", "formenctype",
    };

    static final PolicyTables TABLES = PolicyTables.builder()
            .deniedTags(
                    "applet", "audio", "base", "embed", "frame", "frameset", "iframe", "img", "link", "meta",
                    "object", "style", "video")
            // amp-list cannot be nested; the lightbox components are deprecated.
            .restrictedContextTags(
                    "amp-accordion",
                    "amp-anim",
                    "amp-bind-macro",
                    "amp-carousel",
                    "amp-fit-text",
                    "amp-img",
                    "amp-layout",
                    "amp-selector",
                    "amp-sidebar",
                    "amp-state",
                    "amp-timeago")
            // Raw interpolation output is never re-validated downstream, hence the short list.
            .tripleEscapeTags(
                    "a", "b", "br", "caption", "colgroup", "code", "del", "div", "em", "hr", "i", "ins", "li",
                    "mark", "ol", "p", "q", "s", "small", "span", "strong", "sub", "sup", "table", "tbody",
                    "time", "td", "th", "thead", "tfoot", "tr", "u", "ul")
            // Component-only attributes that don't exist in HTML.
            .globalAttributes(
                    "amp-fx",
                    "fallback",
                    "heights",
                    "layout",
                    "min-font-size",
                    "max-font-size",
                    "on",
                    "option",
                    "placeholder")
            // Form submission state.
            .globalAttributes(
                    "submitting",
                    "submit-success",
                    "submit-error",
                    "validation-for",
                    "verify-error",
                    "visible-when-invalid")
            // HTML attributes handled specially by the validator.
            .globalAttributes("href", "style")
            // Binding attributes that exist in "[foo]" form.
            .globalAttributes("text")
            .globalAttributes(
                    "subscriptions-action",
                    "subscriptions-actions",
                    "subscriptions-decorate",
                    "subscriptions-dialog",
                    "subscriptions-display",
                    "subscriptions-section",
                    "subscriptions-service")
            .globalAttributes("amp-drilldown-submenu", "amp-drilldown-submenu-open", "amp-drilldown-submenu-close")
            // Structured data.
            .globalAttributes("itemprop")
            .tagAttributes("a", "rel", "target")
            .tagAttributes("div", "template")
            .tagAttributes("form", "action-xhr", "verify-xhr", "custom-validation-reporting", "target")
            .tagAttributes("input", "mask-output")
            .tagAttributes("template", "type")
            .tagAttributes("textarea", "autoexpand")
            .validTargets("_top", "_blank")
            .valueSubstrings("javascript:", "vbscript:", "data:", "<script", "</script")
            .valueDenylist("input", "type", Pattern.compile("(?:image|button)", Pattern.CASE_INSENSITIVE))
            .restrictedValueDenylist(
                    "input", "type", Pattern.compile("(?:button|file|image|password)", Pattern.CASE_INSENSITIVE))
            .attributeDenylist("input", FORM_FIELD_ATTRIBUTES)
            .attributeDenylist("textarea", FORM_FIELD_ATTRIBUTES)
            .attributeDenylist("select", FORM_FIELD_ATTRIBUTES)
            .restrictedAttributeDenylist("amp-anim", "controls")
            .restrictedAttributeDenylist("form", "name")
            // !important would override runtime styles; fixed/sticky elements must come from the
            // custom stylesheet, which is the only place the runtime looks for them.
            .inlineStyleDenylist(Pattern.compile(
                    "!important|position[\\s\\uFEFF]*:[\\s\\uFEFF]*(?:fixed|sticky)",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS))
            .diffableTag("amp-img", "src", "srcset", "layout", "width", "height")
            .build();

    private PolicyDefaults() {
        // constants
    }
}
