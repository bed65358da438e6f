package io.markuppolicy.core.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.markuppolicy.core.engine.AttributeValidator;
import io.markuppolicy.core.engine.DiffStrategyClassifier;
import io.markuppolicy.core.engine.UrlAttributes;
import io.markuppolicy.core.error.PolicyLoadException;
import io.markuppolicy.core.error.PolicyParseException;
import io.markuppolicy.core.model.DocumentMode;
import io.markuppolicy.core.model.MarkerInstruction;
import io.markuppolicy.core.policy.PolicyTables;
import io.markuppolicy.core.testkit.CountingKeyGenerator;
import io.markuppolicy.core.testkit.TestNode;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

/** Tests for {@link PolicyParser}: YAML overlays, additivity and load errors. */
@DisplayName("PolicyParser")
class PolicyParserTest {

    private final PolicyParser parser = new PolicyParser();

    @TempDir
    Path tempDir;

    private Path write(String yaml) throws IOException {
        Path path = tempDir.resolve("policy.yaml");
        Files.writeString(path, yaml);
        return path;
    }

    private static PolicyTables parseString(PolicyParser parser, String yaml) {
        return parser.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "inline");
    }

    @Nested
    @DisplayName("Valid overlays")
    class ValidOverlays {

        @Test
        @DisplayName("full overlay → every table extended, built-ins kept")
        void fullOverlay() throws IOException {
            Path path = write("""
                    policy:
                      denied-tags: [marquee]
                      restricted-context-tags: [amp-list]
                      triple-escape-tags: [abbr]
                      global-attributes: [data-track]
                      tag-attributes:
                        img: [alt]
                      valid-targets: [_self]
                      value-substrings: ["livescript:"]
                      attribute-denylist:
                        button: [formaction]
                      value-denylist:
                        a:
                          rel: "(?:opener)"
                      diffable-tags:
                        amp-anim: [src]
                    """);

            PolicyTables tables = parser.parse(path);

            assertThat(tables.isDeniedTag("marquee")).isTrue();
            assertThat(tables.isDeniedTag("iframe")).isTrue();
            assertThat(tables.isRestrictedContextTag("amp-list")).isTrue();
            assertThat(tables.tripleEscapeTags()).endsWith("abbr");
            assertThat(tables.isAllowlistedAttribute("section", "data-track")).isTrue();
            assertThat(tables.isAllowlistedAttribute("img", "alt")).isTrue();
            assertThat(tables.isValidTarget("_self")).isTrue();
            assertThat(tables.isValidTarget("_blank")).isTrue();
            assertThat(tables.valueSubstringDenylist()).endsWith("livescript:");
            assertThat(tables.diffableAttributes("amp-anim")).containsExactly("src");
        }

        @Test
        @DisplayName("overlay rules are enforced by the validator")
        void overlayRulesEnforced() throws IOException {
            Path path = write("""
                    policy:
                      value-substrings: ["livescript:"]
                      attribute-denylist:
                        button: [formaction]
                      value-denylist:
                        a:
                          rel: "opener"
                    """);
            var validator = new AttributeValidator(parser.parse(path), UrlAttributes.INSTANCE);
            var builtIn = new AttributeValidator();

            assertThat(validator.isValidAttribute("button", "formaction", "/x", DocumentMode.STANDARD))
                    .isFalse();
            assertThat(builtIn.isValidAttribute("button", "formaction", "/x", DocumentMode.STANDARD))
                    .isTrue();
            assertThat(validator.isValidAttribute("a", "rel", "noopener OPENER", DocumentMode.STANDARD))
                    .isFalse();
            assertThat(validator.isValidAttribute("div", "title", "Live Script:x", DocumentMode.STANDARD))
                    .isFalse();
            assertThat(validator.isValidAttribute("input", "formaction", "/x", DocumentMode.STANDARD))
                    .isFalse();
        }

        @Test
        @DisplayName("restricted overlay rules apply only in restricted documents")
        void restrictedOverlay() {
            PolicyTables tables = parseString(parser, """
                    policy:
                      restricted:
                        attribute-denylist:
                          a: [download]
                        value-denylist:
                          a:
                            target: "_top"
                    """);
            var validator = new AttributeValidator(tables, UrlAttributes.INSTANCE);

            assertThat(validator.isValidAttribute("a", "download", "", DocumentMode.STANDARD))
                    .isTrue();
            assertThat(validator.isValidAttribute("a", "download", "", DocumentMode.RESTRICTED))
                    .isFalse();
            assertThat(validator.isValidAttribute("a", "target", "_top", DocumentMode.STANDARD))
                    .isTrue();
            assertThat(validator.isValidAttribute("a", "target", "_top", DocumentMode.RESTRICTED))
                    .isFalse();
            assertThat(validator.isValidAttribute("form", "name", "f", DocumentMode.RESTRICTED))
                    .isFalse();
        }

        @Test
        @DisplayName("diffable overlay entries drive the classifier")
        void diffableOverlay() {
            PolicyTables tables = parseString(parser, """
                    policy:
                      diffable-tags:
                        amp-anim: [src, width]
                    """);

            MarkerInstruction instruction =
                    new DiffStrategyClassifier(tables).classify(TestNode.element("amp-anim"), new CountingKeyGenerator());

            assertThat(instruction).isEqualTo(MarkerInstruction.SET_IGNORE);
        }

        @Test
        @DisplayName("empty policy mapping → tables equivalent to the base")
        void emptyPolicy() {
            PolicyTables tables = parseString(parser, "policy: {}\n");

            assertThat(tables.deniedTags()).isEqualTo(PolicyTables.defaults().deniedTags());
            assertThat(tables.valueSubstringDenylist())
                    .isEqualTo(PolicyTables.defaults().valueSubstringDenylist());
        }

        @Test
        @DisplayName("the base tables are not modified")
        void baseUnchanged() {
            parseString(parser, """
                    policy:
                      denied-tags: [marquee]
                    """);

            assertThat(PolicyTables.defaults().isDeniedTag("marquee")).isFalse();
        }

        @Test
        @DisplayName("a custom base is extended instead of the built-ins")
        void customBase() {
            PolicyTables base = PolicyTables.builder().deniedTags("script").build();

            PolicyTables tables = parseString(new PolicyParser(base), """
                    policy:
                      denied-tags: [marquee]
                    """);

            assertThat(tables.deniedTags()).containsExactlyInAnyOrder("script", "marquee");
        }

        @Test
        @DisplayName("a successful load logs a summary at INFO")
        void loadIsLogged() {
            Logger logger = (Logger) LoggerFactory.getLogger(PolicyParser.class);
            ListAppender<ILoggingEvent> appender = new ListAppender<>();
            appender.start();
            logger.addAppender(appender);
            try {
                parseString(parser, "policy:\n  denied-tags: [marquee]\n");
            } finally {
                logger.detachAppender(appender);
                appender.stop();
            }

            assertThat(appender.list).hasSize(1);
            assertThat(appender.list.get(0).getFormattedMessage())
                    .contains("Policy overlay loaded")
                    .contains("source=inline")
                    .contains("denied_tags=14");
        }
    }

    @Nested
    @DisplayName("Invalid overlays")
    class InvalidOverlays {

        @Test
        @DisplayName("missing file → PolicyLoadException")
        void missingFile() {
            Path missing = tempDir.resolve("absent.yaml");

            assertThatThrownBy(() -> parser.parse(missing))
                    .isExactlyInstanceOf(PolicyLoadException.class)
                    .hasMessageContaining("not found")
                    .satisfies(e -> assertThat(((PolicyLoadException) e).source()).isEqualTo(missing.toString()));
        }

        @Test
        @DisplayName("directory path → PolicyLoadException")
        void directoryPath() {
            assertThatThrownBy(() -> parser.parse(tempDir))
                    .isExactlyInstanceOf(PolicyLoadException.class)
                    .hasMessageContaining("not a regular file");
        }

        @Test
        @DisplayName("value substring with whitespace → PolicyParseException")
        void unmatchableSubstring() {
            assertThatThrownBy(() -> parseString(parser, "policy:\n  value-substrings: [\"java script:\"]\n"))
                    .isInstanceOf(PolicyParseException.class)
                    .hasMessageContaining("must not contain whitespace");
        }

        @Test
        @DisplayName("malformed YAML → PolicyParseException")
        void malformedYaml() throws IOException {
            Path path = write("policy: [unclosed\n");

            assertThatThrownBy(() -> parser.parse(path))
                    .isInstanceOf(PolicyParseException.class)
                    .hasMessageContaining("Failed to parse policy YAML");
        }

        @Test
        @DisplayName("no policy root → PolicyParseException")
        void missingRoot() {
            assertThatThrownBy(() -> parseString(parser, "denied-tags: [marquee]\n"))
                    .isInstanceOf(PolicyParseException.class)
                    .hasMessageContaining("'policy' mapping");
        }

        @Test
        @DisplayName("unknown key → PolicyParseException naming the key")
        void unknownKey() {
            assertThatThrownBy(() -> parseString(parser, "policy:\n  denyed-tags: [marquee]\n"))
                    .isInstanceOf(PolicyParseException.class)
                    .hasMessageContaining("policy.denyed-tags");
            assertThatThrownBy(() -> parseString(parser, "policy:\n  restricted:\n    denied-tags: [x]\n"))
                    .isInstanceOf(PolicyParseException.class)
                    .hasMessageContaining("policy.restricted.denied-tags");
        }

        @Test
        @DisplayName("uppercase name → PolicyParseException")
        void uppercaseName() {
            assertThatThrownBy(() -> parseString(parser, """
                            policy:
                              attribute-denylist:
                                INPUT: [formaction]
                            """))
                    .isInstanceOf(PolicyParseException.class)
                    .hasMessageContaining("lowercase")
                    .hasCauseInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("invalid pattern → PolicyParseException naming the field")
        void invalidPattern() {
            assertThatThrownBy(() -> parseString(parser, """
                            policy:
                              value-denylist:
                                input:
                                  type: "(image"
                            """))
                    .isInstanceOf(PolicyParseException.class)
                    .hasMessageContaining("value-denylist.input.type")
                    .hasMessageContaining("not a valid pattern");
        }

        @Test
        @DisplayName("wrong shapes → PolicyParseException")
        void wrongShapes() {
            assertThatThrownBy(() -> parseString(parser, "policy:\n  denied-tags: marquee\n"))
                    .isInstanceOf(PolicyParseException.class)
                    .hasMessageContaining("must be a list");
            assertThatThrownBy(() -> parseString(parser, "policy:\n  denied-tags: [1, 2]\n"))
                    .isInstanceOf(PolicyParseException.class)
                    .hasMessageContaining("only strings");
            assertThatThrownBy(() -> parseString(parser, "policy:\n  attribute-denylist: [input]\n"))
                    .isInstanceOf(PolicyParseException.class)
                    .hasMessageContaining("mapping of tag to names");
            assertThatThrownBy(() -> parseString(parser, "policy:\n  value-denylist:\n    input: [type]\n"))
                    .isInstanceOf(PolicyParseException.class)
                    .hasMessageContaining("mapping of attribute to pattern");
            assertThatThrownBy(() -> parseString(parser, "policy:\n  restricted: []\n"))
                    .isInstanceOf(PolicyParseException.class)
                    .hasMessageContaining("'policy.restricted' must be a mapping");
        }
    }
}
