package geosite.core.service.regex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import geosite.core.service.regex.RegexNode.AnchorKind;
import geosite.core.service.regex.RegexNode.QuantifierKind;

@DisplayName("RegexParser")
class RegexParserTest {

    @Nested
    @DisplayName("Atoms")
    class Atoms {

        @Test
        @DisplayName("should merge adjacent literals into one run")
        void shouldMergeLiterals() {
            assertEquals(new RegexNode.Literal("abc"), RegexParser.parse("abc"));
        }

        @Test
        @DisplayName("should parse escaped punctuation as literal")
        void shouldParseEscapedDot() {
            assertEquals(new RegexNode.Literal("google.com"), RegexParser.parse("google\\.com"));
        }

        @Test
        @DisplayName("should parse Unicode classes as char-class")
        void shouldParseUnicodeClasses() {
            assertEquals(new RegexNode.CharClass("\\pL"), RegexParser.parse("\\pL"));
            assertEquals(new RegexNode.CharClass("\\P{Greek}"), RegexParser.parse("\\P{Greek}"));
        }

        @Test
        @DisplayName("should parse class escapes as char-class")
        void shouldParseClassEscapes() {
            assertEquals(new RegexNode.CharClass("\\d"), RegexParser.parse("\\d"));
            assertEquals(new RegexNode.CharClass("\\W"), RegexParser.parse("\\W"));
        }

        @Test
        @DisplayName("should parse bracket expressions including POSIX classes")
        void shouldParseBrackets() {
            assertEquals(new RegexNode.CharClass("[a-z]"), RegexParser.parse("[a-z]"));
            assertEquals(new RegexNode.CharClass("[[:alpha:]0-9]"), RegexParser.parse("[[:alpha:]0-9]"));
            assertEquals(new RegexNode.CharClass("[]a]"), RegexParser.parse("[]a]"));
        }

        @Test
        @DisplayName("should parse anchors and word boundaries")
        void shouldParseAnchors() {
            var node = RegexParser.parse("^\\bx$");

            var concat = assertInstanceOf(RegexNode.Concat.class, node);
            assertEquals(
                    List.of(
                            new RegexNode.Anchor(AnchorKind.BEGIN_LINE),
                            new RegexNode.WordBoundary(false),
                            new RegexNode.Literal("x"),
                            new RegexNode.Anchor(AnchorKind.END_LINE)),
                    concat.children());
        }

        @Test
        @DisplayName("should decode hex escapes")
        void shouldDecodeHexEscapes() {
            assertEquals(new RegexNode.Literal("AB"), RegexParser.parse("\\x41\\x{42}"));
        }

        @Test
        @DisplayName("should treat a brace that is not a repeat as literal")
        void shouldTreatLooseBraceAsLiteral() {
            assertEquals(new RegexNode.Literal("a{,3}"), RegexParser.parse("a{,3}"));
        }

        @Test
        @DisplayName("should parse the empty pattern as empty match")
        void shouldParseEmptyPattern() {
            assertEquals(new RegexNode.EmptyMatch(), RegexParser.parse(""));
        }
    }

    @Nested
    @DisplayName("Quantifiers")
    class Quantifiers {

        @Test
        @DisplayName("should bind a quantifier to the preceding character only")
        void shouldBindToPrecedingCharacter() {
            var concat = assertInstanceOf(RegexNode.Concat.class, RegexParser.parse("ab+"));

            assertEquals(new RegexNode.Literal("a"), concat.children().get(0));
            assertEquals(
                    new RegexNode.Quantified(new RegexNode.Literal("b"), QuantifierKind.PLUS, false),
                    concat.children().get(1));
        }

        @Test
        @DisplayName("should accept a lazy suffix")
        void shouldAcceptLazySuffix() {
            var node = assertInstanceOf(RegexNode.Quantified.class, RegexParser.parse(".*?"));

            assertEquals(QuantifierKind.STAR, node.kind());
            assertTrue(node.lazy());
        }

        @Test
        @DisplayName("should parse counted repeats")
        void shouldParseRepeats() {
            assertEquals(new RegexNode.Repeat(new RegexNode.Literal("a"), 2, 2, false), RegexParser.parse("a{2}"));
            assertEquals(new RegexNode.Repeat(new RegexNode.Literal("a"), 2, -1, false), RegexParser.parse("a{2,}"));
            assertEquals(new RegexNode.Repeat(new RegexNode.Literal("a"), 1, 3, true), RegexParser.parse("a{1,3}?"));
        }

        @Test
        @DisplayName("should reject a repeat whose maximum is below its minimum")
        void shouldRejectInvertedRepeat() {
            assertThrows(RegexSyntaxException.class, () -> RegexParser.parse("a{5,2}"));
        }
    }

    @Nested
    @DisplayName("Groups and alternation")
    class Groups {

        @Test
        @DisplayName("should parse non-capturing groups")
        void shouldParseNonCapturingGroup() {
            var group = assertInstanceOf(RegexNode.Group.class, RegexParser.parse("(?:ab)"));

            assertFalse(group.capturing());
            assertEquals(new RegexNode.Literal("ab"), group.child());
        }

        @Test
        @DisplayName("should parse named groups as capturing groups")
        void shouldParseNamedGroups() {
            var expected = new RegexNode.Group(true, new RegexNode.Literal("www"));

            assertEquals(expected, RegexParser.parse("(?P<sub>www)"));
            assertEquals(expected, RegexParser.parse("(?<sub>www)"));
        }

        @Test
        @DisplayName("should drop standalone flags")
        void shouldDropFlagDirective() {
            var concat = assertInstanceOf(RegexNode.Concat.class, RegexParser.parse("(?i)example\\.com"));

            assertEquals(
                    List.of(new RegexNode.EmptyMatch(), new RegexNode.Literal("example.com")), concat.children());
        }

        @Test
        @DisplayName("should parse a flag group as non-capturing")
        void shouldParseFlagGroup() {
            assertEquals(
                    new RegexNode.Group(false, new RegexNode.Literal("ab")), RegexParser.parse("(?i-s:ab)"));
        }

        @Test
        @DisplayName("should parse alternation at the top level")
        void shouldParseAlternation() {
            var alternation = assertInstanceOf(RegexNode.Alternation.class, RegexParser.parse("www|api"));

            assertEquals(List.of(new RegexNode.Literal("www"), new RegexNode.Literal("api")), alternation.children());
        }

        @Test
        @DisplayName("should allow an empty alternative")
        void shouldAllowEmptyAlternative() {
            var group = assertInstanceOf(RegexNode.Group.class, RegexParser.parse("(a|)"));
            var alternation = assertInstanceOf(RegexNode.Alternation.class, group.child());

            assertEquals(new RegexNode.EmptyMatch(), alternation.children().get(1));
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @ParameterizedTest
        @ValueSource(strings = {"*a", "a**", "a+*", "(ab", "ab)", "[abc", "a\\", "(?=a)", "(?<=a)b", "(?P=n)", "(?)a", "(?i-)a", "(?x)a", "(?i)*a", "\\p", "\\p{}", "\\q", "\\1", "a{2}{3}"})
        @DisplayName("should reject malformed or unsupported patterns")
        void shouldRejectInvalidPatterns(String pattern) {
            assertThrows(RegexSyntaxException.class, () -> RegexParser.parse(pattern));
        }

        @Test
        @DisplayName("should report the position of the error")
        void shouldReportPosition() {
            var error = assertThrows(RegexSyntaxException.class, () -> RegexParser.parse("ab)"));

            assertEquals(2, error.position());
        }
    }
}
