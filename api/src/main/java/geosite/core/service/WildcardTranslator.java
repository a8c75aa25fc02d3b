package geosite.core.service;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import geosite.core.model.WildcardTranslation;
import geosite.core.service.regex.RegexNode;
import geosite.core.service.regex.RegexParser;
import geosite.core.service.regex.RegexSyntaxException;

/**
 * Converts regular expressions into the coarser wildcard syntax ({@code ?} for one
 * character, {@code *} for any run) and judges whether a conversion is safe to publish.
 *
 * <p>Translation is a bottom-up rewrite of the regex syntax tree:
 * <ul>
 *   <li>literal: itself</li>
 *   <li>any-char, char-class: {@code ?}</li>
 *   <li>quantifiers, counted repeats, alternation: {@code *}</li>
 *   <li>anchors, word boundaries, empty match: nothing</li>
 *   <li>groups, concatenation: concatenation of the children</li>
 * </ul>
 *
 * <p>A translation is <em>dangerous</em> when the pattern does not parse, when it
 * contains a precision-losing construct (char-class, alternation, counted repeat),
 * or when the translated wildcard is too broad. The two checks run independently;
 * either one is enough.
 */
@ApplicationScoped
public class WildcardTranslator {

    private static final Logger LOG = Logger.getLogger(WildcardTranslator.class);
    private static final int MAX_SINGLE_WILDCARDS = 3;

    private static final RegexNode.Visitor<String> TO_WILDCARD = new ToWildcard();
    private static final RegexNode.Visitor<Boolean> LOSES_PRECISION = new LosesPrecision();

    /**
     * Translate a regex and classify the result.
     *
     * @param regex pattern, optionally wrapped in slashes
     * @return translation with its danger flag
     */
    public WildcardTranslation translate(String regex) {
        var dangerous = isDangerous(regex);
        return new WildcardTranslation(toWildcard(regex), dangerous);
    }

    /**
     * Translate a regex to a wildcard pattern.
     *
     * @param regex pattern, optionally wrapped in slashes
     * @return the wildcard, or an empty string if the pattern cannot be parsed
     */
    public String toWildcard(String regex) {
        try {
            return RegexParser.parse(stripDelimiters(regex)).accept(TO_WILDCARD);
        } catch (RegexSyntaxException e) {
            LOG.debugv("No wildcard translation for {0}: {1}", regex, e.getMessage());
            return "";
        }
    }

    /**
     * Whether translating this regex would produce a wildcard too imprecise to
     * publish as an active rule.
     *
     * @param regex pattern, optionally wrapped in slashes
     * @return true if the translation must not be emitted
     */
    public boolean isDangerous(String regex) {
        RegexNode tree;
        try {
            tree = RegexParser.parse(stripDelimiters(regex));
        } catch (RegexSyntaxException e) {
            LOG.debugv("Unparseable regex treated as dangerous: {0}", e.getMessage());
            return true;
        }
        if (tree.accept(LOSES_PRECISION)) {
            return true;
        }
        return isBroad(tree.accept(TO_WILDCARD));
    }

    /**
     * A wildcard is too broad when it has no literal text besides dots, or when it
     * carries {@value #MAX_SINGLE_WILDCARDS} or more single-character wildcards.
     */
    static boolean isBroad(String wildcard) {
        if (wildcard.isEmpty()) {
            return false;
        }
        var onlyWildcardsAndDots = true;
        var questionMarks = 0;
        for (int i = 0; i < wildcard.length(); i++) {
            var c = wildcard.charAt(i);
            if (c == '?') {
                questionMarks++;
            } else if (c != '*' && c != '.') {
                onlyWildcardsAndDots = false;
            }
        }
        return onlyWildcardsAndDots || questionMarks >= MAX_SINGLE_WILDCARDS;
    }

    static String stripDelimiters(String regex) {
        var result = regex;
        if (result.startsWith("/")) {
            result = result.substring(1);
        }
        if (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static final class ToWildcard implements RegexNode.Visitor<String> {

        @Override
        public String visitLiteral(RegexNode.Literal node) {
            return node.text();
        }

        @Override
        public String visitCharClass(RegexNode.CharClass node) {
            return "?";
        }

        @Override
        public String visitAnyChar(RegexNode.AnyChar node) {
            return "?";
        }

        @Override
        public String visitAnchor(RegexNode.Anchor node) {
            return "";
        }

        @Override
        public String visitWordBoundary(RegexNode.WordBoundary node) {
            return "";
        }

        @Override
        public String visitGroup(RegexNode.Group node) {
            return node.child().accept(this);
        }

        @Override
        public String visitQuantified(RegexNode.Quantified node) {
            return "*";
        }

        @Override
        public String visitRepeat(RegexNode.Repeat node) {
            return "*";
        }

        @Override
        public String visitConcat(RegexNode.Concat node) {
            var result = new StringBuilder();
            for (var child : node.children()) {
                result.append(child.accept(this));
            }
            return result.toString();
        }

        @Override
        public String visitAlternation(RegexNode.Alternation node) {
            return "*";
        }

        @Override
        public String visitEmptyMatch(RegexNode.EmptyMatch node) {
            return "";
        }
    }

    private static final class LosesPrecision implements RegexNode.Visitor<Boolean> {

        @Override
        public Boolean visitLiteral(RegexNode.Literal node) {
            return false;
        }

        @Override
        public Boolean visitCharClass(RegexNode.CharClass node) {
            return true;
        }

        @Override
        public Boolean visitAnyChar(RegexNode.AnyChar node) {
            return false;
        }

        @Override
        public Boolean visitAnchor(RegexNode.Anchor node) {
            return false;
        }

        @Override
        public Boolean visitWordBoundary(RegexNode.WordBoundary node) {
            return false;
        }

        @Override
        public Boolean visitGroup(RegexNode.Group node) {
            return node.child().accept(this);
        }

        @Override
        public Boolean visitQuantified(RegexNode.Quantified node) {
            return node.child().accept(this);
        }

        @Override
        public Boolean visitRepeat(RegexNode.Repeat node) {
            return true;
        }

        @Override
        public Boolean visitConcat(RegexNode.Concat node) {
            for (var child : node.children()) {
                if (child.accept(this)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public Boolean visitAlternation(RegexNode.Alternation node) {
            return true;
        }

        @Override
        public Boolean visitEmptyMatch(RegexNode.EmptyMatch node) {
            return false;
        }
    }
}
