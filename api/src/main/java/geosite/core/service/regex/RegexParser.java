package geosite.core.service.regex;

import java.util.ArrayList;
import java.util.List;

import geosite.core.service.regex.RegexNode.AnchorKind;
import geosite.core.service.regex.RegexNode.QuantifierKind;

/**
 * Recursive-descent parser for the regular expression subset used by domain lists.
 *
 * <p>Supported: literals and escaped punctuation, {@code .}, bracket expressions,
 * the class escapes {@code \d \w \s}, Unicode classes {@code \pL \p{Greek}} and their
 * negations, anchors {@code ^ $ \A \z}, word boundaries, capturing, named and
 * {@code (?:...)} groups, the flags {@code i m s U} as {@code (?flags)} or
 * {@code (?flags:...)}, {@code * + ?} and {@code {n} {n,} {n,m}} quantifiers with an
 * optional lazy {@code ?} suffix, concatenation and alternation.
 *
 * <p>Anything else (lookaround, back-references, nested quantifiers) is rejected
 * with {@link RegexSyntaxException}.
 */
public final class RegexParser {

    private static final int MAX_REPEAT = 1000;
    private static final String FLAGS = "imsU";

    private final String pattern;
    private int pos;

    private RegexParser(String pattern) {
        this.pattern = pattern;
    }

    /**
     * Parse a pattern into a syntax tree.
     *
     * @param pattern regular expression without delimiters
     * @return root node
     * @throws RegexSyntaxException if the pattern is malformed or unsupported
     */
    public static RegexNode parse(String pattern) {
        if (pattern == null) {
            throw new RegexSyntaxException("null pattern", "", 0);
        }
        var parser = new RegexParser(pattern);
        var root = parser.parseAlternation();
        if (!parser.atEnd()) {
            throw parser.error("unexpected )");
        }
        return root;
    }

    private RegexNode parseAlternation() {
        var branches = new ArrayList<RegexNode>();
        branches.add(parseConcat());
        while (!atEnd() && current() == '|') {
            pos++;
            branches.add(parseConcat());
        }
        return branches.size() == 1 ? branches.get(0) : new RegexNode.Alternation(branches);
    }

    private RegexNode parseConcat() {
        var items = new ArrayList<RegexNode>();
        while (!atEnd() && current() != '|' && current() != ')') {
            var atom = parseQuantifiers(parseAtom());
            append(items, atom);
        }
        if (items.isEmpty()) {
            return new RegexNode.EmptyMatch();
        }
        return items.size() == 1 ? items.get(0) : new RegexNode.Concat(items);
    }

    // Adjacent literals collapse into one run.
    private static void append(List<RegexNode> items, RegexNode node) {
        if (node instanceof RegexNode.Literal literal && !items.isEmpty()) {
            var last = items.get(items.size() - 1);
            if (last instanceof RegexNode.Literal previous) {
                items.set(items.size() - 1, new RegexNode.Literal(previous.text() + literal.text()));
                return;
            }
        }
        items.add(node);
    }

    private RegexNode parseAtom() {
        var c = current();
        switch (c) {
            case '(':
                return parseGroup();
            case '[':
                return parseBracket();
            case '.':
                pos++;
                return new RegexNode.AnyChar();
            case '^':
                pos++;
                return new RegexNode.Anchor(AnchorKind.BEGIN_LINE);
            case '$':
                pos++;
                return new RegexNode.Anchor(AnchorKind.END_LINE);
            case '\\':
                return parseEscape();
            case '*':
            case '+':
            case '?':
                throw error("missing argument to repetition operator");
            case '{':
                if (lookingAtRepeat()) {
                    throw error("missing argument to repetition operator");
                }
                pos++;
                return new RegexNode.Literal("{");
            default:
                var codePoint = pattern.codePointAt(pos);
                pos += Character.charCount(codePoint);
                return new RegexNode.Literal(new String(Character.toChars(codePoint)));
        }
    }

    private RegexNode parseGroup() {
        var start = pos;
        pos++;
        var capturing = true;
        if (!atEnd() && current() == '?') {
            if (pattern.startsWith("?:", pos)) {
                capturing = false;
                pos += 2;
            } else if (pattern.startsWith("?P<", pos) || pattern.startsWith("?<", pos)) {
                pos += pattern.charAt(pos + 1) == 'P' ? 3 : 2;
                parseGroupName(start);
            } else if (parseFlags(start)) {
                // (?flags) applies to the rest of the pattern and matches nothing
                if (!atEnd() && (isQuantifierChar(current()) || (current() == '{' && lookingAtRepeat()))) {
                    throw error("missing argument to repetition operator");
                }
                return new RegexNode.EmptyMatch();
            } else {
                capturing = false;
            }
        }
        var inner = parseAlternation();
        if (atEnd() || current() != ')') {
            throw new RegexSyntaxException("missing closing )", pattern, start);
        }
        pos++;
        return new RegexNode.Group(capturing, inner);
    }

    private void parseGroupName(int start) {
        var close = pattern.indexOf('>', pos);
        if (close <= pos) {
            throw new RegexSyntaxException("invalid named capture", pattern, start);
        }
        for (int i = pos; i < close; i++) {
            var c = pattern.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') {
                throw new RegexSyntaxException("invalid named capture", pattern, start);
            }
        }
        pos = close + 1;
    }

    /**
     * Consume the flag list of {@code (?flags)} or {@code (?flags:}. Flags only change
     * case folding and line handling, neither of which survives wildcard translation,
     * so they are validated and dropped.
     *
     * @return true for a standalone {@code (?flags)}, false for a {@code (?flags:...)} group
     */
    private boolean parseFlags(int start) {
        pos++;
        var sawFlag = false;
        var negated = false;
        var flagsAfterMinus = false;
        while (!atEnd()) {
            var c = current();
            if (c == ')' || c == ':') {
                if (!sawFlag || (negated && !flagsAfterMinus)) {
                    break;
                }
                pos++;
                return c == ')';
            }
            if (c == '-' && !negated) {
                negated = true;
            } else if (FLAGS.indexOf(c) >= 0) {
                sawFlag = true;
                flagsAfterMinus = negated;
            } else {
                break;
            }
            pos++;
        }
        throw new RegexSyntaxException("unsupported group syntax", pattern, start);
    }

    private RegexNode parseBracket() {
        var start = pos;
        pos++;
        if (!atEnd() && current() == '^') {
            pos++;
        }
        if (!atEnd() && current() == ']') {
            pos++;
        }
        while (true) {
            if (atEnd()) {
                throw new RegexSyntaxException("missing closing ]", pattern, start);
            }
            var c = current();
            if (c == '\\') {
                if (pos + 1 >= pattern.length()) {
                    throw error("trailing backslash");
                }
                pos += 2;
            } else if (c == '[' && pattern.startsWith("[:", pos)) {
                var close = pattern.indexOf(":]", pos + 2);
                pos = close < 0 ? pos + 1 : close + 2;
            } else if (c == ']') {
                pos++;
                return new RegexNode.CharClass(pattern.substring(start, pos));
            } else {
                pos++;
            }
        }
    }

    private RegexNode parseEscape() {
        var start = pos;
        pos++;
        if (atEnd()) {
            throw error("trailing backslash");
        }
        var c = current();
        pos++;
        switch (c) {
            case 'd':
            case 'D':
            case 'w':
            case 'W':
            case 's':
            case 'S':
                return new RegexNode.CharClass("\\" + c);
            case 'p':
            case 'P':
                return new RegexNode.CharClass(pattern.substring(start, parseUnicodeClassName(start)));
            case 'b':
                return new RegexNode.WordBoundary(false);
            case 'B':
                return new RegexNode.WordBoundary(true);
            case 'A':
                return new RegexNode.Anchor(AnchorKind.BEGIN_TEXT);
            case 'z':
                return new RegexNode.Anchor(AnchorKind.END_TEXT);
            case 't':
                return new RegexNode.Literal("\t");
            case 'n':
                return new RegexNode.Literal("\n");
            case 'r':
                return new RegexNode.Literal("\r");
            case 'f':
                return new RegexNode.Literal("\f");
            case 'v':
                return new RegexNode.Literal("\u000B");
            case 'x':
                return new RegexNode.Literal(new String(Character.toChars(parseHexEscape(start))));
            default:
                if (Character.isLetterOrDigit(c)) {
                    throw new RegexSyntaxException("invalid escape sequence \\" + c, pattern, start);
                }
                return new RegexNode.Literal(String.valueOf(c));
        }
    }

    // \pL or \p{Greek}; returns the end of the escape
    private int parseUnicodeClassName(int start) {
        if (atEnd()) {
            throw new RegexSyntaxException("invalid character class range", pattern, start);
        }
        if (current() == '{') {
            var close = pattern.indexOf('}', pos);
            if (close <= pos + 1) {
                throw new RegexSyntaxException("invalid character class range", pattern, start);
            }
            pos = close + 1;
        } else if (Character.isLetter(current())) {
            pos++;
        } else {
            throw new RegexSyntaxException("invalid character class range", pattern, start);
        }
        return pos;
    }

    private int parseHexEscape(int start) {
        String digits;
        if (!atEnd() && current() == '{') {
            var close = pattern.indexOf('}', pos);
            if (close < 0) {
                throw new RegexSyntaxException("invalid escape sequence", pattern, start);
            }
            digits = pattern.substring(pos + 1, close);
            pos = close + 1;
        } else {
            if (pos + 2 > pattern.length()) {
                throw new RegexSyntaxException("invalid escape sequence", pattern, start);
            }
            digits = pattern.substring(pos, pos + 2);
            pos += 2;
        }
        try {
            var value = Integer.parseInt(digits, 16);
            if (digits.isEmpty() || !Character.isValidCodePoint(value)) {
                throw new RegexSyntaxException("invalid escape sequence", pattern, start);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new RegexSyntaxException("invalid escape sequence", pattern, start);
        }
    }

    private RegexNode parseQuantifiers(RegexNode atom) {
        if (atEnd()) {
            return atom;
        }
        RegexNode result;
        var c = current();
        if (c == '*' || c == '+' || c == '?') {
            pos++;
            var kind = c == '*' ? QuantifierKind.STAR : c == '+' ? QuantifierKind.PLUS : QuantifierKind.QUEST;
            result = new RegexNode.Quantified(atom, kind, consumeLazy());
        } else if (c == '{' && lookingAtRepeat()) {
            result = parseRepeat(atom);
        } else {
            return atom;
        }
        if (!atEnd() && (isQuantifierChar(current()) || (current() == '{' && lookingAtRepeat()))) {
            throw error("invalid nested repetition operator");
        }
        return result;
    }

    private RegexNode parseRepeat(RegexNode atom) {
        var start = pos;
        var close = pattern.indexOf('}', pos);
        var body = pattern.substring(pos + 1, close);
        pos = close + 1;
        var comma = body.indexOf(',');
        int min;
        int max;
        if (comma < 0) {
            min = Integer.parseInt(body);
            max = min;
        } else {
            min = Integer.parseInt(body.substring(0, comma));
            var upper = body.substring(comma + 1);
            max = upper.isEmpty() ? -1 : Integer.parseInt(upper);
        }
        if (min > MAX_REPEAT || max > MAX_REPEAT || (max >= 0 && max < min)) {
            throw new RegexSyntaxException("invalid repeat count", pattern, start);
        }
        return new RegexNode.Repeat(atom, min, max, consumeLazy());
    }

    // Only well-formed {n}, {n,} and {n,m} count as repetition; anything else is a literal brace.
    private boolean lookingAtRepeat() {
        var close = pattern.indexOf('}', pos);
        if (close < 0) {
            return false;
        }
        var body = pattern.substring(pos + 1, close);
        return body.matches("\\d{1,4}(,\\d{0,4})?");
    }

    private boolean consumeLazy() {
        if (!atEnd() && current() == '?') {
            pos++;
            return true;
        }
        return false;
    }

    private static boolean isQuantifierChar(char c) {
        return c == '*' || c == '+' || c == '?';
    }

    private boolean atEnd() {
        return pos >= pattern.length();
    }

    private char current() {
        return pattern.charAt(pos);
    }

    private RegexSyntaxException error(String message) {
        return new RegexSyntaxException(message, pattern, pos);
    }
}
