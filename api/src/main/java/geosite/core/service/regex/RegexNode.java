package geosite.core.service.regex;

import java.util.List;

/**
 * Syntax tree of a parsed regular expression.
 *
 * <p>The variant set is closed. Consumers dispatch through {@link Visitor} so that
 * adding a node kind is a compile error everywhere it is not handled.
 */
public sealed interface RegexNode {

    <R> R accept(Visitor<R> visitor);

    /** A run of literal characters. */
    record Literal(String text) implements RegexNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    /** A bracket expression or class escape such as {@code \d}, kept as written. */
    record CharClass(String source) implements RegexNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCharClass(this);
        }
    }

    /** The {@code .} wildcard. */
    record AnyChar() implements RegexNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAnyChar(this);
        }
    }

    enum AnchorKind {
        BEGIN_LINE,
        END_LINE,
        BEGIN_TEXT,
        END_TEXT
    }

    record Anchor(AnchorKind kind) implements RegexNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAnchor(this);
        }
    }

    /** {@code \b}, or {@code \B} when negated. */
    record WordBoundary(boolean negated) implements RegexNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWordBoundary(this);
        }
    }

    record Group(boolean capturing, RegexNode child) implements RegexNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGroup(this);
        }
    }

    enum QuantifierKind {
        STAR,
        PLUS,
        QUEST
    }

    record Quantified(RegexNode child, QuantifierKind kind, boolean lazy) implements RegexNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitQuantified(this);
        }
    }

    /**
     * Counted repetition {@code {min}}, {@code {min,}} or {@code {min,max}}.
     *
     * @param max upper bound, or -1 when unbounded
     */
    record Repeat(RegexNode child, int min, int max, boolean lazy) implements RegexNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRepeat(this);
        }
    }

    record Concat(List<RegexNode> children) implements RegexNode {
        public Concat {
            children = List.copyOf(children);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConcat(this);
        }
    }

    record Alternation(List<RegexNode> children) implements RegexNode {
        public Alternation {
            children = List.copyOf(children);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAlternation(this);
        }
    }

    /** Matches the empty string, e.g. an empty branch or {@code ()}. */
    record EmptyMatch() implements RegexNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEmptyMatch(this);
        }
    }

    interface Visitor<R> {
        R visitLiteral(Literal node);

        R visitCharClass(CharClass node);

        R visitAnyChar(AnyChar node);

        R visitAnchor(Anchor node);

        R visitWordBoundary(WordBoundary node);

        R visitGroup(Group node);

        R visitQuantified(Quantified node);

        R visitRepeat(Repeat node);

        R visitConcat(Concat node);

        R visitAlternation(Alternation node);

        R visitEmptyMatch(EmptyMatch node);
    }
}
