package geosite.core.model;

/**
 * One parsed line of a list member: a rule, a comment, or the echo of an expanded include.
 */
public sealed interface ListItem {

    record RuleLine(Rule rule) implements ListItem {}

    record CommentLine(String text) implements ListItem {}

    /**
     * Marks where an {@code include:} directive was expanded.
     *
     * @param directive the directive as written, e.g. {@code include:youtube @cn}
     */
    record IncludeEcho(String directive) implements ListItem {

        public String text() {
            return "# " + directive;
        }
    }

    default boolean isRule() {
        return this instanceof RuleLine;
    }

    static ListItem rule(Rule rule) {
        return new RuleLine(rule);
    }

    static ListItem comment(String text) {
        return new CommentLine(text);
    }

    static ListItem include(String directive) {
        return new IncludeEcho(directive);
    }
}
