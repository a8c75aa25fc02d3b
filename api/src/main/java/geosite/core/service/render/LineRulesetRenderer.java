package geosite.core.service.render;

import java.util.ArrayList;
import java.util.List;

import geosite.core.model.ListItem;
import geosite.core.model.Rule;

/**
 * Shared traversal for the line-oriented dialects.
 *
 * <p>Comments are buffered and only written out directly before the next emitted
 * rule, so that a comment never ends up orphaned at the end of a section whose
 * rules were filtered away. Include echoes are buffered separately and always
 * precede the ordinary pending comment. A later ordinary comment replaces an
 * unflushed earlier one.
 *
 * <p>A rule whose rendering is itself a comment (a refused translation) is buffered
 * as the pending comment rather than emitted.
 */
public abstract class LineRulesetRenderer implements RulesetRenderer {

    @Override
    public String render(List<ListItem> items) {
        var lines = new ArrayList<String>();
        var pendingIncludes = new ArrayList<String>();
        String pendingComment = null;

        for (var item : items) {
            if (item instanceof ListItem.IncludeEcho include) {
                pendingIncludes.add(include.text());
                continue;
            }
            if (item instanceof ListItem.CommentLine comment) {
                pendingComment = comment.text();
                continue;
            }

            var line = renderRule(((ListItem.RuleLine) item).rule());
            if (line.trim().startsWith("#")) {
                pendingComment = line;
                continue;
            }

            lines.addAll(pendingIncludes);
            pendingIncludes.clear();
            if (pendingComment != null) {
                lines.add(pendingComment);
                pendingComment = null;
            }
            lines.add(line);
        }

        return String.join("\n", lines);
    }

    /**
     * Render a single rule as one line. A line starting with {@code #} is treated as
     * a disabled rule.
     */
    protected abstract String renderRule(Rule rule);

    /**
     * Render the kinds every line dialect shares.
     */
    protected static String renderPlain(String type, Rule rule) {
        return appendComment(type + "," + rule.value(), rule.comment());
    }

    static String appendComment(String line, String comment) {
        if (comment.isEmpty()) {
            return line;
        }
        if (comment.startsWith("#")) {
            return line + " " + comment;
        }
        return line + " # " + comment;
    }
}
