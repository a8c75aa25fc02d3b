package geosite.core.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import geosite.core.error.CyclicIncludeException;
import geosite.core.model.ListItem;
import geosite.core.model.Rule;
import geosite.core.model.RuleKind;
import geosite.core.port.out.MemberResolver;

/**
 * Parses domain-list members into ordered items.
 *
 * <h2>Line grammar</h2>
 * <ul>
 *   <li>blank: dropped</li>
 *   <li>{@code # ...}: comment, kept verbatim</li>
 *   <li>{@code domain:}, {@code full:}, {@code keyword:}, {@code regexp:}: rule of that kind</li>
 *   <li>{@code include:NAME}: the named member, parsed recursively with the same filter</li>
 *   <li>anything else: a bare domain, parsed as a suffix rule</li>
 * </ul>
 *
 * <p>The first space separates a rule's value from its trailing tag/comment region,
 * e.g. {@code domain:example.cn @cn # mainland}.
 *
 * <h2>Filtering</h2>
 * <p>With a non-empty filter tag, a rule is kept only if its trailing region starts
 * with an attribute and carries {@code @tag} before any {@code #}. Comments are
 * never filtered.
 */
@ApplicationScoped
public class RuleParser {

    private static final Logger LOG = Logger.getLogger(RuleParser.class);
    private static final String INCLUDE_PREFIX = "include:";

    /**
     * Parse a member and everything it includes.
     *
     * @param memberName name of the member being parsed, used for cycle detection
     * @param text       member content
     * @param filterTag  attribute to select on, without {@code @}; empty keeps every rule
     * @param resolver   source of included members
     * @return items in source order, includes expanded inline
     * @throws CyclicIncludeException if an include chain refers back to a member being expanded
     */
    public List<ListItem> parse(String memberName, String text, String filterTag, MemberResolver resolver) {
        var chain = new LinkedHashSet<String>();
        chain.add(memberName);
        return parseMember(text, filterTag == null ? "" : filterTag, resolver, chain);
    }

    private List<ListItem> parseMember(
            String text, String filterTag, MemberResolver resolver, LinkedHashSet<String> chain) {
        var items = new ArrayList<ListItem>();

        for (var rawLine : text.split("\n", -1)) {
            var line = rawLine.trim();
            if (line.isEmpty()) {
                continue;
            }
            if (line.startsWith("#")) {
                items.add(ListItem.comment(line));
                continue;
            }
            if (line.startsWith(INCLUDE_PREFIX)) {
                items.addAll(parseInclude(line, filterTag, resolver, chain));
                continue;
            }
            var item = parseRuleLine(line, kindOf(line), filterTag);
            if (item != null) {
                items.add(item);
            }
        }

        return items;
    }

    private static RuleKind kindOf(String line) {
        for (var kind : RuleKind.values()) {
            if (line.startsWith(kind.prefix())) {
                return kind;
            }
        }
        return null;
    }

    private static ListItem parseRuleLine(String line, RuleKind prefixKind, String filterTag) {
        var space = line.indexOf(' ');
        var token = space < 0 ? line : line.substring(0, space);
        var rest = space < 0 ? "" : line.substring(space + 1);

        var kind = prefixKind == null ? RuleKind.DOMAIN_SUFFIX : prefixKind;
        var value = prefixKind == null ? token : token.substring(prefixKind.prefix().length());

        if (!matchesFilter(rest, filterTag)) {
            return null;
        }
        if (value.isEmpty()) {
            LOG.debugv("Skipping rule with empty value: {0}", line);
            return null;
        }
        return ListItem.rule(new Rule(kind, value, rest));
    }

    /**
     * Whether a rule's trailing region selects it for the given filter tag.
     */
    static boolean matchesFilter(String rest, String filterTag) {
        if (filterTag.isEmpty()) {
            return true;
        }

        var trimmed = rest.trim();
        if (!trimmed.startsWith("@")) {
            return false;
        }

        var commentIndex = trimmed.indexOf('#');
        var filterIndex = trimmed.indexOf("@" + filterTag);

        return filterIndex != -1 && (commentIndex == -1 || commentIndex > filterIndex);
    }

    private List<ListItem> parseInclude(
            String line, String filterTag, MemberResolver resolver, LinkedHashSet<String> chain) {
        var space = line.indexOf(' ');
        var target = (space < 0 ? line : line.substring(0, space)).substring(INCLUDE_PREFIX.length());

        if (chain.contains(target)) {
            var cycle = new ArrayList<>(chain);
            cycle.add(target);
            throw new CyclicIncludeException(cycle);
        }

        var content = resolver.resolve(target);

        chain.add(target);
        List<ListItem> subItems;
        try {
            subItems = parseMember(content, filterTag, resolver, chain);
        } finally {
            chain.remove(target);
        }

        if (subItems.stream().noneMatch(ListItem::isRule)) {
            LOG.debugv("Include {0} has no rules for filter [{1}], dropping", target, filterTag);
            return List.of();
        }

        var items = new ArrayList<ListItem>(subItems.size() + 1);
        items.add(ListItem.include(line));
        items.addAll(subItems);
        return items;
    }
}
