package geosite.core.service.render;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;

import com.fasterxml.jackson.core.io.JsonStringEncoder;

import geosite.core.model.Dialect;
import geosite.core.model.ListItem;
import geosite.core.model.RuleKind;

/**
 * Egern rule-set YAML: values grouped into one sequence per rule kind. Comments
 * are not carried over.
 *
 * <pre>
 * domain_set:
 *   - "example.com"
 * domain_suffix_set:
 *   - "example.org"
 * </pre>
 */
@ApplicationScoped
public class EgernRenderer implements RulesetRenderer {

    private static final Map<RuleKind, String> SET_NAMES = new EnumMap<>(Map.of(
            RuleKind.DOMAIN, "domain_set",
            RuleKind.DOMAIN_SUFFIX, "domain_suffix_set",
            RuleKind.DOMAIN_KEYWORD, "domain_keyword_set",
            RuleKind.DOMAIN_REGEX, "domain_regex_set"));

    private static final List<RuleKind> SET_ORDER =
            List.of(RuleKind.DOMAIN, RuleKind.DOMAIN_SUFFIX, RuleKind.DOMAIN_KEYWORD, RuleKind.DOMAIN_REGEX);

    @Override
    public Dialect dialect() {
        return Dialect.EGERN;
    }

    @Override
    public String render(List<ListItem> items) {
        var sets = new EnumMap<RuleKind, List<String>>(RuleKind.class);
        for (var item : items) {
            if (item instanceof ListItem.RuleLine line) {
                sets.computeIfAbsent(line.rule().kind(), k -> new ArrayList<>()).add(line.rule().value());
            }
        }

        var out = new StringBuilder();
        for (var kind : SET_ORDER) {
            var values = sets.get(kind);
            if (values == null || values.isEmpty()) {
                continue;
            }
            out.append(SET_NAMES.get(kind)).append(":\n");
            for (var value : values) {
                out.append("  - \"").append(quote(value)).append("\"\n");
            }
        }

        var length = out.length();
        while (length > 0 && out.charAt(length - 1) == '\n') {
            length--;
        }
        out.setLength(length);
        return out.toString();
    }

    // JSON string escaping is valid inside a YAML double-quoted scalar.
    private static String quote(String value) {
        return new String(JsonStringEncoder.getInstance().quoteAsString(value));
    }
}
