package geosite.core.model;

import java.util.Objects;

/**
 * A single matching directive parsed from a list member.
 *
 * @param kind    rule kind, fixed at parse time
 * @param value   the domain, keyword, or regular expression
 * @param comment trailing tag/comment region of the source line (may be empty)
 */
public record Rule(RuleKind kind, String value, String comment) {
    public Rule {
        Objects.requireNonNull(kind, "kind");
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Rule value must not be empty");
        }
        if (comment == null) {
            comment = "";
        }
    }

    public static Rule of(RuleKind kind, String value) {
        return new Rule(kind, value, "");
    }
}
