package geosite.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Identifies one rendering: a list member, an optional filter tag, and a dialect.
 *
 * @param member  list member name (for example {@code google})
 * @param filter  filter tag without the {@code @}, or empty for no filtering
 * @param dialect output dialect
 */
public record RulesetKey(String member, String filter, Dialect dialect) {
    public RulesetKey {
        if (member == null || member.isBlank()) {
            throw new IllegalArgumentException("Invalid name parameter");
        }
        Objects.requireNonNull(dialect, "dialect");
        if (filter == null) {
            filter = "";
        }
    }

    /**
     * Parse the {@code name[@filter]} request syntax. Input is trimmed and lower-cased
     * and split at the first {@code @}.
     *
     * @param nameWithFilter raw path segment
     * @param dialect        requested dialect
     * @return the parsed key
     * @throws IllegalArgumentException if the name part is empty
     */
    public static RulesetKey parse(String nameWithFilter, Dialect dialect) {
        var normalized = nameWithFilter == null ? "" : nameWithFilter.trim().toLowerCase(Locale.ROOT);
        var at = normalized.indexOf('@');
        if (at < 0) {
            return new RulesetKey(normalized, "", dialect);
        }
        return new RulesetKey(normalized.substring(0, at), normalized.substring(at + 1), dialect);
    }

    /**
     * Human-readable cache key, e.g. {@code surge:google@cn}.
     */
    public String describe() {
        return dialect.id() + ":" + member + (filter.isEmpty() ? "" : "@" + filter);
    }
}
