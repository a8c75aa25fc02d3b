package geosite.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Output formats the service can render a list into.
 */
public enum Dialect {
    /** Line-oriented; regular expressions are translated to wildcards. */
    SURGE("text/plain; charset=utf-8"),
    /** Line-oriented with native regex support. */
    MIHOMO("text/plain; charset=utf-8"),
    /** YAML document grouping values by rule kind. */
    EGERN("text/yaml; charset=utf-8");

    private final String contentType;

    Dialect(String contentType) {
        this.contentType = contentType;
    }

    public String contentType() {
        return contentType;
    }

    /**
     * Lower-case identifier used in URLs and cache keys.
     */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Dialect> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        for (var dialect : values()) {
            if (dialect.id().equals(id.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(dialect);
            }
        }
        return Optional.empty();
    }
}
