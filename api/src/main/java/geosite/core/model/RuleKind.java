package geosite.core.model;

/**
 * Matching directive kinds understood by the domain-list format.
 *
 * <p>The kind is fixed when a line is parsed and is never reinterpreted by
 * renderers.
 */
public enum RuleKind {
    DOMAIN_SUFFIX("domain:"),
    DOMAIN("full:"),
    DOMAIN_KEYWORD("keyword:"),
    DOMAIN_REGEX("regexp:");

    private final String prefix;

    RuleKind(String prefix) {
        this.prefix = prefix;
    }

    /**
     * The line prefix that selects this kind in the source format.
     *
     * @return prefix including the trailing colon
     */
    public String prefix() {
        return prefix;
    }
}
