package geosite.core.model;

/**
 * Result of translating a regular expression into the wildcard alphabet
 * ({@code ?}, {@code *} and literal characters).
 *
 * @param pattern   translated wildcard; empty when the regex could not be parsed
 * @param dangerous whether the translation is too imprecise to publish as an active rule
 */
public record WildcardTranslation(String pattern, boolean dangerous) {

    /**
     * Whether the pattern carries no literal text: empty, or only wildcard characters.
     * Such a pattern matches nothing useful and must not be published as an active rule.
     */
    public boolean hasNoLiteral() {
        for (int i = 0; i < pattern.length(); i++) {
            var c = pattern.charAt(i);
            if (c != '?' && c != '*') {
                return false;
            }
        }
        return true;
    }
}
