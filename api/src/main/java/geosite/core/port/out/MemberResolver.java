package geosite.core.port.out;

/**
 * Supplies the text of list members referenced by {@code include:} directives.
 */
@FunctionalInterface
public interface MemberResolver {

    /**
     * Resolve a list member by name.
     *
     * @param name member name as written after {@code include:}
     * @return the member's text
     * @throws geosite.core.error.MemberNotFoundException if the member does not exist
     * @throws geosite.core.error.ArchiveFormatException if the member cannot be decoded
     */
    String resolve(String name);
}
