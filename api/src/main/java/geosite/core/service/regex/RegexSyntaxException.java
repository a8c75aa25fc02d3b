package geosite.core.service.regex;

/**
 * A pattern uses syntax outside the supported operator set, or is malformed.
 */
public class RegexSyntaxException extends RuntimeException {

    private final int position;

    public RegexSyntaxException(String message, String pattern, int position) {
        super("%s at index %d in `%s`".formatted(message, position, pattern));
        this.position = position;
    }

    public int position() {
        return position;
    }
}
