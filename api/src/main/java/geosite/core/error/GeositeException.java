package geosite.core.error;

/**
 * Base type for failures while fetching, parsing, or rendering rulesets.
 */
public abstract class GeositeException extends RuntimeException {

    protected GeositeException(String message) {
        super(message);
    }

    protected GeositeException(String message, Throwable cause) {
        super(message, cause);
    }
}
