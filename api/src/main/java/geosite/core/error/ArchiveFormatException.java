package geosite.core.error;

/**
 * Archive or member content could not be decoded. Not retried.
 */
public class ArchiveFormatException extends GeositeException {

    public ArchiveFormatException(String message) {
        super(message);
    }

    public ArchiveFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
