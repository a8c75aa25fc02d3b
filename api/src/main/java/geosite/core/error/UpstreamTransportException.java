package geosite.core.error;

/**
 * The upstream archive fingerprint could not be fetched or the archive downloaded. Retryable.
 */
public class UpstreamTransportException extends GeositeException {

    public UpstreamTransportException(String message) {
        super(message);
    }

    public UpstreamTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
