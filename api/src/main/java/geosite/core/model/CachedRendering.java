package geosite.core.model;

import java.time.Instant;

/**
 * A memoized rendering, tied to the archive fingerprint it was computed against.
 */
public record CachedRendering(String text, String fingerprint, Instant createdAt) {

    public boolean matches(String currentFingerprint) {
        return fingerprint.equals(currentFingerprint);
    }
}
