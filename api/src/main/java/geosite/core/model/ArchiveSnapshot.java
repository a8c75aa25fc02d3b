package geosite.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One cached version of the upstream archive.
 *
 * <p>The payload and fingerprint always travel together; a snapshot is replaced
 * wholesale, never mutated.
 *
 * @param archive     decoded archive
 * @param payload     raw bytes as downloaded
 * @param fingerprint opaque version token (ETag or content hash)
 * @param fetchedAt   start of the current freshness window
 */
public record ArchiveSnapshot(SourceArchive archive, byte[] payload, String fingerprint, Instant fetchedAt) {
    public ArchiveSnapshot {
        Objects.requireNonNull(archive, "archive");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(fetchedAt, "fetchedAt");
        if (fingerprint == null || fingerprint.isBlank()) {
            throw new IllegalArgumentException("Fingerprint must not be empty");
        }
    }

    /**
     * Same archive with a new freshness window.
     */
    public ArchiveSnapshot withFetchedAt(Instant instant) {
        return new ArchiveSnapshot(archive, payload, fingerprint, instant);
    }
}
