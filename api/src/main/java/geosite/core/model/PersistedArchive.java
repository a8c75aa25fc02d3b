package geosite.core.model;

/**
 * On-disk form of an {@link ArchiveSnapshot}.
 *
 * @param fingerprint          archive version token
 * @param fetchedAtEpochMillis fetch time in epoch milliseconds
 * @param payload              raw archive bytes
 */
public record PersistedArchive(String fingerprint, long fetchedAtEpochMillis, byte[] payload) {}
