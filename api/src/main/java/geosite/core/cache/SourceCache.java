package geosite.core.cache;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.jboss.logging.Logger;

import geosite.core.error.ArchiveFormatException;
import geosite.core.model.ArchiveSnapshot;
import geosite.core.model.PersistedArchive;
import geosite.core.model.SourceArchive;
import geosite.core.port.out.ArchiveSnapshotStore;

/**
 * Holds the current upstream archive together with its fingerprint and fetch time.
 *
 * <p>Pure storage: no network access. Readers run concurrently; a replacement swaps
 * the whole snapshot under the write lock. When a {@link ArchiveSnapshotStore} is
 * configured the new snapshot is persisted while the lock is held, since writes
 * are rare.
 *
 * <p>A persistence failure is logged and the cache keeps working from memory.
 */
public class SourceCache {

    private static final Logger LOG = Logger.getLogger(SourceCache.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Duration ttl;
    private final ArchiveSnapshotStore store;

    private ArchiveSnapshot snapshot;

    /**
     * @param ttl   freshness window of a fetched archive
     * @param store persistence target, or {@code null} for memory only
     */
    public SourceCache(Duration ttl, ArchiveSnapshotStore store) {
        this.ttl = ttl;
        this.store = store;
    }

    public SourceCache(Duration ttl) {
        this(ttl, null);
    }

    /**
     * @return the snapshot if one is cached and still within its TTL
     */
    public Optional<ArchiveSnapshot> get() {
        lock.readLock().lock();
        try {
            if (snapshot == null || isExpired(snapshot)) {
                return Optional.empty();
            }
            return Optional.of(snapshot);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return the cached snapshot regardless of TTL
     */
    public Optional<ArchiveSnapshot> getAny() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(snapshot);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return the current fingerprint, or an empty string if nothing is cached
     */
    public String fingerprint() {
        return getAny().map(ArchiveSnapshot::fingerprint).orElse("");
    }

    /**
     * Replace the cached archive.
     *
     * <p>The payload is decoded before anything changes, so a corrupt download never
     * replaces a good archive.
     *
     * @param payload     raw archive bytes
     * @param fingerprint version token of the payload
     * @return the new snapshot
     * @throws ArchiveFormatException if the payload is not a readable archive
     */
    public ArchiveSnapshot store(byte[] payload, String fingerprint) {
        var archive = SourceArchive.parse(payload);
        var fresh = new ArchiveSnapshot(archive, payload, fingerprint, Instant.now());

        lock.writeLock().lock();
        try {
            snapshot = fresh;
            persistLocked(fresh);
            return fresh;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Start a new freshness window for an archive the upstream reports as unchanged.
     *
     * @param fingerprint fingerprint reported by the upstream
     * @return the refreshed snapshot, or empty if nothing is cached or the fingerprint differs
     */
    public Optional<ArchiveSnapshot> touch(String fingerprint) {
        lock.writeLock().lock();
        try {
            if (snapshot == null || !snapshot.fingerprint().equals(fingerprint)) {
                return Optional.empty();
            }
            snapshot = snapshot.withFetchedAt(Instant.now());
            return Optional.of(snapshot);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Restore the persisted snapshot, keeping its original fetch time.
     *
     * @return true if a snapshot was restored; false if persistence is off or nothing was persisted
     * @throws IOException            if the persisted snapshot cannot be read
     * @throws ArchiveFormatException if the persisted payload is not a readable archive
     */
    public boolean restore() throws IOException {
        if (store == null) {
            return false;
        }
        var persisted = store.load();
        if (persisted.isEmpty()) {
            return false;
        }
        var saved = persisted.get();
        var archive = SourceArchive.parse(saved.payload());
        var restored = new ArchiveSnapshot(
                archive, saved.payload(), saved.fingerprint(), Instant.ofEpochMilli(saved.fetchedAtEpochMillis()));

        lock.writeLock().lock();
        try {
            snapshot = restored;
        } finally {
            lock.writeLock().unlock();
        }
        LOG.infov("Restored archive {0} ({1} entries) from {2}", saved.fingerprint(), archive.size(), store.location());
        return true;
    }

    public Duration ttl() {
        return ttl;
    }

    private boolean isExpired(ArchiveSnapshot current) {
        return Instant.now().isAfter(current.fetchedAt().plus(ttl));
    }

    private void persistLocked(ArchiveSnapshot current) {
        if (store == null) {
            return;
        }
        try {
            store.save(new PersistedArchive(
                    current.fingerprint(), current.fetchedAt().toEpochMilli(), current.payload()));
        } catch (IOException | RuntimeException e) {
            LOG.warnf(e, "Failed to persist archive to %s, continuing in memory", store.location());
        }
    }
}
