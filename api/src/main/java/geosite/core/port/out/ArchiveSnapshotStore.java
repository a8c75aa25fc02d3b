package geosite.core.port.out;

import java.io.IOException;
import java.util.Optional;

import geosite.core.model.PersistedArchive;

/**
 * Durable storage for the single cached archive snapshot.
 *
 * <p>Implementations must never leave a half-written snapshot behind. A crash during
 * {@link #save} leaves either the previous snapshot or the new one.
 */
public interface ArchiveSnapshotStore {

    /**
     * Persist a snapshot, replacing any previous one.
     *
     * @param snapshot the snapshot to write
     * @throws IOException if the snapshot could not be written
     */
    void save(PersistedArchive snapshot) throws IOException;

    /**
     * Load the persisted snapshot.
     *
     * @return the snapshot, or empty if none has been persisted yet
     * @throws IOException if a snapshot exists but cannot be read or decoded
     */
    Optional<PersistedArchive> load() throws IOException;

    /**
     * Location of the snapshot, for logging.
     */
    String location();
}
