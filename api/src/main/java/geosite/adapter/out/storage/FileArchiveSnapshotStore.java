package geosite.adapter.out.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;

import geosite.core.model.PersistedArchive;
import geosite.core.port.out.ArchiveSnapshotStore;

/**
 * Persists the archive snapshot as one JSON document ({@code payload} base64-encoded by Jackson).
 */
public class FileArchiveSnapshotStore implements ArchiveSnapshotStore {

    private final Path path;
    private final ObjectMapper objectMapper;

    public FileArchiveSnapshotStore(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public void save(PersistedArchive snapshot) throws IOException {
        AtomicFiles.write(path, objectMapper.writeValueAsBytes(snapshot));
    }

    @Override
    public Optional<PersistedArchive> load() throws IOException {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        var saved = objectMapper.readValue(path.toFile(), PersistedArchive.class);
        if (saved.fingerprint() == null || saved.fingerprint().isBlank() || saved.payload() == null) {
            throw new IOException("Persisted archive at " + path + " is incomplete");
        }
        return Optional.of(saved);
    }

    @Override
    public String location() {
        return path.toString();
    }
}
