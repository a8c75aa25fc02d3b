package geosite.adapter.out.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import geosite.config.GeositeConfig;
import geosite.core.port.out.IndexStore;

/**
 * File copy of the published index at {@code geosite.index.path}.
 */
@ApplicationScoped
public class FileIndexStore implements IndexStore {

    private static final Logger LOG = Logger.getLogger(FileIndexStore.class);

    private final Optional<Path> path;

    @Inject
    public FileIndexStore(GeositeConfig config) {
        this(config.index().path().filter(p -> !p.isBlank()).map(Paths::get));
    }

    public FileIndexStore(Optional<Path> path) {
        this.path = path;
    }

    @Override
    public boolean isConfigured() {
        return path.isPresent();
    }

    @Override
    public boolean exists() {
        return path.map(Files::isRegularFile).orElse(false);
    }

    @Override
    public Optional<byte[]> read() {
        if (!exists()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(path.get()));
        } catch (IOException e) {
            LOG.warnf("Failed to read index file %s: %s", path.get(), e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void write(byte[] body) throws IOException {
        if (path.isEmpty()) {
            return;
        }
        AtomicFiles.write(path.get(), body);
        LOG.debugv("Wrote index file {0} ({1} bytes)", path.get(), body.length);
    }

    @Override
    public String location() {
        return path.map(Path::toString).orElse("<none>");
    }
}
