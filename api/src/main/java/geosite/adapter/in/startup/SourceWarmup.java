package geosite.adapter.in.startup;

import java.io.IOException;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import geosite.core.cache.SourceCache;
import geosite.core.error.ArchiveFormatException;
import geosite.core.service.GeositeIndexService;

/**
 * Restores the persisted archive on startup and publishes the index in the background.
 *
 * <p>Startup never fails here: without a usable snapshot the first request downloads the archive.
 */
@ApplicationScoped
public class SourceWarmup {

    private static final Logger LOG = Logger.getLogger(SourceWarmup.class);

    private final SourceCache sourceCache;
    private final GeositeIndexService indexService;

    @Inject
    public SourceWarmup(SourceCache sourceCache, GeositeIndexService indexService) {
        this.sourceCache = sourceCache;
        this.indexService = indexService;
    }

    void onStart(@Observes StartupEvent event) {
        restoreSnapshot();

        if (indexService.isPublishing()) {
            indexService
                    .refresh()
                    .subscribe()
                    .with(
                            index -> LOG.infov("Initial index published ({0} entries)", index.entries().size()),
                            error -> LOG.warnf("Initial index publication failed: %s", error.getMessage()));
        }
    }

    void restoreSnapshot() {
        try {
            if (!sourceCache.restore()) {
                LOG.info("No persisted archive, first request will download it");
            }
        } catch (IOException | ArchiveFormatException e) {
            LOG.warnf("Ignoring unusable persisted archive: %s", e.getMessage());
        }
    }
}
