package geosite.config;

import java.nio.file.Paths;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.infrastructure.Infrastructure;

import geosite.adapter.out.storage.FileArchiveSnapshotStore;
import geosite.core.cache.ResultCache;
import geosite.core.cache.SourceCache;
import geosite.core.model.ArchiveLayout;
import geosite.core.port.out.ArchiveTransport;
import geosite.core.port.out.IndexStore;
import geosite.core.port.out.RulesetMetrics;
import geosite.core.service.ArchiveFetcher;
import geosite.core.service.GeositeIndexService;

/**
 * Produces the caches and core services that are built from configuration.
 * This bridges {@link GeositeConfig} to the core layer, which knows nothing of it.
 */
@ApplicationScoped
public class ServiceProducer {

    private final GeositeConfig config;

    @Inject
    public ServiceProducer(GeositeConfig config) {
        this.config = config;
    }

    @Produces
    @ApplicationScoped
    public ArchiveLayout archiveLayout() {
        return new ArchiveLayout(config.source().dataPrefix());
    }

    @Produces
    @ApplicationScoped
    public SourceCache sourceCache(ObjectMapper objectMapper) {
        var store = config.source()
                .persistPath()
                .filter(path -> !path.isBlank())
                .map(path -> new FileArchiveSnapshotStore(Paths.get(path), objectMapper))
                .orElse(null);
        return new SourceCache(config.source().ttl(), store);
    }

    @Produces
    @ApplicationScoped
    public ResultCache resultCache() {
        var result = config.cache().result();
        return new ResultCache(result.ttl(), result.maxEntries(), result.jitter());
    }

    @Produces
    @ApplicationScoped
    public ArchiveFetcher archiveFetcher(SourceCache sourceCache, ArchiveTransport transport, RulesetMetrics metrics) {
        return new ArchiveFetcher(sourceCache, transport, metrics, Infrastructure.getDefaultWorkerPool());
    }

    @Produces
    @ApplicationScoped
    public GeositeIndexService geositeIndexService(
            ArchiveFetcher fetcher, ArchiveLayout layout, IndexStore indexStore, ObjectMapper objectMapper) {
        return new GeositeIndexService(
                fetcher,
                layout,
                indexStore,
                config.index().baseUrl(),
                objectMapper,
                Infrastructure.getDefaultWorkerPool());
    }
}
