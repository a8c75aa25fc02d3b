package geosite.adapter.in.scheduling;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import geosite.core.cache.SourceCache;
import geosite.core.service.ArchiveFetcher;
import geosite.core.service.GeositeIndexService;

/**
 * Checks the upstream for a new archive on a fixed interval, so that requests rarely
 * pay for a fingerprint check or download. Set {@code geosite.source.refresh-interval=off} to disable.
 */
@ApplicationScoped
public class SourceRefreshJob {

    private static final Logger LOG = Logger.getLogger(SourceRefreshJob.class);

    private final ArchiveFetcher fetcher;
    private final SourceCache sourceCache;
    private final GeositeIndexService indexService;

    @Inject
    public SourceRefreshJob(ArchiveFetcher fetcher, SourceCache sourceCache, GeositeIndexService indexService) {
        this.fetcher = fetcher;
        this.sourceCache = sourceCache;
        this.indexService = indexService;
    }

    @Scheduled(
            every = "${geosite.source.refresh-interval:30m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> refresh() {
        var previous = sourceCache.fingerprint();
        return fetcher.forceRefresh()
                .invoke(snapshot -> {
                    if (snapshot.fingerprint().equals(previous)) {
                        LOG.debug("Background refresh: archive unchanged");
                    } else {
                        LOG.infov("Background refresh: archive changed {0} -> {1}", previous, snapshot.fingerprint());
                    }
                })
                .flatMap(snapshot -> indexService.refresh(snapshot))
                .replaceWithVoid()
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Background refresh failed: %s", error.getMessage());
                    return null;
                });
    }
}
