package geosite.adapter.in.scheduling;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import org.jboss.logging.Logger;

import geosite.core.cache.ResultCache;
import geosite.core.port.out.RulesetMetrics;

/**
 * Reclaims expired result-cache entries. Expired entries are already misses; this only frees memory.
 */
@ApplicationScoped
public class ResultCacheSweeper {

    private static final Logger LOG = Logger.getLogger(ResultCacheSweeper.class);

    private final ResultCache resultCache;
    private final RulesetMetrics metrics;

    @Inject
    public ResultCacheSweeper(ResultCache resultCache, RulesetMetrics metrics) {
        this.resultCache = resultCache;
        this.metrics = metrics;
    }

    @Scheduled(
            every = "${geosite.cache.result.sweep-interval:10m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void sweep() {
        var before = resultCache.size();
        resultCache.sweep();
        var after = resultCache.size();
        metrics.updateResultCacheSize(after);
        LOG.debugv("Result cache sweep: {0} -> {1} entries", before, after);
    }
}
