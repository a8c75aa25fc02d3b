package geosite.core.service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import geosite.core.cache.ResultCache;
import geosite.core.error.MemberNotFoundException;
import geosite.core.model.ArchiveLayout;
import geosite.core.model.ArchiveSnapshot;
import geosite.core.model.ListItem;
import geosite.core.model.RenderedRuleset;
import geosite.core.model.RulesetKey;
import geosite.core.port.in.RulesetConversion;
import geosite.core.port.out.MemberResolver;
import geosite.core.port.out.RulesetMetrics;
import geosite.core.service.render.RendererRegistry;

/**
 * Serves rendered rulesets from the result cache, generating them on a miss.
 *
 * <p>Generation for a given key and archive fingerprint is coalesced: concurrent
 * misses share one parse and render, and the shared computation runs to completion
 * even if the caller that started it goes away. Failed generations are never cached.
 *
 * <p>Parsing and rendering run on the blocking executor, never on the calling
 * event-loop thread.
 */
@ApplicationScoped
public class RulesetService implements RulesetConversion {

    private static final Logger LOG = Logger.getLogger(RulesetService.class);

    private final ArchiveFetcher fetcher;
    private final ResultCache resultCache;
    private final RuleParser parser;
    private final RendererRegistry renderers;
    private final ArchiveLayout layout;
    private final RulesetMetrics metrics;
    private final Executor blockingExecutor;

    private final Map<Generation, Uni<String>> inFlightGenerations = new ConcurrentHashMap<>();

    @Inject
    public RulesetService(
            ArchiveFetcher fetcher,
            ResultCache resultCache,
            RuleParser parser,
            RendererRegistry renderers,
            ArchiveLayout layout,
            RulesetMetrics metrics) {
        this(fetcher, resultCache, parser, renderers, layout, metrics, Infrastructure.getDefaultWorkerPool());
    }

    public RulesetService(
            ArchiveFetcher fetcher,
            ResultCache resultCache,
            RuleParser parser,
            RendererRegistry renderers,
            ArchiveLayout layout,
            RulesetMetrics metrics,
            Executor blockingExecutor) {
        this.fetcher = fetcher;
        this.resultCache = resultCache;
        this.parser = parser;
        this.renderers = renderers;
        this.layout = layout;
        this.metrics = metrics;
        this.blockingExecutor = blockingExecutor;
    }

    @Override
    public Uni<RenderedRuleset> render(RulesetKey key) {
        return fetcher.ensureFresh().flatMap(snapshot -> {
            var fingerprint = snapshot.fingerprint();
            var cached = resultCache.lookup(key, fingerprint);
            if (cached.isPresent()) {
                LOG.infov("Cache hit for {0}", key.describe());
                metrics.recordCacheHit(key.dialect());
                return Uni.createFrom().item(new RenderedRuleset(cached.get(), key.dialect(), fingerprint, true));
            }

            LOG.infov("Cache miss for {0}, generating...", key.describe());
            metrics.recordCacheMiss(key.dialect());
            return inFlightGenerations
                    .computeIfAbsent(new Generation(key, fingerprint), generation -> startGeneration(generation, snapshot))
                    .map(text -> new RenderedRuleset(text, key.dialect(), fingerprint, false));
        });
    }

    private Uni<String> startGeneration(Generation generation, ArchiveSnapshot snapshot) {
        return Uni.createFrom()
                .item(() -> generate(generation.key(), snapshot))
                .runSubscriptionOn(blockingExecutor)
                .onTermination()
                .invoke(() -> inFlightGenerations.remove(generation))
                .memoize()
                .indefinitely();
    }

    private String generate(RulesetKey key, ArchiveSnapshot snapshot) {
        var start = System.nanoTime();
        MemberResolver resolver = name -> snapshot.archive()
                .readText(layout.memberPath(name))
                .orElseThrow(() -> new MemberNotFoundException(name));

        List<ListItem> items = parser.parse(key.member(), resolver.resolve(key.member()), key.filter(), resolver);
        var text = renderers.forDialect(key.dialect()).render(items);

        resultCache.store(key, snapshot.fingerprint(), text);
        metrics.recordRenderDuration(key.dialect(), (System.nanoTime() - start) / 1_000_000);
        metrics.updateResultCacheSize(resultCache.size());
        LOG.debugv("Generated {0}: {1} items, {2} chars", key.describe(), items.size(), text.length());
        return text;
    }

    private record Generation(RulesetKey key, String fingerprint) {}
}
