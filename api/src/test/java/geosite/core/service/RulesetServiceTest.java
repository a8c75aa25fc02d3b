package geosite.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import geosite.core.cache.ResultCache;
import geosite.core.error.CyclicIncludeException;
import geosite.core.error.MemberNotFoundException;
import geosite.core.model.ArchiveLayout;
import geosite.core.model.ArchiveSnapshot;
import geosite.core.model.Dialect;
import geosite.core.model.RulesetKey;
import geosite.core.model.SourceArchive;
import geosite.core.port.out.RulesetMetrics;
import geosite.core.service.render.EgernRenderer;
import geosite.core.service.render.MihomoRenderer;
import geosite.core.service.render.RendererRegistry;
import geosite.core.service.render.RulesetRenderer;
import geosite.core.service.render.SurgeRenderer;
import geosite.testing.TestArchives;

@DisplayName("RulesetService")
class RulesetServiceTest {

    private static final Map<String, String> MEMBERS = Map.of(
            "google", "# Google\ngoogle.com\nfull:www.google.cn @cn\ninclude:youtube",
            "youtube", "youtube.com\nregexp:^(.+\\.)?ytimg\\.com$",
            "loop-a", "include:loop-b",
            "loop-b", "include:loop-a");

    private ArchiveFetcher fetcher;
    private ResultCache resultCache;
    private RuleParser parser;
    private RulesetMetrics metrics;
    private RendererRegistry renderers;
    private RulesetService service;

    @BeforeEach
    void setUp() {
        fetcher = mock(ArchiveFetcher.class);
        metrics = mock(RulesetMetrics.class);
        parser = spy(new RuleParser());
        resultCache = new ResultCache(Duration.ofMinutes(5), 100, 0.0);
        renderers = new RendererRegistry(List.<RulesetRenderer>of(
                new SurgeRenderer(new WildcardTranslator(), metrics), new MihomoRenderer(), new EgernRenderer()));
        service = new RulesetService(
                fetcher,
                resultCache,
                parser,
                renderers,
                new ArchiveLayout(TestArchives.DATA_PREFIX),
                metrics,
                Runnable::run);
        serve(MEMBERS, "v1");
    }

    private void serve(Map<String, String> members, String fingerprint) {
        var payload = TestArchives.dataArchive(members);
        var snapshot = new ArchiveSnapshot(SourceArchive.parse(payload), payload, fingerprint, Instant.now());
        when(fetcher.ensureFresh()).thenReturn(Uni.createFrom().item(snapshot));
    }

    private RulesetKey key(String name, Dialect dialect) {
        return RulesetKey.parse(name, dialect);
    }

    @Nested
    @DisplayName("Rendering")
    class Rendering {

        @Test
        @DisplayName("should render a member with its includes")
        void shouldRenderWithIncludes() {
            var result = service.render(key("google", Dialect.SURGE)).await().indefinitely();

            assertEquals(
                    String.join(
                            "\n",
                            "# Google",
                            "DOMAIN-SUFFIX,google.com",
                            "DOMAIN,www.google.cn # @cn",
                            "# include:youtube",
                            "DOMAIN-SUFFIX,youtube.com",
                            "DOMAIN-WILDCARD,*ytimg.com"),
                    result.text());
            assertEquals("v1", result.fingerprint());
            assertFalse(result.cached());
        }

        @Test
        @DisplayName("should apply the filter tag")
        void shouldApplyFilter() {
            var result = service.render(key("google@cn", Dialect.MIHOMO)).await().indefinitely();

            assertEquals("# Google\nDOMAIN,www.google.cn # @cn", result.text());
        }

        @Test
        @DisplayName("should render the Egern dialect")
        void shouldRenderEgern() {
            var result = service.render(key("youtube", Dialect.EGERN)).await().indefinitely();

            assertEquals(
                    "domain_suffix_set:\n  - \"youtube.com\"\ndomain_regex_set:\n  - \"^(.+\\\\.)?ytimg\\\\.com$\"",
                    result.text());
        }
    }

    @Nested
    @DisplayName("Caching")
    class Caching {

        @Test
        @DisplayName("should serve a repeated request from the cache")
        void shouldServeFromCache() {
            var first = service.render(key("google", Dialect.SURGE)).await().indefinitely();
            var second = service.render(key("google", Dialect.SURGE)).await().indefinitely();

            assertTrue(second.cached());
            assertEquals(first.text(), second.text());
            verify(parser, times(1)).parse(eq("google"), anyString(), anyString(), any());
            verify(metrics).recordCacheMiss(Dialect.SURGE);
            verify(metrics).recordCacheHit(Dialect.SURGE);
        }

        @Test
        @DisplayName("should regenerate after the archive changed")
        void shouldRegenerateOnNewArchive() {
            service.render(key("youtube", Dialect.SURGE)).await().indefinitely();
            serve(Map.of("youtube", "youtube.com\ngooglevideo.com"), "v2");

            var result = service.render(key("youtube", Dialect.SURGE)).await().indefinitely();

            assertFalse(result.cached());
            assertEquals("v2", result.fingerprint());
            assertEquals("DOMAIN-SUFFIX,youtube.com\nDOMAIN-SUFFIX,googlevideo.com", result.text());
        }

        @Test
        @DisplayName("should cache each dialect separately")
        void shouldSeparateDialects() {
            service.render(key("google", Dialect.SURGE)).await().indefinitely();

            var mihomo = service.render(key("google", Dialect.MIHOMO)).await().indefinitely();

            assertFalse(mihomo.cached());
            assertEquals(2, resultCache.size());
        }
    }

    @Nested
    @DisplayName("Generation")
    class Generation {

        private final List<Runnable> queued = new ArrayList<>();

        private RulesetService queuedService() {
            return new RulesetService(
                    fetcher,
                    resultCache,
                    parser,
                    renderers,
                    new ArchiveLayout(TestArchives.DATA_PREFIX),
                    metrics,
                    queued::add);
        }

        private void drain() {
            while (!queued.isEmpty()) {
                queued.remove(0).run();
            }
        }

        @Test
        @DisplayName("should hand parsing and rendering to the blocking executor")
        void shouldRunOnBlockingExecutor() {
            var pending = queuedService()
                    .render(key("google", Dialect.SURGE))
                    .subscribeAsCompletionStage();

            assertFalse(pending.isDone());
            assertEquals(1, queued.size());
            verify(parser, never()).parse(anyString(), anyString(), anyString(), any());

            drain();

            assertTrue(pending.isDone());
            assertTrue(pending.join().text().startsWith("# Google"));
        }

        @Test
        @DisplayName("should coalesce concurrent misses for the same key into one generation")
        void shouldCoalesceConcurrentMisses() {
            var queuedService = queuedService();

            CompletableFuture<String> first = queuedService
                    .render(key("google", Dialect.SURGE))
                    .map(result -> result.text())
                    .subscribeAsCompletionStage();
            CompletableFuture<String> second = queuedService
                    .render(key("google", Dialect.SURGE))
                    .map(result -> result.text())
                    .subscribeAsCompletionStage();

            assertFalse(first.isDone());
            assertFalse(second.isDone());

            drain();

            assertEquals(first.join(), second.join());
            verify(parser, times(1)).parse(eq("google"), anyString(), anyString(), any());
            verify(metrics, times(2)).recordCacheMiss(Dialect.SURGE);
            assertEquals(1, resultCache.size());
        }

        @Test
        @DisplayName("should not coalesce different keys")
        void shouldKeepKeysApart() {
            var queuedService = queuedService();

            var surge = queuedService.render(key("youtube", Dialect.SURGE)).subscribeAsCompletionStage();
            var mihomo = queuedService.render(key("youtube", Dialect.MIHOMO)).subscribeAsCompletionStage();
            drain();

            assertFalse(surge.join().cached());
            assertFalse(mihomo.join().cached());
            verify(parser, times(2)).parse(eq("youtube"), anyString(), anyString(), any());
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("should report a missing member and cache nothing")
        void shouldReportMissingMember() {
            var error = assertThrows(
                    MemberNotFoundException.class,
                    () -> service.render(key("nonexistent", Dialect.SURGE)).await().indefinitely());

            assertEquals("nonexistent", error.member());
            assertEquals(0, resultCache.size());
        }

        @Test
        @DisplayName("should report a cyclic include and cache nothing")
        void shouldReportCycle() {
            assertThrows(
                    CyclicIncludeException.class,
                    () -> service.render(key("loop-a", Dialect.SURGE)).await().indefinitely());

            assertEquals(0, resultCache.size());
        }

        @Test
        @DisplayName("should retry a failed generation on the next request")
        void shouldRetryAfterFailure() {
            assertThrows(
                    MemberNotFoundException.class,
                    () -> service.render(key("late", Dialect.SURGE)).await().indefinitely());
            serve(Map.of("late", "late.com"), "v2");

            var result = service.render(key("late", Dialect.SURGE)).await().indefinitely();

            assertEquals("DOMAIN-SUFFIX,late.com", result.text());
        }
    }
}
