package geosite.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import geosite.core.model.Dialect;

@DisplayName("MicrometerRulesetMetrics")
class MicrometerRulesetMetricsTest {

    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
    }

    private MicrometerRulesetMetrics metrics(boolean enabled) {
        var metrics = new MicrometerRulesetMetrics(registry, enabled);
        metrics.init();
        return metrics;
    }

    @Nested
    @DisplayName("When enabled")
    class Enabled {

        @Test
        @DisplayName("should count cache lookups by dialect and outcome")
        void shouldCountLookups() {
            var metrics = metrics(true);

            metrics.recordCacheHit(Dialect.SURGE);
            metrics.recordCacheHit(Dialect.SURGE);
            metrics.recordCacheMiss(Dialect.EGERN);

            assertEquals(2.0, registry.get("geosite.result_cache.requests")
                    .tag("dialect", "surge").tag("outcome", "hit").counter().count());
            assertEquals(1.0, registry.get("geosite.result_cache.requests")
                    .tag("dialect", "egern").tag("outcome", "miss").counter().count());
        }

        @Test
        @DisplayName("should count source checks by outcome")
        void shouldCountSourceChecks() {
            var metrics = metrics(true);

            metrics.recordSourceCheck("unchanged");
            metrics.recordSourceCheck("downloaded");
            metrics.recordSourceCheck("unchanged");

            assertEquals(2.0, registry.get("geosite.source.checks").tag("outcome", "unchanged").counter().count());
        }

        @Test
        @DisplayName("should record render time and dangerous regexes")
        void shouldRecordRenderAndRegex() {
            var metrics = metrics(true);

            metrics.recordRenderDuration(Dialect.MIHOMO, 12);
            metrics.recordDangerousRegex();

            assertEquals(1, registry.get("geosite.render.duration").tag("dialect", "mihomo").timer().count());
            assertEquals(1.0, registry.get("geosite.regex.dangerous").counter().count());
        }

        @Test
        @DisplayName("should expose the result cache size as a gauge")
        void shouldExposeCacheSize() {
            var metrics = metrics(true);

            metrics.updateResultCacheSize(42);

            assertEquals(42.0, registry.get("geosite.result_cache.size").gauge().value());
        }
    }

    @Nested
    @DisplayName("When disabled")
    class Disabled {

        @Test
        @DisplayName("should register no meters")
        void shouldRegisterNothing() {
            var metrics = metrics(false);

            metrics.recordCacheHit(Dialect.SURGE);
            metrics.recordSourceCheck("fresh");
            metrics.recordRenderDuration(Dialect.SURGE, 5);
            metrics.recordDangerousRegex();
            metrics.updateResultCacheSize(3);

            assertNull(registry.find("geosite.result_cache.requests").counter());
            assertNull(registry.find("geosite.result_cache.size").gauge());
            assertEquals(0, registry.getMeters().size());
        }
    }
}
