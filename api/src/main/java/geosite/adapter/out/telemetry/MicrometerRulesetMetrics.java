package geosite.adapter.out.telemetry;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import geosite.config.GeositeConfig;
import geosite.core.model.Dialect;
import geosite.core.port.out.RulesetMetrics;

/**
 * Records ruleset pipeline metrics using Micrometer.
 *
 * <p>All methods are no-ops when {@code geosite.metrics.enabled} is false.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code geosite.result_cache.requests} - result cache lookups by dialect and outcome</li>
 *   <li>{@code geosite.source.checks} - archive freshness checks by outcome</li>
 *   <li>{@code geosite.render.duration} - parse and render time by dialect</li>
 *   <li>{@code geosite.regex.dangerous} - regex rules refused as wildcards</li>
 *   <li>{@code geosite.result_cache.size} - entries held in the result cache</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerRulesetMetrics implements RulesetMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;
    private final AtomicLong resultCacheSize = new AtomicLong(0);

    @Inject
    public MicrometerRulesetMetrics(MeterRegistry registry, GeositeConfig config) {
        this(registry, config.metrics().enabled());
    }

    public MicrometerRulesetMetrics(MeterRegistry registry, boolean enabled) {
        this.registry = registry;
        this.enabled = enabled;
    }

    @PostConstruct
    void init() {
        if (!enabled) {
            return;
        }
        Gauge.builder("geosite.result_cache.size", resultCacheSize, AtomicLong::get)
                .description("Number of rendered rulesets held in the result cache")
                .register(registry);
    }

    @Override
    public void recordCacheHit(Dialect dialect) {
        recordLookup(dialect, "hit");
    }

    @Override
    public void recordCacheMiss(Dialect dialect) {
        recordLookup(dialect, "miss");
    }

    private void recordLookup(Dialect dialect, String outcome) {
        if (!enabled) {
            return;
        }
        Counter.builder("geosite.result_cache.requests")
                .description("Result cache lookups")
                .tag("dialect", dialect.id())
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    @Override
    public void recordSourceCheck(String outcome) {
        if (!enabled) {
            return;
        }
        Counter.builder("geosite.source.checks")
                .description("Upstream archive freshness checks")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    @Override
    public void recordRenderDuration(Dialect dialect, long durationMs) {
        if (!enabled) {
            return;
        }
        Timer.builder("geosite.render.duration")
                .description("Time to parse and render a ruleset")
                .tag("dialect", dialect.id())
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordDangerousRegex() {
        if (!enabled) {
            return;
        }
        Counter.builder("geosite.regex.dangerous")
                .description("Regex rules not emitted as wildcards")
                .register(registry)
                .increment();
    }

    @Override
    public void updateResultCacheSize(long size) {
        resultCacheSize.set(size);
    }
}
