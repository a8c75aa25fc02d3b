package geosite.core.port.out;

import geosite.core.model.Dialect;

/**
 * Port interface for recording ruleset pipeline metrics.
 *
 * <p>Keeps the core services independent of a specific metrics backend.
 */
public interface RulesetMetrics {

    RulesetMetrics NOOP = new RulesetMetrics() {};

    default void recordCacheHit(Dialect dialect) {}

    default void recordCacheMiss(Dialect dialect) {}

    /**
     * Record the outcome of a freshness check against the upstream.
     *
     * @param outcome one of {@code fresh}, {@code unchanged}, {@code downloaded}, {@code stale_fallback}, {@code failed}
     */
    default void recordSourceCheck(String outcome) {}

    default void recordRenderDuration(Dialect dialect, long durationMs) {}

    default void recordDangerousRegex() {}

    default void updateResultCacheSize(long size) {}
}
