package geosite.core.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import geosite.core.model.CachedRendering;
import geosite.core.model.RulesetKey;

/**
 * Memoized renderings keyed by {@link RulesetKey} and guarded by the archive
 * fingerprint each one was computed against.
 *
 * <p>A lookup with a fingerprint other than the stored one is a miss, so output
 * derived from an older archive is never served once the archive changes. Entries
 * also expire after a TTL and are physically reclaimed by {@link #sweep()}.
 *
 * <p><b>Jitter:</b> each entry's TTL is varied by {@code ±jitterFactor} so that
 * renderings written together do not all expire in the same instant.
 */
public class ResultCache {

    private final Cache<RulesetKey, CachedRendering> entries;
    private final long ttlNanos;
    private final double jitterFactor;

    /**
     * @param ttl          time-to-live measured from the last write
     * @param maxEntries   maximum number of renderings kept
     * @param jitterFactor 0.0 to 0.5; 0.1 varies each TTL by ±10%
     */
    public ResultCache(Duration ttl, long maxEntries, double jitterFactor) {
        this(ttl, maxEntries, jitterFactor, Ticker.systemTicker());
    }

    ResultCache(Duration ttl, long maxEntries, double jitterFactor, Ticker ticker) {
        if (jitterFactor < 0.0 || jitterFactor > 0.5) {
            throw new IllegalArgumentException("Jitter factor must be between 0.0 and 0.5, got: " + jitterFactor);
        }
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive, got: " + ttl);
        }
        this.ttlNanos = ttl.toNanos();
        this.jitterFactor = jitterFactor;
        this.entries = Caffeine.newBuilder()
                .expireAfter(new RenderingExpiry())
                .maximumSize(maxEntries)
                .ticker(ticker)
                .build();
    }

    /**
     * @param key         rendering key
     * @param fingerprint current archive fingerprint
     * @return the cached text if present, unexpired, and computed against {@code fingerprint}
     */
    public Optional<String> lookup(RulesetKey key, String fingerprint) {
        return Optional.ofNullable(entries.getIfPresent(key))
                .filter(entry -> entry.matches(fingerprint))
                .map(CachedRendering::text);
    }

    public void store(RulesetKey key, String fingerprint, String text) {
        entries.put(key, new CachedRendering(text, fingerprint, Instant.now()));
    }

    /**
     * Remove expired entries.
     */
    public void sweep() {
        entries.cleanUp();
    }

    public long size() {
        return entries.estimatedSize();
    }

    long lifetimeNanos() {
        if (jitterFactor == 0.0) {
            return ttlNanos;
        }
        var spread = (ThreadLocalRandom.current().nextDouble() * 2 - 1) * jitterFactor;
        return (long) (ttlNanos * (1.0 + spread));
    }

    private final class RenderingExpiry implements Expiry<RulesetKey, CachedRendering> {

        @Override
        public long expireAfterCreate(RulesetKey key, CachedRendering value, long currentTime) {
            return lifetimeNanos();
        }

        @Override
        public long expireAfterUpdate(RulesetKey key, CachedRendering value, long currentTime, long currentDuration) {
            return lifetimeNanos();
        }

        @Override
        public long expireAfterRead(RulesetKey key, CachedRendering value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
