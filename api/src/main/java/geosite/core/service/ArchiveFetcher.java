package geosite.core.service;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import geosite.core.cache.SourceCache;
import geosite.core.error.UpstreamTransportException;
import geosite.core.model.ArchiveSnapshot;
import geosite.core.port.out.ArchiveTransport;
import geosite.core.port.out.RulesetMetrics;

/**
 * Keeps the {@link SourceCache} fresh without re-downloading the archive on every request.
 *
 * <h2>Freshness protocol</h2>
 * <ol>
 *   <li>A cached archive within its TTL is returned as is ({@link #ensureFresh()} only).</li>
 *   <li>Otherwise the upstream fingerprint is fetched with a metadata-only request.</li>
 *   <li>If the fingerprint check fails and any archive is cached, the stale archive is served.</li>
 *   <li>If the fingerprint is unchanged, only the TTL window is restarted.</li>
 *   <li>Otherwise the archive is downloaded, validated, and stored.</li>
 * </ol>
 *
 * <p>Concurrent refreshes are coalesced: callers that miss while a fingerprint check or download
 * is running share its result. Download failures always propagate and never
 * touch the cache.
 */
public class ArchiveFetcher {

    private static final Logger LOG = Logger.getLogger(ArchiveFetcher.class);
    private static final String REFRESH_KEY = "archive";

    private final SourceCache cache;
    private final ArchiveTransport transport;
    private final RulesetMetrics metrics;
    private final Executor blockingExecutor;
    private final Map<String, Uni<ArchiveSnapshot>> inFlightRefreshes = new ConcurrentHashMap<>();

    /**
     * @param cache            archive storage
     * @param transport        upstream access
     * @param metrics          metrics sink
     * @param blockingExecutor executor for storing the archive, which may write to disk
     */
    public ArchiveFetcher(
            SourceCache cache, ArchiveTransport transport, RulesetMetrics metrics, Executor blockingExecutor) {
        this.cache = cache;
        this.transport = transport;
        this.metrics = metrics;
        this.blockingExecutor = blockingExecutor;
    }

    /**
     * Return a usable archive, refreshing it if the TTL has elapsed.
     *
     * @return the current snapshot
     */
    public Uni<ArchiveSnapshot> ensureFresh() {
        return Uni.createFrom().deferred(() -> {
            var fresh = cache.get();
            if (fresh.isPresent()) {
                metrics.recordSourceCheck("fresh");
                return Uni.createFrom().item(fresh.get());
            }
            return coalescedRefresh();
        });
    }

    /**
     * Check the upstream regardless of TTL. Intended for background refresh only,
     * so that a slow upstream never stalls request handling.
     *
     * @return the current snapshot
     */
    public Uni<ArchiveSnapshot> forceRefresh() {
        return Uni.createFrom().deferred(this::coalescedRefresh);
    }

    private Uni<ArchiveSnapshot> coalescedRefresh() {
        return inFlightRefreshes.computeIfAbsent(REFRESH_KEY, k -> createRefresh());
    }

    private Uni<ArchiveSnapshot> createRefresh() {
        return Uni.createFrom()
                .deferred(this::refresh)
                .onTermination()
                .invoke(() -> inFlightRefreshes.remove(REFRESH_KEY))
                .memoize()
                .indefinitely();
    }

    private Uni<ArchiveSnapshot> refresh() {
        var cached = cache.getAny();
        return transport.fetchFingerprint().onItemOrFailure().transformToUni((token, failure) -> {
            if (failure != null) {
                return fallback(cached, failure);
            }
            if (cached.isPresent() && !token.isEmpty() && token.equals(cached.get().fingerprint())) {
                LOG.debugv("Upstream archive unchanged ({0})", truncate(token));
                metrics.recordSourceCheck("unchanged");
                return Uni.createFrom().item(cache.touch(token).orElse(cached.get()));
            }
            return download(token);
        });
    }

    private Uni<ArchiveSnapshot> fallback(Optional<ArchiveSnapshot> cached, Throwable failure) {
        if (cached.isPresent()) {
            LOG.warnf(
                    "Fingerprint check failed, serving cached archive %s: %s",
                    truncate(cached.get().fingerprint()),
                    failure.getMessage());
            metrics.recordSourceCheck("stale_fallback");
            return Uni.createFrom().item(cached.get());
        }
        metrics.recordSourceCheck("failed");
        if (failure instanceof UpstreamTransportException) {
            return Uni.createFrom().failure(failure);
        }
        return Uni.createFrom()
                .failure(new UpstreamTransportException("Failed to get ETag: " + failure.getMessage(), failure));
    }

    private Uni<ArchiveSnapshot> download(String token) {
        LOG.infov("Downloading upstream archive (fingerprint {0})", token.isEmpty() ? "unknown" : truncate(token));
        return transport
                .download()
                .emitOn(blockingExecutor)
                .map(payload -> {
                    var fingerprint = token.isEmpty() ? contentHash(payload) : token;
                    var stored = cache.store(payload, fingerprint);
                    LOG.infov(
                            "Archive updated to {0} ({1} bytes, {2} entries)",
                            truncate(fingerprint),
                            payload.length,
                            stored.archive().size());
                    metrics.recordSourceCheck("downloaded");
                    return stored;
                })
                .onFailure()
                .invoke(error -> {
                    metrics.recordSourceCheck("failed");
                    LOG.errorf("Archive download failed: %s", error.getMessage());
                });
    }

    static String contentHash(byte[] payload) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(payload));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String truncate(String fingerprint) {
        return fingerprint.length() > 8 ? fingerprint.substring(0, 8) : fingerprint;
    }
}
