package geosite.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import geosite.core.cache.SourceCache;

/**
 * Ready once an upstream archive is loaded, whether fresh or stale.
 *
 * <p>A stale archive still serves requests, so staleness is reported as data
 * rather than as DOWN.
 */
@Readiness
@ApplicationScoped
public class SourceArchiveHealthCheck implements HealthCheck {

    private final SourceCache sourceCache;

    @Inject
    public SourceArchiveHealthCheck(SourceCache sourceCache) {
        this.sourceCache = sourceCache;
    }

    @Override
    public HealthCheckResponse call() {
        var builder = HealthCheckResponse.builder().name("source-archive");
        var snapshot = sourceCache.getAny();
        if (snapshot.isEmpty()) {
            return builder.down().withData("reason", "no archive loaded").build();
        }
        return builder.up()
                .withData("fingerprint", snapshot.get().fingerprint())
                .withData("fetchedAt", snapshot.get().fetchedAt().toString())
                .withData("entries", snapshot.get().archive().size())
                .withData("fresh", sourceCache.get().isPresent())
                .build();
    }
}
