package geosite.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the ruleset service.
 *
 * <p>Configuration prefix: {@code geosite}
 *
 * <p>Every property can be overridden by the matching environment variable,
 * e.g. {@code GEOSITE_SOURCE_ARCHIVE_URL}.
 */
@ConfigMapping(prefix = "geosite")
public interface GeositeConfig {

    /**
     * Where {@code GET /} redirects to.
     *
     * @return project page URL
     */
    @WithDefault("https://github.com/xxxbrian/Surge-Geosite")
    String repoUrl();

    Source source();

    Cache cache();

    Index index();

    Misc misc();

    Metrics metrics();

    /**
     * Upstream archive settings.
     */
    interface Source {

        @WithDefault("https://github.com/v2fly/domain-list-community/archive/refs/heads/master.zip")
        String archiveUrl();

        /**
         * Directory inside the archive that holds the list members.
         */
        @WithDefault("domain-list-community-master/data/")
        String dataPrefix();

        @WithDefault("Surge-Geosite-Java/1.0")
        String userAgent();

        /**
         * How long a fetched archive is used before the upstream is asked again.
         *
         * @return freshness window (default: 30 minutes)
         */
        @WithDefault("PT30M")
        Duration ttl();

        /**
         * Interval of the background refresh. {@code off} disables it.
         *
         * @return scheduler interval (default: 30m)
         */
        @WithDefault("30m")
        String refreshInterval();

        @WithDefault("PT15S")
        Duration fingerprintTimeout();

        @WithDefault("PT60S")
        Duration downloadTimeout();

        /**
         * File the archive snapshot is persisted to, so restarts skip the first download.
         * Unset keeps the archive in memory only.
         */
        Optional<String> persistPath();
    }

    interface Cache {

        Result result();

        /**
         * Rendered ruleset cache.
         */
        interface Result {

            /**
             * @return entry lifetime (default: 24 hours)
             */
            @WithDefault("PT24H")
            Duration ttl();

            /**
             * Interval of the physical sweep of expired entries.
             */
            @WithDefault("10m")
            String sweepInterval();

            @WithDefault("10000")
            long maxEntries();

            /**
             * Random TTL spread as a fraction of the TTL, 0.0 to 0.5. A non-zero value
             * lets some entries outlive {@link #ttl()}.
             */
            @WithDefault("0.0")
            double jitter();
        }
    }

    /**
     * Published index settings.
     */
    interface Index {

        /**
         * Public base URL of the ruleset routes, e.g. {@code https://example.com/geosite}.
         * When set, the index is published at startup and after every archive change.
         */
        Optional<String> baseUrl();

        /**
         * File the published index is written to.
         */
        Optional<String> path();
    }

    /**
     * Hand-maintained lists outside the upstream archive.
     */
    interface Misc {

        @WithDefault("https://raw.githubusercontent.com/xxxbrian/Surge-Geosite/refs/heads/main/misc")
        String baseUrl();

        @WithDefault("PT30S")
        Duration timeout();
    }

    interface Metrics {

        @WithDefault("true")
        boolean enabled();
    }
}
