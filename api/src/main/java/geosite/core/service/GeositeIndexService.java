package geosite.core.service;

import java.io.IOException;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import geosite.core.model.ArchiveLayout;
import geosite.core.model.ArchiveSnapshot;
import geosite.core.model.PublishedIndex;
import geosite.core.port.in.IndexQuery;
import geosite.core.port.out.IndexStore;

/**
 * Builds and publishes the index of available list members.
 *
 * <p>When a public base URL is configured the index is published ahead of time:
 * kept in memory and, if an index path is configured, written to disk for static
 * serving. Without one, the index is built per request from the request's own
 * base URL.
 */
public class GeositeIndexService implements IndexQuery {

    private static final Logger LOG = Logger.getLogger(GeositeIndexService.class);

    private final ArchiveFetcher fetcher;
    private final ArchiveLayout layout;
    private final IndexStore indexStore;
    private final Optional<String> publicBaseUrl;
    private final ObjectMapper objectMapper;
    private final Executor blockingExecutor;

    private final AtomicReference<PublishedIndex> published = new AtomicReference<>();

    public GeositeIndexService(
            ArchiveFetcher fetcher,
            ArchiveLayout layout,
            IndexStore indexStore,
            Optional<String> publicBaseUrl,
            ObjectMapper objectMapper,
            Executor blockingExecutor) {
        this.fetcher = fetcher;
        this.layout = layout;
        this.indexStore = indexStore;
        this.publicBaseUrl = publicBaseUrl.filter(url -> !url.isBlank());
        this.objectMapper = objectMapper;
        this.blockingExecutor = blockingExecutor;
    }

    /**
     * Build the index for one archive version.
     *
     * @param snapshot archive to list
     * @param baseUrl  URL prefix for ruleset links
     * @return member name to ruleset URL, sorted by name
     */
    public PublishedIndex build(ArchiveSnapshot snapshot, String baseUrl) {
        var prefix = stripTrailingSlash(baseUrl);
        var entries = new TreeMap<String, String>();
        for (var entryName : snapshot.archive().entryNames()) {
            layout.memberName(entryName).ifPresent(name -> entries.put(name, prefix + "/" + name));
        }
        return new PublishedIndex(snapshot.fingerprint(), entries);
    }

    public boolean isPublishing() {
        return publicBaseUrl.isPresent();
    }

    /**
     * Republish the index from the current archive. No-op without a public base URL.
     *
     * @return the published index, or {@code null} when publishing is off
     */
    public Uni<PublishedIndex> refresh() {
        if (!isPublishing()) {
            return Uni.createFrom().nullItem();
        }
        return fetcher.ensureFresh().flatMap(this::refresh);
    }

    /**
     * Republish the index for a given archive version. Rebuilds only if the
     * version changed or the file copy is missing.
     *
     * @param snapshot archive to publish
     * @return the published index, or {@code null} when publishing is off
     */
    public Uni<PublishedIndex> refresh(ArchiveSnapshot snapshot) {
        if (!isPublishing()) {
            return Uni.createFrom().nullItem();
        }
        return Uni.createFrom()
                .item(() -> publish(snapshot))
                .runSubscriptionOn(blockingExecutor);
    }

    @Override
    public Uni<byte[]> indexJson(String requestBaseUrl) {
        return Uni.createFrom()
                .item(indexStore::read)
                .runSubscriptionOn(blockingExecutor)
                .flatMap(stored -> {
                    if (stored.isPresent()) {
                        return Uni.createFrom().item(stored.get());
                    }
                    var current = published.get();
                    if (current != null) {
                        return Uni.createFrom().item(toJson(current));
                    }
                    return fetcher.ensureFresh().map(snapshot -> toJson(build(snapshot, requestBaseUrl)));
                });
    }

    /**
     * @return the in-memory published index, if any
     */
    public Optional<PublishedIndex> current() {
        return Optional.ofNullable(published.get());
    }

    private PublishedIndex publish(ArchiveSnapshot snapshot) {
        var current = published.get();
        var upToDate = current != null && current.fingerprint().equals(snapshot.fingerprint());
        if (upToDate && (!indexStore.isConfigured() || indexStore.exists())) {
            return current;
        }

        var index = build(snapshot, publicBaseUrl.orElseThrow());
        published.set(index);
        LOG.infov("Published index with {0} entries for archive {1}", index.entries().size(), snapshot.fingerprint());

        if (indexStore.isConfigured()) {
            try {
                indexStore.write(toJson(index));
            } catch (IOException e) {
                LOG.warnf(e, "Failed to write index to %s", indexStore.location());
            }
        }
        return index;
    }

    byte[] toJson(PublishedIndex index) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(index.entries());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize index", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        var result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
