package geosite.adapter.out.http;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpRequest;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import geosite.config.GeositeConfig;
import geosite.core.error.GeositeException;
import geosite.core.error.UpstreamTransportException;
import geosite.core.port.out.ArchiveTransport;

/**
 * Fetches the upstream archive over HTTP using Vert.x WebClient.
 *
 * <p>The fingerprint is the archive's ETag, taken from a HEAD request so that an
 * unchanged archive costs one round trip and no body.
 */
@ApplicationScoped
public class VertxArchiveTransport implements ArchiveTransport {

    private static final Logger LOG = Logger.getLogger(VertxArchiveTransport.class);

    private final Vertx vertx;
    private final GeositeConfig.Source config;
    private WebClient webClient;

    @Inject
    public VertxArchiveTransport(Vertx vertx, GeositeConfig config) {
        this(vertx, config.source());
    }

    VertxArchiveTransport(Vertx vertx, GeositeConfig.Source config) {
        this.vertx = vertx;
        this.config = config;
    }

    @PostConstruct
    void init() {
        this.webClient = WebClient.create(vertx);
    }

    @Override
    public Uni<String> fetchFingerprint() {
        var request = webClient.headAbs(config.archiveUrl()).timeout(config.fingerprintTimeout().toMillis());
        return send(request, "HEAD").map(response -> {
            var token = normalizeEtag(response.getHeader("ETag"));
            LOG.debugv("Upstream fingerprint: {0}", token.isEmpty() ? "<none>" : token);
            return token;
        });
    }

    @Override
    public Uni<byte[]> download() {
        var request = webClient.getAbs(config.archiveUrl()).timeout(config.downloadTimeout().toMillis());
        return send(request, "GET").map(response -> {
            var body = response.bodyAsBuffer();
            return body == null ? new byte[0] : body.getBytes();
        });
    }

    private Uni<HttpResponse<Buffer>> send(HttpRequest<Buffer> request, String method) {
        return request.putHeader("User-Agent", config.userAgent())
                .send()
                .onFailure(error -> !(error instanceof GeositeException))
                .transform(error -> new UpstreamTransportException(
                        "%s %s failed: %s".formatted(method, config.archiveUrl(), error.getMessage()), error))
                .map(response -> {
                    if (response.statusCode() != 200) {
                        throw new UpstreamTransportException("%s %s returned status %d"
                                .formatted(method, config.archiveUrl(), response.statusCode()));
                    }
                    return response;
                });
    }

    /**
     * Strip quotes and the weak-validator prefix, so {@code W/"abc"} and {@code "abc"} compare equal.
     */
    static String normalizeEtag(String etag) {
        if (etag == null) {
            return "";
        }
        var token = etag.trim();
        if (token.startsWith("W/")) {
            token = token.substring(2);
        }
        return token.replace("\"", "");
    }
}
