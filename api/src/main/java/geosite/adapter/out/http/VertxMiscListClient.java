package geosite.adapter.out.http;

import java.util.Locale;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;

import geosite.config.GeositeConfig;
import geosite.core.error.GeositeException;
import geosite.core.error.MemberNotFoundException;
import geosite.core.error.UpstreamTransportException;
import geosite.core.port.out.MiscListClient;

/**
 * Fetches {@code <base-url>/<category>/<name>.list} using Vert.x WebClient.
 */
@ApplicationScoped
public class VertxMiscListClient implements MiscListClient {

    private final Vertx vertx;
    private final GeositeConfig.Misc config;
    private final String userAgent;
    private WebClient webClient;

    @Inject
    public VertxMiscListClient(Vertx vertx, GeositeConfig config) {
        this.vertx = vertx;
        this.config = config.misc();
        this.userAgent = config.source().userAgent();
    }

    @PostConstruct
    void init() {
        this.webClient = WebClient.create(vertx);
    }

    @Override
    public Uni<String> fetch(String category, String name) {
        var path = category.toLowerCase(Locale.ROOT) + "/" + name.toLowerCase(Locale.ROOT);
        var url = stripTrailingSlash(config.baseUrl()) + "/" + path + ".list";
        return webClient
                .getAbs(url)
                .putHeader("User-Agent", userAgent)
                .timeout(config.timeout().toMillis())
                .send()
                .onFailure(error -> !(error instanceof GeositeException))
                .transform(error -> new UpstreamTransportException("GET " + url + " failed: " + error.getMessage(), error))
                .map(response -> {
                    if (response.statusCode() == 404) {
                        throw new MemberNotFoundException(path);
                    }
                    if (response.statusCode() != 200) {
                        throw new UpstreamTransportException("GET " + url + " returned status " + response.statusCode());
                    }
                    var body = response.bodyAsString();
                    return body == null ? "" : body;
                });
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
