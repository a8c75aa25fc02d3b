package geosite.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;

import io.smallrye.mutiny.Uni;

import geosite.core.model.Dialect;
import geosite.core.model.RulesetKey;
import geosite.core.port.in.IndexQuery;
import geosite.core.port.in.RulesetConversion;

/**
 * Ruleset and index routes.
 *
 * <p>{@code /geosite/{name}} without a dialect segment serves Surge output.
 */
@Path("/geosite")
@ApplicationScoped
public class GeositeResource {

    static final String CACHE_CONTROL = "public, max-age=1800";

    private final RulesetConversion conversion;
    private final IndexQuery indexQuery;

    @Inject
    public GeositeResource(RulesetConversion conversion, IndexQuery indexQuery) {
        this.conversion = conversion;
        this.indexQuery = indexQuery;
    }

    @GET
    public Uni<Response> index(@Context HttpHeaders headers, @Context UriInfo uriInfo) {
        return indexResponse(headers, uriInfo);
    }

    @GET
    @Path("surge")
    public Uni<Response> surgeIndex(@Context HttpHeaders headers, @Context UriInfo uriInfo) {
        return indexResponse(headers, uriInfo);
    }

    @GET
    @Path("mihomo")
    public Uni<Response> mihomoIndex(@Context HttpHeaders headers, @Context UriInfo uriInfo) {
        return indexResponse(headers, uriInfo);
    }

    @GET
    @Path("egern")
    public Uni<Response> egernIndex(@Context HttpHeaders headers, @Context UriInfo uriInfo) {
        return indexResponse(headers, uriInfo);
    }

    @GET
    @Path("{name}")
    public Uni<Response> defaultRuleset(@PathParam("name") String name) {
        return ruleset(name, Dialect.SURGE);
    }

    @GET
    @Path("surge/{name}")
    public Uni<Response> surgeRuleset(@PathParam("name") String name) {
        return ruleset(name, Dialect.SURGE);
    }

    @GET
    @Path("mihomo/{name}")
    public Uni<Response> mihomoRuleset(@PathParam("name") String name) {
        return ruleset(name, Dialect.MIHOMO);
    }

    @GET
    @Path("egern/{name}")
    public Uni<Response> egernRuleset(@PathParam("name") String name) {
        return ruleset(name, Dialect.EGERN);
    }

    private Uni<Response> ruleset(String name, Dialect dialect) {
        var key = RulesetKey.parse(name, dialect);
        return conversion.render(key).map(rendered -> Response.ok(rendered.text())
                .type(dialect.contentType())
                .header(HttpHeaders.CACHE_CONTROL, CACHE_CONTROL)
                .header(HttpHeaders.ETAG, "\"" + rendered.fingerprint() + "\"")
                .build());
    }

    private Uni<Response> indexResponse(HttpHeaders headers, UriInfo uriInfo) {
        return indexQuery
                .indexJson(requestBaseUrl(headers, uriInfo))
                .map(body -> Response.ok(body)
                        .type(MediaType.APPLICATION_JSON)
                        .header(HttpHeaders.CACHE_CONTROL, CACHE_CONTROL)
                        .build());
    }

    /**
     * Base URL of the ruleset routes as seen by the client, honouring reverse-proxy headers.
     */
    static String requestBaseUrl(HttpHeaders headers, UriInfo uriInfo) {
        var base = uriInfo.getBaseUri();
        var proto = firstValue(headers.getHeaderString("X-Forwarded-Proto"));
        var host = firstValue(headers.getHeaderString("X-Forwarded-Host"));
        if (proto == null) {
            proto = base.getScheme();
        }
        if (host == null) {
            host = base.getRawAuthority();
        }
        return proto + "://" + host + "/geosite";
    }

    private static String firstValue(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        var comma = header.indexOf(',');
        return (comma < 0 ? header : header.substring(0, comma)).trim();
    }
}
