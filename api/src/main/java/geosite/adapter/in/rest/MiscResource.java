package geosite.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import geosite.core.port.out.MiscListClient;

/**
 * Passes hand-maintained lists through unchanged.
 */
@Path("/misc")
@ApplicationScoped
public class MiscResource {

    private final MiscListClient client;

    @Inject
    public MiscResource(MiscListClient client) {
        this.client = client;
    }

    @GET
    @Path("{category}/{name}")
    public Uni<Response> list(@PathParam("category") String category, @PathParam("name") String name) {
        if (category.isBlank() || name.isBlank()) {
            throw new IllegalArgumentException("Invalid misc list parameters");
        }
        return client.fetch(category.trim(), name.trim()).map(body -> Response.ok(body)
                .type("text/plain; charset=utf-8")
                .header(HttpHeaders.CACHE_CONTROL, GeositeResource.CACHE_CONTROL)
                .build());
    }
}
