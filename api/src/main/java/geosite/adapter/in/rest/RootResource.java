package geosite.adapter.in.rest;

import java.net.URI;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.core.Response;

import geosite.config.GeositeConfig;

@Path("/")
@ApplicationScoped
public class RootResource {

    private final URI repoUrl;

    @Inject
    public RootResource(GeositeConfig config) {
        this.repoUrl = URI.create(config.repoUrl());
    }

    @GET
    public Response root() {
        return Response.status(Response.Status.FOUND).location(repoUrl).build();
    }
}
