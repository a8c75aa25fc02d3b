package geosite.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import geosite.core.error.ArchiveFormatException;
import geosite.core.error.CyclicIncludeException;
import geosite.core.error.MemberNotFoundException;
import geosite.core.error.UpstreamTransportException;

/**
 * Global exception mappers for converting exceptions to RFC 7807 Problem Details.
 *
 * <p>Client errors are logged at DEBUG, upstream and data errors at WARN.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapMemberNotFound(MemberNotFoundException e) {
        LOG.debugv("Not found: {0}", e.getMessage());
        return toResponse(GeositeProblem.memberNotFound(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapUpstreamTransport(UpstreamTransportException e) {
        LOG.warnv("Upstream unavailable: {0}", e.getMessage());
        return toResponse(GeositeProblem.upstreamUnavailable(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapArchiveFormat(ArchiveFormatException e) {
        LOG.warnv("Unusable upstream archive: {0}", e.getMessage());
        return toResponse(GeositeProblem.upstreamUnavailable(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapCyclicInclude(CyclicIncludeException e) {
        LOG.warnv("List data error: {0}", e.getMessage());
        return toResponse(GeositeProblem.listDataError(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(GeositeProblem.badRequest(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
