package geosite.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for ruleset errors.
 *
 * <p>Static factories give every endpoint the same titles for the same failures.
 */
public final class GeositeProblem {

    private GeositeProblem() {
        // Utility class - prevent instantiation
    }

    // ========== Client Errors ==========

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem memberNotFound(String detail) {
        return HttpProblem.builder()
                .withTitle("List Not Found")
                .withStatus(Status.NOT_FOUND)
                .withDetail(detail)
                .build();
    }

    // ========== Server Errors ==========

    public static HttpProblem upstreamUnavailable(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Gateway")
                .withStatus(Status.BAD_GATEWAY)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem listDataError(String detail) {
        return HttpProblem.builder()
                .withTitle("Internal Server Error")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail(detail)
                .build();
    }
}
