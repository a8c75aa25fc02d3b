package geosite.adapter.in.http;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.vertx.web.RouteFilter;
import io.vertx.ext.web.RoutingContext;
import org.jboss.logging.Logger;

/**
 * Logs method, path, status and duration of every request once the response is written.
 */
@ApplicationScoped
public class RequestLoggingFilter {

    private static final Logger LOG = Logger.getLogger(RequestLoggingFilter.class);

    @RouteFilter(100)
    void logRequest(RoutingContext rc) {
        var start = System.nanoTime();
        var method = rc.request().method().name();
        var path = rc.request().path();
        rc.addEndHandler(ignored -> LOG.infof(
                "%s %s %d %dms",
                method,
                path,
                rc.response().getStatusCode(),
                (System.nanoTime() - start) / 1_000_000));
        rc.next();
    }
}
