package geosite.core.port.in;

import io.smallrye.mutiny.Uni;

/**
 * Use case for serving the published index of available lists.
 */
public interface IndexQuery {

    /**
     * Index as pretty-printed JSON.
     *
     * @param requestBaseUrl base URL derived from the incoming request, used only
     *                       when no published index is available
     * @return JSON body
     */
    Uni<byte[]> indexJson(String requestBaseUrl);
}
