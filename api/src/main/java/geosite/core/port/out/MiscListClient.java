package geosite.core.port.out;

import io.smallrye.mutiny.Uni;

/**
 * Fetches hand-maintained rule lists that live outside the upstream archive.
 */
public interface MiscListClient {

    /**
     * @param category list category directory
     * @param name     list name without extension
     * @return the list body as published
     */
    Uni<String> fetch(String category, String name);
}
