package geosite.core.port.out;

import io.smallrye.mutiny.Uni;

/**
 * Port for talking to the server that hosts the upstream archive.
 *
 * <p>Both operations fail with
 * {@link geosite.core.error.UpstreamTransportException} when the upstream
 * cannot be reached or answers with a non-success status.
 */
public interface ArchiveTransport {

    /**
     * Fetch the archive's current version token without downloading it.
     *
     * @return the normalized token; empty if the upstream does not advertise one
     */
    Uni<String> fetchFingerprint();

    /**
     * Download the complete archive.
     *
     * @return raw archive bytes
     */
    Uni<byte[]> download();
}
