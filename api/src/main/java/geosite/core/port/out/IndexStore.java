package geosite.core.port.out;

import java.io.IOException;
import java.util.Optional;

/**
 * Optional file copy of the published index, for static serving.
 */
public interface IndexStore {

    boolean isConfigured();

    /**
     * @return true if a stored index body exists
     */
    boolean exists();

    /**
     * @return the stored index body, or empty if none is stored or storage is not configured
     */
    Optional<byte[]> read();

    /**
     * Atomically replace the stored index body.
     *
     * @throws IOException if the body could not be written
     */
    void write(byte[] body) throws IOException;

    String location();
}
