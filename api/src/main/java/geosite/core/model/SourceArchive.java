package geosite.core.model;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.zip.ZipInputStream;

import geosite.core.error.ArchiveFormatException;

/**
 * Decoded view of the upstream ZIP archive.
 *
 * <p>Entries are read eagerly into memory in archive order. Directory entries are
 * skipped. Instances are immutable and safe to share between threads.
 */
public final class SourceArchive {

    private final Map<String, byte[]> entries;

    private SourceArchive(Map<String, byte[]> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    /**
     * Decode a ZIP payload.
     *
     * @param payload raw archive bytes
     * @return the decoded archive
     * @throws ArchiveFormatException if the payload is not a ZIP or has no file entries
     */
    public static SourceArchive parse(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new ArchiveFormatException("Archive payload is empty");
        }
        var entries = new LinkedHashMap<String, byte[]>();
        try (var zip = new ZipInputStream(new ByteArrayInputStream(payload))) {
            var entry = zip.getNextEntry();
            while (entry != null) {
                if (!entry.isDirectory()) {
                    entries.put(entry.getName(), zip.readAllBytes());
                }
                zip.closeEntry();
                entry = zip.getNextEntry();
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new ArchiveFormatException("Archive is not a readable ZIP: " + e.getMessage(), e);
        }
        if (entries.isEmpty()) {
            throw new ArchiveFormatException("Archive contains no entries");
        }
        return new SourceArchive(entries);
    }

    /**
     * Read an entry as UTF-8 text.
     *
     * @param path full entry path inside the archive
     * @return entry content, or empty if absent
     */
    public Optional<String> readText(String path) {
        var data = entries.get(path);
        if (data == null) {
            return Optional.empty();
        }
        return Optional.of(new String(data, StandardCharsets.UTF_8));
    }

    /**
     * All file entry paths in archive order.
     */
    public List<String> entryNames() {
        return List.copyOf(entries.keySet());
    }

    public int size() {
        return entries.size();
    }
}
