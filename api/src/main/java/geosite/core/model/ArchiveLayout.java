package geosite.core.model;

import java.util.Optional;

/**
 * Where list members live inside the upstream archive.
 *
 * @param dataPrefix directory holding the members, e.g. {@code domain-list-community-master/data/}
 */
public record ArchiveLayout(String dataPrefix) {
    public ArchiveLayout {
        if (dataPrefix == null || dataPrefix.isBlank()) {
            throw new IllegalArgumentException("Data prefix must not be blank");
        }
        if (!dataPrefix.endsWith("/")) {
            dataPrefix = dataPrefix + "/";
        }
    }

    public String memberPath(String member) {
        return dataPrefix + member;
    }

    /**
     * Member name for an archive entry.
     *
     * @param entryPath full entry path
     * @return the member name, or empty if the entry is outside the data directory or nested below it
     */
    public Optional<String> memberName(String entryPath) {
        if (!entryPath.startsWith(dataPrefix)) {
            return Optional.empty();
        }
        var name = entryPath.substring(dataPrefix.length());
        if (name.isEmpty() || name.contains("/")) {
            return Optional.empty();
        }
        return Optional.of(name);
    }
}
