package geosite.core.model;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Name to URL mapping of every list member, derived from one archive version.
 *
 * @param fingerprint archive version the index was built from
 * @param entries     member name to ruleset URL, in lexicographic order
 */
public record PublishedIndex(String fingerprint, SortedMap<String, String> entries) {
    public PublishedIndex {
        entries = Collections.unmodifiableSortedMap(new TreeMap<>(entries));
    }
}
