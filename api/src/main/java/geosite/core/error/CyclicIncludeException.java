package geosite.core.error;

import java.util.List;

/**
 * A chain of {@code include:} directives refers back to a member that is
 * already being expanded.
 */
public class CyclicIncludeException extends GeositeException {

    private final List<String> chain;

    public CyclicIncludeException(List<String> chain) {
        super("Cyclic include: " + String.join(" -> ", chain));
        this.chain = List.copyOf(chain);
    }

    public List<String> chain() {
        return chain;
    }
}
