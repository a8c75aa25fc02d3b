package geosite.core.port.in;

import io.smallrye.mutiny.Uni;

import geosite.core.model.RenderedRuleset;
import geosite.core.model.RulesetKey;

/**
 * Use case for converting one list member into a ruleset dialect.
 */
public interface RulesetConversion {

    /**
     * Render a list member, serving from cache when the archive version is unchanged.
     *
     * @param key member, filter tag, and dialect
     * @return the rendered ruleset
     */
    Uni<RenderedRuleset> render(RulesetKey key);
}
