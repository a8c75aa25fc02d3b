package geosite.core.service.render;

import java.util.List;

import geosite.core.model.Dialect;
import geosite.core.model.ListItem;

/**
 * Renders parsed list items into one output dialect. Implementations are stateless.
 */
public interface RulesetRenderer {

    Dialect dialect();

    /**
     * @param items parsed items in source order
     * @return rendered text without a trailing newline
     */
    String render(List<ListItem> items);
}
