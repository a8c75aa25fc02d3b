package geosite.core.service.render;

import java.util.EnumMap;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import geosite.core.model.Dialect;

/**
 * Looks up the renderer for a dialect.
 */
@ApplicationScoped
public class RendererRegistry {

    private final Map<Dialect, RulesetRenderer> renderers = new EnumMap<>(Dialect.class);

    @Inject
    public RendererRegistry(Instance<RulesetRenderer> renderers) {
        this((Iterable<RulesetRenderer>) renderers);
    }

    public RendererRegistry(Iterable<RulesetRenderer> renderers) {
        for (var renderer : renderers) {
            var previous = this.renderers.put(renderer.dialect(), renderer);
            if (previous != null) {
                throw new IllegalStateException("Duplicate renderer for dialect " + renderer.dialect());
            }
        }
        for (var dialect : Dialect.values()) {
            if (!this.renderers.containsKey(dialect)) {
                throw new IllegalStateException("No renderer registered for dialect " + dialect);
            }
        }
    }

    public RulesetRenderer forDialect(Dialect dialect) {
        return renderers.get(dialect);
    }
}
