package geosite.core.service.render;

import jakarta.enterprise.context.ApplicationScoped;

import geosite.core.model.Dialect;
import geosite.core.model.Rule;

/**
 * Mihomo classical rule-set lines. Mihomo matches regexes natively, so they pass
 * through untranslated.
 */
@ApplicationScoped
public class MihomoRenderer extends LineRulesetRenderer {

    @Override
    public Dialect dialect() {
        return Dialect.MIHOMO;
    }

    @Override
    protected String renderRule(Rule rule) {
        switch (rule.kind()) {
            case DOMAIN_SUFFIX:
                return renderPlain("DOMAIN-SUFFIX", rule);
            case DOMAIN:
                return renderPlain("DOMAIN", rule);
            case DOMAIN_KEYWORD:
                return renderPlain("DOMAIN-KEYWORD", rule);
            case DOMAIN_REGEX:
                return renderPlain("DOMAIN-REGEX", rule);
            default:
                return appendComment(rule.value(), rule.comment());
        }
    }
}
