package geosite.core.service.render;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import geosite.core.model.Dialect;
import geosite.core.model.Rule;
import geosite.core.port.out.RulesetMetrics;
import geosite.core.service.WildcardTranslator;

/**
 * Surge rule-set lines. Surge has no regex rule, so regexes are translated to
 * {@code DOMAIN-WILDCARD}; unsafe translations are kept as disabled lines for auditing.
 */
@ApplicationScoped
public class SurgeRenderer extends LineRulesetRenderer {

    private final WildcardTranslator translator;
    private final RulesetMetrics metrics;

    @Inject
    public SurgeRenderer(WildcardTranslator translator, RulesetMetrics metrics) {
        this.translator = translator;
        this.metrics = metrics;
    }

    @Override
    public Dialect dialect() {
        return Dialect.SURGE;
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
                return renderRegex(rule);
            default:
                return appendComment(rule.value(), rule.comment());
        }
    }

    private String renderRegex(Rule rule) {
        var translation = translator.translate(rule.value());
        if (translation.dangerous()) {
            metrics.recordDangerousRegex();
            return appendComment("# DANGEROUS-REGEX," + rule.value(), rule.comment());
        }
        var prefix = translation.hasNoLiteral() ? "# SKIPPED-DOMAIN-WILDCARD," : "DOMAIN-WILDCARD,";
        return appendComment(prefix + translation.pattern(), rule.comment());
    }
}
