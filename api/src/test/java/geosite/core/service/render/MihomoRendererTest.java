package geosite.core.service.render;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import geosite.core.model.ListItem;
import geosite.core.model.Rule;
import geosite.core.model.RuleKind;

@DisplayName("MihomoRenderer")
class MihomoRendererTest {

    private final MihomoRenderer renderer = new MihomoRenderer();

    @Test
    @DisplayName("should pass regexes through natively")
    void shouldPassRegexThrough() {
        var output = renderer.render(List.of(
                ListItem.comment("# ads"),
                ListItem.rule(Rule.of(RuleKind.DOMAIN_REGEX, "^(www|api)\\.example\\.com$")),
                ListItem.rule(new Rule(RuleKind.DOMAIN_SUFFIX, "example.com", "@ads"))));

        assertEquals(
                "# ads\nDOMAIN-REGEX,^(www|api)\\.example\\.com$\nDOMAIN-SUFFIX,example.com # @ads", output);
    }

    @Test
    @DisplayName("should render keyword and full-domain rules")
    void shouldRenderPlainKinds() {
        var output = renderer.render(List.of(
                ListItem.rule(Rule.of(RuleKind.DOMAIN, "a.com")), ListItem.rule(Rule.of(RuleKind.DOMAIN_KEYWORD, "ad"))));

        assertEquals("DOMAIN,a.com\nDOMAIN-KEYWORD,ad", output);
    }
}
