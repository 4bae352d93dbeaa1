package com.pagepilot.orchestrator.observe;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SelectorGeneratorTest {

    static ElementProbe probe(String tag, String id, String name, String aria, String placeholder,
                              List<ElementProbe.PathSegment> ancestry) {
        return new ElementProbe(tag, id, name, aria, placeholder, null, null, null,
                null, null, false, ancestry);
    }

    static ElementProbe.PathSegment seg(String tag, int n) {
        return new ElementProbe.PathSegment(tag, n);
    }

    @Test
    void selectorFor_idWins() {
        ElementProbe el = probe("input", "q", "query", "Search", "Search...", List.of());
        assertThat(SelectorGenerator.selectorFor(el, 4)).isEqualTo("#q");
    }

    @Test
    void selectorFor_idWithSpecialCharacters_isEscaped() {
        ElementProbe el = probe("div", "a.b:c", null, null, null, List.of());
        assertThat(SelectorGenerator.selectorFor(el, 4)).isEqualTo("#a\\.b\\:c");
    }

    @Test
    void selectorFor_nameBeforeAriaLabel() {
        ElementProbe el = probe("input", null, "q", "Search", null, List.of());
        assertThat(SelectorGenerator.selectorFor(el, 4)).isEqualTo("input[name=\"q\"]");
    }

    @Test
    void selectorFor_ariaLabelBeforePlaceholder() {
        ElementProbe el = probe("button", null, null, "Close dialog", "x", List.of());
        assertThat(SelectorGenerator.selectorFor(el, 4)).isEqualTo("button[aria-label=\"Close dialog\"]");
    }

    @Test
    void selectorFor_placeholderOnly() {
        ElementProbe el = probe("textarea", null, null, null, "Write a comment", List.of());
        assertThat(SelectorGenerator.selectorFor(el, 4)).isEqualTo("textarea[placeholder=\"Write a comment\"]");
    }

    @Test
    void selectorFor_quoteInAttribute_isEscaped() {
        ElementProbe el = probe("button", null, null, "Say \"hi\"", null, List.of());
        assertThat(SelectorGenerator.selectorFor(el, 4)).isEqualTo("button[aria-label=\"Say \\\"hi\\\"\"]");
    }

    @Test
    void selectorFor_noAttributes_positionalOutermostFirst() {
        ElementProbe el = probe("a", null, null, null, null,
                List.of(seg("a", 2), seg("li", 3), seg("ul", 1)));

        assertThat(SelectorGenerator.selectorFor(el, 4))
                .isEqualTo("ul:nth-of-type(1) > li:nth-of-type(3) > a:nth-of-type(2)");
    }

    @Test
    void selectorFor_positional_limitedToDepth() {
        ElementProbe el = probe("span", null, null, null, null,
                List.of(seg("span", 1), seg("div", 2), seg("section", 1), seg("main", 1), seg("body", 1)));

        assertThat(SelectorGenerator.selectorFor(el, 4))
                .isEqualTo("main:nth-of-type(1) > section:nth-of-type(1) > div:nth-of-type(2) > span:nth-of-type(1)");
    }

    @Test
    void selectorFor_noAncestry_bareTag() {
        assertThat(SelectorGenerator.selectorFor(probe("html", null, null, null, null, List.of()), 4))
                .isEqualTo("html");
    }

    @Test
    void selectorFor_emptyId_fallsThrough() {
        ElementProbe el = probe("input", "", "email", null, null, List.of());
        assertThat(SelectorGenerator.selectorFor(el, 4)).isEqualTo("input[name=\"email\"]");
    }
}
