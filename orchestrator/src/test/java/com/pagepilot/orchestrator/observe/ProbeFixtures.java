package com.pagepilot.orchestrator.observe;

import java.util.List;

/** Builders for {@link ElementProbe}s in observation tests. */
final class ProbeFixtures {

    static final Viewport VIEWPORT = new Viewport(1280, 720);

    static final ElementProbe.Style SHOWN = new ElementProbe.Style("block", "visible", "1", "auto");

    private ProbeFixtures() {}

    static ElementProbe.Box box(double top, double left, double width, double height) {
        return new ElementProbe.Box(top, left, top + height, left + width, width, height);
    }

    static ElementProbe button(String id, String text) {
        return new ElementProbe("button", id, null, null, null, null, null, text,
                box(10, 10, 80, 30), SHOWN, false, List.of(new ElementProbe.PathSegment("button", 1)));
    }

    static ElementProbe withStyle(ElementProbe el, ElementProbe.Style style) {
        return new ElementProbe(el.tag(), el.id(), el.name(), el.ariaLabel(), el.placeholder(), el.type(),
                el.href(), el.text(), el.box(), style, el.disabled(), el.ancestry());
    }

    static ElementProbe withBox(ElementProbe el, ElementProbe.Box box) {
        return new ElementProbe(el.tag(), el.id(), el.name(), el.ariaLabel(), el.placeholder(), el.type(),
                el.href(), el.text(), box, el.style(), el.disabled(), el.ancestry());
    }

    static ElementProbe disabled(ElementProbe el) {
        return new ElementProbe(el.tag(), el.id(), el.name(), el.ariaLabel(), el.placeholder(), el.type(),
                el.href(), el.text(), el.box(), el.style(), true, el.ancestry());
    }
}
