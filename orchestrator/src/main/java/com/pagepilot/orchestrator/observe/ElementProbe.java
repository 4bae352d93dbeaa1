package com.pagepilot.orchestrator.observe;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Raw facts about one DOM element, as reported by the document driver.
 *
 * Nothing here is truncated or interpreted; the collector derives
 * visibility, the selector and the bounded candidate fields from it.
 *
 * @param ancestry the element and up to a few ancestors, innermost first,
 *                 each with its 1-based position among same-tag siblings.
 *                 A segment whose element has no parent is not reported.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ElementProbe(
        String tag,
        String id,
        String name,
        String ariaLabel,
        String placeholder,
        String type,
        String href,
        String text,
        Box box,
        Style style,
        boolean disabled,
        List<PathSegment> ancestry
) {
    public ElementProbe {
        tag      = tag == null ? "" : tag.toLowerCase();
        ancestry = ancestry == null ? List.of() : List.copyOf(ancestry);
    }

    /** Rendered bounding box in viewport coordinates (CSS px). */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Box(double top, double left, double bottom, double right,
                      double width, double height) {}

    /** The computed-style properties the visibility rules read. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Style(String display, String visibility, String opacity, String pointerEvents) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PathSegment(String tag, int nthOfType) {}
}
