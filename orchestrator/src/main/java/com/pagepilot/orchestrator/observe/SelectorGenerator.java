package com.pagepilot.orchestrator.observe;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Builds a CSS selector for an element, most stable form first:
 *
 *   1. #id
 *   2. tag[name="..."]
 *   3. tag[aria-label="..."]
 *   4. tag[placeholder="..."]
 *   5. tag:nth-of-type(k) segments for up to {@code depth} ancestor levels,
 *      outermost first, joined by " > "
 */
public final class SelectorGenerator {

    // Characters that must be backslash-escaped inside an #id selector.
    private static final Pattern CSS_SPECIAL =
            Pattern.compile("([ #;?%&,.+*~':\"!^$\\[\\]()=>|/@])");

    private SelectorGenerator() {}

    public static String selectorFor(ElementProbe el, int depth) {
        if (notBlank(el.id())) {
            return "#" + cssEscape(el.id());
        }
        if (notBlank(el.name())) {
            return attributeSelector(el.tag(), "name", el.name());
        }
        if (notBlank(el.ariaLabel())) {
            return attributeSelector(el.tag(), "aria-label", el.ariaLabel());
        }
        if (notBlank(el.placeholder())) {
            return attributeSelector(el.tag(), "placeholder", el.placeholder());
        }
        return positionalSelector(el, depth);
    }

    public static String cssEscape(String value) {
        return CSS_SPECIAL.matcher(value).replaceAll("\\\\$1");
    }

    private static String attributeSelector(String tag, String attribute, String value) {
        return tag + "[" + attribute + "=\"" + value.replace("\"", "\\\"") + "\"]";
    }

    private static String positionalSelector(ElementProbe el, int depth) {
        List<String> parts = new ArrayList<>();
        for (ElementProbe.PathSegment seg : el.ancestry()) {
            if (parts.size() >= depth) break;
            parts.add(0, seg.tag().toLowerCase() + ":nth-of-type(" + seg.nthOfType() + ")");
        }
        if (parts.isEmpty()) {
            // Root-level element with no parent: the bare tag is all we have.
            return el.tag();
        }
        return String.join(" > ", parts);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isEmpty();
    }
}
