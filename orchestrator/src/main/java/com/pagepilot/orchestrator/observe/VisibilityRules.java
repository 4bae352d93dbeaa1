package com.pagepilot.orchestrator.observe;

/**
 * Visibility and interactability predicates over an {@link ElementProbe}.
 *
 * Visible: box at least {@code minSize} in both dimensions, not entirely
 * outside the viewport, and not hidden by display / visibility / opacity.
 * Interactable: visible, pointer events enabled, and not disabled.
 */
public final class VisibilityRules {

    private VisibilityRules() {}

    public static boolean isVisible(ElementProbe el, Viewport viewport, int minSize) {
        if (el == null || el.box() == null) return false;

        ElementProbe.Box r = el.box();
        if (r.width() < minSize || r.height() < minSize) return false;
        if (r.bottom() < 0 || r.right() < 0) return false;
        if (r.top() > viewport.height() || r.left() > viewport.width()) return false;

        ElementProbe.Style s = el.style();
        if (s == null) return true;
        return !"none".equals(s.display())
            && !"hidden".equals(s.visibility())
            && !isZero(s.opacity());
    }

    public static boolean isInteractable(ElementProbe el, Viewport viewport, int minSize) {
        if (!isVisible(el, viewport, minSize)) return false;
        ElementProbe.Style s = el.style();
        boolean pointerDisabled = s != null && "none".equals(s.pointerEvents());
        return !pointerDisabled && !el.disabled();
    }

    private static boolean isZero(String opacity) {
        if (opacity == null || opacity.isBlank()) return false;
        try {
            return Double.parseDouble(opacity.strip()) == 0.0;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
