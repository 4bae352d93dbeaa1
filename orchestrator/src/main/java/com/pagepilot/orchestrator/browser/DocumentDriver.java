package com.pagepilot.orchestrator.browser;

import com.pagepilot.orchestrator.observe.ElementProbe;
import com.pagepilot.orchestrator.observe.Viewport;

import java.util.List;
import java.util.Optional;

/**
 * Port to the single active document.
 *
 * Implementations report raw element facts and perform raw DOM actions;
 * they do not decide visibility, build selectors or wait. All methods may
 * throw {@link DriverException}.
 */
public interface DocumentDriver {

    String currentUrl();

    String title();

    /** The document's rendered body text, untruncated. */
    String visibleText();

    Viewport viewport();

    /**
     * Every link, button, input, textarea, select and role=button element,
     * in document order.
     */
    List<ElementProbe> scanInteractive();

    /** The first element matching {@code selector}, if any. */
    Optional<ElementProbe> probe(String selector);

    /** Scroll the first match into view and click it. */
    void click(String selector);

    /** Scroll into view, focus, replace the value, fire input/change events. */
    void fill(String selector, String text);

    void scrollBy(int deltaY);

    void navigate(String url);

    /** PNG of the current viewport, or empty when capture is not possible. */
    Optional<byte[]> screenshot();
}
