package com.pagepilot.orchestrator.execution;

import com.pagepilot.orchestrator.model.PageSnapshot;

import java.util.Optional;

/**
 * Everything the orchestrator core is allowed to do to the active document.
 *
 * Actions report failure through {@link ActionResult} rather than throwing;
 * once an action has been dispatched it is not cancelled.
 */
public interface Actuator {

    PageSnapshot observe();

    /** Address of the active document, read without a full observation. */
    String currentUrl();

    ActionResult click(String selector);

    ActionResult type(String selector, String text);

    ActionResult scrollBy(int deltaY);

    ActionResult navigate(String url);

    /** {@code data:image/png;base64,...} of the viewport, if one can be taken. */
    Optional<String> captureScreenshot();
}
