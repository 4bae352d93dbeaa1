package com.pagepilot.orchestrator.observe;

import com.pagepilot.orchestrator.browser.DocumentDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Polls the document until an element matching a selector is both visible
 * and interactable, to cope with content that renders asynchronously.
 *
 * Polls every {@code pollInterval} up to {@code waitTimeout}. Timing out is
 * reported as {@link ElementNotInteractableException} and is not retried here.
 */
public class InteractableWaiter {

    private static final Logger log = LoggerFactory.getLogger(InteractableWaiter.class);

    private final DocumentDriver        driver;
    private final ObservationProperties props;
    private final Clock                 clock;

    public InteractableWaiter(DocumentDriver driver, ObservationProperties props, Clock clock) {
        this.driver = driver;
        this.props  = props;
        this.clock  = clock;
    }

    /**
     * @return the matching element once it is interactable
     * @throws ElementNotInteractableException after the timeout
     */
    public ElementProbe awaitInteractable(String selector) {
        Instant deadline = clock.instant().plus(props.waitTimeout());
        boolean seen = false;

        while (true) {
            Optional<ElementProbe> el = driver.probe(selector);
            if (el.isPresent()) {
                seen = true;
                Viewport viewport = driver.viewport();
                if (VisibilityRules.isInteractable(el.get(), viewport, props.minElementSize())) {
                    return el.get();
                }
            }
            if (!clock.instant().isBefore(deadline)) break;
            pause(props.pollInterval());
        }

        log.warn("Gave up waiting for '{}' after {} ms (seen={})",
                selector, props.waitTimeout().toMillis(), seen);
        throw new ElementNotInteractableException(selector,
                seen ? ElementNotInteractableException.Reason.NOT_INTERACTABLE
                     : ElementNotInteractableException.Reason.NOT_FOUND);
    }

    private static void pause(Duration interval) {
        try {
            Thread.sleep(interval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for element", e);
        }
    }
}
