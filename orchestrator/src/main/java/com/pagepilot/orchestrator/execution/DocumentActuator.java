package com.pagepilot.orchestrator.execution;

import com.pagepilot.orchestrator.browser.DocumentDriver;
import com.pagepilot.orchestrator.browser.DriverException;
import com.pagepilot.orchestrator.model.PageSnapshot;
import com.pagepilot.orchestrator.observe.ElementNotInteractableException;
import com.pagepilot.orchestrator.observe.InteractableWaiter;
import com.pagepilot.orchestrator.observe.ObservationCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Base64;
import java.util.Optional;

/**
 * {@link Actuator} over a {@link DocumentDriver}.
 *
 * Click and type first wait for the target to become interactable; a wait
 * timeout or a driver error becomes a failed {@link ActionResult} carrying
 * the reason. Observation errors propagate: without a snapshot the safety
 * gate cannot run.
 */
public class DocumentActuator implements Actuator {

    private static final Logger log = LoggerFactory.getLogger(DocumentActuator.class);

    private final DocumentDriver       driver;
    private final ObservationCollector collector;
    private final InteractableWaiter   waiter;

    public DocumentActuator(DocumentDriver driver,
                            ObservationCollector collector,
                            InteractableWaiter waiter) {
        this.driver    = driver;
        this.collector = collector;
        this.waiter    = waiter;
    }

    @Override
    public PageSnapshot observe() {
        return collector.observe();
    }

    @Override
    public String currentUrl() {
        return driver.currentUrl();
    }

    @Override
    public ActionResult click(String selector) {
        try {
            waiter.awaitInteractable(selector);
            driver.click(selector);
            return ActionResult.success();
        } catch (ElementNotInteractableException e) {
            return ActionResult.failure(e.getMessage());
        } catch (DriverException e) {
            log.warn("Click on '{}' failed: {}", selector, e.getMessage());
            return ActionResult.failure("Click failed: " + selector);
        }
    }

    @Override
    public ActionResult type(String selector, String text) {
        try {
            waiter.awaitInteractable(selector);
            driver.fill(selector, text);
            return ActionResult.success();
        } catch (ElementNotInteractableException e) {
            return ActionResult.failure(e.getMessage());
        } catch (DriverException e) {
            log.warn("Typing into '{}' failed: {}", selector, e.getMessage());
            return ActionResult.failure("Typing failed: " + selector);
        }
    }

    @Override
    public ActionResult scrollBy(int deltaY) {
        try {
            driver.scrollBy(deltaY);
            return ActionResult.success();
        } catch (DriverException e) {
            log.warn("Scroll by {} failed: {}", deltaY, e.getMessage());
            return ActionResult.failure("Scroll failed");
        }
    }

    @Override
    public ActionResult navigate(String url) {
        try {
            driver.navigate(url);
            return ActionResult.success();
        } catch (DriverException e) {
            log.warn("Navigation to {} failed: {}", url, e.getMessage());
            return ActionResult.failure("Navigation failed: " + url);
        }
    }

    @Override
    public Optional<String> captureScreenshot() {
        return driver.screenshot()
                .map(png -> "data:image/png;base64," + Base64.getEncoder().encodeToString(png));
    }
}
