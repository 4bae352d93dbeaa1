package com.pagepilot.orchestrator.observe;

import com.pagepilot.orchestrator.browser.DocumentDriver;
import com.pagepilot.orchestrator.model.Candidate;
import com.pagepilot.orchestrator.model.PageSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Produces a bounded {@link PageSnapshot} of the active document.
 *
 * Candidates are kept in document order, first discovered first kept, and
 * only visible elements qualify. Every text field is cut to its cap and the
 * page text to {@code maxTextLength}, so the snapshot size is bounded no
 * matter how large the page is.
 */
public class ObservationCollector {

    private static final Logger log = LoggerFactory.getLogger(ObservationCollector.class);

    private final DocumentDriver        driver;
    private final ObservationProperties props;

    public ObservationCollector(DocumentDriver driver, ObservationProperties props) {
        this.driver = driver;
        this.props  = props;
    }

    public PageSnapshot observe() {
        String   url      = driver.currentUrl();
        Viewport viewport = driver.viewport();

        List<ElementProbe> scanned = driver.scanInteractive();
        List<Candidate> candidates = new ArrayList<>();
        for (ElementProbe el : scanned) {
            if (!VisibilityRules.isVisible(el, viewport, props.minElementSize())) continue;

            candidates.add(toCandidate(el));
            if (candidates.size() >= props.maxCandidates()) break;
        }

        String text = truncate(driver.visibleText(), props.maxTextLength());
        log.debug("Observed {}: {} of {} interactive elements kept, {} chars of text",
                url, candidates.size(), scanned.size(), text.length());
        return new PageSnapshot(url, driver.title(), text, candidates);
    }

    Candidate toCandidate(ElementProbe el) {
        int field = props.maxFieldLength();
        return new Candidate(
                SelectorGenerator.selectorFor(el, props.selectorDepth()),
                el.tag(),
                clip(el.text(), field),
                clip(el.ariaLabel(), field),
                clip(el.placeholder(), field),
                clip(el.name(), field),
                clip(el.type(), props.maxTypeLength()),
                clip(el.href(), props.maxHrefLength()));
    }

    /** Trim, then cut to {@code max} characters. */
    static String clip(String value, int max) {
        return truncate(value == null ? "" : value.strip(), max);
    }

    static String truncate(String value, int max) {
        if (value == null) return "";
        return value.length() <= max ? value : value.substring(0, max);
    }
}
