package com.pagepilot.orchestrator.browser;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.pagepilot.orchestrator.observe.ElementProbe;
import com.pagepilot.orchestrator.observe.Viewport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link DocumentDriver} backed by a single Playwright Chromium page.
 *
 * The browser is started on first use, not at construction, so the
 * application (and every test context) starts without a browser. All
 * Playwright calls are serialised on this object: Playwright's Java API is
 * not thread-safe.
 *
 * Element facts are gathered by {@code browser/element-probe.js}, evaluated
 * in the page: with a null argument it describes every interactive element
 * in document order, with a selector it describes the first match or
 * returns null.
 */
public class PlaywrightDocumentDriver implements DocumentDriver, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PlaywrightDocumentDriver.class);

    private static final String PROBE_SCRIPT = loadScript("browser/element-probe.js");

    private static final TypeReference<List<ElementProbe>> PROBE_LIST = new TypeReference<>() {};

    private final BrowserProperties props;
    private final ObjectMapper      json;

    private Playwright     playwright;
    private Browser        browser;
    private BrowserContext context;
    private Page           page;

    public PlaywrightDocumentDriver(BrowserProperties props, ObjectMapper objectMapper) {
        this.props = props;
        this.json  = objectMapper;
    }

    // ------------------------------------------------------------------
    // Observation
    // ------------------------------------------------------------------

    @Override
    public synchronized String currentUrl() {
        return call("read url", () -> page().url());
    }

    @Override
    public synchronized String title() {
        return call("read title", () -> page().title());
    }

    @Override
    public synchronized String visibleText() {
        Object text = call("read text", () -> page().evaluate("() => document.body ? document.body.innerText : ''"));
        return text == null ? "" : text.toString();
    }

    @Override
    public synchronized Viewport viewport() {
        Object size = call("read viewport",
                () -> page().evaluate("() => ({ width: window.innerWidth, height: window.innerHeight })"));
        Map<?, ?> m = (Map<?, ?>) size;
        return new Viewport(((Number) m.get("width")).doubleValue(), ((Number) m.get("height")).doubleValue());
    }

    @Override
    public synchronized List<ElementProbe> scanInteractive() {
        Object raw = call("scan elements", () -> page().evaluate(PROBE_SCRIPT, null));
        return json.convertValue(raw, PROBE_LIST);
    }

    @Override
    public synchronized Optional<ElementProbe> probe(String selector) {
        Object raw = call("probe " + selector, () -> page().evaluate(PROBE_SCRIPT, selector));
        if (raw == null) return Optional.empty();
        return Optional.of(json.convertValue(raw, ElementProbe.class));
    }

    @Override
    public synchronized Optional<byte[]> screenshot() {
        try {
            return Optional.of(page().screenshot());
        } catch (PlaywrightException e) {
            log.warn("Screenshot capture failed, continuing without: {}", e.getMessage());
            return Optional.empty();
        }
    }

    // ------------------------------------------------------------------
    // Actions
    // ------------------------------------------------------------------

    @Override
    public synchronized void click(String selector) {
        call("click " + selector, () -> {
            Locator target = page().locator(selector).first();
            target.scrollIntoViewIfNeeded();
            target.click();
            return null;
        });
    }

    @Override
    public synchronized void fill(String selector, String text) {
        call("type into " + selector, () -> {
            Locator target = page().locator(selector).first();
            target.scrollIntoViewIfNeeded();
            target.focus();
            target.fill(text);
            target.dispatchEvent("change");
            return null;
        });
    }

    @Override
    public synchronized void scrollBy(int deltaY) {
        call("scroll", () -> page().evaluate(
                "d => window.scrollBy({ top: d, left: 0, behavior: 'smooth' })", deltaY));
    }

    @Override
    public synchronized void navigate(String url) {
        call("navigate to " + url, () -> page().navigate(url));
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    private Page page() {
        if (page != null && !page.isClosed()) return page;

        if (playwright == null) {
            playwright = Playwright.create();
        }
        if (props.cdpUrl() != null && !props.cdpUrl().isBlank()) {
            log.info("Attaching to browser over CDP: {}", props.cdpUrl());
            browser = playwright.chromium().connectOverCDP(props.cdpUrl());
            context = browser.contexts().isEmpty() ? browser.newContext() : browser.contexts().get(0);
            page    = context.pages().isEmpty() ? context.newPage() : context.pages().get(0);
        } else {
            log.info("Launching Chromium (headless={})", props.headless());
            browser = playwright.chromium().launch(
                    new BrowserType.LaunchOptions().setHeadless(props.headless()));
            context = browser.newContext(new Browser.NewContextOptions()
                    .setViewportSize(props.viewportWidth(), props.viewportHeight()));
            page = context.newPage();
            if (!"about:blank".equals(props.startUrl())) {
                page.navigate(props.startUrl());
            }
        }
        return page;
    }

    @Override
    public synchronized void close() {
        if (browser != null) {
            try {
                browser.close();
            } catch (PlaywrightException e) {
                log.warn("Error closing browser: {}", e.getMessage());
            }
        }
        if (playwright != null) {
            playwright.close();
        }
        page       = null;
        context    = null;
        browser    = null;
        playwright = null;
        log.info("Browser stopped");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static <T> T call(String opName, Supplier<T> action) {
        try {
            return action.get();
        } catch (PlaywrightException e) {
            throw new DriverException(opName + " failed: " + e.getMessage(), e);
        }
    }

    private static String loadScript(String path) {
        try {
            return StreamUtils.copyToString(new ClassPathResource(path).getInputStream(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Missing page script " + path, e);
        }
    }
}
