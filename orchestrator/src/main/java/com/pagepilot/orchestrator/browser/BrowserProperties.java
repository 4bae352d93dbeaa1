package com.pagepilot.orchestrator.browser;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Playwright browser settings (pagepilot.browser.*).
 *
 * @param cdpUrl   when set, attach to an already running Chromium over CDP
 *                 instead of launching one; its first open page is the active document.
 * @param startUrl first page of a launched browser. Must be an ordinary web page:
 *                 requests are refused on about:, chrome: and extension pages.
 */
@ConfigurationProperties(prefix = "pagepilot.browser")
public record BrowserProperties(
        Boolean headless,
        String  cdpUrl,
        String  startUrl,
        Integer viewportWidth,
        Integer viewportHeight
) {
    public static final String DEFAULT_START_URL = "https://duckduckgo.com/";

    public BrowserProperties {
        if (headless == null)       headless       = true;
        if (startUrl == null || startUrl.isBlank()) startUrl = DEFAULT_START_URL;
        if (viewportWidth == null)  viewportWidth  = 1280;
        if (viewportHeight == null) viewportHeight = 720;
    }
}
