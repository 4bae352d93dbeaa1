package com.pagepilot.orchestrator.observe;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Caps and timings for page observation (pagepilot.observation.*).
 *
 * Every snapshot honours these caps regardless of how large the document is.
 */
@ConfigurationProperties(prefix = "pagepilot.observation")
public record ObservationProperties(
        Integer  maxCandidates,
        Integer  maxTextLength,
        Integer  maxFieldLength,
        Integer  maxTypeLength,
        Integer  maxHrefLength,
        Integer  minElementSize,
        Integer  selectorDepth,
        Duration waitTimeout,
        Duration pollInterval
) {
    public ObservationProperties {
        if (maxCandidates == null)  maxCandidates  = 60;
        if (maxTextLength == null)  maxTextLength  = 40_000;
        if (maxFieldLength == null) maxFieldLength = 80;
        if (maxTypeLength == null)  maxTypeLength  = 30;
        if (maxHrefLength == null)  maxHrefLength  = 120;
        if (minElementSize == null) minElementSize = 6;
        if (selectorDepth == null)  selectorDepth  = 4;
        if (waitTimeout == null)    waitTimeout    = Duration.ofSeconds(2);
        if (pollInterval == null)   pollInterval   = Duration.ofMillis(100);
    }

    public static ObservationProperties defaults() {
        return new ObservationProperties(null, null, null, null, null, null, null, null, null);
    }
}
