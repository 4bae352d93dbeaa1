package com.pagepilot.orchestrator.model;

import java.util.List;

/**
 * A bounded, point-in-time description of the active document.
 *
 * The caps on {@code text} and {@code candidates} are applied by the
 * observation collector; this record only guarantees immutability.
 */
public record PageSnapshot(
        String url,
        String title,
        String text,
        List<Candidate> candidates
) {
    public PageSnapshot {
        url        = url == null ? "" : url;
        title      = title == null ? "" : title;
        text       = text == null ? "" : text;
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }
}
