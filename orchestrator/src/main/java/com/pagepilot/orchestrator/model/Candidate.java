package com.pagepilot.orchestrator.model;

/**
 * One interactive element of the active document, as seen by the planner.
 *
 * Produced fresh on every observation and never mutated. The selector is
 * generated by the observation collector; every text field has already been
 * truncated to its cap by the time a Candidate exists.
 *
 * Missing text fields are normalised to "" so the matcher never sees null.
 */
public record Candidate(
        String selector,
        String tag,
        String text,
        String ariaLabel,
        String placeholder,
        String name,
        String type,
        String href
) {
    public Candidate {
        if (selector == null || selector.isBlank()) {
            throw new IllegalArgumentException("candidate selector must not be blank");
        }
        tag         = tag == null ? "" : tag.toLowerCase();
        text        = text == null ? "" : text;
        ariaLabel   = ariaLabel == null ? "" : ariaLabel;
        placeholder = placeholder == null ? "" : placeholder;
        name        = name == null ? "" : name;
        type        = type == null ? "" : type;
        href        = href == null ? "" : href;
    }
}
