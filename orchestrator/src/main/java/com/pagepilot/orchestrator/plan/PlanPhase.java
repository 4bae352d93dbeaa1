package com.pagepilot.orchestrator.plan;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * IDLE → PLANNED (plan loaded, cursor 0) → EXHAUSTED (cursor == steps).
 * Loading a plan returns to PLANNED from any phase; an empty plan is EXHAUSTED at once.
 */
public enum PlanPhase {
    IDLE,
    PLANNED,
    EXHAUSTED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
