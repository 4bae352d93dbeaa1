package com.pagepilot.orchestrator.plan;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Execution state of one plan step.
 *
 * Transitions:
 *   PENDING → RUNNING   (runNext picked it up)
 *   RUNNING → COMPLETED (actuator reported success)
 *   RUNNING → FAILED    (actuator reported failure; not retried)
 *   RUNNING → PENDING   (safety gate refused it; it will be offered again)
 */
public enum StepStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
