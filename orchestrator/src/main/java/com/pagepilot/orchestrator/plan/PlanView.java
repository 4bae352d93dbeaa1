package com.pagepilot.orchestrator.plan;

import com.pagepilot.orchestrator.model.Step;

import java.util.List;

/**
 * Read-only copy of the current plan for display.
 */
public record PlanView(
        String           summary,
        List<Step>       steps,
        List<StepStatus> statuses,
        int              cursor,
        PlanPhase        phase
) {
    static final PlanView IDLE = new PlanView("", List.of(), List.of(), 0, PlanPhase.IDLE);
}
