package com.pagepilot.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A planner's answer: a summary plus ordered steps.
 * An empty step list is a valid answer meaning "no confident plan".
 * {@code error} is set only when planning itself failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlanResponse(String summary, List<Step> steps, String error) {

    public PlanResponse {
        summary = summary == null ? "" : summary;
        steps   = steps == null ? List.of() : List.copyOf(steps);
    }

    public PlanResponse(String summary, List<Step> steps) {
        this(summary, steps, null);
    }

    public static PlanResponse empty(String summary) {
        return new PlanResponse(summary, List.of(), null);
    }

    public boolean hasError() {
        return error != null && !error.isBlank();
    }
}
