package com.pagepilot.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body of POST /plan on the planning backend.
 *
 * Required: userRequest, page
 * Optional: screenshotDataUrl (PNG data URL for vision planners),
 *           provider (planner override; the backend default applies when null)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlanRequest(
        String       userRequest,
        PageSnapshot page,
        String       screenshotDataUrl,
        String       provider
) {
    public PlanRequest(String userRequest, PageSnapshot page) {
        this(userRequest, page, null, null);
    }
}
