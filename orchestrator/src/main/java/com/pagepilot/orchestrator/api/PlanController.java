package com.pagepilot.orchestrator.api;

import com.pagepilot.orchestrator.api.dto.ProvidersResponse;
import com.pagepilot.orchestrator.model.PlanRequest;
import com.pagepilot.orchestrator.model.PlanResponse;
import com.pagepilot.orchestrator.planner.PlannerNotFoundException;
import com.pagepilot.orchestrator.planner.PlannerRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

/**
 * Planning backend contract, served in-process so another orchestrator can
 * run with {@code pagepilot.planning.mode=remote} against this one.
 *
 * POST /plan       : plan a goal for a page snapshot
 * GET  /providers  : registered planners and the default
 */
@RestController
public class PlanController {

    private final PlannerRegistry planners;

    public PlanController(PlannerRegistry planners) {
        this.planners = planners;
    }

    /**
     * Returns 400 for an unknown provider or a request without a page.
     * Planner failures degrade to the rule-based planner instead of failing.
     */
    @PostMapping("/plan")
    public PlanResponse plan(@RequestBody PlanRequest req) {
        if (req.userRequest() == null || req.page() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "userRequest and page are required");
        }
        try {
            return planners.plan(req);
        } catch (PlannerNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }

    @GetMapping("/providers")
    public ProvidersResponse providers() {
        return new ProvidersResponse(planners.providers(), planners.defaultProvider());
    }
}
