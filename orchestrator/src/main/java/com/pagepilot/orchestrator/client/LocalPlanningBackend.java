package com.pagepilot.orchestrator.client;

import com.pagepilot.orchestrator.model.PlanRequest;
import com.pagepilot.orchestrator.model.PlanResponse;
import com.pagepilot.orchestrator.planner.PlannerNotFoundException;
import com.pagepilot.orchestrator.planner.PlannerRegistry;

import java.time.Duration;

/** In-process backend: plans through the local {@link PlannerRegistry}. */
public class LocalPlanningBackend implements PlanningBackend {

    private final PlannerRegistry planners;
    private final String          version;

    public LocalPlanningBackend(PlannerRegistry planners, String version) {
        this.planners = planners;
        this.version  = version;
    }

    @Override
    public PlanResponse plan(PlanRequest request) {
        try {
            return planners.plan(request);
        } catch (PlannerNotFoundException e) {
            throw new PlanningBackendException(PlanningBackendException.Kind.SERVER_ERROR,
                    "Server returned 400: " + e.getMessage(), e);
        }
    }

    @Override
    public HealthReport health(Duration timeout) {
        return new HealthReport(HealthReport.HEALTHY, version);
    }
}
