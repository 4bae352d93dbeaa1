package com.pagepilot.orchestrator.api;

import com.pagepilot.orchestrator.api.dto.DetailedHealthResponse;
import com.pagepilot.orchestrator.client.HealthReport;
import com.pagepilot.orchestrator.planner.PlannerRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness endpoints of the planning backend contract.
 *
 * GET /health           : {status, version}; what remote orchestrators probe
 * GET /health/detailed  : plus per-planner availability
 */
@RestController
public class HealthController {

    private final PlannerRegistry planners;
    private final String          version;

    public HealthController(PlannerRegistry planners,
                            @Value("${pagepilot.version:0.2.0}") String version) {
        this.planners = planners;
        this.version  = version;
    }

    @GetMapping("/health")
    public HealthReport health() {
        return new HealthReport(HealthReport.HEALTHY, version);
    }

    @GetMapping("/health/detailed")
    public DetailedHealthResponse detailed() {
        return DetailedHealthResponse.from(version, planners.defaultProvider(), planners.availability());
    }
}
