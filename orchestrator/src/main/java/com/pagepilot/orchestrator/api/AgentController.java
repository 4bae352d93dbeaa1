package com.pagepilot.orchestrator.api;

import com.pagepilot.orchestrator.agent.AgentOrchestrator;
import com.pagepilot.orchestrator.agent.AgentReply;
import com.pagepilot.orchestrator.agent.RunStepReply;
import com.pagepilot.orchestrator.api.dto.AgentRequest;
import com.pagepilot.orchestrator.api.dto.ConnectionStatusReply;
import com.pagepilot.orchestrator.client.HealthCheckResult;
import com.pagepilot.orchestrator.plan.PlanView;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for the operator's side panel.
 *
 * POST /agent/request            : plan a goal against the current page
 * POST /agent/run-next           : run the next approved step
 * GET  /agent/plan               : current plan with per-step status
 * GET  /agent/connection-status  : planning backend connection status
 * GET  /agent/health             : probe the planning backend
 *
 * Every endpoint answers 200; failures travel in the reply's {@code error}.
 */
@RestController
@RequestMapping("/agent")
public class AgentController {

    private final AgentOrchestrator orchestrator;

    public AgentController(AgentOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/agent/request \
     *     -H "Content-Type: application/json" \
     *     -d '{"text":"search cats"}'
     */
    @PostMapping("/request")
    public AgentReply request(@RequestBody AgentRequest req) {
        return orchestrator.handleRequest(req.text());
    }

    @PostMapping("/run-next")
    public RunStepReply runNext() {
        return orchestrator.runNextStep();
    }

    @GetMapping("/plan")
    public PlanView plan() {
        return orchestrator.planView();
    }

    @GetMapping("/connection-status")
    public ConnectionStatusReply connectionStatus() {
        return new ConnectionStatusReply(orchestrator.connectionStatus());
    }

    @GetMapping("/health")
    public HealthCheckResult health() {
        return orchestrator.checkHealth();
    }
}
