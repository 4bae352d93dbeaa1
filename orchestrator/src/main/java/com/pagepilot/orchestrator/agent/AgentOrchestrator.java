package com.pagepilot.orchestrator.agent;

import com.pagepilot.orchestrator.client.ConnectionStatus;
import com.pagepilot.orchestrator.client.HealthCheckResult;
import com.pagepilot.orchestrator.client.MalformedPlanException;
import com.pagepilot.orchestrator.client.PlanningClientProperties;
import com.pagepilot.orchestrator.client.PlanningServiceClient;
import com.pagepilot.orchestrator.client.PlanningUnavailableException;
import com.pagepilot.orchestrator.execution.Actuator;
import com.pagepilot.orchestrator.model.PageSnapshot;
import com.pagepilot.orchestrator.model.PlanRequest;
import com.pagepilot.orchestrator.model.PlanResponse;
import com.pagepilot.orchestrator.plan.PlanStateMachine;
import com.pagepilot.orchestrator.plan.PlanView;
import com.pagepilot.orchestrator.plan.RunOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * The single orchestrator context behind the agent endpoints.
 *
 * Goal request flow:
 * <pre>
 *   1. refuse browser-internal pages before touching the page or the network
 *   2. observe the page and attach a screenshot when one can be taken
 *   3. ask the planning client (retry / timeout / circuit breaker live there)
 *   4. replace the current plan with the answer
 * </pre>
 * Planning failures leave the previous plan as it was. Every failure is
 * reported in the reply's {@code error}; nothing is thrown to the caller.
 */
@Service
public class AgentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AgentOrchestrator.class);

    static final String RESTRICTED_PAGE_MESSAGE =
            "I cannot run on this page. Please try a normal website (e.g. google.com).";

    static final List<String> RESTRICTED_PREFIXES =
            List.of("about:", "moz-extension:", "chrome-extension:", "view-source:", "chrome:");

    private final Actuator              actuator;
    private final PlanningServiceClient planningClient;
    private final PlanStateMachine      stateMachine;
    private final String                provider;

    public AgentOrchestrator(Actuator actuator,
                             PlanningServiceClient planningClient,
                             PlanStateMachine stateMachine,
                             PlanningClientProperties planningProps) {
        this.actuator       = actuator;
        this.planningClient = planningClient;
        this.stateMachine   = stateMachine;
        this.provider       = planningProps.provider();
    }

    // ------------------------------------------------------------------
    // Goal requests
    // ------------------------------------------------------------------

    public AgentReply handleRequest(String text) {
        if (text == null || text.isBlank()) {
            return AgentReply.failure("Please describe what you want to do.", planningClient.connectionStatus());
        }

        String url;
        try {
            url = actuator.currentUrl();
        } catch (RuntimeException e) {
            log.error("Could not read the active page address", e);
            return AgentReply.failure("Could not read the active page: " + e.getMessage(),
                    planningClient.connectionStatus());
        }
        log.info("Agent request received: '{}' on {}", text, url);

        if (isRestricted(url)) {
            log.info("Refusing request on restricted page {}", url);
            return AgentReply.failure(RESTRICTED_PAGE_MESSAGE, planningClient.connectionStatus());
        }

        PageSnapshot page;
        try {
            page = actuator.observe();
        } catch (RuntimeException e) {
            log.error("Page observation failed", e);
            return AgentReply.failure("Could not read the active page: " + e.getMessage(),
                    planningClient.connectionStatus());
        }
        log.info("Page observed: {} candidates", page.candidates().size());

        String screenshot = actuator.captureScreenshot().orElse(null);

        PlanResponse plan;
        try {
            plan = planningClient.requestPlan(new PlanRequest(text, page, screenshot, provider));
        } catch (PlanningUnavailableException e) {
            log.warn("Planning unavailable ({}): {}", e.getReason(), e.getMessage());
            return AgentReply.failure(e.getMessage(), planningClient.connectionStatus());
        } catch (MalformedPlanException e) {
            log.warn("Discarding malformed plan: {}", e.getMessage());
            return AgentReply.failure(e.getMessage(), planningClient.connectionStatus());
        }

        stateMachine.loadPlan(plan.steps(), plan.summary());
        return new AgentReply(plan.summary(), plan.steps(), plan.error(), planningClient.connectionStatus());
    }

    static boolean isRestricted(String url) {
        if (url == null || url.isBlank()) return true;
        String lower = url.strip().toLowerCase(Locale.ROOT);
        return RESTRICTED_PREFIXES.stream().anyMatch(lower::startsWith);
    }

    // ------------------------------------------------------------------
    // Step execution
    // ------------------------------------------------------------------

    public RunStepReply runNextStep() {
        RunOutcome outcome = stateMachine.runNext();
        return switch (outcome.kind()) {
            case NO_STEPS_LEFT      -> RunStepReply.finished(outcome.message());
            case COMPLETED          -> RunStepReply.ran(outcome.ranIndex(), outcome.message(), outcome.done());
            case FAILED             -> RunStepReply.failed(outcome.ranIndex(), outcome.message(), outcome.done());
            case BLOCKED            -> RunStepReply.blocked(outcome.message());
            case BUSY, OBSERVATION_FAILED -> RunStepReply.failed(null, outcome.message(), false);
        };
    }

    // ------------------------------------------------------------------
    // Status
    // ------------------------------------------------------------------

    public ConnectionStatus connectionStatus() {
        return planningClient.connectionStatus();
    }

    public HealthCheckResult checkHealth() {
        return planningClient.checkHealth();
    }

    public PlanView planView() {
        return stateMachine.view();
    }
}
