package com.pagepilot.orchestrator.planner;

import com.pagepilot.orchestrator.model.PlanRequest;
import com.pagepilot.orchestrator.model.PlanResponse;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process planner registry.
 *
 * All {@link Planner} beans are collected at startup via constructor
 * injection. {@link RuleBasedPlanner} must be among them: it is the
 * fallback whenever another planner throws or reports an error.
 *
 * <p>Every call is timed and counted:
 * <pre>
 *   pagepilot.planner.calls{planner, status="success|error|fallback"}
 *   pagepilot.planner.duration{planner}
 * </pre>
 */
@Component
public class PlannerRegistry {

    private static final Logger log = LoggerFactory.getLogger(PlannerRegistry.class);

    static final String FALLBACK_PREFIX = "[Fallback] ";
    static final String FALLBACK_HINT =
            "Try: 'search <term>', 'click <button text>', or 'scroll down'.";

    private final Map<String, Planner> planners = new ConcurrentHashMap<>();
    private final String defaultProvider;
    private final MeterRegistry meterRegistry;

    public PlannerRegistry(List<Planner> allPlanners,
                           @Value("${pagepilot.planner.default-provider:rule_based}") String defaultProvider,
                           MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (Planner planner : allPlanners) {
            planners.put(planner.name(), planner);
            log.info("Registered planner '{}' (available={})", planner.name(), planner.available());
        }
        if (!planners.containsKey(RuleBasedPlanner.NAME)) {
            throw new IllegalStateException("The rule_based planner must always be registered");
        }
        if (!planners.containsKey(defaultProvider)) {
            throw new IllegalStateException("Default provider '" + defaultProvider + "' is not registered");
        }
        this.defaultProvider = defaultProvider;
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Planner get(String name) {
        Planner planner = planners.get(name);
        if (planner == null) {
            throw new PlannerNotFoundException(name);
        }
        return planner;
    }

    /** Registered planner names (sorted). */
    public List<String> providers() {
        return planners.keySet().stream().sorted().toList();
    }

    public String defaultProvider() {
        return defaultProvider;
    }

    /** Planner name → whether it can currently serve. */
    public Map<String, Boolean> availability() {
        Map<String, Boolean> out = new TreeMap<>();
        planners.forEach((name, p) -> out.put(name, p.available()));
        return out;
    }

    // ------------------------------------------------------------------
    // Planning with fallback
    // ------------------------------------------------------------------

    /**
     * Plan with the requested provider (or the default one).
     *
     * @throws PlannerNotFoundException if the request names an unknown provider
     */
    public PlanResponse plan(PlanRequest request) {
        String provider = request.provider() == null || request.provider().isBlank()
                ? defaultProvider
                : request.provider();
        Planner planner = get(provider);

        PlanResponse response;
        try {
            response = timed(planner, request);
        } catch (RuntimeException e) {
            if (RuleBasedPlanner.NAME.equals(provider)) {
                throw e;
            }
            log.warn("Planner '{}' raised {}: {}. Falling back to {}",
                    provider, e.getClass().getSimpleName(), e.getMessage(), RuleBasedPlanner.NAME);
            return fallback(request, String.valueOf(e.getMessage()));
        }

        if (response.hasError() && !RuleBasedPlanner.NAME.equals(provider)) {
            log.warn("Planner '{}' reported error: {}. Falling back to {}",
                    provider, response.error(), RuleBasedPlanner.NAME);
            return fallback(request, response.error());
        }
        return response;
    }

    private PlanResponse fallback(PlanRequest request, String originalError) {
        meterRegistry.counter("pagepilot.planner.calls",
                "planner", RuleBasedPlanner.NAME, "status", "fallback").increment();
        try {
            PlanResponse response = timed(planners.get(RuleBasedPlanner.NAME), request);
            if (!response.steps().isEmpty()) {
                return new PlanResponse(FALLBACK_PREFIX + response.summary(), response.steps());
            }
            return PlanResponse.empty("AI provider unavailable (" + originalError + "). " + FALLBACK_HINT);
        } catch (RuntimeException e) {
            log.error("Fallback to {} also failed", RuleBasedPlanner.NAME, e);
            return new PlanResponse(
                    "All planners failed. Original error: " + originalError,
                    List.of(),
                    "Fallback also failed: " + e.getMessage());
        }
    }

    private PlanResponse timed(Planner planner, PlanRequest request) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            PlanResponse response = planner.plan(request);
            if (response.hasError()) status = "error";
            return response;
        } catch (RuntimeException e) {
            status = "error";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("pagepilot.planner.duration", "planner", planner.name()));
            meterRegistry.counter("pagepilot.planner.calls",
                    "planner", planner.name(), "status", status).increment();
        }
    }
}
