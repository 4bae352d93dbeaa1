package com.pagepilot.orchestrator.planner;

import com.pagepilot.orchestrator.model.Candidate;
import com.pagepilot.orchestrator.model.PageSnapshot;
import com.pagepilot.orchestrator.model.PlanRequest;
import com.pagepilot.orchestrator.model.PlanResponse;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Registry lookup, metrics and graceful degradation to the rule-based planner.
 * No Spring context; planners are wired by hand.
 */
class PlannerRegistryTest {

    static final PageSnapshot SEARCH_PAGE = new PageSnapshot("https://example.com", "", "", List.of(
            new Candidate("#q", "input", null, null, "Search", null, null, null),
            new Candidate("#btn", "button", "Search", null, null, null, null, null)));

    SimpleMeterRegistry meters;

    @BeforeEach
    void setUp() {
        meters = new SimpleMeterRegistry();
    }

    PlannerRegistry registry(Planner... extra) {
        List<Planner> all = new ArrayList<>(List.of(new RuleBasedPlanner()));
        all.addAll(List.of(extra));
        return new PlannerRegistry(all, "rule_based", meters);
    }

    static Planner fake(String name, Function<PlanRequest, PlanResponse> behaviour) {
        return new Planner() {
            @Override public String name() { return name; }
            @Override public PlanResponse plan(PlanRequest request) { return behaviour.apply(request); }
        };
    }

    static PlanRequest request(String goal, String provider) {
        return new PlanRequest(goal, SEARCH_PAGE, null, provider);
    }

    // ------------------------------------------------------------------
    // Registration and lookup
    // ------------------------------------------------------------------

    @Test
    void providers_sortedNames() {
        PlannerRegistry registry = registry(fake("openai", r -> PlanResponse.empty("")));

        assertThat(registry.providers()).containsExactly("openai", "rule_based");
        assertThat(registry.defaultProvider()).isEqualTo("rule_based");
    }

    @Test
    void construction_withoutRuleBasedPlanner_fails() {
        assertThatThrownBy(() -> new PlannerRegistry(
                List.of(fake("openai", r -> PlanResponse.empty(""))), "openai", meters))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void construction_unknownDefault_fails() {
        assertThatThrownBy(() -> new PlannerRegistry(List.of(new RuleBasedPlanner()), "gemini", meters))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("gemini");
    }

    @Test
    void plan_unknownProvider_throwsNotFound() {
        assertThatThrownBy(() -> registry().plan(request("search cats", "nope")))
                .isInstanceOf(PlannerNotFoundException.class)
                .hasMessageContaining("nope");
    }

    @Test
    void availability_reportsEachPlanner() {
        Planner offline = new Planner() {
            @Override public String name() { return "anthropic"; }
            @Override public PlanResponse plan(PlanRequest request) { return PlanResponse.empty(""); }
            @Override public boolean available() { return false; }
        };

        assertThat(registry(offline).availability())
                .containsEntry("rule_based", true)
                .containsEntry("anthropic", false);
    }

    // ------------------------------------------------------------------
    // Planning
    // ------------------------------------------------------------------

    @Test
    void plan_noProvider_usesDefaultAndCountsSuccess() {
        PlanResponse plan = registry().plan(request("search cats", null));

        assertThat(plan.summary()).isEqualTo("Planned search for \"cats\".");
        assertThat(meters.counter("pagepilot.planner.calls", "planner", "rule_based", "status", "success").count())
                .isEqualTo(1.0);
        assertThat(meters.timer("pagepilot.planner.duration", "planner", "rule_based").count()).isEqualTo(1);
    }

    @Test
    void plan_namedProvider_isUsed() {
        PlannerRegistry registry = registry(fake("local", r -> PlanResponse.empty("from local")));

        assertThat(registry.plan(request("search cats", "local")).summary()).isEqualTo("from local");
    }

    // ------------------------------------------------------------------
    // Fallback
    // ------------------------------------------------------------------

    @Test
    void plannerThrows_fallsBackWithPrefixedSummary() {
        PlannerRegistry registry = registry(fake("openai", r -> {
            throw new IllegalStateException("rate limited");
        }));

        PlanResponse plan = registry.plan(request("search cats", "openai"));

        assertThat(plan.summary()).isEqualTo("[Fallback] Planned search for \"cats\".");
        assertThat(plan.steps()).hasSize(3);
        assertThat(plan.hasError()).isFalse();
        assertThat(meters.counter("pagepilot.planner.calls", "planner", "openai", "status", "error").count())
                .isEqualTo(1.0);
        assertThat(meters.counter("pagepilot.planner.calls", "planner", "rule_based", "status", "fallback").count())
                .isEqualTo(1.0);
    }

    @Test
    void plannerReportsError_fallbackWithoutSteps_explainsUnavailability() {
        PlannerRegistry registry = registry(fake("gemini",
                r -> new PlanResponse("", List.of(), "API key missing")));

        PlanResponse plan = registry.plan(request("book a flight", "gemini"));

        assertThat(plan.steps()).isEmpty();
        assertThat(plan.summary()).isEqualTo(
                "AI provider unavailable (API key missing). "
                + "Try: 'search <term>', 'click <button text>', or 'scroll down'.");
    }

    @Test
    void ruleBasedItselfThrows_noFallbackLoop() {
        Planner broken = fake("rule_based", r -> {
            throw new IllegalStateException("boom");
        });
        PlannerRegistry registry = new PlannerRegistry(List.of(broken), "rule_based", meters);

        assertThatThrownBy(() -> registry.plan(request("search cats", null)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");
    }

    @Test
    void fallbackAlsoFails_allPlannersFailedWithError() {
        Planner broken = fake("rule_based", r -> {
            throw new IllegalStateException("boom");
        });
        Planner remote = fake("openai", r -> {
            throw new IllegalStateException("timeout");
        });
        PlannerRegistry registry = new PlannerRegistry(List.of(broken, remote), "rule_based", meters);

        PlanResponse plan = registry.plan(request("search cats", "openai"));

        assertThat(plan.steps()).isEmpty();
        assertThat(plan.summary()).isEqualTo("All planners failed. Original error: timeout");
        assertThat(plan.error()).isEqualTo("Fallback also failed: boom");
    }
}
