package com.pagepilot.orchestrator.planner;

import com.pagepilot.orchestrator.model.Candidate;
import com.pagepilot.orchestrator.model.ClickStep;
import com.pagepilot.orchestrator.model.PlanRequest;
import com.pagepilot.orchestrator.model.PlanResponse;
import com.pagepilot.orchestrator.model.ScrollStep;
import com.pagepilot.orchestrator.model.Step;
import com.pagepilot.orchestrator.model.TypeStep;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword planner that works offline and needs no API key.
 *
 * Goal forms, case-insensitive, first match wins:
 *   1. contains "search"          → focus + type the query (+ submit if a control exists)
 *   2. contains "scroll" / "down" → one SCROLL of {@link #SCROLL_DELTA}
 *   3. starts with "click "       → one CLICK on the best-labelled control
 *   otherwise an empty plan with a hint.
 *
 * Every selector in a plan comes from the snapshot's candidates.
 */
@Component
public class RuleBasedPlanner implements Planner {

    public static final String NAME = "rule_based";

    static final int SCROLL_DELTA = 900;

    static final String NO_PLAN_SUMMARY =
            "No confident automation plan. Try: 'search <term>', 'click <button text>', or 'scroll down'.";

    // ASCII case folding only, so match offsets index the goal as written.
    private static final Pattern SEARCH_TOKEN = Pattern.compile("search", Pattern.CASE_INSENSITIVE);
    private static final String CLICK_PREFIX = "click ";
    private static final String QUERY_EDGE_CHARS = " :,-";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PlanResponse plan(PlanRequest request) {
        String goal = request.userRequest() == null ? "" : request.userRequest().strip();
        String goalLower = goal.toLowerCase(Locale.ROOT);
        List<Candidate> candidates = request.page() == null ? List.of() : request.page().candidates();

        Matcher search = SEARCH_TOKEN.matcher(goal);
        if (search.find()) {
            return planSearch(goal, search.end(), candidates);
        }
        if (goalLower.contains("scroll") || goalLower.contains("go down") || goalLower.contains("down")) {
            return planScroll();
        }
        if (goal.regionMatches(true, 0, CLICK_PREFIX, 0, CLICK_PREFIX.length())) {
            return planClick(goal, candidates);
        }
        return PlanResponse.empty(NO_PLAN_SUMMARY);
    }

    // ------------------------------------------------------------------
    // Goal forms
    // ------------------------------------------------------------------

    private PlanResponse planSearch(String goal, int tokenEnd, List<Candidate> candidates) {
        String query = extractQuery(goal, tokenEnd);

        Optional<Candidate> field = CandidateMatcher.findSearchInput(candidates);
        if (field.isEmpty()) {
            return PlanResponse.empty("Could not find a search input on this page.");
        }

        List<Step> steps = new ArrayList<>();
        String selector = field.get().selector();
        steps.add(new ClickStep(selector, "Focus the search box"));
        steps.add(new TypeStep(selector, query, "Type: \"" + query + "\""));

        // No submit control is fine: the form's default submission still applies.
        CandidateMatcher.findSubmitButton(candidates, field.get())
                .ifPresent(btn -> steps.add(new ClickStep(btn.selector(), "Submit search")));

        return new PlanResponse("Planned search for \"" + query + "\".", steps);
    }

    private PlanResponse planScroll() {
        return new PlanResponse("Scrolling down.", List.of(new ScrollStep(SCROLL_DELTA, "Scroll down")));
    }

    private PlanResponse planClick(String goal, List<Candidate> candidates) {
        String target = goal.substring(CLICK_PREFIX.length()).strip();

        Optional<Candidate> control = CandidateMatcher.findClickable(candidates, target);
        if (control.isEmpty()) {
            return PlanResponse.empty("Could not find element matching \"" + target + "\".");
        }
        return new PlanResponse("Clicking \"" + target + "\".", List.of(
                new ClickStep(control.get().selector(), "Click something matching \"" + target + "\"")));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Text after the first "search", edge punctuation stripped; the whole goal if that is empty. */
    static String extractQuery(String goal, int tokenEnd) {
        String query = stripChars(goal.substring(tokenEnd), QUERY_EDGE_CHARS);
        return query.isEmpty() ? goal : query;
    }

    private static String stripChars(String s, String chars) {
        int start = 0;
        int end = s.length();
        while (start < end && chars.indexOf(s.charAt(start)) >= 0) start++;
        while (end > start && chars.indexOf(s.charAt(end - 1)) >= 0) end--;
        return s.substring(start, end);
    }
}
