package com.pagepilot.orchestrator.safety;

import com.pagepilot.orchestrator.model.PageSnapshot;
import com.pagepilot.orchestrator.model.Step;
import com.pagepilot.orchestrator.model.Tool;
import com.pagepilot.orchestrator.model.TypeStep;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Pre-execution veto for risky steps.
 *
 * Always evaluated against the snapshot taken immediately before the step
 * runs, never the one used for planning. Rules, in order:
 *   - the page address contains a risk word: every step is blocked
 *   - a TYPE step whose selector mentions password / otp / 2fa
 *   - a CLICK step whose note contains a risk word
 *
 * A block is a refusal, not a failure: callers must not advance the plan
 * cursor or count it against the circuit breaker.
 */
@Component
public class SafetyGate {

    public static final List<String> RISK_WORDS = List.of(
            "pay", "checkout", "purchase", "order", "delete",
            "cancel", "unsubscribe", "send", "publish", "confirm");

    static final List<String> SENSITIVE_FIELD_MARKERS = List.of("password", "otp", "2fa");

    public boolean isBlocked(Step step, PageSnapshot freshSnapshot) {
        return evaluate(step, freshSnapshot).isPresent();
    }

    /**
     * @return the reason the step is blocked, or empty if it may run
     */
    public Optional<String> evaluate(Step step, PageSnapshot freshSnapshot) {
        String url = lower(freshSnapshot == null ? null : freshSnapshot.url());
        Optional<String> riskyPage = firstContained(url, RISK_WORDS);
        if (riskyPage.isPresent()) {
            return Optional.of("page address contains '" + riskyPage.get() + "'");
        }

        if (step instanceof TypeStep type) {
            Optional<String> sensitive = firstContained(lower(type.selector()), SENSITIVE_FIELD_MARKERS);
            if (sensitive.isPresent()) {
                return Optional.of("typing into a " + sensitive.get() + " field");
            }
        }

        if (step.tool() == Tool.CLICK) {
            Optional<String> riskyNote = firstContained(lower(step.note()), RISK_WORDS);
            if (riskyNote.isPresent()) {
                return Optional.of("click described as '" + riskyNote.get() + "'");
            }
        }

        return Optional.empty();
    }

    private static Optional<String> firstContained(String haystack, List<String> words) {
        return words.stream().filter(haystack::contains).findFirst();
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}
