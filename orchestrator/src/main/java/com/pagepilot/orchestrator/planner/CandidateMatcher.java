package com.pagepilot.orchestrator.planner;

import com.pagepilot.orchestrator.model.Candidate;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Scores page candidates against goal keywords, without any model.
 *
 * Scoring per candidate whose tag is allowed:
 *   +2 for every keyword found in text / ariaLabel / placeholder / name / href (lower-cased)
 *   +1 each for a non-empty ariaLabel, placeholder and text
 *
 * A candidate must match at least one keyword to be eligible; the label
 * bonuses only rank candidates that already match. Highest score wins, ties
 * go to the earlier candidate in document order.
 */
public final class CandidateMatcher {

    static final Set<String>  SEARCH_INPUT_TAGS     = Set.of("input", "textarea");
    static final List<String> SEARCH_INPUT_KEYWORDS = List.of("search", "q", "query", "find", "looking for");
    static final Set<String>  CLICKABLE_TAGS        = Set.of("button", "a", "input");
    static final List<String> SUBMIT_KEYWORDS       = List.of("search", "submit", "go", "find");

    private CandidateMatcher() {}

    public static Optional<Candidate> bestMatch(Collection<Candidate> candidates,
                                                Set<String> allowedTags,
                                                List<String> keywords) {
        return bestMatch(candidates, allowedTags, keywords, c -> true);
    }

    static Optional<Candidate> bestMatch(Collection<Candidate> candidates,
                                         Set<String> allowedTags,
                                         List<String> keywords,
                                         Predicate<Candidate> eligible) {
        List<String> needles = keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> k.strip().toLowerCase(Locale.ROOT))
                .toList();
        if (needles.isEmpty() || candidates == null) {
            return Optional.empty();
        }

        Candidate best = null;
        int bestScore = 0;

        for (Candidate c : candidates) {
            if (!allowedTags.contains(c.tag().toLowerCase(Locale.ROOT))) continue;
            if (!eligible.test(c)) continue;

            String haystack = String.join(" ",
                    c.text(), c.ariaLabel(), c.placeholder(), c.name(), c.href())
                    .toLowerCase(Locale.ROOT);

            int keywordScore = 0;
            for (String needle : needles) {
                if (haystack.contains(needle)) keywordScore += 2;
            }
            if (keywordScore == 0) continue;

            int score = keywordScore;
            if (!c.ariaLabel().isEmpty())   score++;
            if (!c.placeholder().isEmpty()) score++;
            if (!c.text().isEmpty())        score++;

            if (score > bestScore) {
                bestScore = score;
                best = c;
            }
        }
        return Optional.ofNullable(best);
    }

    /** A text field that looks like a search box. */
    public static Optional<Candidate> findSearchInput(Collection<Candidate> candidates) {
        return bestMatch(candidates, SEARCH_INPUT_TAGS, SEARCH_INPUT_KEYWORDS);
    }

    /**
     * A control that submits a search typed into {@code field}.
     * The field itself is never its own submit control.
     */
    public static Optional<Candidate> findSubmitButton(Collection<Candidate> candidates, Candidate field) {
        return bestMatch(candidates, CLICKABLE_TAGS, SUBMIT_KEYWORDS,
                c -> field == null || !c.selector().equals(field.selector()));
    }

    /** A button, link or input labelled like {@code target}. */
    public static Optional<Candidate> findClickable(Collection<Candidate> candidates, String target) {
        return bestMatch(candidates, CLICKABLE_TAGS, List.of(target == null ? "" : target));
    }
}
