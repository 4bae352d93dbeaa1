package com.pagepilot.orchestrator.plan;

/**
 * Result of one {@link PlanStateMachine#runNext()} call.
 *
 * BLOCKED and BUSY leave the cursor where it was; COMPLETED and FAILED have
 * consumed the step at {@code ranIndex}.
 */
public record RunOutcome(
        Kind    kind,
        Integer ranIndex,
        String  message,
        boolean done
) {
    public enum Kind {
        /** Nothing left to run (or no plan at all). */
        NO_STEPS_LEFT,
        /** The safety gate refused the step. */
        BLOCKED,
        COMPLETED,
        FAILED,
        /** Another runNext() is still in flight. */
        BUSY,
        /** The page could not be re-observed, so the step was not attempted. */
        OBSERVATION_FAILED
    }

    public static RunOutcome noStepsLeft() {
        return new RunOutcome(Kind.NO_STEPS_LEFT, null, "No steps left.", true);
    }

    public boolean consumedStep() {
        return kind == Kind.COMPLETED || kind == Kind.FAILED;
    }
}
