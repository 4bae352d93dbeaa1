package com.pagepilot.orchestrator.plan;

import com.pagepilot.orchestrator.model.Step;

import java.util.Arrays;
import java.util.List;

/**
 * The current plan: summary, ordered steps, one status per step and a cursor.
 *
 * Created whole by {@link PlanStateMachine#loadPlan} and mutated only by the
 * state machine. The cursor never decreases and never exceeds the step count.
 */
final class Plan {

    private final String       summary;
    private final List<Step>   steps;
    private final StepStatus[] statuses;
    private int                cursor;

    Plan(String summary, List<Step> steps) {
        this.summary  = summary == null ? "" : summary;
        this.steps    = List.copyOf(steps);
        this.statuses = new StepStatus[this.steps.size()];
        Arrays.fill(this.statuses, StepStatus.PENDING);
    }

    String     summary()   { return summary; }
    List<Step> steps()     { return steps; }
    int        cursor()    { return cursor; }
    boolean    exhausted() { return cursor >= steps.size(); }

    Step current() {
        return steps.get(cursor);
    }

    void mark(int index, StepStatus status) {
        statuses[index] = status;
    }

    void advance() {
        if (cursor < steps.size()) cursor++;
    }

    List<StepStatus> statuses() {
        return List.of(statuses);
    }
}
