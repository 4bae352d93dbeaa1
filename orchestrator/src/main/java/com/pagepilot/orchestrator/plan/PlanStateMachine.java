package com.pagepilot.orchestrator.plan;

import com.pagepilot.orchestrator.execution.ActionResult;
import com.pagepilot.orchestrator.execution.Actuator;
import com.pagepilot.orchestrator.execution.StepExecutor;
import com.pagepilot.orchestrator.model.PageSnapshot;
import com.pagepilot.orchestrator.model.Step;
import com.pagepilot.orchestrator.safety.SafetyGate;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the current plan and runs it one approved step at a time.
 *
 * runNext():
 *   1. cursor at the end → "No steps left.", no side effects
 *   2. re-observe the page
 *   3. mark the step RUNNING and ask the safety gate
 *   4. blocked → back to PENDING, cursor unchanged (the same step is offered next call)
 *   5. otherwise execute, mark COMPLETED / FAILED, advance the cursor by one
 *
 * Failed steps are not retried: every step needs its own approval, so
 * moving forward is the caller's decision. At most one runNext() is in
 * flight; a concurrent call returns BUSY without touching the plan.
 */
@Component
public class PlanStateMachine {

    private static final Logger log = LoggerFactory.getLogger(PlanStateMachine.class);

    private final Actuator      actuator;
    private final SafetyGate    safetyGate;
    private final StepExecutor  executor;
    private final MeterRegistry meterRegistry;

    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private final Object        lock     = new Object();
    private Plan                plan;    // null while IDLE; guarded by lock

    public PlanStateMachine(Actuator actuator,
                            SafetyGate safetyGate,
                            StepExecutor executor,
                            MeterRegistry meterRegistry) {
        this.actuator      = actuator;
        this.safetyGate    = safetyGate;
        this.executor      = executor;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Loading
    // ------------------------------------------------------------------

    /**
     * Replace the current plan, whatever state it was in. Cursor resets to 0
     * and every status to PENDING. A step still in flight finishes against
     * the plan it was started from.
     */
    public void loadPlan(List<Step> steps, String summary) {
        Plan next = new Plan(summary, steps == null ? List.of() : steps);
        synchronized (lock) {
            plan = next;
        }
        log.info("Loaded plan with {} steps: {}", next.steps().size(), next.summary());
    }

    public PlanView view() {
        synchronized (lock) {
            if (plan == null) return PlanView.IDLE;
            return new PlanView(plan.summary(), plan.steps(), plan.statuses(), plan.cursor(),
                    plan.exhausted() ? PlanPhase.EXHAUSTED : PlanPhase.PLANNED);
        }
    }

    // ------------------------------------------------------------------
    // Running
    // ------------------------------------------------------------------

    public RunOutcome runNext() {
        if (!inFlight.compareAndSet(false, true)) {
            log.warn("runNext() called while a step is still running; ignored");
            return new RunOutcome(RunOutcome.Kind.BUSY, null, "A step is already running.", false);
        }
        try {
            return runNextExclusive();
        } finally {
            inFlight.set(false);
        }
    }

    private RunOutcome runNextExclusive() {
        Plan target;
        int  index;
        Step step;
        synchronized (lock) {
            target = plan;
            if (target == null || target.exhausted()) {
                return RunOutcome.noStepsLeft();
            }
            index = target.cursor();
            step  = target.current();
        }

        MDC.put("stepIndex", String.valueOf(index));
        MDC.put("tool",      step.tool().name());
        try {
            PageSnapshot fresh;
            try {
                fresh = actuator.observe();
            } catch (RuntimeException e) {
                log.error("Could not re-observe the page before step {}", index, e);
                return new RunOutcome(RunOutcome.Kind.OBSERVATION_FAILED, null,
                        "Could not read the page: " + e.getMessage(), false);
            }

            mark(target, index, StepStatus.RUNNING);

            Optional<String> blockReason = safetyGate.evaluate(step, fresh);
            if (blockReason.isPresent()) {
                mark(target, index, StepStatus.PENDING);
                count(step, "blocked");
                log.warn("Blocked step {} ({}): {}", index, step.tool(), blockReason.get());
                return new RunOutcome(RunOutcome.Kind.BLOCKED, null,
                        "Blocked: risky step (" + blockReason.get() + "). "
                        + "Do this manually or refine request.", false);
            }

            log.info("Executing step {} ({}) selector={}", index, step.tool(), step.targetSelector());
            ActionResult result;
            try {
                result = executor.execute(step);
            } catch (RuntimeException e) {
                log.error("Step {} ({}) threw while executing", index, step.tool(), e);
                result = ActionResult.failure(step.tool() + " failed: " + e.getClass().getSimpleName());
            }

            boolean done;
            synchronized (lock) {
                target.mark(index, result.ok() ? StepStatus.COMPLETED : StepStatus.FAILED);
                target.advance();
                done = target.exhausted();
            }

            if (!result.ok()) {
                count(step, "failed");
                log.error("Step {} failed: {}", index, result.error());
                return new RunOutcome(RunOutcome.Kind.FAILED, index, result.error(), done);
            }

            count(step, "completed");
            log.info("Step {} completed (done={})", index, done);
            String message = step.note() != null && !step.note().isBlank()
                    ? step.note()
                    : step.tool() + " executed.";
            return new RunOutcome(RunOutcome.Kind.COMPLETED, index, message, done);
        } finally {
            MDC.remove("stepIndex");
            MDC.remove("tool");
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void mark(Plan target, int index, StepStatus status) {
        synchronized (lock) {
            target.mark(index, status);
        }
    }

    private void count(Step step, String outcome) {
        meterRegistry.counter("pagepilot.steps", "tool", step.tool().name(), "outcome", outcome).increment();
    }
}
