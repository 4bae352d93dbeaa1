package com.pagepilot.orchestrator.plan;

import com.pagepilot.orchestrator.execution.ActionResult;
import com.pagepilot.orchestrator.execution.Actuator;
import com.pagepilot.orchestrator.execution.StepExecutor;
import com.pagepilot.orchestrator.model.ClickStep;
import com.pagepilot.orchestrator.model.PageSnapshot;
import com.pagepilot.orchestrator.model.ScrollStep;
import com.pagepilot.orchestrator.model.Step;
import com.pagepilot.orchestrator.model.TypeStep;
import com.pagepilot.orchestrator.safety.SafetyGate;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Plan lifecycle with a real {@link SafetyGate} and a mocked actuator.
 */
@ExtendWith(MockitoExtension.class)
class PlanStateMachineTest {

    static final PageSnapshot SAFE_PAGE     = new PageSnapshot("https://www.example.com/", "", "", List.of());
    static final PageSnapshot CHECKOUT_PAGE = new PageSnapshot("https://shop.example.com/checkout", "", "", List.of());

    @Mock Actuator actuator;

    SimpleMeterRegistry meters;
    PlanStateMachine    machine;

    @BeforeEach
    void setUp() {
        meters  = new SimpleMeterRegistry();
        machine = new PlanStateMachine(actuator, new SafetyGate(), new StepExecutor(actuator), meters);
    }

    static List<Step> searchPlan() {
        return List.of(
                new ClickStep("#q", "Focus the search box"),
                new TypeStep("#q", "cats", "Type: \"cats\""),
                new ClickStep("#btn", "Submit search"));
    }

    // ------------------------------------------------------------------
    // Loading
    // ------------------------------------------------------------------

    @Test
    void view_beforeAnyPlan_isIdle() {
        PlanView view = machine.view();

        assertThat(view.phase()).isEqualTo(PlanPhase.IDLE);
        assertThat(view.steps()).isEmpty();
    }

    @Test
    void loadPlan_resetsCursorAndStatuses() {
        machine.loadPlan(searchPlan(), "Planned search for \"cats\".");

        PlanView view = machine.view();
        assertThat(view.phase()).isEqualTo(PlanPhase.PLANNED);
        assertThat(view.cursor()).isZero();
        assertThat(view.statuses()).containsOnly(StepStatus.PENDING).hasSize(3);
    }

    @Test
    void loadPlan_replacesPartlyRunPlan() {
        when(actuator.observe()).thenReturn(SAFE_PAGE);
        when(actuator.click("#q")).thenReturn(ActionResult.success());
        machine.loadPlan(searchPlan(), "first");
        machine.runNext();

        machine.loadPlan(List.of(new ScrollStep(900, "Scroll down")), "Scrolling down.");

        PlanView view = machine.view();
        assertThat(view.summary()).isEqualTo("Scrolling down.");
        assertThat(view.cursor()).isZero();
        assertThat(view.statuses()).containsExactly(StepStatus.PENDING);
    }

    // ------------------------------------------------------------------
    // Running
    // ------------------------------------------------------------------

    @Test
    void runNext_noPlan_noStepsLeftWithoutSideEffects() {
        RunOutcome outcome = machine.runNext();

        assertThat(outcome.kind()).isEqualTo(RunOutcome.Kind.NO_STEPS_LEFT);
        assertThat(outcome.message()).isEqualTo("No steps left.");
        assertThat(outcome.done()).isTrue();
        verifyNoInteractions(actuator);
    }

    @Test
    void runNext_wholePlan_cursorAdvancesMonotonicallyToEnd() {
        when(actuator.observe()).thenReturn(SAFE_PAGE);
        when(actuator.click(any())).thenReturn(ActionResult.success());
        when(actuator.type("#q", "cats")).thenReturn(ActionResult.success());
        machine.loadPlan(searchPlan(), "s");

        RunOutcome first  = machine.runNext();
        RunOutcome second = machine.runNext();
        RunOutcome third  = machine.runNext();

        assertThat(first.ranIndex()).isZero();
        assertThat(first.message()).isEqualTo("Focus the search box");
        assertThat(first.done()).isFalse();
        assertThat(second.ranIndex()).isEqualTo(1);
        assertThat(third.ranIndex()).isEqualTo(2);
        assertThat(third.done()).isTrue();

        PlanView view = machine.view();
        assertThat(view.cursor()).isEqualTo(3);
        assertThat(view.phase()).isEqualTo(PlanPhase.EXHAUSTED);
        assertThat(view.statuses()).containsOnly(StepStatus.COMPLETED);

        assertThat(machine.runNext().kind()).isEqualTo(RunOutcome.Kind.NO_STEPS_LEFT);
        assertThat(machine.view().cursor()).isEqualTo(3);
        assertThat(meters.counter("pagepilot.steps", "tool", "CLICK", "outcome", "completed").count())
                .isEqualTo(2.0);
    }

    @Test
    void runNext_stepWithoutNote_reportsToolExecuted() {
        when(actuator.observe()).thenReturn(SAFE_PAGE);
        when(actuator.scrollBy(700)).thenReturn(ActionResult.success());
        machine.loadPlan(List.of(new ScrollStep(null, null)), "s");

        assertThat(machine.runNext().message()).isEqualTo("SCROLL executed.");
    }

    @Test
    void runNext_failedStep_markedFailedAndCursorStillAdvances() {
        when(actuator.observe()).thenReturn(SAFE_PAGE);
        when(actuator.click("#q")).thenReturn(ActionResult.failure("Element not found: #q"));
        machine.loadPlan(searchPlan(), "s");

        RunOutcome outcome = machine.runNext();

        assertThat(outcome.kind()).isEqualTo(RunOutcome.Kind.FAILED);
        assertThat(outcome.ranIndex()).isZero();
        assertThat(outcome.message()).isEqualTo("Element not found: #q");
        assertThat(outcome.done()).isFalse();
        assertThat(machine.view().cursor()).isEqualTo(1);
        assertThat(machine.view().statuses().get(0)).isEqualTo(StepStatus.FAILED);
    }

    @Test
    void runNext_executorThrows_stepMarkedFailedAndCursorAdvances() {
        when(actuator.observe()).thenReturn(SAFE_PAGE);
        when(actuator.click("#q")).thenThrow(new IllegalStateException("Interrupted while waiting for #q"));
        machine.loadPlan(searchPlan(), "s");

        RunOutcome outcome = machine.runNext();

        assertThat(outcome.kind()).isEqualTo(RunOutcome.Kind.FAILED);
        assertThat(outcome.ranIndex()).isZero();
        assertThat(outcome.message()).isEqualTo("CLICK failed: IllegalStateException");
        assertThat(machine.view().cursor()).isEqualTo(1);
        assertThat(machine.view().statuses().get(0)).isEqualTo(StepStatus.FAILED);
        assertThat(meters.counter("pagepilot.steps", "tool", "CLICK", "outcome", "failed").count()).isEqualTo(1.0);
    }

    @Test
    void runNext_blockedStep_cursorUnchangedAndSameStepOfferedAgain() {
        when(actuator.observe()).thenReturn(CHECKOUT_PAGE);
        machine.loadPlan(searchPlan(), "s");

        RunOutcome first  = machine.runNext();
        RunOutcome second = machine.runNext();

        assertThat(first.kind()).isEqualTo(RunOutcome.Kind.BLOCKED);
        assertThat(first.consumedStep()).isFalse();
        assertThat(first.message()).startsWith("Blocked: risky step").endsWith("Do this manually or refine request.");
        assertThat(second.kind()).isEqualTo(RunOutcome.Kind.BLOCKED);
        assertThat(machine.view().cursor()).isZero();
        assertThat(machine.view().statuses().get(0)).isEqualTo(StepStatus.PENDING);
        verify(actuator, never()).click(any());
        assertThat(meters.counter("pagepilot.steps", "tool", "CLICK", "outcome", "blocked").count())
                .isEqualTo(2.0);
    }

    @Test
    void runNext_blockedThenPageChanges_stepRuns() {
        when(actuator.observe()).thenReturn(CHECKOUT_PAGE).thenReturn(SAFE_PAGE);
        when(actuator.click("#q")).thenReturn(ActionResult.success());
        machine.loadPlan(searchPlan(), "s");

        assertThat(machine.runNext().kind()).isEqualTo(RunOutcome.Kind.BLOCKED);
        RunOutcome retried = machine.runNext();

        assertThat(retried.kind()).isEqualTo(RunOutcome.Kind.COMPLETED);
        assertThat(retried.ranIndex()).isZero();
    }

    @Test
    void runNext_observationFails_stepNotAttempted() {
        when(actuator.observe()).thenThrow(new IllegalStateException("page crashed"));
        machine.loadPlan(searchPlan(), "s");

        RunOutcome outcome = machine.runNext();

        assertThat(outcome.kind()).isEqualTo(RunOutcome.Kind.OBSERVATION_FAILED);
        assertThat(machine.view().cursor()).isZero();
        assertThat(machine.view().statuses().get(0)).isEqualTo(StepStatus.PENDING);
    }

    @Test
    void runNext_concurrentCall_isRejectedWhileStepInFlight() throws Exception {
        CountDownLatch clicking = new CountDownLatch(1);
        CountDownLatch release  = new CountDownLatch(1);
        when(actuator.observe()).thenReturn(SAFE_PAGE);
        when(actuator.click("#q")).thenAnswer(inv -> {
            clicking.countDown();
            release.await(5, TimeUnit.SECONDS);
            return ActionResult.success();
        });
        machine.loadPlan(searchPlan(), "s");

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<RunOutcome> first = pool.submit(machine::runNext);
            assertThat(clicking.await(5, TimeUnit.SECONDS)).isTrue();

            RunOutcome concurrent = machine.runNext();
            assertThat(concurrent.kind()).isEqualTo(RunOutcome.Kind.BUSY);
            assertThat(machine.view().statuses().get(0)).isEqualTo(StepStatus.RUNNING);

            release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS).kind()).isEqualTo(RunOutcome.Kind.COMPLETED);
        } finally {
            pool.shutdownNow();
        }
        assertThat(machine.view().cursor()).isEqualTo(1);
        verify(actuator, times(1)).click("#q");
    }
}
