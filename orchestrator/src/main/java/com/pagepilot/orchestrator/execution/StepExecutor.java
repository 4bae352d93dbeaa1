package com.pagepilot.orchestrator.execution;

import com.pagepilot.orchestrator.model.ClickStep;
import com.pagepilot.orchestrator.model.NavigateStep;
import com.pagepilot.orchestrator.model.ScrollStep;
import com.pagepilot.orchestrator.model.Step;
import com.pagepilot.orchestrator.model.StepVisitor;
import com.pagepilot.orchestrator.model.TypeStep;
import org.springframework.stereotype.Component;

/**
 * Dispatches an approved step to the {@link Actuator}.
 *
 * Called only after the safety gate has passed the step. There is no
 * "unknown tool" branch: {@link StepVisitor} covers every variant.
 */
@Component
public class StepExecutor {

    private final Actuator actuator;

    public StepExecutor(Actuator actuator) {
        this.actuator = actuator;
    }

    public ActionResult execute(Step step) {
        return step.accept(new StepVisitor<>() {
            @Override
            public ActionResult visitClick(ClickStep s) {
                return actuator.click(s.selector());
            }

            @Override
            public ActionResult visitType(TypeStep s) {
                return actuator.type(s.selector(), s.text());
            }

            @Override
            public ActionResult visitScroll(ScrollStep s) {
                return actuator.scrollBy(s.deltaY());
            }

            @Override
            public ActionResult visitNavigate(NavigateStep s) {
                return actuator.navigate(s.url());
            }
        });
    }
}
