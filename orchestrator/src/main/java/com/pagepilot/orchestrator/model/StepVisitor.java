package com.pagepilot.orchestrator.model;

/**
 * Exhaustive dispatch over the step variants.
 */
public interface StepVisitor<R> {
    R visitClick(ClickStep step);
    R visitType(TypeStep step);
    R visitScroll(ScrollStep step);
    R visitNavigate(NavigateStep step);
}
