package com.pagepilot.orchestrator.model;

/**
 * Replace the value of a field with {@code text}.
 * A null text is read as "" (clear the field).
 */
public record TypeStep(String selector, String text, String note) implements Step {

    public TypeStep {
        Step.requireText(selector, Tool.TYPE, "selector");
        text = text == null ? "" : text;
    }

    @Override public Tool tool() { return Tool.TYPE; }

    @Override public String targetSelector() { return selector; }

    @Override
    public <R> R accept(StepVisitor<R> visitor) {
        return visitor.visitType(this);
    }
}
