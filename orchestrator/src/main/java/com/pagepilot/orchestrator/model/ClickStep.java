package com.pagepilot.orchestrator.model;

public record ClickStep(String selector, String note) implements Step {

    public ClickStep {
        Step.requireText(selector, Tool.CLICK, "selector");
    }

    @Override public Tool tool() { return Tool.CLICK; }

    @Override public String targetSelector() { return selector; }

    @Override
    public <R> R accept(StepVisitor<R> visitor) {
        return visitor.visitClick(this);
    }
}
