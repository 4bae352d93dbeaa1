package com.pagepilot.orchestrator.model;

public record NavigateStep(String url, String note) implements Step {

    public NavigateStep {
        Step.requireText(url, Tool.NAVIGATE, "url");
    }

    @Override public Tool tool() { return Tool.NAVIGATE; }

    @Override
    public <R> R accept(StepVisitor<R> visitor) {
        return visitor.visitNavigate(this);
    }
}
