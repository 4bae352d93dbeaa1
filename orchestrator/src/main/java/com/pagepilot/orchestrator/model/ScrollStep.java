package com.pagepilot.orchestrator.model;

/**
 * Scroll the viewport vertically. Positive is down.
 * A missing delta scrolls by {@link #DEFAULT_DELTA_Y}.
 */
public record ScrollStep(Integer deltaY, String note) implements Step {

    public static final int DEFAULT_DELTA_Y = 700;

    public ScrollStep {
        deltaY = deltaY == null ? DEFAULT_DELTA_Y : deltaY;
    }

    @Override public Tool tool() { return Tool.SCROLL; }

    @Override
    public <R> R accept(StepVisitor<R> visitor) {
        return visitor.visitScroll(this);
    }
}
