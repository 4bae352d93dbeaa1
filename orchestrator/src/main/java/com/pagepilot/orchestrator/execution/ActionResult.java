package com.pagepilot.orchestrator.execution;

/**
 * Outcome of one dispatched action. {@code error} is set iff {@code ok} is false.
 */
public record ActionResult(boolean ok, String error) {

    private static final ActionResult OK = new ActionResult(true, null);

    public static ActionResult success() {
        return OK;
    }

    public static ActionResult failure(String error) {
        return new ActionResult(false, error);
    }
}
