package com.pagepilot.orchestrator.client;

/**
 * The planning service could not produce a plan after the retry policy ran
 * (or without trying, when the circuit breaker is open).
 *
 * The message is safe to show to the operator as-is.
 */
public class PlanningUnavailableException extends RuntimeException {

    public enum Reason { CIRCUIT_OPEN, UNREACHABLE, SERVER_ERROR, TIMEOUT }

    private final Reason reason;

    public PlanningUnavailableException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() { return reason; }
}
