package com.pagepilot.orchestrator.client;

/**
 * Thrown by a {@link PlanningBackend} for a single failed call.
 * {@link PlanningServiceClient} decides from the kind whether to retry.
 */
public class PlanningBackendException extends RuntimeException {

    public enum Kind { UNREACHABLE, SERVER_ERROR, MALFORMED_RESPONSE }

    private final Kind kind;

    public PlanningBackendException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PlanningBackendException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
