package com.pagepilot.orchestrator.client;

/** The backend answered, but the body is not a valid plan. Never retried. */
public class MalformedPlanException extends RuntimeException {

    public MalformedPlanException(String message, Throwable cause) {
        super(message, cause);
    }
}
