package com.pagepilot.orchestrator.browser;

/**
 * Thrown when the document driver cannot complete a call
 * (browser gone, script error, navigation failure).
 */
public class DriverException extends RuntimeException {

    public DriverException(String message) {
        super(message);
    }

    public DriverException(String message, Throwable cause) {
        super(message, cause);
    }
}
