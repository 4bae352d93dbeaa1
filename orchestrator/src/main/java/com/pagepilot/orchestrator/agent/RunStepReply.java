package com.pagepilot.orchestrator.agent;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Answer to a run-next request.
 *
 * {@code blocked} marks a safety refusal: the step was not consumed and will
 * be offered again. {@code error} without {@code blocked} is a real failure.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunStepReply(
        Integer ranIndex,
        String  message,
        boolean done,
        String  error,
        Boolean blocked
) {
    static RunStepReply ran(int index, String message, boolean done) {
        return new RunStepReply(index, message, done, null, null);
    }

    static RunStepReply failed(Integer index, String error, boolean done) {
        return new RunStepReply(index, null, done, error, null);
    }

    static RunStepReply blocked(String reason) {
        return new RunStepReply(null, null, false, reason, Boolean.TRUE);
    }

    static RunStepReply finished(String message) {
        return new RunStepReply(null, message, true, null, null);
    }
}
