package com.pagepilot.orchestrator.agent;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.pagepilot.orchestrator.client.ConnectionStatus;
import com.pagepilot.orchestrator.model.Step;

import java.util.List;

/** Answer to a goal request: the loaded plan, or an error and no plan change. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentReply(
        String           summary,
        List<Step>       steps,
        String           error,
        ConnectionStatus connectionStatus
) {
    public static AgentReply failure(String error, ConnectionStatus status) {
        return new AgentReply(null, null, error, status);
    }
}
