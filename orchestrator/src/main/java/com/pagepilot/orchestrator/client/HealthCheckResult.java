package com.pagepilot.orchestrator.client;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthCheckResult(boolean healthy, String version, String error) {

    public static HealthCheckResult ok(String version) {
        return new HealthCheckResult(true, version, null);
    }

    public static HealthCheckResult failure(String error) {
        return new HealthCheckResult(false, null, error);
    }
}
