package com.pagepilot.orchestrator.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Body of GET /health on the planning backend. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HealthReport(String status, String version) {

    public static final String HEALTHY = "healthy";

    public boolean healthy() {
        return HEALTHY.equals(status);
    }
}
