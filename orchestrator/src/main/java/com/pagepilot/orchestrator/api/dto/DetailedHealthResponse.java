package com.pagepilot.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response of GET /health/detailed.
 *
 * <pre>
 * {
 *   "status": "healthy",
 *   "version": "0.2.0",
 *   "default_provider": "rule_based",
 *   "providers": { "rule_based": { "status": "available" } },
 *   "available_providers": 1
 * }
 * </pre>
 */
public record DetailedHealthResponse(
        String status,
        String version,
        @JsonProperty("default_provider")    String defaultProvider,
        Map<String, ProviderStatus> providers,
        @JsonProperty("available_providers") int availableProviders
) {
    public record ProviderStatus(String status) {}

    public static DetailedHealthResponse from(String version, String defaultProvider,
                                              Map<String, Boolean> availability) {
        Map<String, ProviderStatus> providers = new LinkedHashMap<>();
        availability.forEach((name, available) ->
                providers.put(name, new ProviderStatus(available ? "available" : "unavailable")));
        int availableCount = (int) availability.values().stream().filter(Boolean::booleanValue).count();
        return new DetailedHealthResponse("healthy", version, defaultProvider, providers, availableCount);
    }
}
