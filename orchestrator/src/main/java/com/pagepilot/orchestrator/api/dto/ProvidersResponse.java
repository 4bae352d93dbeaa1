package com.pagepilot.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Response of GET /providers. */
public record ProvidersResponse(
        List<String> providers,
        @JsonProperty("default") String defaultProvider
) {}
