package com.pagepilot.orchestrator.api.dto;

/** Request body for POST /agent/request. */
public record AgentRequest(String text) {}
