package com.pagepilot.orchestrator.api.dto;

import com.pagepilot.orchestrator.client.ConnectionStatus;

public record ConnectionStatusReply(ConnectionStatus status) {}
