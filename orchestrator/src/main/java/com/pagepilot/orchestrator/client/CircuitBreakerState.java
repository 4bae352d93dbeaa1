package com.pagepilot.orchestrator.client;

import java.time.Duration;
import java.time.Instant;

/** Read-only copy of the breaker's counters. */
public record CircuitBreakerState(
        int      consecutiveFailures,
        Instant  lastFailureTime,
        boolean  open,
        Duration cooldownDuration,
        int      failureThreshold
) {}
