package com.pagepilot.orchestrator.client;

import com.pagepilot.orchestrator.model.PlanRequest;
import com.pagepilot.orchestrator.model.PlanResponse;

import java.time.Duration;

/**
 * One call to a planning backend, without retries.
 *
 * Both operations fail with {@link PlanningBackendException}. Blocking is
 * allowed; the caller bounds plan calls with its own attempt timeout.
 */
public interface PlanningBackend {

    PlanResponse plan(PlanRequest request);

    HealthReport health(Duration timeout);
}
