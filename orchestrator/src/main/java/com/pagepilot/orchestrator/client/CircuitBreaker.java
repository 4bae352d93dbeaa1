package com.pagepilot.orchestrator.client;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Consecutive-failure circuit breaker around the planning backend.
 *
 * A failure here is one plan request that exhausted all its attempts, not a
 * single attempt. After {@code failureThreshold} of them in a row the breaker
 * opens; while open, {@link #checkAvailable()} rejects calls until
 * {@code cooldown} has passed since the last failure, then closes and resets.
 * Any success closes it and zeroes the counter.
 */
@Component
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final int           failureThreshold;
    private final Duration      cooldown;
    private final Clock         clock;
    private final MeterRegistry meterRegistry;

    private int     consecutiveFailures;
    private Instant lastFailureTime;
    private boolean open;

    public CircuitBreaker(PlanningClientProperties props, Clock clock, MeterRegistry meterRegistry) {
        this.failureThreshold = props.failureThreshold();
        this.cooldown         = props.cooldown();
        this.clock            = clock;
        this.meterRegistry    = meterRegistry;
    }

    /**
     * @throws PlanningUnavailableException with reason CIRCUIT_OPEN while the
     *         breaker is open and the cooldown has not elapsed
     */
    public synchronized void checkAvailable() {
        if (!open) return;

        Duration sinceFailure = Duration.between(lastFailureTime, clock.instant());
        if (sinceFailure.compareTo(cooldown) > 0) {
            log.info("Circuit breaker reset after cooldown of {}", cooldown);
            open = false;
            consecutiveFailures = 0;
            return;
        }

        long remainingMs = cooldown.minus(sinceFailure).toMillis();
        long remainingSec = (remainingMs + 999) / 1000;
        throw new PlanningUnavailableException(PlanningUnavailableException.Reason.CIRCUIT_OPEN,
                "Agent server temporarily unavailable. Please try again in " + remainingSec + " seconds.");
    }

    public synchronized void recordSuccess() {
        if (open || consecutiveFailures > 0) {
            log.info("Circuit breaker closed after success ({} prior failures)", consecutiveFailures);
        }
        consecutiveFailures = 0;
        open = false;
    }

    public synchronized void recordFailure() {
        consecutiveFailures++;
        lastFailureTime = clock.instant();

        if (consecutiveFailures >= failureThreshold && !open) {
            open = true;
            meterRegistry.counter("pagepilot.planning.breaker.opened").increment();
            log.warn("Circuit breaker opened after {} consecutive failures; cooling down for {}",
                    consecutiveFailures, cooldown);
        }
    }

    public synchronized CircuitBreakerState state() {
        return new CircuitBreakerState(consecutiveFailures, lastFailureTime, open, cooldown, failureThreshold);
    }
}
