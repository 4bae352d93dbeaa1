package com.pagepilot.orchestrator.client;

import com.pagepilot.orchestrator.model.PlanRequest;
import com.pagepilot.orchestrator.model.PlanResponse;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Resilient front for the planning backend.
 *
 * <pre>
 *   requestPlan:
 *     breaker open?          → fail now, no network attempt
 *     for attempt in 1..N:   → call, bounded by attemptTimeout
 *       success              → breaker reset, CONNECTED, return
 *       malformed body       → CONNECTED, fail now (not retried, breaker untouched)
 *       backend bug          → CONNECTED, fail now (not retried, breaker untouched)
 *       timeout/unreachable/
 *       non-2xx              → sleep backoff[attempt], try again
 *     exhausted              → breaker failure, DISCONNECTED, fail with a user-facing message
 * </pre>
 *
 * The health probe uses its own short timeout and only updates the
 * connection status.
 */
@Component
public class PlanningServiceClient {

    private static final Logger log = LoggerFactory.getLogger(PlanningServiceClient.class);

    static final String UNREACHABLE_MESSAGE =
            "Cannot connect to agent server. Please ensure the server is running.";

    static final String SERVER_ERROR_MESSAGE =
            "Agent server returned an error. Please try again later.";

    static final String PLANNING_FAILED_MESSAGE =
            "Agent server could not plan this request. Try rephrasing it.";

    /** Blocking pause between attempts. */
    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final PlanningBackend          backend;
    private final CircuitBreaker           breaker;
    private final PlanningClientProperties props;
    private final MeterRegistry            meterRegistry;
    private final Sleeper                  sleeper;
    private final ExecutorService          attempts;

    private final AtomicReference<ConnectionStatus> status =
            new AtomicReference<>(ConnectionStatus.DISCONNECTED);

    @Autowired
    public PlanningServiceClient(PlanningBackend backend,
                                 CircuitBreaker breaker,
                                 PlanningClientProperties props,
                                 MeterRegistry meterRegistry) {
        this(backend, breaker, props, meterRegistry, d -> Thread.sleep(d.toMillis()));
    }

    PlanningServiceClient(PlanningBackend backend,
                          CircuitBreaker breaker,
                          PlanningClientProperties props,
                          MeterRegistry meterRegistry,
                          Sleeper sleeper) {
        this.backend       = backend;
        this.breaker       = breaker;
        this.props         = props;
        this.meterRegistry = meterRegistry;
        this.sleeper       = sleeper;
        this.attempts      = Executors.newCachedThreadPool(daemonThreads());
    }

    // ------------------------------------------------------------------
    // Planning
    // ------------------------------------------------------------------

    /**
     * @throws PlanningUnavailableException when the breaker is open or every attempt failed
     * @throws MalformedPlanException       when the backend answered with an unusable body
     * @throws PlanningUnavailableException when the backend itself failed on this request (not retried)
     */
    public PlanResponse requestPlan(PlanRequest request) {
        breaker.checkAvailable();

        status.set(ConnectionStatus.CONNECTING);
        log.info("Planning request: goal='{}' url={}", request.userRequest(),
                request.page() == null ? null : request.page().url());

        PlanningUnavailableException.Reason lastReason = PlanningUnavailableException.Reason.UNREACHABLE;
        String lastMessage = UNREACHABLE_MESSAGE;
        int maxAttempts = props.maxAttempts();

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            long start = System.nanoTime();
            try {
                PlanResponse plan = attempt(request);
                status.set(ConnectionStatus.CONNECTED);
                breaker.recordSuccess();
                countAttempt("success");
                log.info("Planning succeeded in {} ms ({} steps)",
                        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), plan.steps().size());
                return plan;

            } catch (TimeoutException e) {
                countAttempt("timeout");
                lastReason  = PlanningUnavailableException.Reason.TIMEOUT;
                lastMessage = "Request timed out after " + props.attemptTimeout().toSeconds() + " seconds";
                log.warn("Planning attempt {}/{} timed out", attempt + 1, maxAttempts);

            } catch (PlanningBackendException e) {
                if (e.getKind() == PlanningBackendException.Kind.MALFORMED_RESPONSE) {
                    countAttempt("malformed");
                    status.set(ConnectionStatus.CONNECTED);
                    log.error("Planning backend returned a malformed plan: {}", e.getMessage());
                    throw new MalformedPlanException("Invalid plan received from agent server.", e);
                }
                if (e.getKind() == PlanningBackendException.Kind.SERVER_ERROR) {
                    countAttempt("server_error");
                    lastReason  = PlanningUnavailableException.Reason.SERVER_ERROR;
                    lastMessage = SERVER_ERROR_MESSAGE;
                } else {
                    countAttempt("unreachable");
                    lastReason  = PlanningUnavailableException.Reason.UNREACHABLE;
                    lastMessage = UNREACHABLE_MESSAGE;
                }
                log.warn("Planning attempt {}/{} failed: {}", attempt + 1, maxAttempts, e.getMessage());
            }

            if (attempt < maxAttempts - 1) {
                Duration delay = props.backoffAfter(attempt);
                log.info("Retrying in {} ms", delay.toMillis());
                pause(delay);
            }
        }

        status.set(ConnectionStatus.DISCONNECTED);
        breaker.recordFailure();
        throw new PlanningUnavailableException(lastReason, lastMessage);
    }

    private PlanResponse attempt(PlanRequest request) throws TimeoutException {
        Future<PlanResponse> call = attempts.submit(() -> backend.plan(request));
        try {
            return call.get(props.attemptTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            status.set(ConnectionStatus.DISCONNECTED);
            throw new IllegalStateException("Interrupted while waiting for the planning backend", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PlanningBackendException pbe) {
                throw pbe;
            }
            countAttempt("backend_error");
            status.set(ConnectionStatus.CONNECTED);
            log.error("Planning backend failed on goal '{}'", request.userRequest(), cause);
            throw new PlanningUnavailableException(PlanningUnavailableException.Reason.SERVER_ERROR,
                    PLANNING_FAILED_MESSAGE);
        }
    }

    private void pause(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            status.set(ConnectionStatus.DISCONNECTED);
            throw new IllegalStateException("Interrupted during retry backoff", e);
        }
    }

    // ------------------------------------------------------------------
    // Health and status
    // ------------------------------------------------------------------

    /** Lightweight liveness probe. Updates the connection status, never the breaker. */
    public HealthCheckResult checkHealth() {
        try {
            HealthReport report = backend.health(props.healthTimeout());
            if (!report.healthy()) {
                status.set(ConnectionStatus.DISCONNECTED);
                return HealthCheckResult.failure("Server reported status: " + report.status());
            }
            status.set(ConnectionStatus.CONNECTED);
            return HealthCheckResult.ok(report.version());
        } catch (PlanningBackendException e) {
            status.set(ConnectionStatus.DISCONNECTED);
            log.warn("Health check failed: {}", e.getMessage());
            return HealthCheckResult.failure(e.getMessage());
        }
    }

    public ConnectionStatus connectionStatus() {
        return status.get();
    }

    @PreDestroy
    public void shutdown() {
        attempts.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private void countAttempt(String outcome) {
        meterRegistry.counter("pagepilot.planning.attempts", "outcome", outcome).increment();
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "planning-attempt-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
