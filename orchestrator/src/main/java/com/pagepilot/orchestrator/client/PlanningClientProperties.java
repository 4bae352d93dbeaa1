package com.pagepilot.orchestrator.client;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Planning client settings, bound from {@code pagepilot.planning.*}.
 * Unset values take the defaults below.
 */
@ConfigurationProperties("pagepilot.planning")
public record PlanningClientProperties(
        Mode           mode,
        String         baseUrl,
        String         provider,
        Integer        maxAttempts,
        Duration       attemptTimeout,
        List<Duration> backoff,
        Duration       healthTimeout,
        Integer        failureThreshold,
        Duration       cooldown
) {

    public enum Mode { LOCAL, REMOTE }

    public PlanningClientProperties {
        mode             = mode == null ? Mode.LOCAL : mode;
        baseUrl          = baseUrl == null || baseUrl.isBlank() ? "http://127.0.0.1:8765" : stripSlash(baseUrl);
        provider         = provider == null || provider.isBlank() ? null : provider;
        maxAttempts      = maxAttempts == null ? 3 : maxAttempts;
        attemptTimeout   = attemptTimeout == null ? Duration.ofSeconds(30) : attemptTimeout;
        backoff          = backoff == null || backoff.isEmpty()
                ? List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4))
                : List.copyOf(backoff);
        healthTimeout    = healthTimeout == null ? Duration.ofSeconds(5) : healthTimeout;
        failureThreshold = failureThreshold == null ? 3 : failureThreshold;
        cooldown         = cooldown == null ? Duration.ofMinutes(5) : cooldown;

        if (maxAttempts < 1) {
            throw new IllegalArgumentException("pagepilot.planning.max-attempts must be >= 1");
        }
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("pagepilot.planning.failure-threshold must be >= 1");
        }
    }

    public static PlanningClientProperties defaults() {
        return new PlanningClientProperties(null, null, null, null, null, null, null, null, null);
    }

    /** Delay after failed attempt {@code attempt} (0-based); the last entry repeats. */
    public Duration backoffAfter(int attempt) {
        return backoff.get(Math.min(attempt, backoff.size() - 1));
    }

    private static String stripSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
