package com.pagepilot.orchestrator.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagepilot.orchestrator.model.PlanRequest;
import com.pagepilot.orchestrator.model.PlanResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * HTTP client for a remote planning backend.
 *
 * <pre>
 *   POST {baseUrl}/plan    PlanRequest → PlanResponse
 *   GET  {baseUrl}/health  → {status, version}
 * </pre>
 *
 * Uses java.net.http.HttpClient directly. Plan calls carry no request
 * timeout of their own: {@link PlanningServiceClient} bounds each attempt.
 */
public class HttpPlanningBackend implements PlanningBackend {

    private static final Logger log = LoggerFactory.getLogger(HttpPlanningBackend.class);

    private static final int MAX_ERROR_BODY = 200;

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;

    public HttpPlanningBackend(String baseUrl, ObjectMapper objectMapper) {
        this(baseUrl, objectMapper, HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)   // uvicorn doesn't support h2c upgrade
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    HttpPlanningBackend(String baseUrl, ObjectMapper objectMapper, HttpClient http) {
        this.baseUrl = baseUrl;
        this.json    = objectMapper;
        this.http    = http;
    }

    // ------------------------------------------------------------------
    // Planning
    // ------------------------------------------------------------------

    @Override
    public PlanResponse plan(PlanRequest request) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/plan"))
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(request)))
                .build();

        HttpResponse<String> resp = send(req, "plan");
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new PlanningBackendException(PlanningBackendException.Kind.SERVER_ERROR,
                    "Server returned " + resp.statusCode() + ": " + abbreviate(resp.body()));
        }
        return parsePlan(resp.body());
    }

    /** Requires a string {@code summary} and an array {@code steps}; each step must be valid for its tool. */
    PlanResponse parsePlan(String body) {
        try {
            JsonNode root = json.readTree(body);
            if (root == null || !root.path("summary").isTextual() || !root.path("steps").isArray()) {
                throw new PlanningBackendException(PlanningBackendException.Kind.MALFORMED_RESPONSE,
                        "Plan response is missing 'summary' or 'steps'");
            }
            return json.treeToValue(root, PlanResponse.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new PlanningBackendException(PlanningBackendException.Kind.MALFORMED_RESPONSE,
                    "Plan response could not be parsed: " + e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Health
    // ------------------------------------------------------------------

    @Override
    public HealthReport health(Duration timeout) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/health"))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> resp = send(req, "health");
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new PlanningBackendException(PlanningBackendException.Kind.SERVER_ERROR,
                    "Server returned error: HTTP " + resp.statusCode());
        }
        try {
            return json.readValue(resp.body(), HealthReport.class);
        } catch (JsonProcessingException e) {
            throw new PlanningBackendException(PlanningBackendException.Kind.MALFORMED_RESPONSE,
                    "Invalid response format from server", e);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private HttpResponse<String> send(HttpRequest req, String opName) {
        try {
            return http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new PlanningBackendException(PlanningBackendException.Kind.UNREACHABLE,
                    "Cannot reach server: " + opName + " timed out", e);
        } catch (IOException e) {
            log.debug("{} call to {} failed", opName, baseUrl, e);
            throw new PlanningBackendException(PlanningBackendException.Kind.UNREACHABLE,
                    "Cannot reach server: " + e.getClass().getSimpleName(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlanningBackendException(PlanningBackendException.Kind.UNREACHABLE,
                    "Interrupted during " + opName, e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= MAX_ERROR_BODY ? body : body.substring(0, MAX_ERROR_BODY) + "...";
    }
}
