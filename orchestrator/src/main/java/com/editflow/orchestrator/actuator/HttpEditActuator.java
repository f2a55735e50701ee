package com.editflow.orchestrator.actuator;

import com.editflow.orchestrator.actuator.dto.*;
import com.editflow.orchestrator.model.FailureClass;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP client for the host bridge that owns the editing application.
 *
 * Wraps the three bridge endpoints with typed Java methods:
 * <pre>
 *   POST /checkpoint  {subject_ref}         → {handle}
 *   POST /dispatch    {subject_ref, config} → {ok, error, classification}
 *   POST /rollback    {handle}              → 2xx on success
 * </pre>
 * Uses java.net.http.HttpClient so every header and byte on the wire is
 * explicit. Called from worker threads, so blocking I/O is fine here; the
 * engine bounds each call with its own stage timeout on top of this one.
 */
@Component
public class HttpEditActuator implements EditActuator {

    private static final Logger log = LoggerFactory.getLogger(HttpEditActuator.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     requestTimeout;

    public HttpEditActuator(
            @Value("${editflow.actuator.base-url:http://localhost:8765}") String baseUrl,
            @Value("${editflow.actuator.request-timeout-ms:30000}") long requestTimeoutMs,
            ObjectMapper objectMapper) {
        this.baseUrl        = baseUrl;
        this.json           = objectMapper;
        this.requestTimeout = Duration.ofMillis(requestTimeoutMs);
        this.http           = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String checkpoint(String subjectRef) {
        log.info("Requesting checkpoint for subject '{}'", subjectRef);
        HttpResponse<String> resp = post("/checkpoint", toJson(new CheckpointRequest(subjectRef)),
                "checkpoint for " + subjectRef);
        requireSuccess(resp, "checkpoint for " + subjectRef);
        try {
            CheckpointResponse body = json.readValue(resp.body(), CheckpointResponse.class);
            if (body.handle() == null || body.handle().isBlank()) {
                throw new ActuatorException("checkpoint for " + subjectRef + " returned no handle");
            }
            return body.handle();
        } catch (JsonProcessingException e) {
            throw new ActuatorException("Failed to parse checkpoint response", e);
        }
    }

    @Override
    public DispatchResult dispatch(String subjectRef, String config) {
        HttpResponse<String> resp;
        try {
            resp = post("/dispatch", toJson(new DispatchRequest(subjectRef, config)),
                    "dispatch for " + subjectRef);
        } catch (ActuatorException e) {
            return DispatchResult.failure(FailureClass.TRANSIENT, e.getMessage());
        }

        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            return DispatchResult.failure(classifyStatus(resp.statusCode()),
                    "dispatch for " + subjectRef + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
        }
        try {
            DispatchResponse body = json.readValue(resp.body(), DispatchResponse.class);
            if (body.ok()) {
                return DispatchResult.success();
            }
            return DispatchResult.failure(parseClassification(body.classification()),
                    body.error() == null ? "dispatch rejected" : body.error());
        } catch (JsonProcessingException e) {
            return DispatchResult.failure(FailureClass.TRANSIENT,
                    "unparseable dispatch response: " + e.getOriginalMessage());
        }
    }

    @Override
    public RollbackResult rollback(String handle) {
        log.info("Rolling back to checkpoint '{}'", handle);
        try {
            HttpResponse<String> resp = post("/rollback", toJson(new RollbackRequest(handle)),
                    "rollback of " + handle);
            requireSuccess(resp, "rollback of " + handle);
            return RollbackResult.success();
        } catch (ActuatorException e) {
            return RollbackResult.failure(e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Classification
    // ------------------------------------------------------------------

    /**
     * Map a bridge status code to a failure class.
     * 507 = not enough accelerator memory; other 4xx = the request itself is
     * bad and will never succeed; everything else may succeed later.
     */
    static FailureClass classifyStatus(int status) {
        if (status == 507) return FailureClass.RESOURCE;
        if (status == 408 || status == 429) return FailureClass.TRANSIENT;
        if (status >= 400 && status < 500) return FailureClass.FATAL;
        return FailureClass.TRANSIENT;
    }

    static FailureClass parseClassification(String value) {
        if (value == null) return FailureClass.TRANSIENT;
        return switch (value.trim().toLowerCase()) {
            case "fatal", "non_retryable", "invalid" -> FailureClass.FATAL;
            case "resource", "oom", "out_of_memory"  -> FailureClass.RESOURCE;
            default                                  -> FailureClass.TRANSIENT;
        };
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private HttpResponse<String> post(String path, String jsonBody, String opName) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
            return http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActuatorException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new ActuatorException(opName + " failed: " + e.getMessage(), e);
        }
    }

    private static void requireSuccess(HttpResponse<String> resp, String opName) {
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new ActuatorException(
                    opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body(), resp.statusCode());
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ActuatorException("JSON serialization failed", e);
        }
    }
}
