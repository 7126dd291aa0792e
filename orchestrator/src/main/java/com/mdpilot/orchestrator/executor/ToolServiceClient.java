package com.mdpilot.orchestrator.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mdpilot.orchestrator.executor.dto.ToolResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * HTTP client for the Python tool service that wraps the scientific tools
 * (PDB download, PDBFixer, force-field checks, OpenMM system building, MDTraj analysis).
 *
 * The dispatcher calls this on the pipeline's worker thread, so blocking I/O
 * here is acceptable.
 */
@Component
public class ToolServiceClient {

    private static final Logger log = LoggerFactory.getLogger(ToolServiceClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     timeout;

    public ToolServiceClient(
            @Value("${mdpilot.tool-service.base-url}") String baseUrl,
            @Value("${mdpilot.tool-service.timeout:PT10M}") Duration timeout,
            ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.timeout = timeout;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)   // uvicorn doesn't support h2c upgrade
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Run one tool.
     *
     * @throws ToolServiceException if the service returns a non-2xx status or an unreadable body
     */
    public ToolResponse invoke(String capability, Map<String, Object> args, UUID runId, long invocationId) {
        log.info("Calling tool '{}' (invocation {})", capability, invocationId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("run_id",        runId.toString());
        body.put("invocation_id", invocationId);
        body.put("args",          args);

        String respBody = post("/tools/" + capability, toJson(body), "tool " + capability);
        try {
            return json.readValue(respBody, ToolResponse.class);
        } catch (JsonProcessingException e) {
            throw new ToolServiceException("Failed to parse response of tool " + capability, e);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String post(String path, String jsonBody, String opName) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ToolServiceException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (ToolServiceException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolServiceException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new ToolServiceException(opName + " failed", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ToolServiceException("JSON serialization failed", e);
        }
    }
}
