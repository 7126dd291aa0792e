package com.mdpilot.orchestrator.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP client for the HPC batch gateway (a thin REST front for Slurm).
 *
 * <pre>
 *   POST   /jobs                 submit, returns {"handle": "..."}
 *   GET    /jobs/{handle}        status, returns {"state": "RUNNING", "detail": "..."}
 *   DELETE /jobs/{handle}        scancel
 *   GET    /jobs/{handle}/result output of a completed job
 * </pre>
 *
 * I/O errors, HTTP 429 and 5xx are reported as transient; any other non-2xx
 * status is permanent. Retrying is left to {@link JobLifecycleManager}.
 */
@Component
public class HttpBatchScheduler implements BatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(HttpBatchScheduler.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SubmitResponse(String handle) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StatusResponse(String state, String detail) {}

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;

    public HttpBatchScheduler(
            @Value("${mdpilot.batch-gateway.base-url}") String baseUrl,
            ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String submit(JobSpec spec) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("job_type",      spec.jobType());
        body.put("job_name",      spec.jobName());
        body.put("nodes",         spec.nodes());
        body.put("gpus_per_node", spec.gpusPerNode());
        body.put("walltime",      spec.walltimeText());
        body.put("payload",       spec.payload());

        String respBody = send(HttpRequest.newBuilder(uri("/jobs"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body))), "submit " + spec.jobType());
        SubmitResponse resp = parse(respBody, SubmitResponse.class, "submit");
        if (resp.handle() == null || resp.handle().isBlank()) {
            throw new BatchSchedulerException("Batch gateway returned no job handle", false);
        }
        log.info("Batch gateway accepted {} job '{}' as {}", spec.jobType(), spec.jobName(), resp.handle());
        return resp.handle();
    }

    @Override
    public SchedulerStatus status(String handle) {
        String respBody = send(HttpRequest.newBuilder(uri("/jobs/" + encode(handle))).GET(),
                "status of " + handle);
        StatusResponse resp = parse(respBody, StatusResponse.class, "status");
        return new SchedulerStatus(resp.state(), resp.detail());
    }

    @Override
    public void cancel(String handle) {
        log.info("Cancelling batch job {}", handle);
        send(HttpRequest.newBuilder(uri("/jobs/" + encode(handle))).DELETE(), "cancel " + handle);
    }

    @Override
    public Map<String, Object> fetchResult(String handle) {
        String respBody = send(HttpRequest.newBuilder(uri("/jobs/" + encode(handle) + "/result")).GET(),
                "result of " + handle);
        try {
            return json.readValue(respBody, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new BatchSchedulerException("Failed to parse result of " + handle, false, e);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String send(HttpRequest.Builder builder, String opName) {
        HttpRequest req = builder
                .timeout(REQUEST_TIMEOUT)
                .header("Accept", "application/json")
                .build();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new BatchSchedulerException(opName + " failed: " + e.getMessage(), true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BatchSchedulerException(opName + " interrupted", false, e);
        }
        int code = resp.statusCode();
        if (code < 200 || code >= 300) {
            boolean transientFailure = code == 429 || code >= 500;
            throw new BatchSchedulerException(
                    opName + " failed: HTTP " + code + ": " + resp.body(), transientFailure);
        }
        return resp.body();
    }

    private <T> T parse(String body, Class<T> type, String opName) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new BatchSchedulerException("Failed to parse " + opName + " response", false, e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new BatchSchedulerException("JSON serialization failed", false, e);
        }
    }

    private URI uri(String path) {
        return URI.create(baseUrl + path);
    }

    private static String encode(String handle) {
        return URLEncoder.encode(handle, StandardCharsets.UTF_8);
    }
}
