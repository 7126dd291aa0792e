package com.mdpilot.orchestrator.claude;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the Anthropic Messages API.
 *
 * Overloaded (429, 529) and 5xx answers are retried a few times with a
 * growing pause; every other non-200 status surfaces as {@link ClaudeApiException}.
 */
@Component
public class ClaudeClient {

    private static final Logger log = LoggerFactory.getLogger(ClaudeClient.class);

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /** role is "user" or "assistant"; the API expects them to alternate. */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        public String firstText() {
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No text block in response"));
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String API_URL     = "https://api.anthropic.com/v1/messages";
    private static final String API_VER     = "2023-06-01";
    private static final int    MAX_TOKENS  = 2048;
    private static final int    MAX_RETRIES = 3;

    private final HttpClient    http;
    private final ObjectMapper  json;
    private final String        apiKey;

    public ClaudeClient(@Value("${anthropic.api-key}") String apiKey,
                        ObjectMapper objectMapper) {
        this.apiKey = apiKey;
        this.json   = objectMapper;
        this.http   = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Send a conversation to Claude and return the assistant's text reply.
     *
     * @param model    e.g. "claude-sonnet-4-6"
     * @param system   system prompt
     * @param messages the full conversation so far
     */
    public String complete(String model, String system, List<Message> messages) {
        String requestBody;
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model",      model);
            body.put("max_tokens", MAX_TOKENS);
            body.put("system",     system);
            body.put("messages",   messages);
            requestBody = json.writeValueAsString(body);
        } catch (IOException e) {
            throw new RuntimeException("Could not serialise Claude request", e);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(API_URL))
                .timeout(Duration.ofSeconds(60))
                .header("content-type",      "application/json")
                .header("x-api-key",          apiKey)
                .header("anthropic-version",  API_VER)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();

        for (int attempt = 1; ; attempt++) {
            try {
                HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
                int status = response.statusCode();
                if (status == 200) {
                    return json.readValue(response.body(), MessagesResponse.class).firstText();
                }
                ClaudeApiException error = new ClaudeApiException(status, response.body());
                if (!error.isRetryable() || attempt >= MAX_RETRIES) {
                    throw error;
                }
                log.warn("Claude API returned {} (attempt {}/{}), retrying", status, attempt, MAX_RETRIES);
                Thread.sleep(1000L * attempt * attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RuntimeException("Interrupted while calling Claude API", e);
            } catch (IOException e) {
                throw new RuntimeException("Claude API call failed", e);
            }
        }
    }

    // -------------------------------------------------------------------------
    // Exception type
    // -------------------------------------------------------------------------

    public static class ClaudeApiException extends RuntimeException {
        private final int statusCode;
        public ClaudeApiException(int statusCode, String body) {
            super("Claude API error %d: %s".formatted(statusCode, body));
            this.statusCode = statusCode;
        }
        public int statusCode() { return statusCode; }

        boolean isRetryable() {
            return statusCode == 429 || statusCode == 529 || statusCode >= 500;
        }
    }
}
