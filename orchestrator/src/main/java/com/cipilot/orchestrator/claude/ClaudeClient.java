package com.cipilot.orchestrator.claude;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the Anthropic Messages API.
 *
 * Every call in this orchestrator is single-turn: a system prompt describing
 * the job (generate, adapt, fix) plus one user message carrying the context.
 * Raw HttpClient keeps the wire format visible and avoids an SDK dependency.
 */
@Component
public class ClaudeClient {

    private static final Logger log = LoggerFactory.getLogger(ClaudeClient.class);

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /** role must be "user" or "assistant". */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** Extracts the text from the first text block. */
        public String firstText() {
            if (content == null) {
                throw new IllegalStateException("No content in response");
            }
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

    private static final String API_URL    = "https://api.anthropic.com/v1/messages";
    private static final String API_VER    = "2023-06-01";
    private static final int    MAX_TOKENS = 8192;

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final String       model;
    private final Duration     timeout;

    public ClaudeClient(@Value("${anthropic.api-key}") String apiKey,
                        @Value("${cipilot.model.name:claude-sonnet-4-6}") String model,
                        @Value("${cipilot.model.request-timeout:25s}") Duration timeout,
                        ObjectMapper objectMapper) {
        this.apiKey  = apiKey;
        this.model   = model;
        this.timeout = timeout;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Send one system prompt + one user message and return the assistant's text.
     *
     * @throws ModelTimeoutException     if no answer arrives within the request timeout
     * @throws ModelUnavailableException on any other transport or API error
     */
    public String complete(String systemPrompt, String context) {
        try {
            String requestBody = json.writeValueAsString(Map.of(
                    "model",      model,
                    "max_tokens", MAX_TOKENS,
                    "system",     systemPrompt,
                    "messages",   List.of(new Message("user", context))
            ));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(API_URL))
                    .timeout(timeout)
                    .header("content-type",      "application/json")
                    .header("x-api-key",          apiKey)
                    .header("anthropic-version",  API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                throw new ModelUnavailableException(response.statusCode(),
                        "Model API error %d: %s".formatted(response.statusCode(), response.body()));
            }

            MessagesResponse parsed = json.readValue(response.body(), MessagesResponse.class);
            String text = parsed.firstText();
            log.debug("Model {} answered with {} chars", model, text.length());
            return text;

        } catch (ModelUnavailableException e) {
            throw e;
        } catch (HttpTimeoutException e) {
            throw new ModelTimeoutException("Model call timed out after " + timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelUnavailableException("Model call interrupted", e);
        } catch (Exception e) {
            throw new ModelUnavailableException("Model call failed", e);
        }
    }
}
