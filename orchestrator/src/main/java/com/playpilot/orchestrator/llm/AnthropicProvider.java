package com.playpilot.orchestrator.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
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
 * Raw {@link HttpClient} rather than an SDK: one endpoint, one request shape,
 * and we need the HTTP status and {@code stop_reason} to classify failures.
 */
public class AnthropicProvider implements LlmProvider {

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(
            List<ContentBlock> content,
            @JsonProperty("stop_reason") String stopReason) {

        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** Text of the first text block, or null if there is none. */
        public String firstText() {
            if (content == null) return null;
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElse(null);
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    static final String NAME    = "anthropic";
    private static final String API_VER = "2023-06-01";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       apiKey;
    private final String       model;
    private final Duration     timeout;

    public AnthropicProvider(String baseUrl, String apiKey, String model,
                             Duration timeout, ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.apiKey  = apiKey;
        this.model   = model;
        this.timeout = timeout;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override public String name()  { return NAME; }
    @Override public String model() { return model; }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    @Override
    public String complete(String prompt, int maxTokens, double temperature) {
        try {
            String requestBody = json.writeValueAsString(Map.of(
                    "model",       model,
                    "max_tokens",  maxTokens,
                    "temperature", temperature,
                    "messages",    List.of(new Message("user", prompt))
            ));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/v1/messages"))
                    .timeout(timeout)
                    .header("content-type",      "application/json")
                    .header("x-api-key",         apiKey)
                    .header("anthropic-version", API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                throw LlmProviderException.forStatus(NAME, response.statusCode(), response.body());
            }

            MessagesResponse parsed = json.readValue(response.body(), MessagesResponse.class);
            if ("max_tokens".equals(parsed.stopReason())) {
                throw new LlmProviderException(LlmProviderException.Kind.TRUNCATED, NAME,
                        "reply stopped at the " + maxTokens + "-token limit");
            }
            String text = parsed.firstText();
            return text == null ? "" : text;

        } catch (LlmProviderException e) {
            throw e;
        } catch (HttpTimeoutException e) {
            throw new LlmProviderException(LlmProviderException.Kind.TIMEOUT, NAME,
                    "no reply within " + timeout.toSeconds() + "s", e);
        } catch (JsonProcessingException e) {
            throw new LlmProviderException(LlmProviderException.Kind.BAD_RESPONSE, NAME,
                    "unreadable response body", e);
        } catch (IOException e) {
            throw new LlmProviderException(LlmProviderException.Kind.UNAVAILABLE, NAME, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmProviderException(LlmProviderException.Kind.UNAVAILABLE, NAME, "interrupted", e);
        }
    }
}
