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
 * Thin wrapper around the OpenAI Chat Completions API.
 *
 * Same shape as {@link AnthropicProvider}: raw HttpClient, Jackson records
 * for the subset of the response we read, {@code finish_reason = "length"}
 * reported as a truncated reply.
 */
public class OpenAiProvider implements LlmProvider {

    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChatResponse(List<Choice> choices) {

        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Choice(Message message, @JsonProperty("finish_reason") String finishReason) {}

        public Choice first() {
            if (choices == null || choices.isEmpty()) {
                throw new LlmProviderException(LlmProviderException.Kind.BAD_RESPONSE, NAME, "no choices in response");
            }
            return choices.get(0);
        }
    }

    static final String NAME = "openai";

    private static final String SYSTEM_MESSAGE =
            "You are an expert Ansible playbook developer. Generate only valid YAML playbooks.";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       apiKey;
    private final String       model;
    private final Duration     timeout;

    public OpenAiProvider(String baseUrl, String apiKey, String model,
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

    @Override
    public String complete(String prompt, int maxTokens, double temperature) {
        try {
            String requestBody = json.writeValueAsString(Map.of(
                    "model",       model,
                    "max_tokens",  maxTokens,
                    "temperature", temperature,
                    "messages",    List.of(
                            new Message("system", SYSTEM_MESSAGE),
                            new Message("user",   prompt))
            ));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/v1/chat/completions"))
                    .timeout(timeout)
                    .header("Content-Type",  "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                throw LlmProviderException.forStatus(NAME, response.statusCode(), response.body());
            }

            ChatResponse.Choice choice = json.readValue(response.body(), ChatResponse.class).first();
            if ("length".equals(choice.finishReason())) {
                throw new LlmProviderException(LlmProviderException.Kind.TRUNCATED, NAME,
                        "reply stopped at the " + maxTokens + "-token limit");
            }
            String text = choice.message() == null ? null : choice.message().content();
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
