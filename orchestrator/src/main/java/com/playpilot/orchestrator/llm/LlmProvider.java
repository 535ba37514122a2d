package com.playpilot.orchestrator.llm;

/**
 * One completion backend.
 *
 * Every backend exposes the same call; the generator never knows which one
 * it is talking to. The concrete provider is chosen once at startup by
 * {@link LlmConfig}.
 */
public interface LlmProvider {

    /** Provider family, recorded in generation metadata (e.g. "openai"). */
    String name();

    /** Model id sent on every request. */
    String model();

    /**
     * Send one prompt and return the raw text of the reply.
     *
     * @throws LlmProviderException on timeout, authentication or quota failure,
     *         a truncated reply, or an unusable response body
     */
    String complete(String prompt, int maxTokens, double temperature);
}
