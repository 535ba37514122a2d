package com.playpilot.orchestrator.llm;

import java.util.Locale;

/** The closed set of supported completion backends. */
public enum ProviderType {
    OPENAI("gpt-4", "https://api.openai.com"),
    ANTHROPIC("claude-3-5-sonnet-latest", "https://api.anthropic.com");

    private final String defaultModel;
    private final String defaultBaseUrl;

    ProviderType(String defaultModel, String defaultBaseUrl) {
        this.defaultModel   = defaultModel;
        this.defaultBaseUrl = defaultBaseUrl;
    }

    public String defaultModel()   { return defaultModel; }
    public String defaultBaseUrl() { return defaultBaseUrl; }

    public static ProviderType from(String value) {
        if (value != null) {
            for (ProviderType t : values()) {
                if (t.name().equalsIgnoreCase(value.strip())) {
                    return t;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported LLM provider: '" + value + "' (expected openai or anthropic)");
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
