package com.playpilot.orchestrator.llm;

/**
 * A failed provider call, classified so callers can report the failure
 * class without parsing messages.
 *
 * Unchecked: the generator is the only place that catches it, and it turns
 * every kind into an invalid GenerationResult.
 */
public class LlmProviderException extends RuntimeException {

    public enum Kind { TIMEOUT, AUTHENTICATION, QUOTA, TRUNCATED, UNAVAILABLE, BAD_RESPONSE }

    private final Kind   kind;
    private final String provider;

    public LlmProviderException(Kind kind, String provider, String message) {
        super(provider + ": " + message);
        this.kind     = kind;
        this.provider = provider;
    }

    public LlmProviderException(Kind kind, String provider, String message, Throwable cause) {
        super(provider + ": " + message, cause);
        this.kind     = kind;
        this.provider = provider;
    }

    /** Classify a non-200 HTTP reply. */
    public static LlmProviderException forStatus(String provider, int status, String body) {
        Kind kind = switch (status) {
            case 401, 403 -> Kind.AUTHENTICATION;
            case 429      -> Kind.QUOTA;
            case 408, 504 -> Kind.TIMEOUT;
            default       -> Kind.UNAVAILABLE;
        };
        return new LlmProviderException(kind, provider, "HTTP %d: %s".formatted(status, body));
    }

    public Kind   getKind()     { return kind; }
    public String getProvider() { return provider; }
}
