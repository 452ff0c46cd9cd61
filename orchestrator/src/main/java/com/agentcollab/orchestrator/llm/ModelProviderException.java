package com.agentcollab.orchestrator.llm;

/**
 * The provider answered with an error, or the call broke in transport.
 * Server-side errors (5xx, overloaded) are retried; client errors are not.
 */
public class ModelProviderException extends ModelInvocationException {

    private final int statusCode;

    public ModelProviderException(int statusCode, String body) {
        super("MODEL_ERROR", "Model API error %d: %s".formatted(statusCode, body), null);
        this.statusCode = statusCode;
    }

    public ModelProviderException(String message, Throwable cause) {
        super("MODEL_ERROR", message, cause);
        this.statusCode = 0;
    }

    /** HTTP status, or 0 when the request never got an answer. */
    public int statusCode() { return statusCode; }

    @Override
    public boolean isRetryable() {
        return statusCode == 0 || statusCode >= 500;
    }
}
