package com.agentcollab.orchestrator.llm;

/**
 * Base of every model call failure. {@link #code()} is the error code an
 * agent execution fails with once retries are exhausted.
 */
public abstract class ModelInvocationException extends RuntimeException {

    private final String code;

    protected ModelInvocationException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() { return code; }

    /** Whether another attempt could succeed. */
    public abstract boolean isRetryable();
}
