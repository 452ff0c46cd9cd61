package com.agentcollab.orchestrator.llm;

public class ModelTimeoutException extends ModelInvocationException {

    public ModelTimeoutException(String message, Throwable cause) {
        super("MODEL_TIMEOUT", message, cause);
    }

    @Override
    public boolean isRetryable() { return true; }
}
