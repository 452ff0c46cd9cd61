package com.agentcollab.orchestrator.llm;

public class RateLimitedException extends ModelInvocationException {

    public RateLimitedException(String message) {
        super("RATE_LIMITED", message, null);
    }

    @Override
    public boolean isRetryable() { return true; }
}
