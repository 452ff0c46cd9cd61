package com.agentcollab.orchestrator.tool;

/**
 * Thrown when a tool call fails.
 *
 * Unchecked so callers only catch it when they have a specific recovery;
 * the agent executor does, folding the message back to the model unless
 * the agent stops on tool errors.
 */
public class ToolExecutionException extends RuntimeException {

    public enum Kind { NOT_PERMITTED, RATE_LIMITED, EXECUTOR_ERROR, TIMEOUT, TOOL_ERROR }

    private final Kind kind;

    public ToolExecutionException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public ToolExecutionException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    /** Executor trouble and timeouts may clear up on another attempt; the rest will not. */
    public boolean isRetryable() {
        return kind == Kind.EXECUTOR_ERROR || kind == Kind.TIMEOUT;
    }
}
