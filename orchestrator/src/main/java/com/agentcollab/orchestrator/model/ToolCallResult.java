package com.agentcollab.orchestrator.model;

/**
 * Outcome of one tool call as seen by the agent and, when shared, by its
 * teammates. Exactly one of {@code result} and {@code error} is set.
 */
public record ToolCallResult(String callId, String toolName, String result, String error) {

    public static ToolCallResult success(String callId, String toolName, String result) {
        return new ToolCallResult(callId, toolName, result, null);
    }

    public static ToolCallResult failure(String callId, String toolName, String error) {
        return new ToolCallResult(callId, toolName, null, error);
    }

    public boolean hasError() { return error != null; }

    /** Text folded back into the conversation on the next model turn. */
    public String toObservation() {
        return hasError()
                ? "Tool '" + toolName + "' failed: " + error
                : "Tool '" + toolName + "' returned: " + result;
    }
}
