package com.agentcollab.orchestrator.model;

/** Resource usage of one agent execution. */
public record AgentMetrics(
        long inputTokens,
        long outputTokens,
        long totalTokens,
        int  toolCalls,
        int  iterations,
        long durationMs) {

    public static AgentMetrics zero() {
        return new AgentMetrics(0, 0, 0, 0, 0, 0);
    }
}
