package com.agentcollab.orchestrator.model;

/** Per-agent slice of a team's metrics, summed over all runs of that agent. */
public record AgentMetricsSummary(long tokens, int toolCalls, int iterations, long durationMs, int runs) {

    public static AgentMetricsSummary zero() {
        return new AgentMetricsSummary(0, 0, 0, 0, 0);
    }

    public AgentMetricsSummary plus(AgentMetrics m) {
        return new AgentMetricsSummary(
                tokens + m.totalTokens(),
                toolCalls + m.toolCalls(),
                iterations + m.iterations(),
                durationMs + m.durationMs(),
                runs + 1);
    }
}
