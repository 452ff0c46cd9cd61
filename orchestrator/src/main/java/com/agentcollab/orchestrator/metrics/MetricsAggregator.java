package com.agentcollab.orchestrator.metrics;

import com.agentcollab.orchestrator.model.AgentExecution;
import com.agentcollab.orchestrator.model.AgentMetrics;
import com.agentcollab.orchestrator.model.AgentMetricsSummary;
import com.agentcollab.orchestrator.model.TeamMetrics;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Running totals of a team run, merged one agent execution at a time.
 *
 * The orchestrator merges each child as soon as it is terminal, so a run that
 * is polled mid-flight or cancelled still reports what has been spent.
 * Per-agent entries keep first-merge order.
 */
public class MetricsAggregator {

    private long totalTokens;
    private int  totalToolCalls;
    private int  totalIterations;
    private long totalDurationMs;
    private final Map<String, AgentMetricsSummary> perAgent = new LinkedHashMap<>();

    public synchronized void merge(AgentExecution execution) {
        AgentMetrics m = execution.getMetrics();
        if (m == null) return;
        totalTokens     += m.totalTokens();
        totalToolCalls  += m.toolCalls();
        totalIterations += m.iterations();
        totalDurationMs += m.durationMs();
        perAgent.merge(execution.getAgentId(), AgentMetricsSummary.zero().plus(m),
                (existing, ignored) -> existing.plus(m));
    }

    public synchronized long totalTokens() {
        return totalTokens;
    }

    public synchronized TeamMetrics snapshot() {
        return new TeamMetrics(totalTokens, totalToolCalls, totalIterations, totalDurationMs, perAgent);
    }
}
