package com.agentcollab.orchestrator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregated metrics of a team run: totals plus a per-agent breakdown keyed by agentId.
 * {@code totalDurationMs} is summed agent time, not wall-clock time of the team run.
 */
public record TeamMetrics(
        long                             totalTokens,
        int                              totalToolCalls,
        int                              totalIterations,
        long                             totalDurationMs,
        Map<String, AgentMetricsSummary> agentMetrics) {

    public TeamMetrics {
        agentMetrics = agentMetrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(agentMetrics));
    }

    public static TeamMetrics empty() {
        return new TeamMetrics(0, 0, 0, 0, Map.of());
    }
}
