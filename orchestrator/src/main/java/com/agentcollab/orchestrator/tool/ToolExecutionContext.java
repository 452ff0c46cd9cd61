package com.agentcollab.orchestrator.tool;

import java.time.Duration;

/**
 * Runtime context passed with every tool call, so the executor can attribute
 * and sandbox it.
 *
 * @param teamExecutionId null for standalone agent runs
 */
public record ToolExecutionContext(
        String   teamExecutionId,
        String   agentExecutionId,
        String   agentId,
        Duration timeout,
        boolean  sandboxed) {

    public ToolExecutionContext withPolicy(ToolDefinition.ExecutionPolicy policy) {
        return new ToolExecutionContext(teamExecutionId, agentExecutionId, agentId,
                policy.timeout(), policy.sandboxed());
    }
}
