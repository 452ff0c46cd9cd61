package com.agentcollab.orchestrator.model;

import java.util.List;

/**
 * What an agent produced: its final text, every tool call it made with the
 * matching results, and an optional delegation request.
 */
public record AgentOutput(
        String               response,
        List<ToolCall>       toolCalls,
        List<ToolCallResult> toolResults,
        DelegationRequest    delegation) {

    public AgentOutput {
        toolCalls   = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        toolResults = toolResults == null ? List.of() : List.copyOf(toolResults);
    }

    public static AgentOutput empty() {
        return new AgentOutput(null, null, null, null);
    }

    public boolean hasResponse() {
        return response != null && !response.isBlank();
    }
}
