package com.agentcollab.orchestrator.llm;

import com.agentcollab.orchestrator.model.ToolCall;

import java.util.List;

/**
 * What one model turn returned.
 *
 * @param content   assistant text, possibly empty when the turn only calls tools
 * @param toolCalls tool invocations requested in this turn, in order
 */
public record ModelResponse(String content, List<ToolCall> toolCalls, long inputTokens, long outputTokens) {

    public ModelResponse {
        if (content == null) content = "";
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ModelResponse text(String content, long inputTokens, long outputTokens) {
        return new ModelResponse(content, List.of(), inputTokens, outputTokens);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    public long tokensUsed() {
        return inputTokens + outputTokens;
    }
}
