package com.agentcollab.orchestrator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input to one agent run.
 *
 * @param message         the user-turn text
 * @param context         extra key/value context rendered into the prompt
 * @param sessionId       conversation memory key; null for stateless runs
 * @param teamExecutionId owning team run, null for standalone agent runs
 */
public record AgentInput(String message, Map<String, Object> context, String sessionId, String teamExecutionId) {

    public AgentInput {
        if (message == null) message = "";
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static AgentInput of(String message) {
        return new AgentInput(message, null, null, null);
    }
}
