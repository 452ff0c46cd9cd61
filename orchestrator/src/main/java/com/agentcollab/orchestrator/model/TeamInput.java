package com.agentcollab.orchestrator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The task handed to a team, plus optional seed context and memory session.
 */
public record TeamInput(String task, Map<String, Object> context, String sessionId) {

    public TeamInput {
        if (task == null || task.isBlank()) throw new IllegalArgumentException("task is required");
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static TeamInput of(String task) {
        return new TeamInput(task, null, null);
    }
}
