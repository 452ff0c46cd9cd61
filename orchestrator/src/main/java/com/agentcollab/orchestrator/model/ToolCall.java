package com.agentcollab.orchestrator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tool invocation requested by the model.
 *
 * @param id        provider-assigned call id (echoed back with the result)
 * @param toolName  name as advertised in the tool spec
 * @param arguments decoded JSON arguments
 */
public record ToolCall(String id, String toolName, Map<String, Object> arguments) {

    public ToolCall {
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }
}
