package com.agentcollab.orchestrator.llm;

import java.util.Map;

/** Tool advertised to the model: name, description and JSON schema of its arguments. */
public record ToolSpec(String name, String description, Map<String, Object> inputSchema) {

    public ToolSpec {
        inputSchema = inputSchema == null ? Map.of("type", "object") : Map.copyOf(inputSchema);
    }
}
