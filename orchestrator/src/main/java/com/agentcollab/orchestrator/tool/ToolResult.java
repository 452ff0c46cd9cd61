package com.agentcollab.orchestrator.tool;

/**
 * Answer of the tool execution service. Exactly one side is set.
 *
 * @param result whatever the tool returned, decoded from JSON
 * @param error  tool-reported failure text
 */
public record ToolResult(Object result, String error) {

    public static ToolResult ok(Object result)     { return new ToolResult(result, null); }
    public static ToolResult error(String message) { return new ToolResult(null, message); }

    public boolean hasError() { return error != null; }
}
