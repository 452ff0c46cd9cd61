package com.agentcollab.orchestrator.tool;

import java.util.Map;

/**
 * Sandboxed tool execution, seen from the orchestrator. One attempt per call.
 */
public interface ToolExecutionService {

    /**
     * @return the tool's result, or the error the tool itself reported
     * @throws ToolExecutionException when the call could not be carried out
     */
    ToolResult execute(String toolId, Map<String, Object> args, ToolExecutionContext context);
}
