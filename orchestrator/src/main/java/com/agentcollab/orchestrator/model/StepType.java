package com.agentcollab.orchestrator.model;

/** Kind of entry in an agent execution's step sequence. */
public enum StepType {
    THOUGHT,
    TOOL_CALL,
    TOOL_RESULT,
    DELEGATION,
    RESPONSE
}
