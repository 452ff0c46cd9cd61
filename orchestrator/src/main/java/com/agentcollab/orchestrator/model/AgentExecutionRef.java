package com.agentcollab.orchestrator.model;

/**
 * Reference from a team execution to one of its child agent executions.
 * Only terminal children are ever referenced.
 *
 * @param order 1-based position in the order children finished
 */
public record AgentExecutionRef(String executionId, String agentId, String role, int order, AgentStatus status) {}
