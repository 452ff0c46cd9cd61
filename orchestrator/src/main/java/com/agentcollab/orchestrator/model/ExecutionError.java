package com.agentcollab.orchestrator.model;

/**
 * Failure description attached to a failed or cancelled execution.
 * {@code agentId} names the agent the failure is attributed to, when there is one.
 */
public record ExecutionError(String code, String message, String agentId) {}
