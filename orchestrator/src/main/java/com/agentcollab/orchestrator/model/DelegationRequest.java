package com.agentcollab.orchestrator.model;

/**
 * Hand-off requested by an agent. The executor only records it; the
 * orchestrator decides whether and how to act on it.
 */
public record DelegationRequest(String targetAgentId, String instructions) {}
