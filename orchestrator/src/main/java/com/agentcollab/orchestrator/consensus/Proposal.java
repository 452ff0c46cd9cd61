package com.agentcollab.orchestrator.consensus;

/** One agent's candidate answer, carrying the agent's team priority as its vote weight. */
public record Proposal(String agentId, String answer, int priority) {}
