package com.agentcollab.orchestrator.model;

/**
 * Static routing rule for the hierarchical pattern.
 *
 * @param condition     expression in the delegation condition grammar,
 *                      see {@code DelegationCondition}
 * @param targetAgentId agent that receives the work when the condition matches
 */
public record DelegationRule(String condition, String targetAgentId) {}
