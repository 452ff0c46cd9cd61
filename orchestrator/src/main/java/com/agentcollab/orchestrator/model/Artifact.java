package com.agentcollab.orchestrator.model;

/** A piece of team output tagged with the agent that produced it. */
public record Artifact(String type, String content, String producedBy) {}
