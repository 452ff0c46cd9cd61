package com.agentcollab.orchestrator.model;

/**
 * What team members get to see of each other's work.
 */
public record SharedContextPolicy(boolean enabled, boolean shareToolResults, boolean shareResponses) {

    public static SharedContextPolicy defaults() { return new SharedContextPolicy(true, true, true); }
    public static SharedContextPolicy disabled() { return new SharedContextPolicy(false, false, false); }
}
