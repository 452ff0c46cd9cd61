package com.agentcollab.orchestrator.model;

/**
 * One seat on a team: which agent, in which role, with which priority.
 * Higher priority runs first under the PRIORITY order strategy and weighs
 * more in priority-weighted voting.
 */
public record TeamMember(String agentId, String role, int priority) {

    public TeamMember {
        if (agentId == null || agentId.isBlank()) throw new IllegalArgumentException("agentId is required");
        if (role == null) role = "member";
    }

    public static TeamMember of(String agentId, String role) {
        return new TeamMember(agentId, role, 0);
    }
}
