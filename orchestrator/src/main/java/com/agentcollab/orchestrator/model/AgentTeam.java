package com.agentcollab.orchestrator.model;

import java.util.List;
import java.util.Optional;

/**
 * Immutable team definition: members, one collaboration pattern and its
 * configuration, the shared-context policy and the termination policy.
 */
public record AgentTeam(
        String               id,
        String               name,
        boolean              enabled,
        List<TeamMember>     members,
        CollaborationPattern pattern,
        PatternConfig        patternConfig,
        SharedContextPolicy  sharedContext,
        TerminationPolicy    termination) {

    public AgentTeam {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Team id is required");
        if (pattern == null) throw new IllegalArgumentException("Team pattern is required");
        if (name == null)          name = id;
        members = members == null ? List.of() : List.copyOf(members);
        if (patternConfig == null) patternConfig = PatternConfig.defaults();
        if (sharedContext == null) sharedContext = SharedContextPolicy.defaults();
        if (termination == null)   termination = TerminationPolicy.defaults();
    }

    public static AgentTeam of(String id, CollaborationPattern pattern, List<TeamMember> members) {
        return new AgentTeam(id, id, true, members, pattern, null, null, null);
    }

    public Optional<TeamMember> member(String agentId) {
        return members.stream().filter(m -> m.agentId().equals(agentId)).findFirst();
    }

    public Optional<TeamMember> memberWithRole(String role) {
        return members.stream().filter(m -> m.role().equalsIgnoreCase(role)).findFirst();
    }

    public AgentTeam withPatternConfig(PatternConfig config) {
        return new AgentTeam(id, name, enabled, members, pattern, config, sharedContext, termination);
    }

    public AgentTeam withSharedContext(SharedContextPolicy policy) {
        return new AgentTeam(id, name, enabled, members, pattern, patternConfig, policy, termination);
    }

    public AgentTeam withTermination(TerminationPolicy policy) {
        return new AgentTeam(id, name, enabled, members, pattern, patternConfig, sharedContext, policy);
    }

    public AgentTeam withEnabled(boolean flag) {
        return new AgentTeam(id, name, flag, members, pattern, patternConfig, sharedContext, termination);
    }
}
