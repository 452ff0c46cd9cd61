package com.agentcollab.orchestrator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of a team's shared context, handed to an agent at launch.
 *
 * @param values        seed values from the team input
 * @param contributions teammates' responses and tool results, oldest first
 */
public record SharedContextSnapshot(Map<String, Object> values, List<Contribution> contributions) {

    public static final SharedContextSnapshot EMPTY = new SharedContextSnapshot(Map.of(), List.of());

    public enum Kind { RESPONSE, TOOL_RESULT }

    public record Contribution(String agentId, String role, Kind kind, String content) {}

    public SharedContextSnapshot {
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
        contributions = contributions == null ? List.of() : List.copyOf(contributions);
    }

    public boolean isEmpty() {
        return values.isEmpty() && contributions.isEmpty();
    }
}
