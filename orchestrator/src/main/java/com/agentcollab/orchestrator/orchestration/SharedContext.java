package com.agentcollab.orchestrator.orchestration;

import com.agentcollab.orchestrator.model.SharedContextPolicy;
import com.agentcollab.orchestrator.model.SharedContextSnapshot;
import com.agentcollab.orchestrator.model.SharedContextSnapshot.Contribution;
import com.agentcollab.orchestrator.model.SharedContextSnapshot.Kind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The one mutable shared context of a team run.
 *
 * Only the orchestrator's coordinating thread writes to it. Agents get an
 * immutable {@link SharedContextSnapshot} at launch and hand their
 * contributions back through the orchestrator, so there is nothing to lock.
 */
final class SharedContext {

    private final SharedContextPolicy policy;
    private final Map<String, Object> values;
    private final List<Contribution>  contributions = new ArrayList<>();

    SharedContext(SharedContextPolicy policy, Map<String, Object> seed) {
        this.policy = policy;
        this.values = seed == null ? Map.of() : seed;
    }

    /** @return whether the response was shared with the team */
    boolean addResponse(String agentId, String role, String response) {
        if (!policy.enabled() || !policy.shareResponses() || response == null || response.isBlank()) {
            return false;
        }
        contributions.add(new Contribution(agentId, role, Kind.RESPONSE, response));
        return true;
    }

    /** @return whether the tool result was shared with the team */
    boolean addToolResult(String agentId, String role, String observation) {
        if (!policy.enabled() || !policy.shareToolResults()) {
            return false;
        }
        contributions.add(new Contribution(agentId, role, Kind.TOOL_RESULT, observation));
        return true;
    }

    SharedContextSnapshot snapshot() {
        if (!policy.enabled()) {
            return SharedContextSnapshot.EMPTY;
        }
        return new SharedContextSnapshot(values, contributions);
    }
}
