package com.agentcollab.orchestrator.orchestration;

import com.agentcollab.orchestrator.model.Agent;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Bounds delegation within one team run, whatever the configuration says.
 *
 * Two independent checks: every delegator has a budget of
 * {@code capabilities.maxDelegations} hand-offs, and no agent may be handed
 * work while it is already on the active delegation chain (A to B to A).
 * The hierarchical pattern additionally routes through each agent at most
 * once, tracked in the visited set.
 */
final class DelegationGuard {

    private final Map<String, Integer> used    = new HashMap<>();
    private final Deque<String>        chain   = new ArrayDeque<>();
    private final Set<String>          visited = new LinkedHashSet<>();

    /**
     * Charge one delegation to {@code from} and check the target is not on
     * the active chain.
     *
     * @throws DelegationLimitExceededException when the budget is spent or the hand-off would cycle
     */
    void authorize(Agent from, String targetAgentId) {
        int count = used.merge(from.id(), 1, Integer::sum);
        int max = from.capabilities().maxDelegations();
        if (count > max) {
            throw new DelegationLimitExceededException(from.id(),
                    "Agent %s exceeded its %d delegations".formatted(from.id(), max));
        }
        if (chain.contains(targetAgentId)) {
            throw new DelegationLimitExceededException(from.id(),
                    "Delegation %s -> %s would cycle through %s".formatted(from.id(), targetAgentId, chain));
        }
    }

    void enter(String agentId) {
        chain.push(agentId);
    }

    void exit(String agentId) {
        if (!agentId.equals(chain.peek())) {
            throw new IllegalStateException("Delegation chain out of order: expected " + chain.peek() + ", got " + agentId);
        }
        chain.pop();
    }

    /**
     * Mark an agent as routed to by the hierarchical pattern.
     *
     * @throws DelegationLimitExceededException if it has been routed to before
     */
    void visit(String fromAgentId, String agentId) {
        if (!visited.add(agentId)) {
            throw new DelegationLimitExceededException(fromAgentId,
                    "Routing %s -> %s revisits an agent already on the path %s".formatted(fromAgentId, agentId, visited));
        }
    }
}
