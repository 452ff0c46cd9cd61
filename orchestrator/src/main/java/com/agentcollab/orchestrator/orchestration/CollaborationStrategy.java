package com.agentcollab.orchestrator.orchestration;

import com.agentcollab.orchestrator.model.AgentTeam;
import com.agentcollab.orchestrator.model.TeamInput;

/**
 * Control flow of one collaboration pattern.
 *
 * Strategies run on the orchestrator's coordinating thread and go through
 * the {@link OrchestrationContext} for every agent run, log entry and
 * termination check. They throw {@link OrchestrationException} for fatal
 * failures and return an outcome otherwise.
 */
@FunctionalInterface
interface CollaborationStrategy {

    PatternOutcome run(AgentTeam team, TeamInput input, OrchestrationContext ctx);
}
