package com.agentcollab.orchestrator.persistence;

import com.agentcollab.orchestrator.collaboration.CollaborationEntry;
import com.agentcollab.orchestrator.model.Agent;
import com.agentcollab.orchestrator.model.AgentExecution;
import com.agentcollab.orchestrator.model.AgentTeam;
import com.agentcollab.orchestrator.model.TeamExecution;

import java.util.List;
import java.util.Optional;

/**
 * Durable append/replace contract the orchestrator writes through.
 *
 * {@code save*} calls replace the stored copy of an execution; the
 * orchestrator calls {@link #saveExecution} after every absorbed child, so
 * a poller always sees the latest checkpoint. Log entries are appended as
 * they happen and never rewritten.
 */
public interface ExecutionStore {

    Optional<Agent> getAgent(String agentId);

    Optional<AgentTeam> getTeam(String teamId);

    void saveExecution(TeamExecution execution);

    void saveAgentExecution(AgentExecution execution);

    void appendLogEntry(String teamExecutionId, CollaborationEntry entry);

    Optional<TeamExecution> findExecution(String teamExecutionId);

    Optional<AgentExecution> findAgentExecution(String agentExecutionId);

    /** Every entry appended for the team execution, in total order. */
    List<CollaborationEntry> logEntries(String teamExecutionId);
}
