package com.agentcollab.orchestrator.persistence;

import com.agentcollab.orchestrator.collaboration.CollaborationEntry;
import com.agentcollab.orchestrator.model.Agent;
import com.agentcollab.orchestrator.model.AgentExecution;
import com.agentcollab.orchestrator.model.AgentTeam;
import com.agentcollab.orchestrator.model.TeamExecution;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link ExecutionStore}.
 *
 * Executions are kept as JSON snapshots rather than live objects, so a read
 * goes through the same serialisation a durable store would and callers can
 * never mutate what is stored. Agent and team definitions are registered by
 * whatever owns them (the CRUD services, or tests).
 */
@Repository
public class InMemoryExecutionStore implements ExecutionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryExecutionStore.class);

    private final Map<String, Agent>                    agents          = new ConcurrentHashMap<>();
    private final Map<String, AgentTeam>                teams           = new ConcurrentHashMap<>();
    private final Map<String, String>                   executions      = new ConcurrentHashMap<>();
    private final Map<String, String>                   agentExecutions = new ConcurrentHashMap<>();
    private final Map<String, List<CollaborationEntry>> logs            = new ConcurrentHashMap<>();

    private final ObjectMapper json;

    public InMemoryExecutionStore(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    // ------------------------------------------------------------------
    // Definitions
    // ------------------------------------------------------------------

    public void saveAgent(Agent agent) {
        agents.put(agent.id(), agent);
    }

    public void saveTeam(AgentTeam team) {
        teams.put(team.id(), team);
    }

    @Override
    public Optional<Agent> getAgent(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    @Override
    public Optional<AgentTeam> getTeam(String teamId) {
        return Optional.ofNullable(teams.get(teamId));
    }

    // ------------------------------------------------------------------
    // Executions
    // ------------------------------------------------------------------

    @Override
    public void saveExecution(TeamExecution execution) {
        executions.put(execution.getId(), write(execution));
    }

    @Override
    public void saveAgentExecution(AgentExecution execution) {
        agentExecutions.put(execution.getId(), write(execution));
    }

    @Override
    public void appendLogEntry(String teamExecutionId, CollaborationEntry entry) {
        List<CollaborationEntry> entries = logs.computeIfAbsent(teamExecutionId, k -> new ArrayList<>());
        synchronized (entries) {
            entries.add(entry);
        }
    }

    @Override
    public Optional<TeamExecution> findExecution(String teamExecutionId) {
        return Optional.ofNullable(executions.get(teamExecutionId)).map(s -> read(s, TeamExecution.class));
    }

    @Override
    public Optional<AgentExecution> findAgentExecution(String agentExecutionId) {
        return Optional.ofNullable(agentExecutions.get(agentExecutionId)).map(s -> read(s, AgentExecution.class));
    }

    @Override
    public List<CollaborationEntry> logEntries(String teamExecutionId) {
        List<CollaborationEntry> entries = logs.get(teamExecutionId);
        if (entries == null) return List.of();
        synchronized (entries) {
            List<CollaborationEntry> copy = new ArrayList<>(entries);
            copy.sort(CollaborationEntry.TOTAL_ORDER);
            return List.copyOf(copy);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private String write(Object execution) {
        try {
            return json.writeValueAsString(execution);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise " + execution.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(String stored, Class<T> type) {
        try {
            return json.readValue(stored, type);
        } catch (JsonProcessingException e) {
            log.error("Stored {} is unreadable", type.getSimpleName(), e);
            throw new IllegalStateException("Could not deserialise " + type.getSimpleName(), e);
        }
    }
}
