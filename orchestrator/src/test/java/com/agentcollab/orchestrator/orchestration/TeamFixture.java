package com.agentcollab.orchestrator.orchestration;

import com.agentcollab.orchestrator.agent.AgentExecutor;
import com.agentcollab.orchestrator.consensus.AnswerEquivalence;
import com.agentcollab.orchestrator.consensus.ConsensusResolver;
import com.agentcollab.orchestrator.llm.ScriptedModel;
import com.agentcollab.orchestrator.memory.InMemoryConversationMemory;
import com.agentcollab.orchestrator.model.Agent;
import com.agentcollab.orchestrator.model.AgentExecution;
import com.agentcollab.orchestrator.model.AgentExecutionRef;
import com.agentcollab.orchestrator.model.AgentTeam;
import com.agentcollab.orchestrator.model.CollaborationPattern;
import com.agentcollab.orchestrator.model.TeamExecution;
import com.agentcollab.orchestrator.model.TeamInput;
import com.agentcollab.orchestrator.model.TeamMember;
import com.agentcollab.orchestrator.persistence.InMemoryExecutionStore;
import com.agentcollab.orchestrator.support.RetryPolicy;
import com.agentcollab.orchestrator.tool.ToolRegistry;
import com.agentcollab.orchestrator.tool.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Real orchestration stack over a scripted model and the in-memory store.
 * Each agent's model id equals its agent id, so scripts are keyed by agent.
 */
final class TeamFixture {

    final ScriptedModel          model  = new ScriptedModel();
    final SimpleMeterRegistry    meters = new SimpleMeterRegistry();
    final InMemoryExecutionStore store  = new InMemoryExecutionStore(new ObjectMapper().findAndRegisterModules());
    final ToolRegistry            tools;
    final AgentExecutor           executor;
    final TeamOrchestratorFactory factory;

    TeamFixture() {
        this(Clock.systemUTC());
    }

    TeamFixture(Clock clock) {
        tools    = new ToolRegistry((toolId, args, ctx) -> ToolResult.ok(toolId + " ok"),
                meters, new ObjectMapper(), clock, Duration.ZERO);
        executor = new AgentExecutor(model, tools, new InMemoryConversationMemory(), meters, clock, RetryPolicy.none());
        factory  = new TeamOrchestratorFactory(executor, store, new ConsensusResolver(new Random(7)),
                AnswerEquivalence.NORMALIZED, new Random(7), clock, meters);
    }

    Agent agent(String id) {
        return save(Agent.of(id, id));
    }

    Agent delegatingAgent(String id) {
        Agent a = Agent.of(id, id);
        return save(a.withCapabilities(a.capabilities().withDelegation(true)));
    }

    Agent save(Agent agent) {
        store.saveAgent(agent);
        return agent;
    }

    static AgentTeam team(CollaborationPattern pattern, TeamMember... members) {
        return AgentTeam.of("team-" + pattern.name().toLowerCase(), pattern, Arrays.asList(members));
    }

    TeamOrchestrator orchestrator(AgentTeam team, String task) {
        return factory.create(team, TeamInput.of(task));
    }

    TeamExecution run(AgentTeam team, String task) {
        return orchestrator(team, task).execute();
    }

    AgentExecution child(AgentExecutionRef ref) {
        return store.findAgentExecution(ref.executionId()).orElseThrow();
    }

    List<AgentExecution> children(TeamExecution execution) {
        return execution.getAgentExecutions().stream().map(this::child).toList();
    }

    /** Every child reference resolves to a stored, terminal agent execution of the same run. */
    void assertNoDanglingReferences(TeamExecution execution) {
        for (AgentExecutionRef ref : execution.getAgentExecutions()) {
            AgentExecution child = child(ref);
            assertThat(child.isTerminal()).as("child %s terminal", ref.executionId()).isTrue();
            assertThat(child.getTeamExecutionId()).isEqualTo(execution.getId());
            assertThat(child.getStatus()).isEqualTo(ref.status());
        }
    }
}
