package com.agentcollab.orchestrator.persistence;

import com.agentcollab.orchestrator.collaboration.CollaborationEntry;
import com.agentcollab.orchestrator.collaboration.CollaborationEventType;
import com.agentcollab.orchestrator.collaboration.CollaborationLog;
import com.agentcollab.orchestrator.collaboration.OrchestratorClock;
import com.agentcollab.orchestrator.model.AgentExecution;
import com.agentcollab.orchestrator.model.AgentInput;
import com.agentcollab.orchestrator.model.AgentMetrics;
import com.agentcollab.orchestrator.model.AgentOutput;
import com.agentcollab.orchestrator.model.AgentStatus;
import com.agentcollab.orchestrator.model.AgentTeam;
import com.agentcollab.orchestrator.model.CollaborationPattern;
import com.agentcollab.orchestrator.model.StepType;
import com.agentcollab.orchestrator.model.TeamExecution;
import com.agentcollab.orchestrator.model.TeamInput;
import com.agentcollab.orchestrator.model.TeamMember;
import com.agentcollab.orchestrator.model.TeamOutput;
import com.agentcollab.orchestrator.model.ToolCall;
import com.agentcollab.orchestrator.model.ToolCallResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryExecutionStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    InMemoryExecutionStore store;
    AgentTeam team;

    @BeforeEach
    void setUp() {
        store = new InMemoryExecutionStore(new ObjectMapper().findAndRegisterModules());
        team  = AgentTeam.of("writers", CollaborationPattern.SEQUENTIAL, List.of(TeamMember.of("a", "writer")));
    }

    private AgentExecution finishedChild(String teamExecutionId) {
        AgentExecution child = new AgentExecution("child-1", "a",
                new AgentInput("Write", Map.of("tone", "dry"), null, teamExecutionId));
        child.start(T0);
        child.addStep(StepType.TOOL_CALL, "search {q=java}", T0);
        ToolCall call = new ToolCall("c1", "search", Map.of("q", "java"));
        child.complete(new AgentOutput("done", List.of(call),
                        List.of(ToolCallResult.success("c1", "search", "3 hits")), null),
                new AgentMetrics(10, 5, 15, 1, 2, 40), T0.plusSeconds(1));
        return child;
    }

    @Test
    void agentExecution_reloadedWithStepsOutputAndMetrics() {
        AgentExecution child = finishedChild("team-1");
        store.saveAgentExecution(child);

        AgentExecution loaded = store.findAgentExecution("child-1").orElseThrow();

        assertThat(loaded.getStatus()).isEqualTo(AgentStatus.COMPLETED);
        assertThat(loaded.getTeamExecutionId()).isEqualTo("team-1");
        assertThat(loaded.getOutput()).isEqualTo(child.getOutput());
        assertThat(loaded.getMetrics()).isEqualTo(child.getMetrics());
        assertThat(loaded.getSteps()).isEqualTo(child.getSteps());
        assertThat(loaded.getInput().context()).containsEntry("tone", "dry");
    }

    @Test
    void teamExecution_reloadedWithChildrenOutputAndFrozenLog() {
        CollaborationLog log = new CollaborationLog(new OrchestratorClock(Clock.fixed(T0, ZoneOffset.UTC)), null);
        TeamExecution execution = new TeamExecution("team-1", team, TeamInput.of("Write"), log);
        execution.start(T0);
        log.append(CollaborationEventType.MESSAGE, "a", null, "done");
        execution.addAgentExecution(finishedChild("team-1"), "writer");
        execution.complete(new TeamOutput("done", List.of(), null), null, T0.plusSeconds(2));
        store.saveExecution(execution);

        TeamExecution loaded = store.findExecution("team-1").orElseThrow();

        assertThat(loaded.getStatus()).isEqualTo(AgentStatus.COMPLETED);
        assertThat(loaded.response()).isEqualTo("done");
        assertThat(loaded.getAgentExecutions()).isEqualTo(execution.getAgentExecutions());
        assertThat(loaded.getCollaborationLog().entries()).isEqualTo(log.entries());
        assertThat(loaded.getCollaborationLog().isFrozen()).isTrue();
        assertThat(loaded.getCompletedAt()).isEqualTo(T0.plusSeconds(2));
    }

    @Test
    void reloadedLog_isReadOnly() {
        CollaborationLog log = new CollaborationLog(new OrchestratorClock(Clock.fixed(T0, ZoneOffset.UTC)), null);
        TeamExecution execution = new TeamExecution("team-2", team, TeamInput.of("Write"), log);
        store.saveExecution(execution);

        CollaborationLog loaded = store.findExecution("team-2").orElseThrow().getCollaborationLog();

        assertThatThrownBy(() -> loaded.append(CollaborationEventType.MESSAGE, "a", null, "late"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void savedExecution_laterChangesNotVisibleUntilSavedAgain() {
        CollaborationLog log = new CollaborationLog(new OrchestratorClock(Clock.fixed(T0, ZoneOffset.UTC)), null);
        TeamExecution execution = new TeamExecution("team-3", team, TeamInput.of("Write"), log);
        store.saveExecution(execution);

        execution.start(T0);

        assertThat(store.findExecution("team-3").orElseThrow().getStatus()).isEqualTo(AgentStatus.IDLE);
        store.saveExecution(execution);
        assertThat(store.findExecution("team-3").orElseThrow().getStatus()).isEqualTo(AgentStatus.RUNNING);
    }

    @Test
    void logEntries_returnedInTotalOrderWhateverTheAppendOrder() {
        CollaborationEntry late  = new CollaborationEntry(1, T0.plusSeconds(5), CollaborationEventType.MESSAGE, "a", null, "late");
        CollaborationEntry early = new CollaborationEntry(2, T0, CollaborationEventType.VOTE, "b", null, "early");
        CollaborationEntry tie   = new CollaborationEntry(3, T0, CollaborationEventType.VOTE, "c", null, "tie");

        store.appendLogEntry("team-4", late);
        store.appendLogEntry("team-4", tie);
        store.appendLogEntry("team-4", early);

        assertThat(store.logEntries("team-4")).containsExactly(early, tie, late);
        assertThat(store.logEntries("unknown")).isEmpty();
    }

    @Test
    void unknownIds_empty() {
        assertThat(store.findExecution("nope")).isEmpty();
        assertThat(store.findAgentExecution("nope")).isEmpty();
        assertThat(store.getAgent("nope")).isEmpty();
        assertThat(store.getTeam("nope")).isEmpty();
    }
}
