package com.agentcollab.orchestrator.service;

import com.agentcollab.orchestrator.agent.AgentExecutor;
import com.agentcollab.orchestrator.consensus.AnswerEquivalence;
import com.agentcollab.orchestrator.consensus.ConsensusResolver;
import com.agentcollab.orchestrator.llm.ModelResponse;
import com.agentcollab.orchestrator.llm.ModelTimeoutException;
import com.agentcollab.orchestrator.llm.ScriptedModel;
import com.agentcollab.orchestrator.memory.InMemoryConversationMemory;
import com.agentcollab.orchestrator.model.Agent;
import com.agentcollab.orchestrator.model.AgentExecution;
import com.agentcollab.orchestrator.model.AgentInput;
import com.agentcollab.orchestrator.model.AgentStatus;
import com.agentcollab.orchestrator.model.AgentTeam;
import com.agentcollab.orchestrator.model.CollaborationPattern;
import com.agentcollab.orchestrator.model.TeamExecution;
import com.agentcollab.orchestrator.model.TeamInput;
import com.agentcollab.orchestrator.model.TeamMember;
import com.agentcollab.orchestrator.orchestration.TeamOrchestratorFactory;
import com.agentcollab.orchestrator.persistence.InMemoryExecutionStore;
import com.agentcollab.orchestrator.support.RetryPolicy;
import com.agentcollab.orchestrator.tool.ToolRegistry;
import com.agentcollab.orchestrator.tool.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TeamExecutionServiceTest {

    /** Wall clock the test moves by hand. */
    static class MutableClock extends Clock {
        volatile Instant now = Instant.parse("2026-05-01T12:00:00Z");

        @Override public ZoneOffset getZone()        { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }
        @Override public Instant instant()           { return now; }
    }

    MutableClock           clock;
    ScriptedModel          model;
    InMemoryExecutionStore store;
    ExecutorService        workers;
    TeamExecutionService   service;

    @BeforeEach
    void setUp() {
        clock   = new MutableClock();
        model   = new ScriptedModel();
        store   = new InMemoryExecutionStore(new ObjectMapper().findAndRegisterModules());
        workers = Executors.newSingleThreadExecutor();

        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        ToolRegistry tools = new ToolRegistry((toolId, args, ctx) -> ToolResult.ok("ok"),
                meters, new ObjectMapper(), clock, Duration.ZERO);
        AgentExecutor executor = new AgentExecutor(model, tools, new InMemoryConversationMemory(),
                meters, clock, RetryPolicy.none());
        TeamOrchestratorFactory factory = new TeamOrchestratorFactory(executor, store,
                new ConsensusResolver(new Random(1)), AnswerEquivalence.NORMALIZED, new Random(1), clock, meters);
        service = new TeamExecutionService(store, executor, factory, workers, clock, Duration.ofSeconds(30));

        store.saveAgent(Agent.of("a", "a"));
        store.saveAgent(Agent.of("b", "b"));
        store.saveTeam(AgentTeam.of("duo", CollaborationPattern.SEQUENTIAL,
                List.of(TeamMember.of("a", "first"), TeamMember.of("b", "second"))));
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    private TeamExecution awaitStored(String id) throws InterruptedException {
        workers.shutdown();
        assertThat(workers.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        return store.findExecution(id).orElseThrow();
    }

    // ------------------------------------------------------------------
    // Single agent
    // ------------------------------------------------------------------

    @Test
    void executeAgent_runsAndSaves() {
        model.reply("a", "hello");

        AgentExecution run = service.executeAgent("a", AgentInput.of("Say hello"));

        assertThat(run.getStatus()).isEqualTo(AgentStatus.COMPLETED);
        assertThat(run.response()).isEqualTo("hello");
        assertThat(store.findAgentExecution(run.getId())).isPresent();
    }

    @Test
    void executeAgent_unknownAgent_throwsNotFound() {
        assertThatThrownBy(() -> service.executeAgent("ghost", AgentInput.of("hi")))
                .isInstanceOf(NotFoundException.class)
                .satisfies(e -> assertThat(((NotFoundException) e).getKind()).isEqualTo("Agent"));
    }

    // ------------------------------------------------------------------
    // Teams
    // ------------------------------------------------------------------

    @Test
    void executeTeam_returnsTerminalExecutionAndForgetsIt() {
        model.reply("a", "draft");
        model.reply("b", "final");

        TeamExecution run = service.executeTeam("duo", TeamInput.of("Write"));

        assertThat(run.getStatus()).isEqualTo(AgentStatus.COMPLETED);
        assertThat(run.response()).isEqualTo("final");
        assertThat(service.activeCount()).isZero();
        assertThat(service.findExecution(run.getId())).get()
                .extracting(TeamExecution::getStatus).isEqualTo(AgentStatus.COMPLETED);
    }

    @Test
    void executeTeam_unknownTeam_throwsNotFound() {
        assertThatThrownBy(() -> service.executeTeam("nobody", TeamInput.of("Write")))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("nobody");
    }

    @Test
    void submitTeam_runsInBackground() throws Exception {
        model.reply("a", "draft");
        model.reply("b", "final");

        TeamExecution submitted = service.submitTeam("duo", TeamInput.of("Write"));
        TeamExecution stored = awaitStored(submitted.getId());

        assertThat(stored.getStatus()).isEqualTo(AgentStatus.COMPLETED);
        assertThat(stored.response()).isEqualTo("final");
        assertThat(service.activeCount()).isZero();
    }

    @Test
    void submitTeam_poolRejects_runCancelledAndRethrown() {
        workers.shutdown();

        assertThatThrownBy(() -> service.submitTeam("duo", TeamInput.of("Write")))
                .isInstanceOf(RejectedExecutionException.class);
        assertThat(service.activeCount()).isZero();
        assertThat(model.callCount()).isZero();
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    @Test
    void cancelExecution_unknownId_throwsNotFound() {
        assertThatThrownBy(() -> service.cancelExecution("nope")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void cancelExecution_finishedRun_returnsFalse() {
        model.reply("a", "draft");
        model.reply("b", "final");
        TeamExecution run = service.executeTeam("duo", TeamInput.of("Write"));

        assertThat(service.cancelExecution(run.getId())).isFalse();
    }

    @Test
    void cancelExecution_activeRun_endsCancelled() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        model.always("a", messages -> {
            entered.countDown();
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ModelTimeoutException("interrupted", e);
            }
            return ModelResponse.text("too late", 10, 5);
        });

        TeamExecution submitted = service.submitTeam("duo", TeamInput.of("Write"));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(service.findExecution(submitted.getId())).get()
                .extracting(TeamExecution::getStatus).isEqualTo(AgentStatus.RUNNING);
        assertThat(service.cancelExecution(submitted.getId())).isTrue();

        TeamExecution stored = awaitStored(submitted.getId());
        assertThat(stored.getStatus()).isEqualTo(AgentStatus.CANCELLED);
        assertThat(stored.getError().message()).isEqualTo("Cancelled by caller");
        assertThat(model.callsFor("b")).isEmpty();
    }

    @Test
    void watchdog_cancelsRunPastMaxDurationPlusGrace() {
        AgentTeam bounded = AgentTeam.of("bounded", CollaborationPattern.SEQUENTIAL,
                List.of(TeamMember.of("a", "first"), TeamMember.of("b", "second")));
        store.saveTeam(bounded.withTermination(bounded.termination().withMaxDuration(Duration.ofMinutes(1))));
        model.always("a", messages -> {
            clock.now = clock.now.plusSeconds(80);
            service.cancelOverdueExecutions();
            clock.now = clock.now.plusSeconds(20);
            service.cancelOverdueExecutions();
            return ModelResponse.text("slow answer", 10, 5);
        });

        TeamExecution run = service.executeTeam("bounded", TeamInput.of("Write"));

        assertThat(run.getStatus()).isEqualTo(AgentStatus.CANCELLED);
        assertThat(run.getError().message()).startsWith("Exceeded maxDuration PT1M");
        assertThat(model.callsFor("b")).isEmpty();
    }
}
