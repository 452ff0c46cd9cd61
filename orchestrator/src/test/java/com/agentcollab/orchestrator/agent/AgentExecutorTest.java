package com.agentcollab.orchestrator.agent;

import com.agentcollab.orchestrator.llm.Message;
import com.agentcollab.orchestrator.llm.ModelResponse;
import com.agentcollab.orchestrator.llm.ModelTimeoutException;
import com.agentcollab.orchestrator.llm.ScriptedModel;
import com.agentcollab.orchestrator.memory.InMemoryConversationMemory;
import com.agentcollab.orchestrator.model.Agent;
import com.agentcollab.orchestrator.model.AgentExecution;
import com.agentcollab.orchestrator.model.AgentInput;
import com.agentcollab.orchestrator.model.AgentStatus;
import com.agentcollab.orchestrator.model.ExecutionStep;
import com.agentcollab.orchestrator.model.SharedContextSnapshot;
import com.agentcollab.orchestrator.model.StepType;
import com.agentcollab.orchestrator.model.ToolCall;
import com.agentcollab.orchestrator.support.CancellationToken;
import com.agentcollab.orchestrator.support.RetryPolicy;
import com.agentcollab.orchestrator.tool.ToolDefinition;
import com.agentcollab.orchestrator.tool.ToolExecutionService;
import com.agentcollab.orchestrator.tool.ToolRegistry;
import com.agentcollab.orchestrator.tool.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for AgentExecutor.
 *
 * The model is scripted turn by turn and the tool executor is a Mockito
 * mock, so every branch of the loop runs without network access.
 */
@ExtendWith(MockitoExtension.class)
class AgentExecutorTest {

    @Mock ToolExecutionService toolService;

    ScriptedModel              model;
    ToolRegistry               registry;
    InMemoryConversationMemory memory;
    SimpleMeterRegistry        meters;
    AgentExecutor              executor;

    Agent agent = Agent.of("writer", "model-w");

    @BeforeEach
    void setUp() {
        model    = new ScriptedModel();
        meters   = new SimpleMeterRegistry();
        memory   = new InMemoryConversationMemory();
        registry = new ToolRegistry(toolService, meters, new ObjectMapper(), Clock.systemUTC(), Duration.ZERO);
        registry.register(ToolDefinition.of("search", "Search the web"));
        executor = new AgentExecutor(model, registry, memory, meters, Clock.systemUTC(), RetryPolicy.of(2, Duration.ZERO));
    }

    static ModelResponse toolTurn(String tool, Map<String, Object> args) {
        return new ModelResponse("", List.of(new ToolCall("call-1", tool, args)), 10, 5);
    }

    // ------------------------------------------------------------------
    // Happy paths
    // ------------------------------------------------------------------

    @Test
    void execute_plainAnswer_completesWithResponseAndMetrics() {
        model.reply("model-w", "<result>Hello team</result>");

        AgentExecution run = executor.execute(agent, AgentInput.of("Say hello"), SharedContextSnapshot.EMPTY);

        assertThat(run.getStatus()).isEqualTo(AgentStatus.COMPLETED);
        assertThat(run.response()).isEqualTo("Hello team");
        assertThat(run.getMetrics().totalTokens()).isEqualTo(15);
        assertThat(run.getMetrics().iterations()).isEqualTo(1);
        assertThat(run.getSteps()).extracting(ExecutionStep::type)
                .containsExactly(StepType.THOUGHT, StepType.RESPONSE);
        assertThat(meters.counter("agentcollab.agent.executions", "status", "completed").count()).isEqualTo(1.0);
    }

    @Test
    void execute_toolCallThenAnswer_feedsObservationBack() {
        Agent withTools = agent.withTools(List.of("search"));
        when(toolService.execute(eq("search"), any(), any())).thenReturn(ToolResult.ok("3 results"));
        model.then("model-w", m -> toolTurn("search", Map.of("q", "java")))
             .reply("model-w", "Found three");

        AgentExecution run = executor.execute(withTools, AgentInput.of("Look it up"), SharedContextSnapshot.EMPTY);

        assertThat(run.getStatus()).isEqualTo(AgentStatus.COMPLETED);
        assertThat(run.getOutput().toolCalls()).hasSize(1);
        assertThat(run.getOutput().toolResults().get(0).result()).isEqualTo("3 results");
        assertThat(run.getMetrics().toolCalls()).isEqualTo(1);
        assertThat(run.getSteps()).extracting(ExecutionStep::type).containsExactly(
                StepType.THOUGHT, StepType.TOOL_CALL, StepType.TOOL_RESULT, StepType.THOUGHT, StepType.RESPONSE);

        List<Message> second = model.calls().get(1).messages();
        assertThat(second.get(second.size() - 1).content()).contains("3 results");
    }

    @Test
    void execute_sharedContextSnapshot_renderedIntoUserTurn() {
        model.reply("model-w", "ok");
        SharedContextSnapshot snapshot = new SharedContextSnapshot(Map.of("goal", "ship it"), List.of(
                new SharedContextSnapshot.Contribution("critic", "reviewer", SharedContextSnapshot.Kind.RESPONSE, "Looks fine")));

        executor.execute(agent, AgentInput.of("Continue"), snapshot);

        String user = model.calls().get(0).lastUserMessage();
        assertThat(user).contains("=== SHARED CONTEXT ===").contains("goal: ship it").contains("Looks fine");
        assertThat(user).endsWith("Continue");
    }

    @Test
    void execute_delegationTag_completesWithRequest() {
        Agent delegator = agent.withCapabilities(agent.capabilities().withDelegation(true));
        model.reply("model-w", "<delegate to=\"researcher\">Find the numbers</delegate>");

        AgentExecution run = executor.execute(delegator, AgentInput.of("Write the report"), SharedContextSnapshot.EMPTY);

        assertThat(run.getStatus()).isEqualTo(AgentStatus.COMPLETED);
        assertThat(run.getOutput().delegation().targetAgentId()).isEqualTo("researcher");
        assertThat(run.getOutput().delegation().instructions()).isEqualTo("Find the numbers");
        assertThat(run.getSteps()).extracting(ExecutionStep::type).contains(StepType.DELEGATION);
    }

    @Test
    void execute_delegationTagWithoutCapability_treatedAsText() {
        model.reply("model-w", "Answer. <delegate to=\"x\">do it</delegate>");

        AgentExecution run = executor.execute(agent, AgentInput.of("Task"), SharedContextSnapshot.EMPTY);

        assertThat(run.getOutput().delegation()).isNull();
        assertThat(run.response()).isEqualTo("Answer.");
    }

    @Test
    void execute_sessionId_replaysAndAppendsMemory() {
        model.reply("model-w", "first answer", "second answer");

        executor.execute(agent, new AgentInput("first question", null, "s-1", null), SharedContextSnapshot.EMPTY);
        executor.execute(agent, new AgentInput("second question", null, "s-1", null), SharedContextSnapshot.EMPTY);

        List<Message> replayed = model.calls().get(1).messages();
        assertThat(replayed).extracting(Message::content).contains("first question", "first answer");
        assertThat(memory.history("s-1", "writer", 10)).hasSize(4);
    }

    // ------------------------------------------------------------------
    // Failures
    // ------------------------------------------------------------------

    @Test
    void execute_disabledAgent_failsWithoutCallingModel() {
        AgentExecution run = executor.execute(agent.withEnabled(false), AgentInput.of("x"), SharedContextSnapshot.EMPTY);

        assertThat(run.getStatus()).isEqualTo(AgentStatus.FAILED);
        assertThat(run.getError().code()).isEqualTo("AGENT_DISABLED");
        assertThat(run.getError().agentId()).isEqualTo("writer");
        assertThat(model.callCount()).isZero();
    }

    @Test
    void execute_neverAnswers_failsWithMaxIterations() {
        Agent limited = agent.withTools(List.of("search"))
                .withBehavior(agent.behavior().withMaxIterations(2));
        when(toolService.execute(any(), any(), any())).thenReturn(ToolResult.ok("more"));
        model.always("model-w", m -> toolTurn("search", Map.of()));

        AgentExecution run = executor.execute(limited, AgentInput.of("loop"), SharedContextSnapshot.EMPTY);

        assertThat(run.getStatus()).isEqualTo(AgentStatus.FAILED);
        assertThat(run.getError().code()).isEqualTo("MAX_ITERATIONS");
        assertThat(run.getMetrics().iterations()).isEqualTo(2);
    }

    @Test
    void execute_emptyAnswer_failsWithEmptyResponse() {
        model.reply("model-w", "   ");

        AgentExecution run = executor.execute(agent, AgentInput.of("x"), SharedContextSnapshot.EMPTY);

        assertThat(run.getError().code()).isEqualTo("EMPTY_RESPONSE");
    }

    @Test
    void execute_toolNotOnAllowlist_errorFedBackToModel() {
        model.then("model-w", m -> toolTurn("search", Map.of()))
             .reply("model-w", "Never mind");

        AgentExecution run = executor.execute(agent, AgentInput.of("x"), SharedContextSnapshot.EMPTY);

        assertThat(run.getStatus()).isEqualTo(AgentStatus.COMPLETED);
        assertThat(run.getOutput().toolResults().get(0).error()).contains("NOT_PERMITTED");
        verify(toolService, never()).execute(any(), any(), any());
    }

    @Test
    void execute_toolErrorWithStopOnToolError_fails() {
        Agent strict = agent.withTools(List.of("search"))
                .withBehavior(agent.behavior().withStopOnToolError(true));
        when(toolService.execute(any(), any(), any())).thenReturn(ToolResult.error("index offline"));
        model.then("model-w", m -> toolTurn("search", Map.of()));

        AgentExecution run = executor.execute(strict, AgentInput.of("x"), SharedContextSnapshot.EMPTY);

        assertThat(run.getStatus()).isEqualTo(AgentStatus.FAILED);
        assertThat(run.getError().code()).isEqualTo("TOOL_ERROR");
    }

    @Test
    void execute_transientModelTimeout_retriedThenSucceeds() {
        model.then("model-w", m -> { throw new ModelTimeoutException("slow", null); })
             .reply("model-w", "made it");

        AgentExecution run = executor.execute(agent, AgentInput.of("x"), SharedContextSnapshot.EMPTY);

        assertThat(run.getStatus()).isEqualTo(AgentStatus.COMPLETED);
        assertThat(model.callCount()).isEqualTo(2);
    }

    @Test
    void execute_modelKeepsTimingOut_failsWithModelCode() {
        model.always("model-w", m -> { throw new ModelTimeoutException("slow", null); });

        AgentExecution run = executor.execute(agent, AgentInput.of("x"), SharedContextSnapshot.EMPTY);

        assertThat(run.getStatus()).isEqualTo(AgentStatus.FAILED);
        assertThat(run.getError().code()).isEqualTo("MODEL_TIMEOUT");
        assertThat(model.callCount()).isEqualTo(3);   // first attempt + 2 retries
    }

    @Test
    void execute_tokenAlreadyCancelled_cancelledWithoutModelCall() {
        CancellationToken token = new CancellationToken();
        token.cancel("user abort");

        AgentExecution run = executor.execute(agent, AgentInput.of("x"), SharedContextSnapshot.EMPTY, token);

        assertThat(run.getStatus()).isEqualTo(AgentStatus.CANCELLED);
        assertThat(model.callCount()).isZero();
    }
}
