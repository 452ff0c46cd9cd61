package com.agentcollab.orchestrator.agent;

import com.agentcollab.orchestrator.llm.Message;
import com.agentcollab.orchestrator.llm.ModelInvocationException;
import com.agentcollab.orchestrator.llm.ModelInvocationService;
import com.agentcollab.orchestrator.llm.ModelResponse;
import com.agentcollab.orchestrator.llm.ToolSpec;
import com.agentcollab.orchestrator.memory.ConversationMemory;
import com.agentcollab.orchestrator.model.Agent;
import com.agentcollab.orchestrator.model.AgentExecution;
import com.agentcollab.orchestrator.model.AgentInput;
import com.agentcollab.orchestrator.model.AgentMetrics;
import com.agentcollab.orchestrator.model.AgentOutput;
import com.agentcollab.orchestrator.model.DelegationRequest;
import com.agentcollab.orchestrator.model.ExecutionError;
import com.agentcollab.orchestrator.model.SharedContextSnapshot;
import com.agentcollab.orchestrator.model.StepType;
import com.agentcollab.orchestrator.model.ToolCall;
import com.agentcollab.orchestrator.model.ToolCallResult;
import com.agentcollab.orchestrator.orchestration.ExecutionCancelledException;
import com.agentcollab.orchestrator.support.CancellationToken;
import com.agentcollab.orchestrator.support.RetryPolicy;
import com.agentcollab.orchestrator.tool.ToolExecutionContext;
import com.agentcollab.orchestrator.tool.ToolExecutionException;
import com.agentcollab.orchestrator.tool.ToolRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Runs one agent's reasoning loop to completion.
 *
 * For a given agent and input:
 *   1. Builds the system prompt, replays session memory and renders the
 *      shared context snapshot into the first user turn
 *   2. Calls the model; tool calls are executed through the
 *      {@link ToolRegistry} and their observations fed back
 *   3. Repeats until the model answers, asks to delegate, or a limit trips
 *
 * The executor never calls another agent and never writes shared state:
 * a delegation request is recorded in the output and the orchestrator acts
 * on it. Stateless and thread-safe; every call owns its own execution record.
 */
@Component
public class AgentExecutor {

    private static final Logger log = LoggerFactory.getLogger(AgentExecutor.class);

    private final ModelInvocationService model;
    private final ToolRegistry           tools;
    private final ConversationMemory     memory;
    private final MeterRegistry          meterRegistry;
    private final Clock                  clock;
    private final RetryPolicy            modelRetry;

    public AgentExecutor(ModelInvocationService model,
                         ToolRegistry tools,
                         ConversationMemory memory,
                         MeterRegistry meterRegistry,
                         Clock clock,
                         RetryPolicy modelRetryPolicy) {
        this.model         = model;
        this.tools         = tools;
        this.memory        = memory;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
        this.modelRetry    = modelRetryPolicy;
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    public AgentExecution execute(Agent agent, AgentInput input, SharedContextSnapshot snapshot) {
        return execute(agent, input, snapshot, new CancellationToken());
    }

    /**
     * Run the agent. Never throws for agent-level failures: the returned
     * execution is always terminal and carries the error instead.
     */
    public AgentExecution execute(Agent agent,
                                  AgentInput input,
                                  SharedContextSnapshot snapshot,
                                  CancellationToken token) {
        AgentExecution execution = new AgentExecution(UUID.randomUUID().toString(), agent.id(), input);
        try (MDC.MDCCloseable a = MDC.putCloseable("agentId", agent.id());
             MDC.MDCCloseable e = MDC.putCloseable("agentExecutionId", execution.getId())) {

            Run run = new Run(clock.instant());
            execution.start(run.startedAt);
            log.info("Agent {} starting (model {}, max {} iterations)",
                    agent.id(), agent.modelId(), agent.behavior().maxIterations());

            try {
                if (!agent.enabled()) {
                    throw new AgentRunException("AGENT_DISABLED", "Agent " + agent.id() + " is disabled");
                }
                loop(agent, input, snapshot, token, execution, run);
            } catch (ExecutionCancelledException ex) {
                execution.cancel(ex.getMessage(), run.partialOutput(), run.metrics(clock), clock.instant());
                log.info("Agent {} cancelled after {} iterations", agent.id(), run.iterations);
            } catch (AgentRunException ex) {
                fail(agent, execution, run, ex.code, ex.getMessage());
            } catch (ModelInvocationException ex) {
                if (token.isCancelled()) {
                    execution.cancel(token.reason(), run.partialOutput(), run.metrics(clock), clock.instant());
                } else {
                    fail(agent, execution, run, ex.code(), ex.getMessage());
                }
            } catch (RuntimeException ex) {
                if (token.isCancelled()) {
                    execution.cancel(token.reason(), run.partialOutput(), run.metrics(clock), clock.instant());
                } else {
                    log.error("Agent {} failed unexpectedly", agent.id(), ex);
                    fail(agent, execution, run, "INTERNAL_ERROR", ex.getMessage());
                }
            }

            meterRegistry.counter("agentcollab.agent.executions",
                    "status", execution.getStatus().name().toLowerCase()).increment();
            return execution;
        }
    }

    // ------------------------------------------------------------------
    // The loop
    // ------------------------------------------------------------------

    private void loop(Agent agent,
                      AgentInput input,
                      SharedContextSnapshot snapshot,
                      CancellationToken token,
                      AgentExecution execution,
                      Run run) {
        Agent.Capabilities caps = agent.capabilities();

        List<Message> messages = new ArrayList<>();
        messages.add(Message.system(PromptBuilder.systemPrompt(agent)));
        messages.addAll(replayMemory(agent, input));
        String userMessage = PromptBuilder.userMessage(input, caps.canAccessContext() ? snapshot : null);
        messages.add(Message.user(userMessage));

        List<ToolSpec> specs = caps.canUseTools() ? tools.specsFor(agent) : List.of();
        ToolExecutionContext toolContext = new ToolExecutionContext(
                input.teamExecutionId(), execution.getId(), agent.id(), null, true);

        int maxIterations = agent.behavior().maxIterations();
        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            token.throwIfCancelled();
            run.iterations = iteration;
            execution.addStep(StepType.THOUGHT,
                    "Iteration %d/%d: asking %s".formatted(iteration, maxIterations, agent.modelId()),
                    clock.instant());

            ModelResponse response = callModel(agent, messages, specs, token);
            run.inputTokens  += response.inputTokens();
            run.outputTokens += response.outputTokens();

            // --- Tool calls: execute, fold observations back, go again ---
            if (response.hasToolCalls()) {
                if (!caps.canUseTools()) {
                    throw new AgentRunException("TOOLS_NOT_ALLOWED",
                            "Agent " + agent.id() + " requested tools but may not use them");
                }
                messages.add(Message.assistant(response.content().isBlank()
                        ? describeCalls(response.toolCalls())
                        : response.content()));
                for (ToolCall call : response.toolCalls()) {
                    ToolCallResult result = runTool(agent, call, toolContext, token, execution, run);
                    messages.add(Message.tool(result.toObservation()));
                }
                continue;
            }

            String content = response.content();
            messages.add(Message.assistant(content));

            // --- Delegation: record and hand control back ---
            Optional<DelegationRequest> delegation = ResponseParser.extractDelegation(content);
            if (delegation.isPresent()) {
                if (caps.canDelegateToAgents()) {
                    DelegationRequest req = delegation.get();
                    execution.addStep(StepType.DELEGATION,
                            "Delegating to " + req.targetAgentId() + ": " + req.instructions(), clock.instant());
                    String remainder = ResponseParser.stripDelegation(content);
                    execution.complete(run.output(remainder.isEmpty() ? null : remainder, req),
                            run.metrics(clock), clock.instant());
                    log.info("Agent {} delegated to {} after {} iterations",
                            agent.id(), req.targetAgentId(), iteration);
                    return;
                }
                log.warn("Agent {} emitted a delegation tag but may not delegate; treating it as text", agent.id());
                content = ResponseParser.stripDelegation(content);
            }

            // --- Final answer ---
            String answer = ResponseParser.extractAnswer(content);
            if (answer.isEmpty()) {
                throw new AgentRunException("EMPTY_RESPONSE", "Model returned an empty answer");
            }
            execution.addStep(StepType.RESPONSE, answer, clock.instant());
            execution.complete(run.output(answer, null), run.metrics(clock), clock.instant());
            rememberExchange(agent, input, answer);
            log.info("Agent {} completed after {} iterations ({} tokens, {} tool calls)",
                    agent.id(), iteration, run.inputTokens + run.outputTokens, run.toolCalls);
            return;
        }

        throw new AgentRunException("MAX_ITERATIONS",
                "Max iterations (" + maxIterations + ") reached without a final answer");
    }

    private ModelResponse callModel(Agent agent, List<Message> messages, List<ToolSpec> specs,
                                    CancellationToken token) {
        List<Message> turn = List.copyOf(messages);
        try (CancellationToken.Registration ignored = token.interruptOnCancel()) {
            return modelRetry.execute("Model " + agent.modelId(),
                    () -> model.invoke(agent.modelId(), turn, specs, agent.modelConfig()),
                    e -> e instanceof ModelInvocationException mie && mie.isRetryable(),
                    token);
        }
    }

    private ToolCallResult runTool(Agent agent,
                                   ToolCall call,
                                   ToolExecutionContext context,
                                   CancellationToken token,
                                   AgentExecution execution,
                                   Run run) {
        Agent.Capabilities caps = agent.capabilities();
        if (run.toolCalls >= caps.maxToolCalls()) {
            throw new AgentRunException("TOOL_CALL_LIMIT",
                    "Agent " + agent.id() + " exceeded " + caps.maxToolCalls() + " tool calls");
        }
        token.throwIfCancelled();

        run.toolCalls++;
        run.calls.add(call);
        execution.addStep(StepType.TOOL_CALL, call.toolName() + " " + call.arguments(), clock.instant());

        ToolCallResult result;
        execution.markWaiting();
        try (CancellationToken.Registration ignored = token.interruptOnCancel()) {
            String output = tools.execute(agent, call, context, token);
            result = ToolCallResult.success(call.id(), call.toolName(), output);
        } catch (ToolExecutionException e) {
            if (token.isCancelled()) {
                throw new ExecutionCancelledException(token.reason());
            }
            log.warn("Tool '{}' failed for agent {}: {}", call.toolName(), agent.id(), e.getMessage());
            result = ToolCallResult.failure(call.id(), call.toolName(), e.getMessage());
        } finally {
            execution.markRunning();
        }

        run.results.add(result);
        execution.addStep(StepType.TOOL_RESULT, result.toObservation(), clock.instant());
        if (result.hasError() && agent.behavior().stopOnToolError()) {
            throw new AgentRunException("TOOL_ERROR", result.error());
        }
        return result;
    }

    // ------------------------------------------------------------------
    // Memory
    // ------------------------------------------------------------------

    private boolean usesMemory(Agent agent, AgentInput input) {
        return input.sessionId() != null
                && agent.capabilities().canAccessMemory()
                && agent.memory().type() != Agent.MemoryType.NONE;
    }

    private List<Message> replayMemory(Agent agent, AgentInput input) {
        if (!usesMemory(agent, input)) return List.of();
        List<Message> history = memory.history(input.sessionId(), agent.id(), agent.memory().maxMessages());
        if (agent.memory().includeSystemMessages()) return history;
        return history.stream().filter(m -> !"system".equals(m.role())).toList();
    }

    private void rememberExchange(Agent agent, AgentInput input, String answer) {
        if (!usesMemory(agent, input)) return;
        memory.append(input.sessionId(), agent.id(),
                List.of(Message.user(input.message()), Message.assistant(answer)));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void fail(Agent agent, AgentExecution execution, Run run, String code, String message) {
        execution.fail(new ExecutionError(code, message, agent.id()),
                run.partialOutput(), run.metrics(clock), clock.instant());
        log.warn("Agent {} failed with {}: {}", agent.id(), code, message);
    }

    private static String describeCalls(List<ToolCall> calls) {
        return "Calling tools: " + calls.stream().map(ToolCall::toolName).collect(Collectors.joining(", "));
    }

    /** Mutable bookkeeping of one execute() call. */
    private static final class Run {
        final Instant              startedAt;
        final List<ToolCall>       calls   = new ArrayList<>();
        final List<ToolCallResult> results = new ArrayList<>();
        long inputTokens;
        long outputTokens;
        int  toolCalls;
        int  iterations;

        Run(Instant startedAt) {
            this.startedAt = startedAt;
        }

        AgentOutput output(String response, DelegationRequest delegation) {
            return new AgentOutput(response, calls, results, delegation);
        }

        AgentOutput partialOutput() {
            return output(null, null);
        }

        AgentMetrics metrics(Clock clock) {
            long durationMs = Math.max(0, Duration.between(startedAt, clock.instant()).toMillis());
            return new AgentMetrics(inputTokens, outputTokens, inputTokens + outputTokens,
                    toolCalls, iterations, durationMs);
        }
    }

    /** Agent-level failure with the code the execution fails with. */
    private static final class AgentRunException extends RuntimeException {
        final String code;

        AgentRunException(String code, String message) {
            super(message);
            this.code = code;
        }
    }
}
