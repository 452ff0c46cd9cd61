package com.agentcollab.orchestrator.tool;

import com.agentcollab.orchestrator.llm.ToolSpec;
import com.agentcollab.orchestrator.model.Agent;
import com.agentcollab.orchestrator.model.ToolCall;
import com.agentcollab.orchestrator.support.CancellationToken;
import com.agentcollab.orchestrator.support.RetryPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process catalogue of the tools agents may call.
 *
 * Every {@link ToolDefinition} bean is collected at startup; more can be
 * registered at runtime. Responsibilities:
 * <ol>
 *   <li>Allowlist enforcement: an agent only sees, and can only call, the
 *       enabled tools its configuration lists.</li>
 *   <li>Permission and rate-limit checks before anything leaves the JVM.</li>
 *   <li>Metrics-instrumented execution with bounded retry, so no caller
 *       repeats the timing, counting and backoff boilerplate.</li>
 * </ol>
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, ToolDefinition> tools = new ConcurrentHashMap<>();
    private final Map<String, Deque<Instant>> recentCalls = new ConcurrentHashMap<>();

    private final ToolExecutionService executor;
    private final MeterRegistry        meterRegistry;
    private final ObjectMapper         json;
    private final Clock                clock;
    private final Duration             initialBackoff;

    public ToolRegistry(ToolExecutionService executor,
                        MeterRegistry meterRegistry,
                        ObjectMapper objectMapper,
                        Clock clock,
                        Duration initialBackoff) {
        this.executor       = executor;
        this.meterRegistry  = meterRegistry;
        this.json           = objectMapper;
        this.clock          = clock;
        this.initialBackoff = initialBackoff;
    }

    @Autowired
    public ToolRegistry(ObjectProvider<ToolDefinition> definitions,
                        ToolExecutionService executor,
                        MeterRegistry meterRegistry,
                        ObjectMapper objectMapper,
                        Clock clock,
                        @Value("${agentcollab.tool.initial-backoff:PT0.1S}") Duration initialBackoff) {
        this(executor, meterRegistry, objectMapper, clock, initialBackoff);
        definitions.orderedStream().forEach(this::register);
    }

    // ------------------------------------------------------------------
    // Registration and lookup
    // ------------------------------------------------------------------

    public void register(ToolDefinition tool) {
        tools.put(tool.id(), tool);
        log.info("Registered tool '{}' as '{}' (timeout {}, {} retries)",
                tool.id(), tool.name(), tool.execution().timeout(), tool.execution().retries());
    }

    public Optional<ToolDefinition> find(String toolId) {
        return Optional.ofNullable(tools.get(toolId));
    }

    /** Specs of the enabled tools on the agent's allowlist, in allowlist order. */
    public List<ToolSpec> specsFor(Agent agent) {
        return agent.tools().stream()
                .map(tools::get)
                .filter(t -> t != null && t.enabled())
                .map(ToolDefinition::toSpec)
                .toList();
    }

    /**
     * Map a model-side tool name to a definition the agent may use.
     *
     * @throws ToolExecutionException NOT_PERMITTED when the tool is unknown,
     *         disabled, off the allowlist or needs a human to confirm it
     */
    public ToolDefinition resolve(Agent agent, String toolName) {
        ToolDefinition tool = agent.tools().stream()
                .map(tools::get)
                .filter(t -> t != null && (t.name().equals(toolName) || t.id().equals(toolName)))
                .findFirst()
                .orElseThrow(() -> new ToolExecutionException(ToolExecutionException.Kind.NOT_PERMITTED,
                        "Tool '" + toolName + "' is not available to agent " + agent.id()));
        if (!tool.enabled()) {
            throw new ToolExecutionException(ToolExecutionException.Kind.NOT_PERMITTED,
                    "Tool '" + tool.id() + "' is disabled");
        }
        if (tool.permissions().requiresConfirmation()) {
            throw new ToolExecutionException(ToolExecutionException.Kind.NOT_PERMITTED,
                    "Tool '" + tool.id() + "' requires confirmation and cannot run unattended");
        }
        return tool;
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented execution
    // ------------------------------------------------------------------

    /**
     * Run one tool call for an agent and render the result as text.
     *
     * Every call is timed and counted:
     * <pre>
     *   agentcollab.tool.calls{tool, status="success|not_permitted|rate_limited|executor_error|timeout|tool_error"}
     *   agentcollab.tool.duration{tool}
     * </pre>
     *
     * @throws ToolExecutionException when the call fails after its retries,
     *         or the tool reported an error (TOOL_ERROR)
     */
    public String execute(Agent agent, ToolCall call, ToolExecutionContext context, CancellationToken token) {
        String toolTag = call.toolName();
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            ToolDefinition tool = resolve(agent, call.toolName());
            toolTag = tool.id();
            checkRateLimit(tool);

            ToolExecutionContext scoped = context.withPolicy(tool.execution());
            RetryPolicy retry = RetryPolicy.of(tool.execution().retries(), initialBackoff);
            ToolResult result = retry.execute("Tool " + tool.id(),
                    () -> executor.execute(tool.id(), call.arguments(), scoped),
                    e -> e instanceof ToolExecutionException te && te.isRetryable(),
                    token);

            if (result.hasError()) {
                throw new ToolExecutionException(ToolExecutionException.Kind.TOOL_ERROR, result.error());
            }
            return render(result.result());
        } catch (ToolExecutionException e) {
            status = e.getKind().name().toLowerCase();
            throw e;
        } catch (RuntimeException e) {
            status = "error";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("agentcollab.tool.duration", "tool", toolTag));
            meterRegistry.counter("agentcollab.tool.calls", "tool", toolTag, "status", status).increment();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void checkRateLimit(ToolDefinition tool) {
        Integer limit = tool.permissions().rateLimitPerMinute();
        if (limit == null) return;
        Deque<Instant> calls = recentCalls.computeIfAbsent(tool.id(), k -> new ArrayDeque<>());
        Instant now = clock.instant();
        synchronized (calls) {
            Instant windowStart = now.minus(Duration.ofMinutes(1));
            while (!calls.isEmpty() && !calls.peekFirst().isAfter(windowStart)) {
                calls.pollFirst();
            }
            if (calls.size() >= limit) {
                throw new ToolExecutionException(ToolExecutionException.Kind.RATE_LIMITED,
                        "Tool '" + tool.id() + "' allows " + limit + " calls per minute");
            }
            calls.addLast(now);
        }
    }

    private String render(Object result) {
        if (result == null) return "";
        if (result instanceof String s) return s;
        try {
            return json.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.warn("Tool result of type {} is not JSON-serialisable, using toString()", result.getClass().getName());
            return String.valueOf(result);
        }
    }
}
