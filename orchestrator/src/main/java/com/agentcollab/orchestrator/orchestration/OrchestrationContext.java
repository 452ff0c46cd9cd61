package com.agentcollab.orchestrator.orchestration;

import com.agentcollab.orchestrator.agent.AgentExecutor;
import com.agentcollab.orchestrator.collaboration.CollaborationEntry;
import com.agentcollab.orchestrator.collaboration.CollaborationEventType;
import com.agentcollab.orchestrator.collaboration.CollaborationLog;
import com.agentcollab.orchestrator.collaboration.OrchestratorClock;
import com.agentcollab.orchestrator.consensus.AnswerEquivalence;
import com.agentcollab.orchestrator.consensus.ConsensusResolver;
import com.agentcollab.orchestrator.metrics.MetricsAggregator;
import com.agentcollab.orchestrator.model.Agent;
import com.agentcollab.orchestrator.model.AgentExecution;
import com.agentcollab.orchestrator.model.AgentInput;
import com.agentcollab.orchestrator.model.AgentOutput;
import com.agentcollab.orchestrator.model.AgentStatus;
import com.agentcollab.orchestrator.model.AgentTeam;
import com.agentcollab.orchestrator.model.Artifact;
import com.agentcollab.orchestrator.model.DelegationRequest;
import com.agentcollab.orchestrator.model.SharedContextSnapshot;
import com.agentcollab.orchestrator.model.TeamExecution;
import com.agentcollab.orchestrator.model.TeamInput;
import com.agentcollab.orchestrator.model.TeamMember;
import com.agentcollab.orchestrator.model.TeamMetrics;
import com.agentcollab.orchestrator.model.TeamOutput;
import com.agentcollab.orchestrator.model.TerminationReason;
import com.agentcollab.orchestrator.model.ToolCallResult;
import com.agentcollab.orchestrator.persistence.ExecutionStore;
import com.agentcollab.orchestrator.support.CancellationToken;
import com.agentcollab.orchestrator.termination.TerminationDecision;
import com.agentcollab.orchestrator.termination.TerminationEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Everything a collaboration strategy needs for one team run, and the only
 * way it touches shared state.
 *
 * Agent runs are split in two halves:
 * <ul>
 *   <li>{@link #launch} only executes the agent and is safe on any thread;</li>
 *   <li>{@link #absorb} folds the terminal result into the run (child
 *       reference, metrics, shared context, log, checkpoint) and must be
 *       called on the coordinating thread.</li>
 * </ul>
 * Patterns that run agents one at a time use {@link #run}, which does both.
 */
final class OrchestrationContext {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationContext.class);

    private final AgentTeam          team;
    private final TeamInput          input;
    private final TeamExecution      execution;
    private final Map<String, Agent> agents;
    private final AgentExecutor      executor;
    private final ExecutionStore     store;
    private final OrchestratorClock  clock;
    private final CancellationToken  token;
    private final ConsensusResolver  resolver;
    private final AnswerEquivalence  equivalence;
    private final Random             random;

    private final MetricsAggregator metrics  = new MetricsAggregator();
    private final DelegationGuard   guard    = new DelegationGuard();
    private final List<Artifact>    produced = new ArrayList<>();
    private final SharedContext     shared;

    private Instant           startedAt;
    private int               round;
    private TerminationReason terminationReason;
    private String            lastResponse;

    OrchestrationContext(AgentTeam team,
                         TeamExecution execution,
                         Map<String, Agent> agents,
                         AgentExecutor executor,
                         ExecutionStore store,
                         OrchestratorClock clock,
                         CancellationToken token,
                         ConsensusResolver resolver,
                         AnswerEquivalence equivalence,
                         Random random) {
        this.team        = team;
        this.input       = execution.getInput();
        this.execution   = execution;
        this.agents      = new ConcurrentHashMap<>(agents);
        this.executor    = executor;
        this.store       = store;
        this.clock       = clock;
        this.token       = token;
        this.resolver    = resolver;
        this.equivalence = equivalence;
        this.random      = random;
        this.shared      = new SharedContext(team.sharedContext(), input.context());
    }

    void begin(Instant at) {
        this.startedAt = at;
    }

    // ------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------

    AgentTeam         team()              { return team; }
    TeamInput         input()             { return input; }
    CancellationToken token()             { return token; }
    ConsensusResolver resolver()          { return resolver; }
    AnswerEquivalence equivalence()       { return equivalence; }
    Random            random()            { return random; }
    DelegationGuard   guard()             { return guard; }
    int               round()             { return round; }
    TerminationReason terminationReason() { return terminationReason; }
    String            lastResponse()      { return lastResponse; }
    TeamMetrics       metrics()           { return metrics.snapshot(); }

    boolean terminated() {
        return terminationReason != null;
    }

    /**
     * Whether a pattern may still issue its closing turn (aggregation,
     * synthesis, force-complete). Only running out of rounds allows it; any
     * other stop means no further agent calls.
     */
    boolean mayFinalize() {
        return !token.isCancelled()
                && (terminationReason == null || terminationReason == TerminationReason.MAX_ITERATIONS);
    }

    /** A member's definition, or a non-member's looked up in the store (delegation targets). */
    Agent agent(String agentId) {
        Agent agent = agents.get(agentId);
        if (agent != null) return agent;
        agent = store.getAgent(agentId).orElseThrow(() ->
                new OrchestrationException("UNKNOWN_AGENT", "Agent " + agentId + " does not exist", agentId));
        agents.put(agentId, agent);
        return agent;
    }

    String roleOf(String agentId) {
        return team.member(agentId).map(TeamMember::role).orElse("delegate");
    }

    /**
     * The supervising member: {@code supervisorAgentId} when set, else the
     * member whose role is "supervisor".
     */
    TeamMember supervisor() {
        String id = team.patternConfig().supervisorAgentId();
        if (id != null) {
            return team.member(id).orElseGet(() -> new TeamMember(id, "supervisor", 0));
        }
        return team.memberWithRole("supervisor").orElseThrow(() -> new InvalidTeamConfigurationException(
                "Team " + team.id() + " has no supervisorAgentId and no member with role 'supervisor'"));
    }

    AgentInput inputFor(String message) {
        Map<String, Object> context = team.sharedContext().enabled() ? Map.of() : input.context();
        return new AgentInput(message, context, input.sessionId(), execution.getId());
    }

    SharedContextSnapshot snapshot() {
        return shared.snapshot();
    }

    // ------------------------------------------------------------------
    // Running agents
    // ------------------------------------------------------------------

    /** Execute an agent. Touches no run state; safe on worker threads. */
    AgentExecution launch(Agent agent, AgentInput agentInput, SharedContextSnapshot snapshot) {
        return executor.execute(agent, agentInput, snapshot, token);
    }

    /**
     * Fold a terminal child into the run. Coordinating thread only.
     */
    void absorb(AgentExecution child, String role) {
        store.saveAgentExecution(child);
        execution.addAgentExecution(child, role);
        metrics.merge(child);
        execution.updateMetrics(metrics.snapshot());

        AgentOutput out = child.getOutput();
        if (out != null) {
            for (ToolCallResult r : out.toolResults()) {
                if (shared.addToolResult(child.getAgentId(), role, r.toObservation())) {
                    record(CollaborationEventType.TOOL_SHARE, child.getAgentId(), null, r.toObservation());
                }
            }
            if (answered(child)) {
                lastResponse = out.response();
                produced.add(new Artifact("response", out.response(), child.getAgentId()));
                if (shared.addResponse(child.getAgentId(), role, out.response())) {
                    record(CollaborationEventType.MESSAGE, child.getAgentId(), null, out.response());
                }
            }
        }
        if (child.getStatus() == AgentStatus.FAILED) {
            log.warn("Agent {} ({}) failed: {}", child.getAgentId(), role,
                    child.getError() == null ? "unknown" : child.getError().code());
        }
        checkpoint();
    }

    /** A completed child whose output is a final answer rather than a pending delegation. */
    static boolean answered(AgentExecution child) {
        AgentOutput out = child.getOutput();
        return child.isCompleted() && out != null && out.hasResponse() && out.delegation() == null;
    }

    /** Launch and absorb on the calling (coordinating) thread. */
    AgentExecution run(String agentId, String role, AgentInput agentInput) {
        token.throwIfCancelled();
        Agent agent = agent(agentId);
        AgentExecution child = launch(agent, agentInput, snapshot());
        absorb(child, role);
        if (child.getStatus() == AgentStatus.CANCELLED) {
            throw new ExecutionCancelledException(token.reason() == null ? "Cancelled" : token.reason());
        }
        return child;
    }

    /**
     * {@link #run}, then honour delegation requests: the delegate runs with
     * the instructions, and the delegator runs again with the delegate's
     * result appended, until it answers without delegating.
     *
     * @throws DelegationLimitExceededException on an exhausted budget or a cycle
     */
    AgentExecution runWithDelegation(String agentId, String role, AgentInput agentInput) {
        guard.enter(agentId);
        try {
            AgentExecution child = run(agentId, role, agentInput);
            String message = agentInput.message();
            while (child.isCompleted() && child.getOutput().delegation() != null) {
                DelegationRequest req = child.getOutput().delegation();
                String target = req.targetAgentId();
                guard.authorize(agent(agentId), target);
                agent(target);
                record(CollaborationEventType.DELEGATION, agentId, target, req.instructions());

                AgentExecution delegated = runWithDelegation(target, roleOf(target), inputFor(req.instructions()));
                String result = delegated.isCompleted() && delegated.getOutput().hasResponse()
                        ? delegated.response()
                        : "Delegate " + target + " could not complete the task ("
                          + (delegated.getError() == null ? delegated.getStatus() : delegated.getError().code()) + ")";
                record(CollaborationEventType.MESSAGE, target, agentId, result);

                message = message + "\n\nResult from " + target + ":\n" + result;
                child = run(agentId, role, inputFor(message));
            }
            return child;
        } finally {
            guard.exit(agentId);
        }
    }

    // ------------------------------------------------------------------
    // Rounds and termination
    // ------------------------------------------------------------------

    /**
     * Close a round and evaluate termination over it.
     *
     * @param outputs the responses produced during the round
     */
    TerminationDecision completeRound(List<String> outputs) {
        round++;
        TerminationDecision decision = TerminationEvaluator.evaluate(
                metrics.totalTokens(), clock.elapsedSince(startedAt), round, outputs, team.termination());
        if (decision.shouldStop()) {
            stop(decision);
        }
        return decision;
    }

    /** Duration, token and stop-phrase limits only; does not close a round. */
    TerminationDecision checkLimits(List<String> outputs) {
        TerminationDecision decision = TerminationEvaluator.evaluateLimits(
                metrics.totalTokens(), clock.elapsedSince(startedAt), outputs, team.termination());
        if (decision.shouldStop()) {
            stop(decision);
        }
        return decision;
    }

    private void stop(TerminationDecision decision) {
        if (terminationReason != null) return;
        terminationReason = decision.reason();
        record(CollaborationEventType.INTERVENTION, null, null, "Terminating: " + decision.detail());
        log.info("Team {} terminating after round {}: {}", team.id(), round, decision.detail());
    }

    // ------------------------------------------------------------------
    // Log and checkpoints
    // ------------------------------------------------------------------

    CollaborationEntry record(CollaborationEventType type, String from, String to, String content) {
        CollaborationLog collaborationLog = execution.getCollaborationLog();
        return collaborationLog.append(type, from, to, content);
    }

    void checkpoint() {
        store.saveExecution(execution);
    }

    /** Output recorded so far, attached to failed and cancelled runs. */
    TeamOutput partialOutput() {
        return new TeamOutput(lastResponse, produced, null);
    }

    List<Artifact> producedArtifacts() {
        return List.copyOf(produced);
    }
}
