package com.agentcollab.orchestrator.orchestration;

import com.agentcollab.orchestrator.collaboration.CollaborationEventType;
import com.agentcollab.orchestrator.collaboration.OrchestratorClock;
import com.agentcollab.orchestrator.model.AgentTeam;
import com.agentcollab.orchestrator.model.CollaborationPattern;
import com.agentcollab.orchestrator.model.ExecutionError;
import com.agentcollab.orchestrator.model.TeamExecution;
import com.agentcollab.orchestrator.model.TeamOutput;
import com.agentcollab.orchestrator.persistence.ExecutionStore;
import com.agentcollab.orchestrator.support.CancellationToken;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;

/**
 * Drives exactly one team execution.
 *
 * Created per run by {@link TeamOrchestratorFactory}; {@link #execute()}
 * runs the team's collaboration pattern on the calling thread, which
 * becomes the run's coordinating thread. {@link #cancel} may be called from
 * any thread.
 */
public class TeamOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TeamOrchestrator.class);

    private final AgentTeam            team;
    private final TeamExecution        execution;
    private final OrchestrationContext ctx;
    private final CancellationToken    token;
    private final OrchestratorClock    clock;
    private final ExecutionStore       store;
    private final MeterRegistry        meterRegistry;

    TeamOrchestrator(AgentTeam team,
                     TeamExecution execution,
                     OrchestrationContext ctx,
                     CancellationToken token,
                     OrchestratorClock clock,
                     ExecutionStore store,
                     MeterRegistry meterRegistry) {
        this.team          = team;
        this.execution     = execution;
        this.ctx           = ctx;
        this.token         = token;
        this.clock         = clock;
        this.store         = store;
        this.meterRegistry = meterRegistry;
    }

    public TeamExecution execution() {
        return execution;
    }

    public String executionId() {
        return execution.getId();
    }

    /** The team's duration budget, or null when unbounded. */
    public Duration maxDuration() {
        return team.termination().maxDuration();
    }

    /** Ask the run to stop. Idempotent; the coordinating thread finalises the execution. */
    public void cancel(String reason) {
        log.info("Cancelling team execution {}: {}", execution.getId(), reason);
        token.cancel(reason);
    }

    // ------------------------------------------------------------------
    // Run
    // ------------------------------------------------------------------

    /**
     * Run the team to a terminal state and return the execution. Never
     * throws for run-level failures; they end up in the execution's error.
     */
    public TeamExecution execute() {
        MDC.put("teamExecutionId", execution.getId());
        MDC.put("teamId",          team.id());
        MDC.put("pattern",         team.pattern().name());
        try {
            execution.start(clock.now());
            ctx.begin(execution.getStartedAt());
            store.saveExecution(execution);
            log.info("Team {} starting {} run with {} members",
                    team.id(), team.pattern(), team.members().size());

            try {
                token.throwIfCancelled();
                PatternOutcome outcome = strategyFor(team.pattern()).run(team, execution.getInput(), ctx);
                token.throwIfCancelled();
                if (!outcome.isConclusive()) {
                    throw new IncompleteResolutionException(ctx.terminated()
                            ? "Run stopped on " + ctx.terminationReason() + " without a conclusive response"
                            : "Pattern " + team.pattern() + " produced no response");
                }
                execution.updateMetrics(ctx.metrics());
                execution.complete(new TeamOutput(outcome.response(), outcome.artifacts(), outcome.consensus()),
                        ctx.terminationReason(), clock.now());
                log.info("Team {} completed after {} rounds ({} tokens)",
                        team.id(), ctx.round(), ctx.metrics().totalTokens());

            } catch (ExecutionCancelledException e) {
                String reason = token.reason() != null ? token.reason() : e.getMessage();
                ctx.record(CollaborationEventType.INTERVENTION, null, null, "Cancelled: " + reason);
                execution.updateMetrics(ctx.metrics());
                execution.cancel(reason, ctx.partialOutput(), clock.now());
                log.info("Team {} cancelled: {}", team.id(), reason);

            } catch (OrchestrationException e) {
                execution.updateMetrics(ctx.metrics());
                execution.fail(new ExecutionError(e.code(), e.getMessage(), e.agentId()),
                        ctx.partialOutput(), ctx.terminationReason(), clock.now());
                log.warn("Team {} failed with {}: {}", team.id(), e.code(), e.getMessage());

            } catch (RuntimeException e) {
                log.error("Team {} failed unexpectedly", team.id(), e);
                execution.updateMetrics(ctx.metrics());
                execution.fail(new ExecutionError("INTERNAL_ERROR", String.valueOf(e.getMessage()), null),
                        ctx.partialOutput(), ctx.terminationReason(), clock.now());
            }

            store.saveExecution(execution);
            meterRegistry.counter("agentcollab.team.executions",
                    "pattern", team.pattern().name().toLowerCase(),
                    "status",  execution.getStatus().name().toLowerCase()).increment();
            return execution;
        } finally {
            MDC.remove("teamExecutionId");
            MDC.remove("teamId");
            MDC.remove("pattern");
        }
    }

    static CollaborationStrategy strategyFor(CollaborationPattern pattern) {
        return switch (pattern) {
            case SEQUENTIAL   -> new SequentialStrategy();
            case PARALLEL     -> new ParallelStrategy();
            case HIERARCHICAL -> new HierarchicalStrategy();
            case DEBATE       -> new DebateStrategy();
            case CONSENSUS    -> new ConsensusStrategy();
            case SUPERVISOR   -> new SupervisorStrategy();
        };
    }
}
