package com.agentcollab.orchestrator.service;

import com.agentcollab.orchestrator.agent.AgentExecutor;
import com.agentcollab.orchestrator.model.Agent;
import com.agentcollab.orchestrator.model.AgentExecution;
import com.agentcollab.orchestrator.model.AgentInput;
import com.agentcollab.orchestrator.model.AgentTeam;
import com.agentcollab.orchestrator.model.SharedContextSnapshot;
import com.agentcollab.orchestrator.model.TeamExecution;
import com.agentcollab.orchestrator.model.TeamInput;
import com.agentcollab.orchestrator.orchestration.TeamOrchestrator;
import com.agentcollab.orchestrator.orchestration.TeamOrchestratorFactory;
import com.agentcollab.orchestrator.persistence.ExecutionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Caller entry points: run a single agent, run a team synchronously or in
 * the background, poll and cancel.
 *
 * Every team run gets its own {@link TeamOrchestrator}; this service only
 * tracks the active ones so they can be cancelled, and sweeps runs that
 * overshoot their duration budget.
 */
@Service
public class TeamExecutionService {

    private static final Logger log = LoggerFactory.getLogger(TeamExecutionService.class);

    private final ExecutionStore          store;
    private final AgentExecutor           agentExecutor;
    private final TeamOrchestratorFactory orchestrators;
    private final ExecutorService         workers;
    private final Clock                   clock;
    private final Duration                watchdogGrace;

    private final Map<String, TeamOrchestrator> active = new ConcurrentHashMap<>();

    public TeamExecutionService(ExecutionStore store,
                                AgentExecutor agentExecutor,
                                TeamOrchestratorFactory orchestrators,
                                @Qualifier("teamWorkers") ExecutorService workers,
                                Clock clock,
                                @Value("${agentcollab.watchdog.grace:PT30S}") Duration watchdogGrace) {
        this.store         = store;
        this.agentExecutor = agentExecutor;
        this.orchestrators = orchestrators;
        this.workers       = workers;
        this.clock         = clock;
        this.watchdogGrace = watchdogGrace;
    }

    // ------------------------------------------------------------------
    // Single agent
    // ------------------------------------------------------------------

    /**
     * Run one agent outside any team. The returned execution is terminal and
     * has been saved.
     *
     * @throws NotFoundException if the agent id is unknown
     */
    public AgentExecution executeAgent(String agentId, AgentInput input) {
        Agent agent = store.getAgent(agentId).orElseThrow(() -> new NotFoundException("Agent", agentId));
        AgentExecution execution = agentExecutor.execute(agent, input, SharedContextSnapshot.EMPTY);
        store.saveAgentExecution(execution);
        log.info("Agent {} finished standalone run {} as {}", agentId, execution.getId(), execution.getStatus());
        return execution;
    }

    // ------------------------------------------------------------------
    // Teams
    // ------------------------------------------------------------------

    /**
     * Run a team on the calling thread and return the terminal execution.
     *
     * @throws NotFoundException if the team id is unknown
     */
    public TeamExecution executeTeam(String teamId, TeamInput input) {
        TeamOrchestrator orchestrator = prepare(teamId, input);
        try {
            return orchestrator.execute();
        } finally {
            active.remove(orchestrator.executionId());
        }
    }

    /**
     * Start a team run on the worker pool and return its execution right
     * away. Poll {@link #findExecution} for progress.
     */
    public TeamExecution submitTeam(String teamId, TeamInput input) {
        TeamOrchestrator orchestrator = prepare(teamId, input);
        String id = orchestrator.executionId();
        try {
            workers.submit(() -> {
                try {
                    orchestrator.execute();
                } catch (Exception e) {
                    log.error("Unhandled error in team execution {}: {}", id, e.getMessage(), e);
                } finally {
                    active.remove(id);
                }
            });
        } catch (RejectedExecutionException e) {
            active.remove(id);
            orchestrator.cancel("Worker pool rejected the run");
            orchestrator.execute();
            throw e;
        }
        log.info("Submitted team {} as execution {}", teamId, id);
        return orchestrator.execution();
    }

    /** The live execution while it runs, the stored copy afterwards. */
    public Optional<TeamExecution> findExecution(String executionId) {
        TeamOrchestrator running = active.get(executionId);
        if (running != null) {
            return Optional.of(running.execution());
        }
        return store.findExecution(executionId);
    }

    /**
     * Request cancellation of an active run. Returns false when the run has
     * already finished.
     *
     * @throws NotFoundException if the execution id is unknown
     */
    public boolean cancelExecution(String executionId) {
        TeamOrchestrator running = active.get(executionId);
        if (running == null) {
            if (store.findExecution(executionId).isEmpty()) {
                throw new NotFoundException("Execution", executionId);
            }
            return false;
        }
        running.cancel("Cancelled by caller");
        return true;
    }

    // ------------------------------------------------------------------
    // Watchdog
    // ------------------------------------------------------------------

    /**
     * Cancel runs that have overshot their maxDuration by more than the
     * grace period. The in-loop limit check normally stops them first; this
     * catches runs stuck inside a single long model or tool call.
     */
    @Scheduled(fixedDelayString = "${agentcollab.watchdog.interval:PT10S}")
    public void cancelOverdueExecutions() {
        Instant now = clock.instant();
        for (TeamOrchestrator orchestrator : active.values()) {
            TeamExecution execution = orchestrator.execution();
            Instant startedAt = execution.getStartedAt();
            Duration max = orchestrator.maxDuration();
            if (startedAt == null || max == null || execution.isTerminal()) {
                continue;
            }
            Duration elapsed = Duration.between(startedAt, now);
            if (elapsed.compareTo(max.plus(watchdogGrace)) > 0) {
                log.warn("Watchdog cancelling team execution {} after {} (maxDuration={}, grace={})",
                        execution.getId(), elapsed, max, watchdogGrace);
                orchestrator.cancel("Exceeded maxDuration " + max + " by more than " + watchdogGrace);
            }
        }
    }

    int activeCount() {
        return active.size();
    }

    private TeamOrchestrator prepare(String teamId, TeamInput input) {
        AgentTeam team = store.getTeam(teamId).orElseThrow(() -> new NotFoundException("Team", teamId));
        TeamOrchestrator orchestrator = orchestrators.create(team, input);
        active.put(orchestrator.executionId(), orchestrator);
        return orchestrator;
    }
}
