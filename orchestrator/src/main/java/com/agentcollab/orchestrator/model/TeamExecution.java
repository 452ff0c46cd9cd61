package com.agentcollab.orchestrator.model;

import com.agentcollab.orchestrator.collaboration.CollaborationLog;
import com.fasterxml.jackson.annotation.JsonAutoDetect;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One run of a team.
 *
 * Owned by the orchestrator that created it. Child references are added only
 * for terminal agent executions, and reaching a terminal state freezes the
 * collaboration log. Readers on other threads see the state through the
 * synchronized accessors; the execution store keeps its own JSON copies.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
                getterVisibility = JsonAutoDetect.Visibility.NONE,
                isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class TeamExecution {

    private String                  id;
    private String                  teamId;
    private CollaborationPattern    pattern;
    private AgentStatus             status = AgentStatus.IDLE;
    private TeamInput               input;
    private List<AgentExecutionRef> agentExecutions = new ArrayList<>();
    private CollaborationLog        collaborationLog;
    private TeamOutput              output;
    private TeamMetrics             metrics = TeamMetrics.empty();
    private TerminationReason       terminationReason;
    private ExecutionError          error;
    private Instant                 startedAt;
    private Instant                 completedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    private TeamExecution() {}   // Jackson

    public TeamExecution(String id, AgentTeam team, TeamInput input, CollaborationLog log) {
        this.id               = id;
        this.teamId           = team.id();
        this.pattern          = team.pattern();
        this.input            = input;
        this.collaborationLog = log;
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    public synchronized void start(Instant at) {
        transition(AgentStatus.RUNNING);
        this.startedAt = at;
    }

    /**
     * Reference a finished child.
     *
     * @throws IllegalStateException if the child is still in flight or this run is terminal
     */
    public synchronized AgentExecutionRef addAgentExecution(AgentExecution child, String role) {
        if (!child.isTerminal()) {
            throw new IllegalStateException(
                    "Agent execution " + child.getId() + " is " + child.getStatus() + "; only terminal runs are referenced");
        }
        requireMutable();
        AgentExecutionRef ref = new AgentExecutionRef(
                child.getId(), child.getAgentId(), role, agentExecutions.size() + 1, child.getStatus());
        agentExecutions.add(ref);
        return ref;
    }

    public synchronized void updateMetrics(TeamMetrics snapshot) {
        requireMutable();
        this.metrics = snapshot;
    }

    public synchronized void complete(TeamOutput output, TerminationReason reason, Instant at) {
        this.output            = output;
        this.terminationReason = reason;
        finish(AgentStatus.COMPLETED, at);
    }

    public synchronized void fail(ExecutionError error, TeamOutput partial, TerminationReason reason, Instant at) {
        this.error             = error;
        this.output            = partial;
        this.terminationReason = reason;
        finish(AgentStatus.FAILED, at);
    }

    public synchronized void cancel(String reason, TeamOutput partial, Instant at) {
        this.error  = new ExecutionError("CANCELLED", reason, null);
        this.output = partial;
        finish(AgentStatus.CANCELLED, at);
    }

    private void finish(AgentStatus terminal, Instant at) {
        if (startedAt == null) startedAt = at;
        transition(terminal);
        this.completedAt = at;
        if (collaborationLog != null) {
            collaborationLog.freeze();
        }
    }

    private void transition(AgentStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Team execution %s cannot move from %s to %s".formatted(id, status, next));
        }
        this.status = next;
    }

    private void requireMutable() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Team execution " + id + " is " + status + " and can no longer change");
        }
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String               getId()      { return id; }
    public String               getTeamId()  { return teamId; }
    public CollaborationPattern getPattern() { return pattern; }
    public TeamInput            getInput()   { return input; }
    public CollaborationLog     getCollaborationLog() { return collaborationLog; }

    public synchronized AgentStatus       getStatus()            { return status; }
    public synchronized TeamOutput        getOutput()            { return output; }
    public synchronized TeamMetrics       getMetrics()           { return metrics; }
    public synchronized TerminationReason getTerminationReason() { return terminationReason; }
    public synchronized ExecutionError    getError()             { return error; }
    public synchronized Instant           getStartedAt()         { return startedAt; }
    public synchronized Instant           getCompletedAt()       { return completedAt; }

    public synchronized List<AgentExecutionRef> getAgentExecutions() {
        return Collections.unmodifiableList(new ArrayList<>(agentExecutions));
    }

    public synchronized boolean isTerminal() { return status.isTerminal(); }

    public String response() {
        TeamOutput out = getOutput();
        return out == null ? null : out.response();
    }
}
