package com.agentcollab.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One run of an agent against an input.
 *
 * Owned by the executor that created it: only that executor mutates it,
 * and every mutator refuses to touch a terminal execution, so a completed,
 * failed or cancelled run is effectively immutable when the orchestrator
 * receives it.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
                getterVisibility = JsonAutoDetect.Visibility.NONE,
                isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class AgentExecution {

    private String              id;
    private String              agentId;
    private String              teamExecutionId;
    private AgentStatus         status = AgentStatus.IDLE;
    private AgentInput          input;
    private List<ExecutionStep> steps = new ArrayList<>();
    private AgentOutput         output;
    private AgentMetrics        metrics = AgentMetrics.zero();
    private ExecutionError      error;
    private Instant             startedAt;
    private Instant             completedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    private AgentExecution() {}   // Jackson

    public AgentExecution(String id, String agentId, AgentInput input) {
        this.id              = id;
        this.agentId         = agentId;
        this.input           = input;
        this.teamExecutionId = input.teamExecutionId();
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    public void start(Instant at) {
        transition(AgentStatus.RUNNING);
        this.startedAt = at;
    }

    public void markWaiting() { transition(AgentStatus.WAITING); }
    public void markRunning() { transition(AgentStatus.RUNNING); }

    public void addStep(StepType type, String content, Instant at) {
        requireMutable();
        steps.add(new ExecutionStep(steps.size() + 1, type, content, at));
    }

    public void complete(AgentOutput output, AgentMetrics metrics, Instant at) {
        this.output  = output;
        this.metrics = metrics;
        finish(AgentStatus.COMPLETED, at);
    }

    public void fail(ExecutionError error, AgentOutput partial, AgentMetrics metrics, Instant at) {
        this.error   = error;
        this.output  = partial;
        this.metrics = metrics;
        finish(AgentStatus.FAILED, at);
    }

    public void cancel(String reason, AgentOutput partial, AgentMetrics metrics, Instant at) {
        this.error   = new ExecutionError("CANCELLED", reason, agentId);
        this.output  = partial;
        this.metrics = metrics;
        finish(AgentStatus.CANCELLED, at);
    }

    private void finish(AgentStatus terminal, Instant at) {
        if (startedAt == null) startedAt = at;
        transition(terminal);
        this.completedAt = at;
        this.steps       = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    private void transition(AgentStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Agent execution %s cannot move from %s to %s".formatted(id, status, next));
        }
        this.status = next;
    }

    private void requireMutable() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Agent execution " + id + " is " + status + " and can no longer change");
        }
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String              getId()              { return id; }
    public String              getAgentId()         { return agentId; }
    public String              getTeamExecutionId() { return teamExecutionId; }
    public AgentStatus         getStatus()          { return status; }
    public AgentInput          getInput()           { return input; }
    public List<ExecutionStep> getSteps()           { return Collections.unmodifiableList(steps); }
    public AgentOutput         getOutput()          { return output; }
    public AgentMetrics        getMetrics()         { return metrics; }
    public ExecutionError      getError()           { return error; }
    public Instant             getStartedAt()       { return startedAt; }
    public Instant             getCompletedAt()     { return completedAt; }

    public boolean isTerminal()  { return status.isTerminal(); }
    public boolean isCompleted() { return status == AgentStatus.COMPLETED; }

    /** The final response text, or null when the run produced none. */
    public String response() {
        return output == null ? null : output.response();
    }

    public Duration elapsed() {
        if (startedAt == null || completedAt == null) return Duration.ZERO;
        return Duration.between(startedAt, completedAt);
    }
}
