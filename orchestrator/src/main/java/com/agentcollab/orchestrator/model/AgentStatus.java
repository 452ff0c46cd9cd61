package com.agentcollab.orchestrator.model;

/**
 * Lifecycle of an agent execution and of a team execution.
 *
 * Transitions:
 *   IDLE    → RUNNING
 *   RUNNING → WAITING   (a tool call is in flight)
 *   WAITING → RUNNING   (the tool call returned)
 *   RUNNING | WAITING → COMPLETED | FAILED | CANCELLED
 *
 * COMPLETED, FAILED and CANCELLED are terminal; nothing leaves them.
 */
public enum AgentStatus {
    IDLE,
    RUNNING,
    WAITING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(AgentStatus next) {
        return switch (this) {
            case IDLE    -> next == RUNNING || next == CANCELLED;
            case RUNNING -> next == WAITING || next.isTerminal();
            case WAITING -> next == RUNNING || next == FAILED || next == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
