package com.agentcollab.orchestrator.orchestration;

/**
 * Base of every failure the orchestrator reports on a team or agent execution.
 *
 * Unchecked, like the rest of the codebase's failures: callers catch it only
 * where they have a recovery (tie breaking, tolerant patterns); everything else
 * propagates to the orchestrator, which turns it into the execution's error.
 */
public class OrchestrationException extends RuntimeException {

    private final String code;
    private final String agentId;

    public OrchestrationException(String code, String message, String agentId) {
        super(message);
        this.code    = code;
        this.agentId = agentId;
    }

    public OrchestrationException(String code, String message, String agentId, Throwable cause) {
        super(message, cause);
        this.code    = code;
        this.agentId = agentId;
    }

    public String code()    { return code; }
    public String agentId() { return agentId; }
}
