package com.agentcollab.orchestrator.orchestration;

/**
 * The run's cancellation token was set. Always recoverable: whatever was
 * recorded before the cancel is kept as is.
 */
public class ExecutionCancelledException extends OrchestrationException {

    public ExecutionCancelledException(String reason) {
        super("CANCELLED", reason, null);
    }
}
