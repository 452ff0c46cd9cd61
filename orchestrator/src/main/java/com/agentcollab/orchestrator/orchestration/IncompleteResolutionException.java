package com.agentcollab.orchestrator.orchestration;

/** A termination condition ended the run before any conclusive output existed. */
public class IncompleteResolutionException extends OrchestrationException {

    public IncompleteResolutionException(String message) {
        super("INCOMPLETE_RESOLUTION", message, null);
    }
}
