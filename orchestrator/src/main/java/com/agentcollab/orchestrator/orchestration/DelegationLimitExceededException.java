package com.agentcollab.orchestrator.orchestration;

/** Fatal: a delegation exceeded the delegator's budget or would re-enter the active chain. */
public class DelegationLimitExceededException extends OrchestrationException {

    public DelegationLimitExceededException(String agentId, String message) {
        super("DELEGATION_LIMIT_EXCEEDED", message, agentId);
    }
}
