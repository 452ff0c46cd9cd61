package com.agentcollab.orchestrator.orchestration;

import com.agentcollab.orchestrator.model.AgentExecution;
import com.agentcollab.orchestrator.model.ExecutionError;

/**
 * A child agent execution failed under a pattern that treats child failures
 * as fatal. Carries the failing agent's id and its error code.
 */
public class AgentFailedException extends OrchestrationException {

    public AgentFailedException(AgentExecution failed) {
        super(codeOf(failed), messageOf(failed), failed.getAgentId());
    }

    public AgentFailedException(String agentId, String code, String message) {
        super(code, message, agentId);
    }

    private static String codeOf(AgentExecution failed) {
        ExecutionError e = failed.getError();
        return e == null ? "AGENT_FAILED" : e.code();
    }

    private static String messageOf(AgentExecution failed) {
        ExecutionError e = failed.getError();
        String detail = e == null ? failed.getStatus().name() : e.message();
        return "Agent " + failed.getAgentId() + " failed: " + detail;
    }
}
