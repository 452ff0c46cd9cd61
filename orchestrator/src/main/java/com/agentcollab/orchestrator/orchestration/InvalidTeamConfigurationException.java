package com.agentcollab.orchestrator.orchestration;

/** The team definition cannot run under its pattern (missing supervisor, sharing disabled for debate, ...). */
public class InvalidTeamConfigurationException extends OrchestrationException {

    public InvalidTeamConfigurationException(String message) {
        super("INVALID_CONFIGURATION", message, null);
    }
}
