package com.agentcollab.orchestrator.model;

/** How the sequential pattern orders team members. */
public enum OrderStrategy {
    PRIORITY,
    ROUND_ROBIN,
    RANDOM
}
