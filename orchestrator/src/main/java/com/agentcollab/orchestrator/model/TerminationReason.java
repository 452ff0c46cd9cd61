package com.agentcollab.orchestrator.model;

/**
 * Why a team run stopped early. Declaration order is the evaluation
 * priority: when several limits trip together the first one listed wins.
 */
public enum TerminationReason {
    MAX_DURATION,
    MAX_TOKENS,
    MAX_ITERATIONS,
    STOP_PHRASE
}
