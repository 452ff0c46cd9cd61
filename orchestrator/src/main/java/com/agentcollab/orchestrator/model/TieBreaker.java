package com.agentcollab.orchestrator.model;

/** Fallback used by the consensus pattern when no candidate reaches the threshold. */
public enum TieBreaker {
    SUPERVISOR,     // a designated agent is asked to pick one candidate
    VOTING,         // highest priority-weighted candidate wins
    RANDOM          // uniform pick with the injected random source
}
