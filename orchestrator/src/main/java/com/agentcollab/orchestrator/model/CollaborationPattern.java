package com.agentcollab.orchestrator.model;

/**
 * Control-flow strategy governing how the members of a team interact.
 */
public enum CollaborationPattern {
    SEQUENTIAL,     // one after another, each fed the previous output
    PARALLEL,       // bounded pool, outputs merged as artifacts
    HIERARCHICAL,   // supervisor first, static delegation rules pick the next agent
    DEBATE,         // rounds of argument until agreement or maxRounds
    CONSENSUS,      // one proposal round, vote tally, tie breaker fallback
    SUPERVISOR      // supervisor issues ad hoc directives each round
}
