package com.agentcollab.orchestrator.consensus;

import com.agentcollab.orchestrator.orchestration.OrchestrationException;

/**
 * No candidate reached the threshold. Not fatal: the consensus pattern
 * catches it and falls back to the team's tie breaker.
 */
public class ConsensusNotReachedException extends OrchestrationException {

    private final ConsensusResult result;

    public ConsensusNotReachedException(ConsensusResult result, double threshold) {
        super("CONSENSUS_NOT_REACHED",
              "Leading answer has %.2f of the votes, threshold is %.2f".formatted(result.share(), threshold),
              null);
        this.result = result;
    }

    public ConsensusResult result() { return result; }
}
