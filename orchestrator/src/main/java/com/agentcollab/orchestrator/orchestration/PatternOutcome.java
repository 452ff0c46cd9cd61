package com.agentcollab.orchestrator.orchestration;

import com.agentcollab.orchestrator.consensus.ConsensusResult;
import com.agentcollab.orchestrator.model.Artifact;

import java.util.List;

/**
 * What a collaboration strategy hands back to the orchestrator.
 *
 * @param response  null when the pattern produced nothing conclusive
 * @param consensus debate and consensus patterns only
 */
record PatternOutcome(String response, List<Artifact> artifacts, ConsensusResult consensus) {

    PatternOutcome {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }

    static PatternOutcome of(String response, List<Artifact> artifacts) {
        return new PatternOutcome(response, artifacts, null);
    }

    boolean isConclusive() {
        return response != null && !response.isBlank();
    }
}
