package com.agentcollab.orchestrator.model;

import com.agentcollab.orchestrator.consensus.ConsensusResult;

import java.util.List;

/**
 * Aggregated result of a team run.
 *
 * @param consensus set by the debate and consensus patterns only
 */
public record TeamOutput(String response, List<Artifact> artifacts, ConsensusResult consensus) {

    public TeamOutput {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }

    public boolean hasResponse() {
        return response != null && !response.isBlank();
    }
}
