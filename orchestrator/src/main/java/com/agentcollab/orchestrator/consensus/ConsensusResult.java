package com.agentcollab.orchestrator.consensus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a vote tally.
 *
 * @param votes  count per candidate, keyed by the first-seen trimmed answer of
 *               each equivalence group, in first-seen order
 * @param winner leading candidate (after tie breaking when not reached); null
 *               when nobody proposed anything
 * @param share  the leading candidate's share of all votes
 */
public record ConsensusResult(
        boolean              reached,
        int                  rounds,
        Map<String, Integer> votes,
        String               winner,
        double               share) {

    public ConsensusResult {
        votes = votes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(votes));
    }

    public ConsensusResult withRounds(int n) {
        return new ConsensusResult(reached, n, votes, winner, share);
    }

    public ConsensusResult withWinner(String chosen) {
        return new ConsensusResult(reached, rounds, votes, chosen, share);
    }
}
