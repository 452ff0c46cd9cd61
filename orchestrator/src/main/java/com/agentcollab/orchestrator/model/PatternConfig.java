package com.agentcollab.orchestrator.model;

import java.util.List;

/**
 * Pattern-specific knobs. Every field is optional; patterns that do not use
 * a field ignore it.
 *
 * @param maxConcurrent      PARALLEL: worker bound; null or non-positive means team size
 * @param orderStrategy      SEQUENTIAL: member ordering
 * @param supervisorAgentId  HIERARCHICAL / SUPERVISOR / CONSENSUS tie breaker
 * @param delegationRules    HIERARCHICAL: ordered routing rules
 * @param maxRounds          DEBATE: round cap
 * @param consensusThreshold DEBATE / CONSENSUS: share of votes needed, in (0, 1]
 * @param tieBreaker         CONSENSUS: fallback when the threshold is missed
 * @param tolerateFailures   SEQUENTIAL / HIERARCHICAL / SUPERVISOR: keep going after a child failure
 */
public record PatternConfig(
        Integer              maxConcurrent,
        OrderStrategy        orderStrategy,
        String               supervisorAgentId,
        List<DelegationRule> delegationRules,
        Integer              maxRounds,
        Double               consensusThreshold,
        TieBreaker           tieBreaker,
        boolean              tolerateFailures) {

    public static final int    DEFAULT_MAX_ROUNDS = 3;
    public static final double DEFAULT_THRESHOLD  = 0.66;

    public PatternConfig {
        delegationRules = delegationRules == null ? List.of() : List.copyOf(delegationRules);
        if (consensusThreshold != null && (consensusThreshold <= 0 || consensusThreshold > 1)) {
            throw new IllegalArgumentException("consensusThreshold must be in (0, 1]: " + consensusThreshold);
        }
    }

    public static PatternConfig defaults() {
        return new PatternConfig(null, null, null, null, null, null, null, false);
    }

    public OrderStrategy effectiveOrderStrategy() {
        return orderStrategy == null ? OrderStrategy.PRIORITY : orderStrategy;
    }

    public int effectiveMaxRounds() {
        return maxRounds == null || maxRounds <= 0 ? DEFAULT_MAX_ROUNDS : maxRounds;
    }

    public double effectiveThreshold() {
        return consensusThreshold == null ? DEFAULT_THRESHOLD : consensusThreshold;
    }

    public TieBreaker effectiveTieBreaker() {
        return tieBreaker == null ? TieBreaker.VOTING : tieBreaker;
    }

    public int effectiveMaxConcurrent(int teamSize) {
        if (maxConcurrent == null || maxConcurrent <= 0) return Math.max(1, teamSize);
        return Math.min(maxConcurrent, Math.max(1, teamSize));
    }

    public PatternConfig withMaxConcurrent(Integer max) {
        return new PatternConfig(max, orderStrategy, supervisorAgentId, delegationRules, maxRounds,
                consensusThreshold, tieBreaker, tolerateFailures);
    }

    public PatternConfig withOrderStrategy(OrderStrategy strategy) {
        return new PatternConfig(maxConcurrent, strategy, supervisorAgentId, delegationRules, maxRounds,
                consensusThreshold, tieBreaker, tolerateFailures);
    }

    public PatternConfig withSupervisor(String agentId) {
        return new PatternConfig(maxConcurrent, orderStrategy, agentId, delegationRules, maxRounds,
                consensusThreshold, tieBreaker, tolerateFailures);
    }

    public PatternConfig withDelegationRules(List<DelegationRule> rules) {
        return new PatternConfig(maxConcurrent, orderStrategy, supervisorAgentId, rules, maxRounds,
                consensusThreshold, tieBreaker, tolerateFailures);
    }

    public PatternConfig withMaxRounds(Integer rounds) {
        return new PatternConfig(maxConcurrent, orderStrategy, supervisorAgentId, delegationRules, rounds,
                consensusThreshold, tieBreaker, tolerateFailures);
    }

    public PatternConfig withConsensusThreshold(Double threshold) {
        return new PatternConfig(maxConcurrent, orderStrategy, supervisorAgentId, delegationRules, maxRounds,
                threshold, tieBreaker, tolerateFailures);
    }

    public PatternConfig withTieBreaker(TieBreaker breaker) {
        return new PatternConfig(maxConcurrent, orderStrategy, supervisorAgentId, delegationRules, maxRounds,
                consensusThreshold, breaker, tolerateFailures);
    }

    public PatternConfig withTolerateFailures(boolean tolerate) {
        return new PatternConfig(maxConcurrent, orderStrategy, supervisorAgentId, delegationRules, maxRounds,
                consensusThreshold, tieBreaker, tolerate);
    }
}
