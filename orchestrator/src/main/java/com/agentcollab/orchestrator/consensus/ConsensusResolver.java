package com.agentcollab.orchestrator.consensus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Pure vote tally over agent proposals.
 *
 * Deterministic: the same proposals, threshold and equivalence always give the
 * same result. The only randomness is {@link #pickRandom}, which draws from the
 * {@link Random} passed to the constructor so tests can seed it.
 */
public class ConsensusResolver {

    private final Random random;

    public ConsensusResolver(Random random) {
        this.random = random;
    }

    /** Tally with the default trim + lower-case equality. */
    public ConsensusResult resolve(List<Proposal> proposals, double threshold) {
        return resolve(proposals, threshold, AnswerEquivalence.NORMALIZED);
    }

    /**
     * Group equivalent answers and check whether the leading group's share of
     * the votes reaches {@code threshold}. Blank answers are not votes.
     *
     * When several groups tie on count, the one with the larger priority weight
     * wins, then the one seen first.
     */
    public ConsensusResult resolve(List<Proposal> proposals, double threshold, AnswerEquivalence equals) {
        List<Group> groups = group(proposals, equals);
        int total = groups.stream().mapToInt(g -> g.count).sum();
        Map<String, Integer> votes = toVotes(groups);
        if (total == 0) {
            return new ConsensusResult(false, 1, votes, null, 0.0);
        }

        Group leader = null;
        for (Group g : groups) {
            if (leader == null
                    || g.count > leader.count
                    || (g.count == leader.count && g.weight > leader.weight)) {
                leader = g;
            }
        }
        double share = (double) leader.count / total;
        return new ConsensusResult(share >= threshold, 1, votes, leader.answer, share);
    }

    /**
     * Same as {@link #resolve} but throws when the threshold is missed, so the
     * caller can fall back to a tie breaker.
     */
    public ConsensusResult require(List<Proposal> proposals, double threshold, AnswerEquivalence equals) {
        ConsensusResult result = resolve(proposals, threshold, equals);
        if (!result.reached()) {
            throw new ConsensusNotReachedException(result, threshold);
        }
        return result;
    }

    /**
     * Priority-weighted pick: every vote weighs {@code 1 + priority}; ties on
     * weight go to the larger group, then to the group seen first.
     */
    public String pickByPriorityWeight(List<Proposal> proposals, AnswerEquivalence equals) {
        Group best = null;
        for (Group g : group(proposals, equals)) {
            if (best == null
                    || g.weight > best.weight
                    || (g.weight == best.weight && g.count > best.count)) {
                best = g;
            }
        }
        return best == null ? null : best.answer;
    }

    /** Uniform pick among the distinct candidates. */
    public String pickRandom(List<Proposal> proposals, AnswerEquivalence equals) {
        List<Group> groups = group(proposals, equals);
        if (groups.isEmpty()) return null;
        return groups.get(random.nextInt(groups.size())).answer;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static List<Group> group(List<Proposal> proposals, AnswerEquivalence equals) {
        List<Group> groups = new ArrayList<>();
        for (Proposal p : proposals) {
            if (p.answer() == null || p.answer().isBlank()) continue;
            String answer = p.answer().strip();
            Group match = null;
            for (Group g : groups) {
                if (equals.equivalent(g.answer, answer)) {
                    match = g;
                    break;
                }
            }
            if (match == null) {
                match = new Group(answer);
                groups.add(match);
            }
            match.count++;
            match.weight += 1L + Math.max(0, p.priority());
        }
        return groups;
    }

    private static Map<String, Integer> toVotes(List<Group> groups) {
        Map<String, Integer> votes = new LinkedHashMap<>();
        groups.forEach(g -> votes.put(g.answer, g.count));
        return votes;
    }

    private static final class Group {
        final String answer;
        int  count;
        long weight;

        Group(String answer) { this.answer = answer; }
    }
}
