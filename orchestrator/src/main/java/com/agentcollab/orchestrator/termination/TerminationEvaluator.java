package com.agentcollab.orchestrator.termination;

import com.agentcollab.orchestrator.model.TerminationPolicy;
import com.agentcollab.orchestrator.model.TerminationReason;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Pure stop/continue decision over the state of a team run.
 *
 * Conditions are checked in a fixed order: maxDuration, maxTokens,
 * maxIterations, stopPhrases. The first one that holds is the reported
 * reason, so simultaneous breaches always report the same thing.
 */
public final class TerminationEvaluator {

    private TerminationEvaluator() {}

    /**
     * @param elapsedTokens   tokens consumed by the run so far
     * @param elapsedDuration wall-clock time since the run started
     * @param round           number of completed rounds (1 after the first)
     * @param recentOutputs   agent responses produced in the round just finished
     */
    public static TerminationDecision evaluate(long elapsedTokens,
                                               Duration elapsedDuration,
                                               int round,
                                               List<String> recentOutputs,
                                               TerminationPolicy policy) {
        if (policy.maxDuration() != null && elapsedDuration.compareTo(policy.maxDuration()) >= 0) {
            return TerminationDecision.stop(TerminationReason.MAX_DURATION,
                    "Elapsed " + elapsedDuration + " reached limit " + policy.maxDuration());
        }
        if (policy.maxTokens() != null && elapsedTokens >= policy.maxTokens()) {
            return TerminationDecision.stop(TerminationReason.MAX_TOKENS,
                    "Used " + elapsedTokens + " tokens, limit " + policy.maxTokens());
        }
        if (round >= policy.maxIterations()) {
            return TerminationDecision.stop(TerminationReason.MAX_ITERATIONS,
                    "Completed " + round + " rounds, limit " + policy.maxIterations());
        }
        String phrase = firstStopPhrase(recentOutputs, policy.stopPhrases());
        if (phrase != null) {
            return TerminationDecision.stop(TerminationReason.STOP_PHRASE,
                    "Agent output contained stop phrase '" + phrase + "'");
        }
        return TerminationDecision.CONTINUE;
    }

    /**
     * The limits that can trip between rounds (everything except the round
     * counter). Used by the parallel pattern before each launch.
     */
    public static TerminationDecision evaluateLimits(long elapsedTokens,
                                                     Duration elapsedDuration,
                                                     List<String> recentOutputs,
                                                     TerminationPolicy policy) {
        return evaluate(elapsedTokens, elapsedDuration, 0,
                recentOutputs, policy.withMaxIterations(Integer.MAX_VALUE));
    }

    /** Case-insensitive substring match; returns the phrase that matched, or null. */
    static String firstStopPhrase(List<String> outputs, List<String> phrases) {
        if (outputs == null || phrases.isEmpty()) return null;
        for (String output : outputs) {
            if (output == null) continue;
            String haystack = output.toLowerCase(Locale.ROOT);
            for (String phrase : phrases) {
                if (phrase != null && !phrase.isEmpty()
                        && haystack.contains(phrase.toLowerCase(Locale.ROOT))) {
                    return phrase;
                }
            }
        }
        return null;
    }
}
