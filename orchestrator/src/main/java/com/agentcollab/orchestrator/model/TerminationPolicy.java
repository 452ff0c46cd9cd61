package com.agentcollab.orchestrator.model;

import java.time.Duration;
import java.util.List;

/**
 * Limits that end a team run. Null limits are not enforced;
 * maxIterations always is.
 */
public record TerminationPolicy(
        int          maxIterations,
        Long         maxTokens,
        Duration     maxDuration,
        List<String> stopPhrases) {

    public static final int DEFAULT_MAX_ITERATIONS = 20;

    public TerminationPolicy {
        if (maxIterations <= 0) maxIterations = DEFAULT_MAX_ITERATIONS;
        stopPhrases = stopPhrases == null ? List.of() : List.copyOf(stopPhrases);
    }

    public static TerminationPolicy defaults() {
        return new TerminationPolicy(DEFAULT_MAX_ITERATIONS, null, null, null);
    }

    public TerminationPolicy withMaxIterations(int max) {
        return new TerminationPolicy(max, maxTokens, maxDuration, stopPhrases);
    }

    public TerminationPolicy withMaxTokens(Long max) {
        return new TerminationPolicy(maxIterations, max, maxDuration, stopPhrases);
    }

    public TerminationPolicy withMaxDuration(Duration max) {
        return new TerminationPolicy(maxIterations, maxTokens, max, stopPhrases);
    }

    public TerminationPolicy withStopPhrases(List<String> phrases) {
        return new TerminationPolicy(maxIterations, maxTokens, maxDuration, phrases);
    }
}
