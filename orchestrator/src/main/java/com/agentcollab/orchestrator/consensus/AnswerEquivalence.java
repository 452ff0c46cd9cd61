package com.agentcollab.orchestrator.consensus;

import java.util.Locale;

/**
 * Decides whether two answers count as the same vote.
 *
 * The core only ships {@link #NORMALIZED}. Semantic equivalence (embeddings,
 * a judging model) is plugged in by callers.
 */
@FunctionalInterface
public interface AnswerEquivalence {

    boolean equivalent(String a, String b);

    /** Exact equality after trim and lower-casing. */
    AnswerEquivalence NORMALIZED = (a, b) -> normalize(a).equals(normalize(b));

    static String normalize(String answer) {
        return answer == null ? "" : answer.strip().toLowerCase(Locale.ROOT);
    }
}
