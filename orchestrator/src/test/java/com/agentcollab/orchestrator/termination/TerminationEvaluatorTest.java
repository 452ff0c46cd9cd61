package com.agentcollab.orchestrator.termination;

import com.agentcollab.orchestrator.model.TerminationPolicy;
import com.agentcollab.orchestrator.model.TerminationReason;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TerminationEvaluatorTest {

    @Test
    void evaluate_durationAndIterationsBothExceeded_reportsDuration() {
        TerminationPolicy policy = new TerminationPolicy(3, null, Duration.ofSeconds(10), null);

        TerminationDecision d = TerminationEvaluator.evaluate(0, Duration.ofSeconds(11), 5, List.of(), policy);

        assertThat(d.shouldStop()).isTrue();
        assertThat(d.reason()).isEqualTo(TerminationReason.MAX_DURATION);
    }

    @Test
    void evaluate_tokensAndIterationsBothExceeded_reportsTokens() {
        TerminationPolicy policy = new TerminationPolicy(2, 100L, null, null);

        TerminationDecision d = TerminationEvaluator.evaluate(150, Duration.ZERO, 2, List.of(), policy);

        assertThat(d.reason()).isEqualTo(TerminationReason.MAX_TOKENS);
    }

    @Test
    void evaluate_roundReachesMaxIterations_stops() {
        TerminationPolicy policy = TerminationPolicy.defaults().withMaxIterations(2);

        assertThat(TerminationEvaluator.evaluate(0, Duration.ZERO, 1, List.of(), policy).shouldStop()).isFalse();
        assertThat(TerminationEvaluator.evaluate(0, Duration.ZERO, 2, List.of(), policy).reason())
                .isEqualTo(TerminationReason.MAX_ITERATIONS);
    }

    @Test
    void evaluate_stopPhraseInAnyCase_stops() {
        TerminationPolicy policy = TerminationPolicy.defaults().withStopPhrases(List.of("STOP"));

        TerminationDecision d = TerminationEvaluator.evaluate(
                0, Duration.ZERO, 1, List.of("all good", "we should stop here"), policy);

        assertThat(d.reason()).isEqualTo(TerminationReason.STOP_PHRASE);
        assertThat(d.detail()).contains("STOP");
    }

    @Test
    void evaluate_nothingTripped_continues() {
        TerminationPolicy policy = new TerminationPolicy(5, 1_000L, Duration.ofMinutes(1), List.of("DONE"));

        TerminationDecision d = TerminationEvaluator.evaluate(10, Duration.ofSeconds(1), 1, List.of("working"), policy);

        assertThat(d).isSameAs(TerminationDecision.CONTINUE);
    }

    @Test
    void evaluateLimits_ignoresRoundCounter() {
        TerminationPolicy policy = TerminationPolicy.defaults().withMaxIterations(1);

        assertThat(TerminationEvaluator.evaluateLimits(0, Duration.ZERO, List.of(), policy).shouldStop()).isFalse();
    }
}
