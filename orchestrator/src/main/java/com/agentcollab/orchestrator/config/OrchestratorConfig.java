package com.agentcollab.orchestrator.config;

import com.agentcollab.orchestrator.consensus.AnswerEquivalence;
import com.agentcollab.orchestrator.consensus.ConsensusResolver;
import com.agentcollab.orchestrator.support.RetryPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class OrchestratorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Pool that runs submitted team executions, one coordinating thread per
     * run. Parallel patterns spawn their own bounded per-run workers.
     */
    @Bean(name = "teamWorkers", destroyMethod = "shutdownNow")
    public ExecutorService teamWorkers(@Value("${agentcollab.team.workers:4}") int workers) {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, workers), r -> {
            Thread t = new Thread(r, "team-run-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public Random random() {
        return new Random();
    }

    @Bean
    public ConsensusResolver consensusResolver(Random random) {
        return new ConsensusResolver(random);
    }

    @Bean
    public AnswerEquivalence answerEquivalence() {
        return AnswerEquivalence.NORMALIZED;
    }

    @Bean
    public RetryPolicy modelRetryPolicy(@Value("${agentcollab.model.retries:3}") int retries,
                                        @Value("${agentcollab.model.initial-backoff:PT1S}") Duration initialBackoff) {
        return RetryPolicy.of(retries, initialBackoff);
    }
}
