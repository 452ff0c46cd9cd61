package com.agentcollab.orchestrator.support;

import com.agentcollab.orchestrator.orchestration.ExecutionCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff for model and tool calls.
 *
 * @param maxRetries     retries after the first attempt (0 = single attempt)
 * @param initialBackoff delay before the first retry
 * @param multiplier     growth factor per retry
 * @param maxBackoff     cap on any single delay
 */
public record RetryPolicy(int maxRetries, Duration initialBackoff, double multiplier, Duration maxBackoff) {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    public RetryPolicy {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (initialBackoff == null) initialBackoff = Duration.ofMillis(100);
        if (multiplier < 1.0) multiplier = 1.0;
        if (maxBackoff == null) maxBackoff = Duration.ofSeconds(30);
    }

    public static RetryPolicy of(int maxRetries, Duration initialBackoff) {
        return new RetryPolicy(maxRetries, initialBackoff, 2.0, Duration.ofSeconds(30));
    }

    public static RetryPolicy none() {
        return new RetryPolicy(0, Duration.ZERO, 1.0, Duration.ZERO);
    }

    /** Delay before retry number {@code retry} (1-based). */
    public Duration backoffFor(int retry) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, retry - 1);
        return Duration.ofMillis((long) Math.min(millis, maxBackoff.toMillis()));
    }

    /**
     * Run {@code call}, retrying failures accepted by {@code retryable}.
     * The token is checked before every attempt and the backoff sleep is
     * abandoned on interrupt.
     *
     * @throws ExecutionCancelledException if the token is cancelled between attempts
     */
    public <T> T execute(String operation,
                         Supplier<T> call,
                         Predicate<RuntimeException> retryable,
                         CancellationToken token) {
        int retry = 0;
        while (true) {
            token.throwIfCancelled();
            try {
                return call.get();
            } catch (RuntimeException e) {
                if (token.isCancelled() || retry >= maxRetries || !retryable.test(e)) {
                    throw e;
                }
                retry++;
                Duration delay = backoffFor(retry);
                log.warn("{} failed ({}), retry {}/{} in {} ms",
                        operation, e.getMessage(), retry, maxRetries, delay.toMillis());
                sleep(delay, token);
            }
        }
    }

    private static void sleep(Duration delay, CancellationToken token) {
        if (delay.isZero()) return;
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionCancelledException(
                    token.reason() == null ? "Interrupted during retry backoff" : token.reason());
        }
    }
}
