package com.agentcollab.orchestrator.collaboration;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * The single authoritative time source of one team run.
 *
 * Never goes backwards, even if the wall clock does, so log timestamps are
 * non-decreasing in insertion order.
 */
public class OrchestratorClock {

    private final Clock clock;
    private Instant last = Instant.EPOCH;

    public OrchestratorClock(Clock clock) {
        this.clock = clock;
    }

    public synchronized Instant now() {
        Instant t = clock.instant();
        if (t.isBefore(last)) {
            t = last;
        }
        last = t;
        return t;
    }

    public Duration elapsedSince(Instant start) {
        Duration d = Duration.between(start, now());
        return d.isNegative() ? Duration.ZERO : d;
    }
}
