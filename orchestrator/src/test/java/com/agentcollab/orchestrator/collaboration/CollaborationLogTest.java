package com.agentcollab.orchestrator.collaboration;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CollaborationLogTest {

    /** A clock that can be moved backwards to simulate wall-clock skew. */
    static class MutableClock extends Clock {
        Instant now = Instant.parse("2026-01-01T00:00:00Z");

        @Override public ZoneOffset getZone()             { return ZoneOffset.UTC; }
        @Override public Clock withZone(java.time.ZoneId z) { return this; }
        @Override public Instant instant()                { return now; }
    }

    @Test
    void append_sameTimestamp_orderedBySequence() {
        MutableClock clock = new MutableClock();
        CollaborationLog log = new CollaborationLog(new OrchestratorClock(clock), null);

        log.append(CollaborationEventType.MESSAGE, "a", null, "first");
        log.append(CollaborationEventType.MESSAGE, "b", null, "second");
        log.append(CollaborationEventType.VOTE, "c", null, "third");

        assertThat(log.entries()).extracting(CollaborationEntry::content)
                .containsExactly("first", "second", "third");
        assertThat(log.entries()).extracting(CollaborationEntry::sequence).containsExactly(1L, 2L, 3L);
    }

    @Test
    void append_wallClockGoesBackwards_timestampsNeverDecrease() {
        MutableClock clock = new MutableClock();
        CollaborationLog log = new CollaborationLog(new OrchestratorClock(clock), null);

        log.append(CollaborationEventType.MESSAGE, "a", null, "one");
        clock.now = clock.now.minusSeconds(30);
        log.append(CollaborationEventType.MESSAGE, "a", null, "two");

        List<CollaborationEntry> entries = log.entries();
        assertThat(entries.get(1).timestamp()).isEqualTo(entries.get(0).timestamp());
        assertThat(entries).extracting(CollaborationEntry::content).containsExactly("one", "two");
    }

    @Test
    void append_notifiesListener() {
        List<CollaborationEntry> seen = new ArrayList<>();
        CollaborationLog log = new CollaborationLog(new OrchestratorClock(new MutableClock()), seen::add);

        log.append(CollaborationEventType.DELEGATION, "a", "b", "take this");

        assertThat(seen).singleElement().satisfies(e -> {
            assertThat(e.fromAgentId()).isEqualTo("a");
            assertThat(e.toAgentId()).isEqualTo("b");
        });
    }

    @Test
    void append_afterFreeze_throws() {
        CollaborationLog log = new CollaborationLog(new OrchestratorClock(new MutableClock()), null);
        log.append(CollaborationEventType.MESSAGE, "a", null, "x");
        log.freeze();

        assertThatThrownBy(() -> log.append(CollaborationEventType.MESSAGE, "a", null, "y"))
                .isInstanceOf(IllegalStateException.class);
        assertThat(log.size()).isEqualTo(1);
    }

    @Test
    void entriesOfType_filters() {
        CollaborationLog log = new CollaborationLog(new OrchestratorClock(new MutableClock()), null);
        log.append(CollaborationEventType.VOTE, "a", null, "1");
        log.append(CollaborationEventType.MESSAGE, "a", null, "hi");
        log.append(CollaborationEventType.VOTE, "b", null, "2");

        assertThat(log.entriesOfType(CollaborationEventType.VOTE)).hasSize(2);
    }
}
