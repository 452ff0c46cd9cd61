package com.agentcollab.orchestrator.collaboration;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Append-only, totally ordered record of every cross-agent interaction in a
 * team run.
 *
 * Timestamps come from the run's {@link OrchestratorClock}, never from the
 * agents, and every append also receives the next insertion sequence number.
 * After {@link #freeze()} the log rejects appends; entries are never edited
 * or removed.
 *
 * Writes come from the orchestrator's coordinating thread only. Methods are
 * synchronized so that pollers on other threads get a consistent copy.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
                getterVisibility = JsonAutoDetect.Visibility.NONE,
                isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class CollaborationLog {

    private List<CollaborationEntry> entries = new ArrayList<>();
    private boolean frozen;

    @JsonIgnore private transient OrchestratorClock clock;
    @JsonIgnore private transient Consumer<CollaborationEntry> listener;

    private CollaborationLog() {}   // Jackson

    public CollaborationLog(OrchestratorClock clock, Consumer<CollaborationEntry> listener) {
        this.clock    = clock;
        this.listener = listener == null ? e -> { } : listener;
    }

    public synchronized CollaborationEntry append(CollaborationEventType type,
                                                  String fromAgentId,
                                                  String toAgentId,
                                                  String content) {
        if (frozen) {
            throw new IllegalStateException("Collaboration log is frozen; cannot append " + type);
        }
        if (clock == null) {
            throw new IllegalStateException("Collaboration log was reloaded from storage and is read-only");
        }
        CollaborationEntry entry = new CollaborationEntry(
                entries.size() + 1L, clock.now(), type, fromAgentId, toAgentId, content);
        entries.add(entry);
        listener.accept(entry);
        return entry;
    }

    /** Seal the log. Idempotent. */
    public synchronized void freeze() {
        frozen = true;
    }

    public synchronized boolean isFrozen() {
        return frozen;
    }

    /** Entries in total order (timestamp, then insertion sequence). */
    public synchronized List<CollaborationEntry> entries() {
        List<CollaborationEntry> copy = new ArrayList<>(entries);
        copy.sort(CollaborationEntry.TOTAL_ORDER);
        return List.copyOf(copy);
    }

    public synchronized List<CollaborationEntry> entriesOfType(CollaborationEventType type) {
        return entries().stream().filter(e -> e.type() == type).toList();
    }

    public synchronized int size() {
        return entries.size();
    }
}
