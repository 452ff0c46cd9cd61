package com.agentcollab.orchestrator.collaboration;

import java.time.Instant;
import java.util.Comparator;

/**
 * One immutable collaboration log entry.
 *
 * @param sequence    1-based insertion sequence; breaks timestamp ties
 * @param fromAgentId sender, null for orchestrator-originated entries
 * @param toAgentId   recipient, null for broadcasts
 */
public record CollaborationEntry(
        long                   sequence,
        Instant                timestamp,
        CollaborationEventType type,
        String                 fromAgentId,
        String                 toAgentId,
        String                 content) {

    /** Total order of the log: timestamp first, insertion sequence second. */
    public static final Comparator<CollaborationEntry> TOTAL_ORDER =
            Comparator.comparing(CollaborationEntry::timestamp)
                      .thenComparingLong(CollaborationEntry::sequence);
}
