package com.agentcollab.orchestrator.termination;

import com.agentcollab.orchestrator.model.TerminationReason;

/**
 * @param reason null when {@code shouldStop} is false
 * @param detail human-readable explanation for logs and the collaboration log
 */
public record TerminationDecision(boolean shouldStop, TerminationReason reason, String detail) {

    public static final TerminationDecision CONTINUE = new TerminationDecision(false, null, null);

    public static TerminationDecision stop(TerminationReason reason, String detail) {
        return new TerminationDecision(true, reason, detail);
    }
}
