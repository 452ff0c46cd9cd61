package com.agentcollab.orchestrator.collaboration;

/** Kinds of cross-agent interaction recorded in the collaboration log. */
public enum CollaborationEventType {
    DELEGATION,
    MESSAGE,
    TOOL_SHARE,
    VOTE,
    CONSENSUS,
    INTERVENTION
}
