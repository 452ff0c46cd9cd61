package com.agentcollab.orchestrator.memory;

import com.agentcollab.orchestrator.llm.Message;

import java.util.List;

/**
 * Per-session conversation history of an agent, replayed into later runs of
 * the same session.
 */
public interface ConversationMemory {

    /**
     * The most recent {@code maxMessages} exchanges (user + assistant pairs)
     * of the agent in the session, oldest first.
     */
    List<Message> history(String sessionId, String agentId, int maxMessages);

    void append(String sessionId, String agentId, List<Message> messages);

    /** Forget everything recorded for the session, for every agent. */
    void clear(String sessionId);
}
