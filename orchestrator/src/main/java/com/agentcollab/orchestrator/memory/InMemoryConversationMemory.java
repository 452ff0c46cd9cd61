package com.agentcollab.orchestrator.memory;

import com.agentcollab.orchestrator.llm.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link ConversationMemory}. Histories live as long as the JVM.
 */
@Component
public class InMemoryConversationMemory implements ConversationMemory {

    private static final Logger log = LoggerFactory.getLogger(InMemoryConversationMemory.class);

    private final Map<String, Map<String, List<Message>>> sessions = new ConcurrentHashMap<>();

    @Override
    public List<Message> history(String sessionId, String agentId, int maxMessages) {
        Map<String, List<Message>> perAgent = sessions.get(sessionId);
        List<Message> all = perAgent == null ? null : perAgent.get(agentId);
        if (all == null || all.isEmpty() || maxMessages <= 0) {
            return List.of();
        }
        int start = Math.max(0, all.size() - maxMessages * 2);
        List<Message> recent = List.copyOf(all.subList(start, all.size()));
        log.debug("Memory lookup session={} agent={} -> {} message(s)", sessionId, agentId, recent.size());
        return recent;
    }

    @Override
    public void append(String sessionId, String agentId, List<Message> messages) {
        sessions.computeIfAbsent(sessionId, key -> new ConcurrentHashMap<>())
                .compute(agentId, (id, existing) -> {
                    List<Message> target = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
                    target.addAll(messages);
                    log.debug("Appended {} message(s) session={} agent={} -> total={}",
                            messages.size(), sessionId, agentId, target.size());
                    return target;
                });
    }

    @Override
    public void clear(String sessionId) {
        Map<String, List<Message>> removed = sessions.remove(sessionId);
        if (removed != null) {
            log.debug("Cleared conversation memory session={} agents={}", sessionId, removed.keySet());
        }
    }
}
