package com.agentcollab.orchestrator.llm;

import com.agentcollab.orchestrator.model.Agent;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Model double keyed by model id. Each id has a queue of scripted turns and
 * an optional fallback used once the queue is empty. Every call is recorded.
 *
 * Text replies cost 10 input + 5 output tokens.
 */
public class ScriptedModel implements ModelInvocationService {

    public record Call(String modelId, List<Message> messages) {
        public String lastUserMessage() {
            for (int i = messages.size() - 1; i >= 0; i--) {
                if ("user".equals(messages.get(i).role())) return messages.get(i).content();
            }
            return "";
        }
    }

    private final Map<String, Deque<Function<List<Message>, ModelResponse>>> scripts  = new ConcurrentHashMap<>();
    private final Map<String, Function<List<Message>, ModelResponse>>        fallback = new ConcurrentHashMap<>();
    private final List<Call> calls = Collections.synchronizedList(new ArrayList<>());

    public ScriptedModel reply(String modelId, String... texts) {
        for (String text : texts) {
            then(modelId, m -> ModelResponse.text(text, 10, 5));
        }
        return this;
    }

    public ScriptedModel then(String modelId, Function<List<Message>, ModelResponse> turn) {
        Deque<Function<List<Message>, ModelResponse>> queue = scripts.computeIfAbsent(modelId, k -> new ArrayDeque<>());
        synchronized (queue) {
            queue.addLast(turn);
        }
        return this;
    }

    public ScriptedModel always(String modelId, String text) {
        return always(modelId, m -> ModelResponse.text(text, 10, 5));
    }

    public ScriptedModel always(String modelId, Function<List<Message>, ModelResponse> turn) {
        fallback.put(modelId, turn);
        return this;
    }

    @Override
    public ModelResponse invoke(String modelId, List<Message> messages, List<ToolSpec> tools, Agent.ModelConfig config) {
        calls.add(new Call(modelId, List.copyOf(messages)));
        Function<List<Message>, ModelResponse> turn = null;
        Deque<Function<List<Message>, ModelResponse>> queue = scripts.get(modelId);
        if (queue != null) {
            synchronized (queue) {
                turn = queue.pollFirst();
            }
        }
        if (turn == null) turn = fallback.get(modelId);
        if (turn == null) {
            throw new IllegalStateException("No scripted response left for model " + modelId);
        }
        return turn.apply(messages);
    }

    public List<Call> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    public List<Call> callsFor(String modelId) {
        return calls().stream().filter(c -> c.modelId().equals(modelId)).toList();
    }

    public int callCount() {
        return calls.size();
    }
}
