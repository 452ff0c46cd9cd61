package com.agentcollab.orchestrator.agent;

import com.agentcollab.orchestrator.model.Agent;
import com.agentcollab.orchestrator.model.AgentInput;
import com.agentcollab.orchestrator.model.SharedContextSnapshot;

import java.util.Map;

/**
 * Renders the text an agent sees: its system prompt, and a first user turn
 * carrying the task, the input context and the team's shared context.
 */
final class PromptBuilder {

    private static final String DEFAULT_SYSTEM_PROMPT =
            "You are a helpful assistant working as part of a team of agents.";

    private static final String DELEGATION_RULES = """

            DELEGATION:
              You may hand a subtask to a teammate instead of answering yourself. To do so,
              write exactly one tag and nothing else that matters:
                <delegate to="AGENT_ID">what the teammate should do</delegate>
              You will be re-run with the teammate's result.
            """;

    private static final String ANSWER_RULES = """

            When you are done, write your final answer. You may wrap it in
            <result>...</result> tags; anything outside the tags is then ignored.
            """;

    private PromptBuilder() {}

    static String systemPrompt(Agent agent) {
        String base = agent.systemPrompt() == null || agent.systemPrompt().isBlank()
                ? DEFAULT_SYSTEM_PROMPT
                : agent.systemPrompt();
        StringBuilder sb = new StringBuilder(base.strip()).append('\n');
        if (agent.capabilities().canDelegateToAgents()) {
            sb.append(DELEGATION_RULES);
        }
        sb.append(ANSWER_RULES);
        return sb.toString();
    }

    /**
     * @param snapshot null or empty when the agent may not see shared context
     */
    static String userMessage(AgentInput input, SharedContextSnapshot snapshot) {
        StringBuilder sb = new StringBuilder();
        if (snapshot != null && !snapshot.isEmpty()) {
            sb.append(renderSharedContext(snapshot)).append('\n');
        }
        if (!input.context().isEmpty()) {
            sb.append("=== CONTEXT ===\n");
            renderValues(sb, input.context());
            sb.append("=== END CONTEXT ===\n\n");
        }
        sb.append(input.message());
        return sb.toString();
    }

    static String renderSharedContext(SharedContextSnapshot snapshot) {
        StringBuilder sb = new StringBuilder("=== SHARED CONTEXT ===\n");
        renderValues(sb, snapshot.values());
        for (SharedContextSnapshot.Contribution c : snapshot.contributions()) {
            String what = c.kind() == SharedContextSnapshot.Kind.RESPONSE ? "response" : "tool result";
            sb.append("[ ").append(c.agentId());
            if (c.role() != null) sb.append(" (").append(c.role()).append(')');
            sb.append(' ').append(what).append(" ]\n")
              .append(c.content()).append("\n\n");
        }
        sb.append("=== END SHARED CONTEXT ===\n");
        return sb.toString();
    }

    private static void renderValues(StringBuilder sb, Map<String, Object> values) {
        values.forEach((k, v) -> sb.append(k).append(": ").append(v).append('\n'));
    }
}
