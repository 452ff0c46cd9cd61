package com.agentcollab.orchestrator.model;

import java.util.List;

/**
 * Immutable configuration of one agent: model, prompt, tool allowlist and limits.
 *
 * Agents are created and updated by the surrounding CRUD services; the orchestrator
 * only ever reads them.
 */
public record Agent(
        String       id,
        String       name,
        boolean      enabled,
        String       modelId,
        ModelConfig  modelConfig,
        List<String> tools,
        Capabilities capabilities,
        MemoryPolicy memory,
        Behavior     behavior) {

    public Agent {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Agent id is required");
        if (modelId == null || modelId.isBlank()) throw new IllegalArgumentException("Agent modelId is required");
        if (name == null)         name = id;
        if (modelConfig == null)  modelConfig = ModelConfig.defaults();
        tools = tools == null ? List.of() : List.copyOf(tools);
        if (capabilities == null) capabilities = Capabilities.defaults();
        if (memory == null)       memory = MemoryPolicy.defaults();
        if (behavior == null)     behavior = Behavior.defaults();
    }

    /** An enabled agent with every setting at its default. */
    public static Agent of(String id, String modelId) {
        return new Agent(id, id, true, modelId, null, null, null, null, null);
    }

    public String systemPrompt() { return modelConfig.systemPrompt(); }

    public Agent withSystemPrompt(String prompt) {
        return withModelConfig(new ModelConfig(modelConfig.temperature(), modelConfig.maxTokens(), prompt));
    }

    public Agent withModelConfig(ModelConfig config) {
        return new Agent(id, name, enabled, modelId, config, tools, capabilities, memory, behavior);
    }

    public Agent withTools(List<String> toolIds) {
        return new Agent(id, name, enabled, modelId, modelConfig, toolIds, capabilities, memory, behavior);
    }

    public Agent withCapabilities(Capabilities caps) {
        return new Agent(id, name, enabled, modelId, modelConfig, tools, caps, memory, behavior);
    }

    public Agent withMemory(MemoryPolicy policy) {
        return new Agent(id, name, enabled, modelId, modelConfig, tools, capabilities, policy, behavior);
    }

    public Agent withBehavior(Behavior b) {
        return new Agent(id, name, enabled, modelId, modelConfig, tools, capabilities, memory, b);
    }

    public Agent withEnabled(boolean flag) {
        return new Agent(id, name, flag, modelId, modelConfig, tools, capabilities, memory, behavior);
    }

    // ------------------------------------------------------------------
    // Nested configuration blocks
    // ------------------------------------------------------------------

    /** Sampling settings forwarded to the model service; nulls mean "provider default". */
    public record ModelConfig(Double temperature, Integer maxTokens, String systemPrompt) {
        public static ModelConfig defaults() { return new ModelConfig(null, null, null); }
    }

    public record Capabilities(
            boolean canUseTools,
            boolean canDelegateToAgents,
            boolean canAccessMemory,
            boolean canAccessContext,
            int     maxToolCalls,
            int     maxDelegations) {

        public static Capabilities defaults() {
            return new Capabilities(true, false, true, true, 10, 5);
        }

        public Capabilities withDelegation(boolean allowed) {
            return new Capabilities(canUseTools, allowed, canAccessMemory, canAccessContext,
                    maxToolCalls, maxDelegations);
        }

        public Capabilities withMaxDelegations(int max) {
            return new Capabilities(canUseTools, canDelegateToAgents, canAccessMemory, canAccessContext,
                    maxToolCalls, max);
        }
    }

    public enum MemoryType { NONE, BUFFER, SUMMARY, VECTOR }

    /**
     * @param maxMessages number of prior exchanges (user + assistant pairs) replayed
     *                    into a session-scoped run
     */
    public record MemoryPolicy(MemoryType type, int maxMessages, boolean includeSystemMessages) {
        public MemoryPolicy {
            if (type == null) type = MemoryType.BUFFER;
        }

        public static MemoryPolicy defaults() { return new MemoryPolicy(MemoryType.BUFFER, 20, true); }
        public static MemoryPolicy none()     { return new MemoryPolicy(MemoryType.NONE, 0, false); }
    }

    public record Behavior(
            int     maxIterations,
            boolean stopOnToolError,
            boolean returnIntermediateSteps,
            boolean verbose) {

        public Behavior {
            if (maxIterations <= 0) throw new IllegalArgumentException("maxIterations must be positive");
        }

        public static Behavior defaults() { return new Behavior(10, false, false, false); }

        public Behavior withMaxIterations(int max) {
            return new Behavior(max, stopOnToolError, returnIntermediateSteps, verbose);
        }

        public Behavior withStopOnToolError(boolean stop) {
            return new Behavior(maxIterations, stop, returnIntermediateSteps, verbose);
        }
    }
}
