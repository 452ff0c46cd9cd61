package com.agentcollab.orchestrator.tool;

import com.agentcollab.orchestrator.llm.ToolSpec;

import java.time.Duration;
import java.util.Map;

/**
 * A tool agents may call, as registered with the {@link ToolRegistry}.
 *
 * Agents list tools by {@code id} in their allowlist; the model sees and
 * calls them by {@code name}.
 *
 * @param parameters JSON schema of the arguments object
 */
public record ToolDefinition(
        String              id,
        String              name,
        String              description,
        Map<String, Object> parameters,
        ExecutionPolicy     execution,
        Permissions         permissions,
        boolean             enabled) {

    public ToolDefinition {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Tool id is required");
        if (name == null)        name = id;
        if (description == null) description = "";
        parameters = parameters == null ? Map.of("type", "object") : Map.copyOf(parameters);
        if (execution == null)   execution = ExecutionPolicy.defaults();
        if (permissions == null) permissions = Permissions.unrestricted();
    }

    public static ToolDefinition of(String id, String description) {
        return new ToolDefinition(id, id, description, null, null, null, true);
    }

    public ToolDefinition withExecution(ExecutionPolicy policy) {
        return new ToolDefinition(id, name, description, parameters, policy, permissions, enabled);
    }

    public ToolDefinition withPermissions(Permissions perms) {
        return new ToolDefinition(id, name, description, parameters, execution, perms, enabled);
    }

    public ToolSpec toSpec() {
        return new ToolSpec(name, description, parameters);
    }

    /**
     * @param timeout   per-attempt deadline
     * @param retries   retries after a failed attempt (executor errors and timeouts only)
     * @param sandboxed forwarded to the executor, which decides what it means
     */
    public record ExecutionPolicy(Duration timeout, int retries, boolean sandboxed) {

        public ExecutionPolicy {
            if (timeout == null) timeout = Duration.ofSeconds(30);
            if (retries < 0) retries = 0;
        }

        public static ExecutionPolicy defaults() {
            return new ExecutionPolicy(Duration.ofSeconds(30), 3, true);
        }
    }

    /**
     * @param requiresConfirmation a human must approve each call; unattended runs may not use the tool
     * @param rateLimitPerMinute   calls allowed per rolling minute, null for no limit
     */
    public record Permissions(boolean requiresConfirmation, Integer rateLimitPerMinute) {

        public static Permissions unrestricted() {
            return new Permissions(false, null);
        }
    }
}
