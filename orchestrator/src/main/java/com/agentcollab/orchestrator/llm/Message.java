package com.agentcollab.orchestrator.llm;

/**
 * One conversation turn sent to the model.
 * role is one of "system", "user", "assistant" or "tool".
 */
public record Message(String role, String content) {

    public static Message system(String content)    { return new Message("system", content); }
    public static Message user(String content)      { return new Message("user", content); }
    public static Message assistant(String content) { return new Message("assistant", content); }
    public static Message tool(String content)      { return new Message("tool", content); }
}
