package com.agentcollab.orchestrator.llm;

import com.agentcollab.orchestrator.model.Agent;

import java.util.List;

/**
 * Model inference, seen from the orchestrator.
 *
 * Implementations make a single attempt; retrying is the caller's business.
 * A blocked call must give up promptly when its thread is interrupted.
 */
public interface ModelInvocationService {

    /**
     * @throws ModelProviderException the provider rejected or failed the request
     * @throws RateLimitedException   the provider asked us to slow down
     * @throws ModelTimeoutException  no answer within the configured timeout
     */
    ModelResponse invoke(String modelId, List<Message> messages, List<ToolSpec> toolSpecs, Agent.ModelConfig config);
}
