package com.agentcollab.orchestrator.llm;

import com.agentcollab.orchestrator.model.Agent;
import com.agentcollab.orchestrator.model.ToolCall;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link ModelInvocationService} over the Anthropic Messages API.
 *
 * Raw HttpClient, no SDK: the endpoint is plain REST and we want to see
 * exactly what goes on the wire. "system" messages are lifted into the
 * top-level system parameter; "tool" messages (tool observations) are sent
 * as user turns.
 */
@Component
public class AnthropicModelClient implements ModelInvocationService {

    private static final Logger log = LoggerFactory.getLogger(AnthropicModelClient.class);

    // -------------------------------------------------------------------------
    // Wire records
    // -------------------------------------------------------------------------

    record WireMessage(String role, String content) {}

    record WireTool(String name, String description, @JsonProperty("input_schema") Map<String, Object> inputSchema) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MessagesResponse(List<ContentBlock> content, Usage usage) {

        @JsonIgnoreProperties(ignoreUnknown = true)
        record ContentBlock(String type, String text, String id, String name, Map<String, Object> input) {}

        @JsonIgnoreProperties(ignoreUnknown = true)
        record Usage(@JsonProperty("input_tokens") long inputTokens,
                     @JsonProperty("output_tokens") long outputTokens) {}
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String API_VER    = "2023-06-01";
    private static final int    MAX_TOKENS = 4096;

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       apiKey;
    private final Duration     timeout;

    public AnthropicModelClient(@Value("${agentcollab.model.base-url}") String baseUrl,
                                @Value("${agentcollab.model.api-key}") String apiKey,
                                @Value("${agentcollab.model.timeout:PT60S}") Duration timeout,
                                ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.apiKey  = apiKey;
        this.timeout = timeout;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // ModelInvocationService
    // -------------------------------------------------------------------------

    @Override
    public ModelResponse invoke(String modelId, List<Message> messages, List<ToolSpec> toolSpecs,
                                Agent.ModelConfig config) {
        String requestBody = writeRequest(modelId, messages, toolSpecs, config);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/v1/messages"))
                .timeout(timeout)
                .header("content-type",      "application/json")
                .header("x-api-key",         apiKey)
                .header("anthropic-version", API_VER)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();

        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ModelTimeoutException("Model %s did not answer within %s".formatted(modelId, timeout), e);
        } catch (IOException e) {
            throw new ModelProviderException("Model API call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelProviderException("Model API call interrupted", e);
        }

        int status = response.statusCode();
        if (status == 429) {
            throw new RateLimitedException("Model API rate limited: " + response.body());
        }
        if (status == 408 || status == 504) {
            throw new ModelTimeoutException("Model API timed out with status " + status, null);
        }
        if (status != 200) {
            throw new ModelProviderException(status, response.body());
        }

        ModelResponse parsed = parse(response.body());
        log.debug("Model {} answered: {} input / {} output tokens, {} tool calls",
                modelId, parsed.inputTokens(), parsed.outputTokens(), parsed.toolCalls().size());
        return parsed;
    }

    // -------------------------------------------------------------------------
    // Request / response mapping
    // -------------------------------------------------------------------------

    String writeRequest(String modelId, List<Message> messages, List<ToolSpec> toolSpecs, Agent.ModelConfig config) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", modelId);
        body.put("max_tokens", config != null && config.maxTokens() != null ? config.maxTokens() : MAX_TOKENS);
        if (config != null && config.temperature() != null) {
            body.put("temperature", config.temperature());
        }

        String system = messages.stream()
                .filter(m -> "system".equals(m.role()))
                .map(Message::content)
                .collect(Collectors.joining("\n\n"));
        if (!system.isEmpty()) {
            body.put("system", system);
        }

        List<WireMessage> wire = new ArrayList<>();
        for (Message m : messages) {
            switch (m.role()) {
                case "system"    -> { }
                case "assistant" -> wire.add(new WireMessage("assistant", m.content()));
                default          -> wire.add(new WireMessage("user", m.content()));
            }
        }
        body.put("messages", wire);

        if (toolSpecs != null && !toolSpecs.isEmpty()) {
            body.put("tools", toolSpecs.stream()
                    .map(t -> new WireTool(t.name(), t.description(), t.inputSchema()))
                    .toList());
        }

        try {
            return json.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ModelProviderException("Could not encode model request", e);
        }
    }

    ModelResponse parse(String body) {
        MessagesResponse parsed;
        try {
            parsed = json.readValue(body, MessagesResponse.class);
        } catch (JsonProcessingException e) {
            throw new ModelProviderException("Unreadable model response", e);
        }

        StringBuilder text = new StringBuilder();
        List<ToolCall> calls = new ArrayList<>();
        if (parsed.content() != null) {
            for (MessagesResponse.ContentBlock block : parsed.content()) {
                if ("text".equals(block.type()) && block.text() != null) {
                    if (text.length() > 0) text.append('\n');
                    text.append(block.text());
                } else if ("tool_use".equals(block.type())) {
                    calls.add(new ToolCall(block.id(), block.name(), block.input()));
                }
            }
        }
        MessagesResponse.Usage usage = parsed.usage();
        return new ModelResponse(text.toString(), calls,
                usage == null ? 0 : usage.inputTokens(),
                usage == null ? 0 : usage.outputTokens());
    }
}
