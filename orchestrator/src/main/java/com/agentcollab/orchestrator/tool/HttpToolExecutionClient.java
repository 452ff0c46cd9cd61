package com.agentcollab.orchestrator.tool;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP client for the tool executor service.
 *
 * {@code POST /tools/{id}/execute} with {@code {arguments, context}}; the
 * executor answers {@code {result}} or {@code {error}}. Blocking I/O is fine
 * here: calls come from agent executor threads.
 */
@Component
public class HttpToolExecutionClient implements ToolExecutionService {

    private static final Logger log = LoggerFactory.getLogger(HttpToolExecutionClient.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ExecuteResponse(Object result, String error) {}

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;

    public HttpToolExecutionClient(@Value("${agentcollab.tool.base-url}") String baseUrl,
                                   ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public ToolResult execute(String toolId, Map<String, Object> args, ToolExecutionContext context) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("team_execution_id",  context.teamExecutionId());
        ctx.put("agent_execution_id", context.agentExecutionId());
        ctx.put("agent_id",           context.agentId());
        ctx.put("sandboxed",          context.sandboxed());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("arguments", args);
        body.put("context",   ctx);

        String opName = "execute tool '" + toolId + "'";
        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/tools/" + toolId + "/execute"))
                    .timeout(context.timeout())
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)))
                    .build();
            log.debug("Executing tool '{}' for agent {}", toolId, context.agentId());
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ToolExecutionException(ToolExecutionException.Kind.TIMEOUT,
                    opName + " timed out after " + context.timeout(), e);
        } catch (JsonProcessingException e) {
            throw new ToolExecutionException(ToolExecutionException.Kind.EXECUTOR_ERROR,
                    "Could not encode arguments for " + opName, e);
        } catch (IOException e) {
            throw new ToolExecutionException(ToolExecutionException.Kind.EXECUTOR_ERROR, opName + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolExecutionException(ToolExecutionException.Kind.EXECUTOR_ERROR, opName + " interrupted", e);
        }

        int status = resp.statusCode();
        if (status == 403) {
            throw new ToolExecutionException(ToolExecutionException.Kind.NOT_PERMITTED,
                    opName + " refused by executor: " + resp.body());
        }
        if (status == 429) {
            throw new ToolExecutionException(ToolExecutionException.Kind.RATE_LIMITED,
                    opName + " rate limited by executor");
        }
        if (status < 200 || status >= 300) {
            throw new ToolExecutionException(ToolExecutionException.Kind.EXECUTOR_ERROR,
                    opName + " failed, HTTP " + status + ": " + resp.body());
        }

        try {
            ExecuteResponse parsed = json.readValue(resp.body(), ExecuteResponse.class);
            return parsed.error() != null ? ToolResult.error(parsed.error()) : ToolResult.ok(parsed.result());
        } catch (JsonProcessingException e) {
            throw new ToolExecutionException(ToolExecutionException.Kind.EXECUTOR_ERROR,
                    "Unreadable response for " + opName, e);
        }
    }
}
