package com.agentcollab.orchestrator.llm;

import com.agentcollab.orchestrator.model.Agent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Request and response mapping only; nothing here touches the network.
 */
class AnthropicModelClientTest {

    ObjectMapper json = new ObjectMapper();
    AnthropicModelClient client = new AnthropicModelClient("http://localhost:1", "test-key", Duration.ofSeconds(1), json);

    @Test
    void writeRequest_systemMessagesGoToSystemField_toolTurnsSentAsUser() throws Exception {
        List<Message> messages = List.of(
                Message.system("Be brief."),
                Message.user("Hi"),
                Message.assistant("Calling tools: search"),
                Message.tool("Tool 'search' returned: 3 hits"));

        JsonNode body = json.readTree(client.writeRequest("claude-test", messages,
                List.of(new ToolSpec("search", "Search", null)),
                new Agent.ModelConfig(0.2, 512, null)));

        assertThat(body.get("model").asText()).isEqualTo("claude-test");
        assertThat(body.get("max_tokens").asInt()).isEqualTo(512);
        assertThat(body.get("temperature").asDouble()).isEqualTo(0.2);
        assertThat(body.get("system").asText()).isEqualTo("Be brief.");
        assertThat(body.get("messages")).hasSize(3);
        assertThat(body.get("messages").get(2).get("role").asText()).isEqualTo("user");
        assertThat(body.get("tools").get(0).get("input_schema").get("type").asText()).isEqualTo("object");
    }

    @Test
    void writeRequest_noConfig_usesDefaultMaxTokensAndOmitsTemperature() throws Exception {
        JsonNode body = json.readTree(client.writeRequest("m", List.of(Message.user("x")), List.of(), null));

        assertThat(body.get("max_tokens").asInt()).isEqualTo(4096);
        assertThat(body.has("temperature")).isFalse();
        assertThat(body.has("tools")).isFalse();
    }

    @Test
    void parse_textAndToolUseBlocksWithUsage() {
        String body = """
                {"id":"msg_1","content":[
                  {"type":"text","text":"Let me check."},
                  {"type":"tool_use","id":"tu_1","name":"search","input":{"q":"jdk 17"}}
                ],"usage":{"input_tokens":120,"output_tokens":30},"stop_reason":"tool_use"}
                """;

        ModelResponse r = client.parse(body);

        assertThat(r.content()).isEqualTo("Let me check.");
        assertThat(r.toolCalls()).singleElement().satisfies(c -> {
            assertThat(c.id()).isEqualTo("tu_1");
            assertThat(c.toolName()).isEqualTo("search");
            assertThat(c.arguments()).isEqualTo(Map.of("q", "jdk 17"));
        });
        assertThat(r.tokensUsed()).isEqualTo(150);
    }

    @Test
    void parse_garbage_throwsProviderException() {
        assertThatThrownBy(() -> client.parse("<html>bad gateway</html>"))
                .isInstanceOf(ModelProviderException.class);
    }

    @Test
    void providerException_retryableOnlyForServerErrors() {
        assertThat(new ModelProviderException(503, "unavailable").isRetryable()).isTrue();
        assertThat(new ModelProviderException(400, "bad request").isRetryable()).isFalse();
        assertThat(new RateLimitedException("slow down").isRetryable()).isTrue();
    }
}
