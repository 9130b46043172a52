package me.golemcore.gateway.adapter.outbound.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.gateway.domain.model.CanonicalRequest;
import me.golemcore.gateway.domain.model.CanonicalResponse;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.ReasoningSegment;
import me.golemcore.gateway.domain.model.Role;
import me.golemcore.gateway.domain.model.StreamDelta;
import me.golemcore.gateway.domain.model.TextSegment;
import me.golemcore.gateway.domain.model.ThinkingRequest;
import me.golemcore.gateway.domain.model.ToolCallSegment;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.domain.model.TranslationException;
import me.golemcore.gateway.domain.model.UpstreamException;
import me.golemcore.gateway.domain.system.StreamAccumulator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnthropicAdapterTest {

    private static final ProviderEndpoint ENDPOINT = ProviderEndpoint.of("https://anthropic.test/", "sk-ant");

    private ObjectMapper objectMapper;
    private AnthropicAdapter adapter;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        adapter = new AnthropicAdapter(objectMapper);
    }

    private CanonicalRequest.CanonicalRequestBuilder request(Message... messages) {
        return CanonicalRequest.builder()
                .model("claude-sonnet-4-20250514")
                .messages(new ArrayList<>(List.of(messages)));
    }

    // ===== toWire =====

    @Test
    void shouldPlaceSystemPromptInTopLevelArray() {
        WireRequest wire = adapter.toWire(request(
                Message.system("Be brief."),
                Message.user("Hello")).build(), ENDPOINT);

        assertEquals("https://anthropic.test/v1/messages", wire.url());
        assertEquals("sk-ant", wire.headers().get("x-api-key"));
        assertEquals("2023-06-01", wire.headers().get("anthropic-version"));
        JsonNode body = wire.body();
        assertEquals("Be brief.", body.at("/system/0/text").asText());
        assertEquals("ephemeral", body.at("/system/0/cache_control/type").asText());
        assertEquals(1, body.get("messages").size());
        assertEquals("user", body.at("/messages/0/role").asText());
        assertEquals("Hello", body.at("/messages/0/content/0/text").asText());
        assertEquals(AnthropicAdapter.DEFAULT_MAX_TOKENS, body.get("max_tokens").asInt());
        assertFalse(body.has("stream"));
    }

    @Test
    void shouldMergeToolResultsIntoUserTurn() {
        Message assistant = Message.builder()
                .role(Role.ASSISTANT)
                .segment(new ToolCallSegment("toolu_1", "read_file", Map.of("path", "a.txt")))
                .build();
        WireRequest wire = adapter.toWire(request(
                Message.user("Read a.txt"),
                assistant,
                Message.toolResult("toolu_1", "read_file", "contents", false),
                Message.user("Summarize it")).build(), ENDPOINT);

        JsonNode messages = wire.body().get("messages");
        assertEquals(3, messages.size());
        assertEquals("tool_use", messages.at("/1/content/0/type").asText());
        assertEquals("a.txt", messages.at("/1/content/0/input/path").asText());
        assertEquals("user", messages.at("/2/role").asText());
        assertEquals("tool_result", messages.at("/2/content/0/type").asText());
        assertEquals("toolu_1", messages.at("/2/content/0/tool_use_id").asText());
        assertEquals("Summarize it", messages.at("/2/content/1/text").asText());
    }

    @Test
    void shouldRaiseMaxTokensAboveThinkingBudget() {
        CanonicalRequest request = request(Message.user("Think"))
                .maxTokens(2000)
                .temperature(0.3)
                .thinking(ThinkingRequest.builder().enabled(true).budgetTokens(512).build())
                .build();

        JsonNode body = adapter.toWire(request, ENDPOINT).body();

        assertEquals("enabled", body.at("/thinking/type").asText());
        assertEquals(AnthropicAdapter.MIN_THINKING_BUDGET, body.at("/thinking/budget_tokens").asInt());
        assertEquals(2000, body.get("max_tokens").asInt());
        assertFalse(body.has("temperature"));

        CanonicalRequest large = request(Message.user("Think")).maxTokens(2000)
                .thinking(ThinkingRequest.enabled()).build();
        JsonNode largeBody = adapter.toWire(large, ENDPOINT).body();
        assertEquals(AnthropicAdapter.DEFAULT_THINKING_BUDGET, largeBody.at("/thinking/budget_tokens").asInt());
        assertTrue(largeBody.get("max_tokens").asInt() > AnthropicAdapter.DEFAULT_THINKING_BUDGET);
        assertTrue(large.getCapabilityNotes().isEmpty());
    }

    @Test
    void shouldEncodeToolDefinitions() {
        CanonicalRequest request = request(Message.user("Hi"))
                .tools(List.of(ToolDefinition.simple("list_files", "Lists files")))
                .stream(true)
                .build();

        WireRequest wire = adapter.toWire(request, ENDPOINT);

        assertTrue(wire.stream());
        assertTrue(wire.body().get("stream").asBoolean());
        assertEquals("list_files", wire.body().at("/tools/0/name").asText());
        assertEquals("object", wire.body().at("/tools/0/input_schema/type").asText());
    }

    // ===== round trip =====

    @Test
    void shouldDecodeEncodedAssistantTurnUnchanged() {
        Message assistant = Message.builder()
                .role(Role.ASSISTANT)
                .segment(ReasoningSegment.redacted("opaque-blob"))
                .segment(new ReasoningSegment("Look first", "sig-1"))
                .segment(new TextSegment("Reading."))
                .segment(new ToolCallSegment("toolu_5", "read_file", Map.of("path", "c.txt")))
                .build();
        CanonicalRequest request = request(Message.user("Read c.txt"), assistant, Message.user("Go on"))
                .thinking(ThinkingRequest.enabled())
                .build();

        JsonNode encoded = adapter.toWire(request, ENDPOINT).body().at("/messages/1/content");
        assertEquals("redacted_thinking", encoded.at("/0/type").asText());
        assertEquals("opaque-blob", encoded.at("/0/data").asText());
        assertFalse(encoded.get(0).has("thinking"));

        ObjectNode body = objectMapper.createObjectNode();
        body.put("id", "msg_rt");
        body.set("content", encoded);
        body.put("stop_reason", "tool_use");
        CanonicalResponse response = adapter.fromWire(new WireResponse(200, body.toString()));

        assertEquals(assistant.getContent(), response.getMessage().getContent());
        assertTrue(response.getMessage().getReasoning().get(0).redacted());
    }

    // ===== fromWire =====

    @Test
    void shouldDecodeTextThinkingAndToolUse() {
        String body = """
                {"id":"msg_1","type":"message","model":"claude-sonnet-4-20250514",
                 "content":[
                   {"type":"thinking","thinking":"Let me look","signature":"sig"},
                   {"type":"text","text":"Checking."},
                   {"type":"tool_use","id":"toolu_9","name":"read_file","input":{"path":"b.txt"}}],
                 "stop_reason":"tool_use",
                 "usage":{"input_tokens":12,"output_tokens":7}}
                """;

        CanonicalResponse response = adapter.fromWire(new WireResponse(200, body));

        assertEquals("msg_1", response.getId());
        assertEquals(CanonicalResponse.FINISH_TOOL_CALLS, response.getFinishReason());
        assertEquals("Checking.", response.getMessage().getText());
        assertEquals("sig", response.getMessage().getReasoning().get(0).signature());
        ToolCallSegment call = response.getMessage().getToolCalls().get(0);
        assertEquals("toolu_9", call.id());
        assertEquals("b.txt", call.arguments().get("path"));
        assertEquals(19, response.getUsage().getTotalTokens());
    }

    @Test
    void shouldRejectMalformedBody() {
        WireResponse response = new WireResponse(200, "{not json");

        assertThrows(TranslationException.class, () -> adapter.fromWire(response));
    }

    @Test
    void shouldRejectMissingContent() {
        WireResponse response = new WireResponse(200, "{\"id\":\"msg_1\"}");

        TranslationException error = assertThrows(TranslationException.class, () -> adapter.fromWire(response));
        assertTrue(error.getMessage().contains("content"));
    }

    // ===== fromWireChunk =====

    @Test
    void shouldAccumulateStreamEvents() {
        StreamAccumulator accumulator = new StreamAccumulator(objectMapper, "anthropic");
        List<String> events = List.of(
                "{\"type\":\"message_start\",\"message\":{\"id\":\"msg_2\",\"model\":\"claude\","
                        + "\"usage\":{\"input_tokens\":30}}}",
                "{\"type\":\"content_block_start\",\"index\":0,\"content_block\":{\"type\":\"text\",\"text\":\"\"}}",
                "{\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"Hel\"}}",
                "{\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"lo\"}}",
                "{\"type\":\"content_block_start\",\"index\":1,"
                        + "\"content_block\":{\"type\":\"tool_use\",\"id\":\"toolu_3\",\"name\":\"grep\"}}",
                "{\"type\":\"content_block_delta\",\"index\":1,"
                        + "\"delta\":{\"type\":\"input_json_delta\",\"partial_json\":\"{\\\"q\\\":\"}}",
                "{\"type\":\"content_block_delta\",\"index\":1,"
                        + "\"delta\":{\"type\":\"input_json_delta\",\"partial_json\":\"\\\"x\\\"}\"}}",
                "{\"type\":\"message_delta\",\"delta\":{\"stop_reason\":\"tool_use\"},\"usage\":{\"output_tokens\":5}}",
                "{\"type\":\"message_stop\"}");

        for (String event : events) {
            for (StreamDelta delta : adapter.fromWireChunk(event, accumulator)) {
                accumulator.accept(delta);
            }
        }
        CanonicalResponse response = accumulator.toResponse();

        assertFalse(response.isIncomplete());
        assertEquals("msg_2", response.getId());
        assertEquals("Hello", response.getMessage().getText());
        assertEquals(CanonicalResponse.FINISH_TOOL_CALLS, response.getFinishReason());
        assertEquals("x", response.getMessage().getToolCalls().get(0).arguments().get("q"));
        assertEquals(30, response.getUsage().getInputTokens());
        assertEquals(5, response.getUsage().getOutputTokens());
    }

    @Test
    void shouldCarrySignatureAndMetadataAsDeltas() {
        StreamAccumulator accumulator = new StreamAccumulator(objectMapper, "anthropic");
        List<StreamDelta> deltas = new ArrayList<>();
        for (String event : List.of(
                "{\"type\":\"message_start\",\"message\":{\"id\":\"msg_9\",\"model\":\"claude\"}}",
                "{\"type\":\"content_block_delta\",\"index\":0,"
                        + "\"delta\":{\"type\":\"thinking_delta\",\"thinking\":\"hmm\"}}",
                "{\"type\":\"content_block_delta\",\"index\":0,"
                        + "\"delta\":{\"type\":\"signature_delta\",\"signature\":\"SIG\"}}",
                "{\"type\":\"message_stop\"}")) {
            deltas.addAll(adapter.fromWireChunk(event, accumulator));
        }

        assertEquals(StreamDelta.meta("msg_9", "claude"), deltas.get(0));
        assertTrue(deltas.contains(StreamDelta.signature("SIG")));

        StreamAccumulator replay = new StreamAccumulator(objectMapper, "anthropic");
        deltas.forEach(replay::accept);
        CanonicalResponse response = replay.toResponse();
        assertEquals("msg_9", response.getId());
        assertEquals("claude", response.getModel());
        assertEquals(new ReasoningSegment("hmm", "SIG"), response.getMessage().getReasoning().get(0));
    }

    @Test
    void shouldMarkStreamWithoutStopIncomplete() {
        StreamAccumulator accumulator = new StreamAccumulator(objectMapper, "anthropic");
        for (StreamDelta delta : adapter.fromWireChunk(
                "{\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"Par\"}}",
                accumulator)) {
            accumulator.accept(delta);
        }

        CanonicalResponse response = accumulator.toResponse();

        assertTrue(response.isIncomplete());
        assertEquals(CanonicalResponse.FINISH_INCOMPLETE, response.getFinishReason());
        assertEquals(List.of(new TextSegment("Par")), response.getMessage().getContent());
    }

    @Test
    void shouldSurfaceOverloadedStreamError() {
        StreamAccumulator accumulator = new StreamAccumulator(objectMapper, "anthropic");
        String event = "{\"type\":\"error\",\"error\":{\"type\":\"overloaded_error\",\"message\":\"Overloaded\"}}";

        UpstreamException error = assertThrows(UpstreamException.class,
                () -> adapter.fromWireChunk(event, accumulator));

        assertEquals(529, error.getStatus());
    }
}
