package me.golemcore.gateway.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.AttachmentSegment;
import me.golemcore.gateway.domain.model.CanonicalRequest;
import me.golemcore.gateway.domain.model.CanonicalResponse;
import me.golemcore.gateway.domain.model.ContentSegment;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.ProviderCapabilities;
import me.golemcore.gateway.domain.model.ReasoningParameterKind;
import me.golemcore.gateway.domain.model.ReasoningSegment;
import me.golemcore.gateway.domain.model.Role;
import me.golemcore.gateway.domain.model.StreamDelta;
import me.golemcore.gateway.domain.model.TextSegment;
import me.golemcore.gateway.domain.model.TokenUsage;
import me.golemcore.gateway.domain.model.ToolCallSegment;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.domain.model.ToolResultSegment;
import me.golemcore.gateway.domain.model.TranslationException;
import me.golemcore.gateway.domain.model.UpstreamException;
import me.golemcore.gateway.domain.system.StreamAccumulator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API.
 *
 * <p>
 * Differences from the canonical model that this adapter bridges:
 * <ul>
 * <li>the system prompt is a top-level field, not a message;</li>
 * <li>tool results travel inside a {@code user} message as
 * {@code tool_result} blocks;</li>
 * <li>roles must alternate, so consecutive same-role messages are merged;</li>
 * <li>thinking takes a token budget, and prior thinking blocks are echoed
 * back only when they carry a signature.</li>
 * </ul>
 */
@Component
@Slf4j
public class AnthropicAdapter extends AbstractProviderAdapter {

    static final String API_VERSION = "2023-06-01";
    static final int DEFAULT_MAX_TOKENS = 4096;
    static final int DEFAULT_THINKING_BUDGET = 10000;
    static final int MIN_THINKING_BUDGET = 1024;

    private static final String STATE_INPUT_TOKENS = "anthropic.inputTokens";

    private static final ProviderCapabilities CAPABILITIES = new ProviderCapabilities(
            true, true, true, ReasoningParameterKind.BUDGET_TOKENS, "budget_tokens");

    public AnthropicAdapter(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public String getProviderId() {
        return "anthropic";
    }

    @Override
    public List<String> getAliases() {
        return List.of("claude");
    }

    @Override
    public ProviderCapabilities capabilities() {
        return CAPABILITIES;
    }

    @Override
    public String defaultBaseUrl() {
        return "https://api.anthropic.com";
    }

    @Override
    protected WireRequest encode(CanonicalRequest request, ProviderEndpoint endpoint, boolean thinking) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", resolveModel(request, endpoint));

        int maxTokens = request.getMaxTokens() != null ? request.getMaxTokens()
                : endpoint.maxTokens() != null ? endpoint.maxTokens() : DEFAULT_MAX_TOKENS;

        String system = systemPrompt(request);
        if (system != null) {
            ObjectNode block = body.putArray("system").addObject();
            block.put("type", "text");
            block.put("text", system);
            block.putObject("cache_control").put("type", "ephemeral");
        }
        body.set("messages", encodeMessages(request.conversationMessages(), thinking));

        if (!request.getTools().isEmpty()) {
            ArrayNode tools = body.putArray("tools");
            for (ToolDefinition tool : request.getTools()) {
                ObjectNode node = tools.addObject();
                node.put("name", tool.getName());
                if (tool.getDescription() != null) {
                    node.put("description", tool.getDescription());
                }
                node.set("input_schema", schemaNode(tool.getInputSchema()));
            }
        }

        if (thinking) {
            Integer requested = request.getThinking().getBudgetTokens();
            int budget = Math.max(MIN_THINKING_BUDGET, requested != null ? requested : DEFAULT_THINKING_BUDGET);
            ObjectNode thinkingNode = body.putObject("thinking");
            thinkingNode.put("type", "enabled");
            thinkingNode.put("budget_tokens", budget);
            if (maxTokens <= budget) {
                maxTokens = budget + DEFAULT_MAX_TOKENS;
            }
        } else if (request.getTemperature() != null) {
            body.put("temperature", request.getTemperature());
        }
        body.put("max_tokens", maxTokens);
        if (request.isStream()) {
            body.put("stream", true);
        }

        Map<String, String> headers = new LinkedHashMap<>(endpoint.extraHeaders());
        if (endpoint.hasApiKey()) {
            headers.put("x-api-key", endpoint.apiKey());
        }
        headers.put("anthropic-version", API_VERSION);
        return new WireRequest(baseUrl(endpoint) + "/v1/messages", headers, body, request.isStream());
    }

    private ArrayNode encodeMessages(List<Message> messages, boolean thinking) {
        ArrayNode array = objectMapper.createArrayNode();
        ObjectNode previous = null;
        for (Message message : messages) {
            String role = message.getRole() == Role.ASSISTANT ? "assistant" : "user";
            List<ObjectNode> blocks = encodeBlocks(message, thinking);
            if (blocks.isEmpty()) {
                continue;
            }
            ArrayNode content;
            if (previous != null && role.equals(previous.get("role").asText())) {
                content = (ArrayNode) previous.get("content");
            } else {
                previous = array.addObject();
                previous.put("role", role);
                content = previous.putArray("content");
            }
            content.addAll(blocks);
        }
        return array;
    }

    private List<ObjectNode> encodeBlocks(Message message, boolean thinking) {
        List<ObjectNode> blocks = new ArrayList<>();
        StringBuilder pendingText = new StringBuilder();
        for (ContentSegment segment : message.getContent()) {
            if (segment instanceof TextSegment text) {
                pendingText.append(text.text());
                continue;
            }
            if (segment instanceof AttachmentSegment attachment) {
                if (!pendingText.isEmpty()) {
                    pendingText.append("\n\n");
                }
                pendingText.append(renderAttachment(attachment));
                continue;
            }
            flushText(blocks, pendingText);
            if (segment instanceof ReasoningSegment reasoning) {
                if (thinking && reasoning.signature() != null) {
                    ObjectNode block = objectMapper.createObjectNode();
                    if (reasoning.redacted()) {
                        block.put("type", "redacted_thinking");
                        block.put("data", reasoning.signature());
                    } else {
                        block.put("type", "thinking");
                        block.put("thinking", reasoning.text());
                        block.put("signature", reasoning.signature());
                    }
                    blocks.add(block);
                }
            } else if (segment instanceof ToolCallSegment call) {
                ObjectNode block = objectMapper.createObjectNode();
                block.put("type", "tool_use");
                block.put("id", call.id());
                block.put("name", call.name());
                block.set("input", objectMapper.valueToTree(call.arguments()));
                blocks.add(block);
            } else if (segment instanceof ToolResultSegment result) {
                ObjectNode block = objectMapper.createObjectNode();
                block.put("type", "tool_result");
                block.put("tool_use_id", result.toolCallId());
                block.put("content", result.content());
                if (result.error()) {
                    block.put("is_error", true);
                }
                blocks.add(block);
            }
        }
        flushText(blocks, pendingText);
        return blocks;
    }

    private void flushText(List<ObjectNode> blocks, StringBuilder pendingText) {
        if (pendingText.isEmpty()) {
            return;
        }
        ObjectNode block = objectMapper.createObjectNode();
        block.put("type", "text");
        block.put("text", pendingText.toString());
        blocks.add(block);
        pendingText.setLength(0);
    }

    @Override
    public CanonicalResponse fromWire(WireResponse response) {
        JsonNode root = parse(response.body());
        if ("error".equals(textOrNull(root, "type"))) {
            throw new TranslationException(getProviderId(), "Error payload: " + root.path("error"));
        }
        JsonNode content = requireField(root, "content");
        Message.MessageBuilder message = Message.builder().role(Role.ASSISTANT);
        for (JsonNode block : content) {
            String type = textOrNull(block, "type");
            if (type == null) {
                throw new TranslationException(getProviderId(), "Content block without type");
            }
            switch (type) {
            case "text" -> message.segment(new TextSegment(block.path("text").asText()));
            case "thinking" -> message.segment(
                    new ReasoningSegment(block.path("thinking").asText(), textOrNull(block, "signature")));
            case "redacted_thinking" -> message.segment(ReasoningSegment.redacted(textOrNull(block, "data")));
            case "tool_use" -> message.segment(new ToolCallSegment(
                    requireField(block, "id").asText(),
                    requireField(block, "name").asText(),
                    argumentsFromNode(block.get("input"))));
            default -> log.debug("[Provider] anthropic: ignoring content block type {}", type);
            }
        }
        return CanonicalResponse.builder()
                .id(textOrNull(root, "id"))
                .model(textOrNull(root, "model"))
                .providerId(getProviderId())
                .message(message.build())
                .finishReason(mapStopReason(textOrNull(root, "stop_reason")))
                .usage(parseUsage(root.get("usage"), 0))
                .build();
    }

    @Override
    public List<StreamDelta> fromWireChunk(String payload, StreamAccumulator accumulator) {
        JsonNode event = parse(payload);
        String type = textOrNull(event, "type");
        if (type == null) {
            throw new TranslationException(getProviderId(), "Stream event without type");
        }
        List<StreamDelta> deltas = new ArrayList<>();
        switch (type) {
        case "message_start" -> {
            JsonNode msg = event.path("message");
            deltas.add(StreamDelta.meta(textOrNull(msg, "id"), textOrNull(msg, "model")));
            accumulator.state().put(STATE_INPUT_TOKENS, msg.path("usage").path("input_tokens").asInt(0));
        }
        case "content_block_start" -> {
            JsonNode block = event.path("content_block");
            int index = event.path("index").asInt();
            String blockType = textOrNull(block, "type");
            if ("tool_use".equals(blockType)) {
                deltas.add(StreamDelta.toolCall(index, textOrNull(block, "id"), textOrNull(block, "name"), null));
            } else if ("text".equals(blockType) && !block.path("text").asText().isEmpty()) {
                deltas.add(StreamDelta.text(block.path("text").asText()));
            }
        }
        case "content_block_delta" -> {
            JsonNode delta = event.path("delta");
            int index = event.path("index").asInt();
            switch (delta.path("type").asText()) {
            case "text_delta" -> deltas.add(StreamDelta.text(delta.path("text").asText()));
            case "thinking_delta" -> deltas.add(StreamDelta.reasoning(delta.path("thinking").asText()));
            case "signature_delta" -> deltas.add(StreamDelta.signature(delta.path("signature").asText()));
            case "input_json_delta" -> deltas.add(
                    StreamDelta.toolCall(index, null, null, delta.path("partial_json").asText()));
            default -> log.debug("[Provider] anthropic: ignoring delta type {}", delta.path("type").asText());
            }
        }
        case "message_delta" -> {
            Object input = accumulator.state().getOrDefault(STATE_INPUT_TOKENS, 0);
            TokenUsage usage = parseUsage(event.get("usage"), (Integer) input);
            if (usage != null) {
                deltas.add(StreamDelta.usage(usage));
            }
            String stopReason = textOrNull(event.path("delta"), "stop_reason");
            if (stopReason != null) {
                deltas.add(StreamDelta.finish(mapStopReason(stopReason)));
            }
        }
        case "message_stop" -> {
            if (!accumulator.isFinished()) {
                deltas.add(StreamDelta.finish(CanonicalResponse.FINISH_STOP));
            }
        }
        case "error" -> {
            JsonNode error = event.path("error");
            int status = "overloaded_error".equals(error.path("type").asText()) ? 529 : 500;
            throw new UpstreamException(getProviderId(), status, error.toString());
        }
        default -> {
            // ping, content_block_stop
        }
        }
        return deltas;
    }

    private String mapStopReason(String stopReason) {
        if (stopReason == null) {
            return CanonicalResponse.FINISH_STOP;
        }
        return switch (stopReason) {
        case "tool_use" -> CanonicalResponse.FINISH_TOOL_CALLS;
        case "max_tokens" -> CanonicalResponse.FINISH_LENGTH;
        case "refusal" -> CanonicalResponse.FINISH_CONTENT_FILTER;
        default -> CanonicalResponse.FINISH_STOP;
        };
    }

    private TokenUsage parseUsage(JsonNode usage, int fallbackInputTokens) {
        if (usage == null || usage.isNull()) {
            return null;
        }
        return TokenUsage.builder()
                .inputTokens(usage.has("input_tokens") ? usage.get("input_tokens").asInt() : fallbackInputTokens)
                .outputTokens(usage.path("output_tokens").asInt(0))
                .build();
    }
}
