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
import me.golemcore.gateway.domain.model.CanonicalRequest;
import me.golemcore.gateway.domain.model.CanonicalResponse;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.ReasoningSegment;
import me.golemcore.gateway.domain.model.Role;
import me.golemcore.gateway.domain.model.StreamDelta;
import me.golemcore.gateway.domain.model.TextSegment;
import me.golemcore.gateway.domain.model.TokenUsage;
import me.golemcore.gateway.domain.model.ToolCallSegment;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.domain.model.ToolResultSegment;
import me.golemcore.gateway.domain.model.TranslationException;
import me.golemcore.gateway.domain.system.StreamAccumulator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base for providers speaking the OpenAI chat-completions dialect (OpenAI,
 * DeepSeek, Qwen, GLM and generic compatible servers). Subclasses differ in
 * endpoint path and in how the reasoning parameter is spelled.
 *
 * <p>
 * Reasoning segments from earlier assistant turns are not sent back: these
 * APIs reject {@code reasoning_content} on input.
 */
public abstract class OpenAiStyleAdapter extends AbstractProviderAdapter {

    private static final String DONE = "[DONE]";

    protected OpenAiStyleAdapter(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    protected String chatPath() {
        return "/v1/chat/completions";
    }

    /**
     * Adds this provider's reasoning parameter. Called for every request so
     * providers that need an explicit "off" value can write it.
     */
    protected abstract void applyThinking(ObjectNode body, CanonicalRequest request, boolean thinking);

    @Override
    protected WireRequest encode(CanonicalRequest request, ProviderEndpoint endpoint, boolean thinking) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", resolveModel(request, endpoint));
        body.set("messages", encodeMessages(request.getMessages()));
        if (!request.getTools().isEmpty()) {
            body.set("tools", encodeTools(request.getTools()));
        }
        if (request.getTemperature() != null) {
            body.put("temperature", request.getTemperature());
        }
        Integer maxTokens = request.getMaxTokens() != null ? request.getMaxTokens() : endpoint.maxTokens();
        if (maxTokens != null) {
            body.put("max_tokens", maxTokens);
        }
        if (request.isStream()) {
            body.put("stream", true);
            body.putObject("stream_options").put("include_usage", true);
        }
        applyThinking(body, request, thinking);

        Map<String, String> headers = new LinkedHashMap<>(endpoint.extraHeaders());
        if (endpoint.hasApiKey()) {
            headers.put("Authorization", "Bearer " + endpoint.apiKey());
        }
        return new WireRequest(baseUrl(endpoint) + chatPath(), headers, body, request.isStream());
    }

    private ArrayNode encodeMessages(List<Message> messages) {
        ArrayNode array = objectMapper.createArrayNode();
        for (Message message : messages) {
            switch (message.getRole()) {
            case TOOL -> {
                for (ToolResultSegment result : message.getToolResults()) {
                    ObjectNode node = array.addObject();
                    node.put("role", "tool");
                    node.put("tool_call_id", result.toolCallId());
                    node.put("content", result.content());
                }
            }
            case ASSISTANT -> {
                ObjectNode node = array.addObject();
                node.put("role", "assistant");
                String text = renderText(message);
                if (text.isEmpty() && message.hasToolCalls()) {
                    node.putNull("content");
                } else {
                    node.put("content", text);
                }
                if (message.hasToolCalls()) {
                    ArrayNode calls = node.putArray("tool_calls");
                    for (ToolCallSegment call : message.getToolCalls()) {
                        ObjectNode callNode = calls.addObject();
                        callNode.put("id", call.id());
                        callNode.put("type", "function");
                        ObjectNode function = callNode.putObject("function");
                        function.put("name", call.name());
                        function.put("arguments", toJson(call.arguments()));
                    }
                }
            }
            default -> {
                ObjectNode node = array.addObject();
                node.put("role", message.getRole().wireName());
                node.put("content", renderText(message));
            }
            }
        }
        return array;
    }

    private ArrayNode encodeTools(List<ToolDefinition> tools) {
        ArrayNode array = objectMapper.createArrayNode();
        for (ToolDefinition tool : tools) {
            ObjectNode node = array.addObject();
            node.put("type", "function");
            ObjectNode function = node.putObject("function");
            function.put("name", tool.getName());
            if (tool.getDescription() != null) {
                function.put("description", tool.getDescription());
            }
            function.set("parameters", schemaNode(tool.getInputSchema()));
        }
        return array;
    }

    @Override
    public CanonicalResponse fromWire(WireResponse response) {
        JsonNode root = parse(response.body());
        JsonNode choices = requireField(root, "choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new TranslationException(getProviderId(), "No choices in " + getProviderId() + " response");
        }
        JsonNode choice = choices.get(0);
        JsonNode messageNode = requireField(choice, "message");

        Message.MessageBuilder message = Message.builder().role(Role.ASSISTANT);
        String reasoning = textOrNull(messageNode, "reasoning_content");
        if (reasoning != null && !reasoning.isEmpty()) {
            message.segment(new ReasoningSegment(reasoning, null));
        }
        String content = textOrNull(messageNode, "content");
        if (content != null && !content.isEmpty()) {
            message.segment(new TextSegment(content));
        }
        JsonNode toolCalls = messageNode.get("tool_calls");
        if (toolCalls != null && toolCalls.isArray()) {
            for (JsonNode call : toolCalls) {
                JsonNode function = requireField(call, "function");
                String id = textOrNull(call, "id");
                message.segment(new ToolCallSegment(
                        id != null ? id : generateCallId(),
                        requireField(function, "name").asText(),
                        argumentsFromString(textOrNull(function, "arguments"))));
            }
        }

        return CanonicalResponse.builder()
                .id(textOrNull(root, "id"))
                .model(textOrNull(root, "model"))
                .providerId(getProviderId())
                .message(message.build())
                .finishReason(mapFinishReason(textOrNull(choice, "finish_reason")))
                .usage(parseUsage(root.get("usage")))
                .build();
    }

    @Override
    public List<StreamDelta> fromWireChunk(String payload, StreamAccumulator accumulator) {
        if (DONE.equals(payload.trim())) {
            return accumulator.isFinished() ? List.of() : List.of(StreamDelta.finish(CanonicalResponse.FINISH_STOP));
        }
        JsonNode root = parse(payload);
        if (root.has("error")) {
            throw streamError(root.get("error"));
        }

        List<StreamDelta> deltas = new ArrayList<>();
        if (accumulator.getResponseId() == null && root.has("id")) {
            deltas.add(StreamDelta.meta(textOrNull(root, "id"), textOrNull(root, "model")));
        }
        JsonNode choices = root.get("choices");
        if (choices != null && choices.isArray() && !choices.isEmpty()) {
            JsonNode choice = choices.get(0);
            JsonNode delta = choice.get("delta");
            if (delta != null) {
                String reasoning = textOrNull(delta, "reasoning_content");
                if (reasoning != null && !reasoning.isEmpty()) {
                    deltas.add(StreamDelta.reasoning(reasoning));
                }
                String content = textOrNull(delta, "content");
                if (content != null && !content.isEmpty()) {
                    deltas.add(StreamDelta.text(content));
                }
                JsonNode toolCalls = delta.get("tool_calls");
                if (toolCalls != null && toolCalls.isArray()) {
                    for (JsonNode call : toolCalls) {
                        JsonNode function = call.get("function");
                        deltas.add(StreamDelta.toolCall(
                                call.path("index").asInt(0),
                                textOrNull(call, "id"),
                                textOrNull(function, "name"),
                                textOrNull(function, "arguments")));
                    }
                }
            }
            String finish = textOrNull(choice, "finish_reason");
            if (finish != null) {
                deltas.add(StreamDelta.finish(mapFinishReason(finish)));
            }
        }
        TokenUsage usage = parseUsage(root.get("usage"));
        if (usage != null) {
            deltas.add(StreamDelta.usage(usage));
        }
        return deltas;
    }

    protected String mapFinishReason(String finishReason) {
        if (finishReason == null) {
            return CanonicalResponse.FINISH_STOP;
        }
        return switch (finishReason) {
        case "length" -> CanonicalResponse.FINISH_LENGTH;
        case "tool_calls", "function_call" -> CanonicalResponse.FINISH_TOOL_CALLS;
        case "content_filter", "sensitive" -> CanonicalResponse.FINISH_CONTENT_FILTER;
        default -> CanonicalResponse.FINISH_STOP;
        };
    }

    protected TokenUsage parseUsage(JsonNode usage) {
        if (usage == null || usage.isNull()) {
            return null;
        }
        return TokenUsage.builder()
                .inputTokens(usage.path("prompt_tokens").asInt(0))
                .outputTokens(usage.path("completion_tokens").asInt(0))
                .reasoningTokens(usage.path("completion_tokens_details").path("reasoning_tokens").asInt(0))
                .build();
    }
}
