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
import me.golemcore.gateway.domain.system.StreamAccumulator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Google Gemini {@code generateContent}.
 *
 * <p>
 * The model name is part of the URL, the assistant role is {@code model},
 * tool results are {@code functionResponse} parts addressed by function name,
 * and function calls may come back without an id, in which case one is
 * generated.
 */
@Component
public class GoogleAdapter extends AbstractProviderAdapter {

    static final int DEFAULT_THINKING_BUDGET = 8192;
    static final int MAX_THINKING_BUDGET = 32768;

    private static final String STATE_NEXT_CALL_INDEX = "google.nextCallIndex";

    private static final ProviderCapabilities CAPABILITIES = new ProviderCapabilities(
            true, true, true, ReasoningParameterKind.BUDGET_TOKENS, "thinkingBudget");

    public GoogleAdapter(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public String getProviderId() {
        return "google";
    }

    @Override
    public List<String> getAliases() {
        return List.of("gemini");
    }

    @Override
    public ProviderCapabilities capabilities() {
        return CAPABILITIES;
    }

    @Override
    public String defaultBaseUrl() {
        return "https://generativelanguage.googleapis.com";
    }

    @Override
    protected WireRequest encode(CanonicalRequest request, ProviderEndpoint endpoint, boolean thinking) {
        String model = resolveModel(request, endpoint);
        ObjectNode body = objectMapper.createObjectNode();

        String system = systemPrompt(request);
        if (system != null) {
            body.putObject("systemInstruction").putArray("parts").addObject().put("text", system);
        }

        List<Message> conversation = request.conversationMessages();
        Map<String, String> toolNames = toolNamesById(conversation);
        ArrayNode contents = body.putArray("contents");
        ObjectNode previous = null;
        for (Message message : conversation) {
            String role = message.getRole() == Role.ASSISTANT ? "model" : "user";
            List<ObjectNode> parts = encodeParts(message, toolNames);
            if (parts.isEmpty()) {
                continue;
            }
            if (previous == null || !role.equals(previous.get("role").asText())) {
                previous = contents.addObject();
                previous.put("role", role);
                previous.putArray("parts");
            }
            ((ArrayNode) previous.get("parts")).addAll(parts);
        }

        if (!request.getTools().isEmpty()) {
            ArrayNode declarations = body.putArray("tools").addObject().putArray("functionDeclarations");
            for (ToolDefinition tool : request.getTools()) {
                ObjectNode node = declarations.addObject();
                node.put("name", tool.getName());
                if (tool.getDescription() != null) {
                    node.put("description", tool.getDescription());
                }
                node.set("parameters", schemaNode(tool.getInputSchema()));
            }
        }

        ObjectNode generation = objectMapper.createObjectNode();
        if (request.getTemperature() != null) {
            generation.put("temperature", request.getTemperature());
        }
        Integer maxTokens = request.getMaxTokens() != null ? request.getMaxTokens() : endpoint.maxTokens();
        if (maxTokens != null) {
            generation.put("maxOutputTokens", maxTokens);
        }
        if (thinking) {
            Integer requested = request.getThinking().getBudgetTokens();
            int budget = Math.min(MAX_THINKING_BUDGET, requested != null ? requested : DEFAULT_THINKING_BUDGET);
            ObjectNode thinkingConfig = generation.putObject("thinkingConfig");
            thinkingConfig.put("thinkingBudget", budget);
            thinkingConfig.put("includeThoughts", true);
        }
        if (!generation.isEmpty()) {
            body.set("generationConfig", generation);
        }

        Map<String, String> headers = new LinkedHashMap<>(endpoint.extraHeaders());
        if (endpoint.hasApiKey()) {
            headers.put("x-goog-api-key", endpoint.apiKey());
        }
        String action = request.isStream() ? ":streamGenerateContent?alt=sse" : ":generateContent";
        String url = baseUrl(endpoint) + "/v1beta/models/" + model + action;
        return new WireRequest(url, headers, body, request.isStream());
    }

    private List<ObjectNode> encodeParts(Message message, Map<String, String> toolNames) {
        List<ObjectNode> parts = new ArrayList<>();
        for (ContentSegment segment : message.getContent()) {
            if (segment instanceof TextSegment text) {
                if (!text.text().isEmpty()) {
                    parts.add(objectMapper.createObjectNode().put("text", text.text()));
                }
            } else if (segment instanceof AttachmentSegment attachment) {
                parts.add(objectMapper.createObjectNode().put("text", renderAttachment(attachment)));
            } else if (segment instanceof ToolCallSegment call) {
                ObjectNode part = objectMapper.createObjectNode();
                ObjectNode functionCall = part.putObject("functionCall");
                functionCall.put("id", call.id());
                functionCall.put("name", call.name());
                functionCall.set("args", objectMapper.valueToTree(call.arguments()));
                parts.add(part);
            } else if (segment instanceof ToolResultSegment result) {
                String name = result.toolName() != null ? result.toolName()
                        : toolNames.getOrDefault(result.toolCallId(), "unknown");
                ObjectNode part = objectMapper.createObjectNode();
                ObjectNode functionResponse = part.putObject("functionResponse");
                functionResponse.put("id", result.toolCallId());
                functionResponse.put("name", name);
                ObjectNode responseNode = functionResponse.putObject("response");
                responseNode.put(result.error() ? "error" : "content", result.content());
                parts.add(part);
            }
            // reasoning is not sent back to Gemini
        }
        return parts;
    }

    @Override
    public CanonicalResponse fromWire(WireResponse response) {
        JsonNode root = parse(response.body());
        JsonNode candidates = requireField(root, "candidates");
        if (!candidates.isArray() || candidates.isEmpty()) {
            throw new TranslationException(getProviderId(), "No candidates in google response");
        }
        JsonNode candidate = candidates.get(0);
        Message.MessageBuilder message = Message.builder().role(Role.ASSISTANT);
        boolean hasCalls = false;
        for (JsonNode part : candidate.path("content").path("parts")) {
            if (part.has("functionCall")) {
                JsonNode call = part.get("functionCall");
                String id = textOrNull(call, "id");
                message.segment(new ToolCallSegment(id != null ? id : generateCallId(),
                        requireField(call, "name").asText(), argumentsFromNode(call.get("args"))));
                hasCalls = true;
            } else if (part.has("text")) {
                if (part.path("thought").asBoolean(false)) {
                    message.segment(new ReasoningSegment(part.get("text").asText(), null));
                } else {
                    message.segment(new TextSegment(part.get("text").asText()));
                }
            }
        }
        String finish = mapFinishReason(textOrNull(candidate, "finishReason"));
        if (hasCalls && CanonicalResponse.FINISH_STOP.equals(finish)) {
            finish = CanonicalResponse.FINISH_TOOL_CALLS;
        }
        return CanonicalResponse.builder()
                .id(textOrNull(root, "responseId"))
                .model(textOrNull(root, "modelVersion"))
                .providerId(getProviderId())
                .message(message.build())
                .finishReason(finish)
                .usage(parseUsage(root.get("usageMetadata")))
                .build();
    }

    @Override
    public List<StreamDelta> fromWireChunk(String payload, StreamAccumulator accumulator) {
        JsonNode root = parse(payload);
        if (root.has("error")) {
            throw streamError(root.get("error"));
        }
        List<StreamDelta> deltas = new ArrayList<>();
        if (accumulator.getResponseId() == null && root.has("responseId")) {
            deltas.add(StreamDelta.meta(textOrNull(root, "responseId"), textOrNull(root, "modelVersion")));
        }
        JsonNode candidate = root.path("candidates").path(0);
        boolean hasCalls = false;
        for (JsonNode part : candidate.path("content").path("parts")) {
            if (part.has("functionCall")) {
                JsonNode call = part.get("functionCall");
                int index = (Integer) accumulator.state().getOrDefault(STATE_NEXT_CALL_INDEX, 0);
                accumulator.state().put(STATE_NEXT_CALL_INDEX, index + 1);
                String id = textOrNull(call, "id");
                deltas.add(StreamDelta.toolCall(index, id != null ? id : generateCallId(),
                        requireField(call, "name").asText(), toJson(argumentsFromNode(call.get("args")))));
                hasCalls = true;
            } else if (part.has("text")) {
                String text = part.get("text").asText();
                deltas.add(part.path("thought").asBoolean(false)
                        ? StreamDelta.reasoning(text)
                        : StreamDelta.text(text));
            }
        }
        TokenUsage usage = parseUsage(root.get("usageMetadata"));
        if (usage != null) {
            deltas.add(StreamDelta.usage(usage));
        }
        String finishReason = textOrNull(candidate, "finishReason");
        if (finishReason != null) {
            String finish = mapFinishReason(finishReason);
            boolean callsSeen = hasCalls || accumulator.state().containsKey(STATE_NEXT_CALL_INDEX);
            if (callsSeen && CanonicalResponse.FINISH_STOP.equals(finish)) {
                finish = CanonicalResponse.FINISH_TOOL_CALLS;
            }
            deltas.add(StreamDelta.finish(finish));
        }
        return deltas;
    }

    private String mapFinishReason(String finishReason) {
        if (finishReason == null) {
            return CanonicalResponse.FINISH_STOP;
        }
        return switch (finishReason) {
        case "MAX_TOKENS" -> CanonicalResponse.FINISH_LENGTH;
        case "SAFETY", "RECITATION", "BLOCKLIST", "PROHIBITED_CONTENT", "SPII" ->
            CanonicalResponse.FINISH_CONTENT_FILTER;
        default -> CanonicalResponse.FINISH_STOP;
        };
    }

    private TokenUsage parseUsage(JsonNode usage) {
        if (usage == null || usage.isNull()) {
            return null;
        }
        return TokenUsage.builder()
                .inputTokens(usage.path("promptTokenCount").asInt(0))
                .outputTokens(usage.path("candidatesTokenCount").asInt(0))
                .reasoningTokens(usage.path("thoughtsTokenCount").asInt(0))
                .build();
    }
}
