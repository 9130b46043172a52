package me.golemcore.gateway.adapter.inbound.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.gateway.domain.model.AttachmentSegment;
import me.golemcore.gateway.domain.model.CanonicalResponse;
import me.golemcore.gateway.domain.model.ContentSegment;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.ReasoningSegment;
import me.golemcore.gateway.domain.model.Role;
import me.golemcore.gateway.domain.model.StreamDelta;
import me.golemcore.gateway.domain.model.TextSegment;
import me.golemcore.gateway.domain.model.ThinkingRequest;
import me.golemcore.gateway.domain.model.TokenUsage;
import me.golemcore.gateway.domain.model.ToolCallSegment;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.port.inbound.ExchangeCommand;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Converts between the OpenAI chat-completions dialect spoken by clients and
 * the gateway's exchange model.
 *
 * <p>
 * Clients resend their whole conversation on every call, while the gateway
 * keeps history itself. Only the messages after the client's last assistant
 * message form the new turn; system messages anywhere in the request become
 * client system prompts.
 *
 * <p>
 * Besides {@code text} parts, user content may carry
 * {@code {"type":"attachment","uri":...,"name":...,"media_type":...}} parts
 * that the gateway resolves before the call.
 */
@Component
public class OpenAiChatCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public OpenAiChatCodec(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public boolean isStream(JsonNode body) {
        return body.path("stream").asBoolean(false);
    }

    public ExchangeCommand toCommand(JsonNode body, String sessionId, String providerId) {
        JsonNode messages = body.get("messages");
        if (messages == null || !messages.isArray() || messages.isEmpty()) {
            throw new IllegalArgumentException("'messages' must be a non-empty array");
        }
        int lastAssistant = -1;
        for (int i = 0; i < messages.size(); i++) {
            if ("assistant".equals(messages.get(i).path("role").asText())) {
                lastAssistant = i;
            }
        }

        ExchangeCommand.ExchangeCommandBuilder command = ExchangeCommand.builder()
                .sessionId(sessionId)
                .providerId(providerId)
                .model(textOrNull(body, "model"));
        for (int i = 0; i < messages.size(); i++) {
            JsonNode node = messages.get(i);
            String role = node.path("role").asText("");
            if ("system".equals(role) || "developer".equals(role)) {
                command.systemPrompt(contentText(node.get("content")));
            } else if (i > lastAssistant) {
                command.incomingMessage(decodeMessage(node, role));
            }
        }
        JsonNode tools = body.get("tools");
        if (tools != null && tools.isArray()) {
            for (JsonNode tool : tools) {
                command.tool(decodeTool(tool));
            }
        }
        if (body.hasNonNull("temperature")) {
            command.temperature(body.get("temperature").asDouble());
        }
        JsonNode maxTokens = body.hasNonNull("max_completion_tokens")
                ? body.get("max_completion_tokens")
                : body.get("max_tokens");
        if (maxTokens != null && !maxTokens.isNull()) {
            command.maxTokens(maxTokens.asInt());
        }
        String effort = textOrNull(body, "reasoning_effort");
        if (effort != null) {
            command.thinking(ThinkingRequest.builder().enabled(true).effort(effort).build());
        }
        ExchangeCommand result = command.build();
        if (result.getIncoming().isEmpty()) {
            throw new IllegalArgumentException("No new message after the last assistant message");
        }
        return result;
    }

    private Message decodeMessage(JsonNode node, String role) {
        if ("tool".equals(role)) {
            String callId = textOrNull(node, "tool_call_id");
            if (callId == null) {
                throw new IllegalArgumentException("Tool message without 'tool_call_id'");
            }
            return Message.toolResult(callId, textOrNull(node, "name"), contentText(node.get("content")), false);
        }
        if (!"user".equals(role)) {
            throw new IllegalArgumentException("Unsupported message role: " + role);
        }
        Message.MessageBuilder message = Message.builder().role(Role.USER);
        JsonNode content = node.get("content");
        if (content != null && content.isArray()) {
            for (JsonNode part : content) {
                String type = part.path("type").asText("text");
                if ("attachment".equals(type)) {
                    String uri = textOrNull(part, "uri");
                    if (uri == null) {
                        throw new IllegalArgumentException("Attachment part without 'uri'");
                    }
                    message.segment(new AttachmentSegment(uri, textOrNull(part, "media_type"),
                            textOrNull(part, "name"), null));
                } else if ("text".equals(type)) {
                    message.segment(new TextSegment(part.path("text").asText("")));
                }
            }
        } else {
            message.segment(new TextSegment(contentText(content)));
        }
        return message.build();
    }

    private ToolDefinition decodeTool(JsonNode tool) {
        JsonNode function = tool.has("function") ? tool.get("function") : tool;
        String name = textOrNull(function, "name");
        if (name == null) {
            throw new IllegalArgumentException("Tool definition without 'name'");
        }
        JsonNode parameters = function.get("parameters");
        return ToolDefinition.builder()
                .name(name)
                .description(textOrNull(function, "description"))
                .inputSchema(parameters != null && parameters.isObject()
                        ? objectMapper.convertValue(parameters, MAP_TYPE)
                        : Map.of("type", "object", "properties", Map.of()))
                .build();
    }

    // ==================== Responses ====================

    public ObjectNode toCompletion(CanonicalResponse response) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("id", completionId(response.getId()));
        root.put("object", "chat.completion");
        root.put("created", clock.instant().getEpochSecond());
        root.put("model", response.getModel());
        ObjectNode choice = root.putArray("choices").addObject();
        choice.put("index", 0);
        ObjectNode message = choice.putObject("message");
        message.put("role", "assistant");
        Message canonical = response.getMessage();
        String text = canonical.getText();
        if (text.isEmpty() && canonical.hasToolCalls()) {
            message.putNull("content");
        } else {
            message.put("content", text);
        }
        String reasoning = reasoningText(canonical);
        if (!reasoning.isEmpty()) {
            message.put("reasoning_content", reasoning);
        }
        if (canonical.hasToolCalls()) {
            ArrayNode calls = message.putArray("tool_calls");
            for (ToolCallSegment call : canonical.getToolCalls()) {
                writeToolCall(calls.addObject(), call.id(), call.name(), toJson(call.arguments()));
            }
        }
        choice.put("finish_reason", wireFinishReason(response.getFinishReason()));
        if (response.getUsage() != null) {
            root.set("usage", usageNode(response.getUsage()));
        }
        if (response.isDegraded()) {
            root.set("gateway_notes", objectMapper.valueToTree(response.getNotes()));
        }
        return root;
    }

    /**
     * Assistant reply carrying the reason a prompt was refused.
     */
    public ObjectNode toBlockedCompletion(String reason, String model) {
        CanonicalResponse blocked = CanonicalResponse.builder()
                .model(model)
                .message(Message.assistant(blockedText(reason)))
                .finishReason(CanonicalResponse.FINISH_CONTENT_FILTER)
                .build();
        return toCompletion(blocked);
    }

    public String blockedText(String reason) {
        return "[Prompt blocked: " + reason + "]";
    }

    public String toChunk(String id, String model, StreamDelta delta, boolean first) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("id", id);
        root.put("object", "chat.completion.chunk");
        root.put("created", clock.instant().getEpochSecond());
        root.put("model", model);
        ArrayNode choices = root.putArray("choices");
        if (delta.kind() == StreamDelta.Kind.USAGE) {
            root.set("usage", usageNode(delta.usage()));
            return write(root);
        }
        ObjectNode choice = choices.addObject();
        choice.put("index", 0);
        ObjectNode deltaNode = choice.putObject("delta");
        if (first) {
            deltaNode.put("role", "assistant");
        }
        switch (delta.kind()) {
        case TEXT -> deltaNode.put("content", delta.text());
        case REASONING -> deltaNode.put("reasoning_content", delta.text());
        case TOOL_CALL -> {
            ObjectNode call = deltaNode.putArray("tool_calls").addObject();
            call.put("index", delta.index());
            writeToolCall(call, delta.toolCallId(), delta.toolName(), delta.argumentsFragment());
        }
        default -> {
        }
        }
        if (delta.kind() == StreamDelta.Kind.FINISH) {
            choice.put("finish_reason", wireFinishReason(delta.finishReason()));
        } else {
            choice.putNull("finish_reason");
        }
        return write(root);
    }

    public String newCompletionId() {
        return completionId(null);
    }

    private static void writeToolCall(ObjectNode node, String id, String name, String arguments) {
        if (id != null) {
            node.put("id", id);
        }
        node.put("type", "function");
        ObjectNode function = node.putObject("function");
        if (name != null) {
            function.put("name", name);
        }
        function.put("arguments", arguments != null ? arguments : "");
    }

    private ObjectNode usageNode(TokenUsage usage) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("prompt_tokens", usage.getInputTokens());
        node.put("completion_tokens", usage.getOutputTokens());
        node.put("total_tokens", usage.getTotalTokens());
        if (usage.getReasoningTokens() > 0) {
            node.putObject("completion_tokens_details").put("reasoning_tokens", usage.getReasoningTokens());
        }
        return node;
    }

    static String wireFinishReason(String finishReason) {
        if (finishReason == null) {
            return "stop";
        }
        return switch (finishReason) {
        case CanonicalResponse.FINISH_LENGTH -> "length";
        case CanonicalResponse.FINISH_TOOL_CALLS -> "tool_calls";
        case CanonicalResponse.FINISH_CONTENT_FILTER -> "content_filter";
        default -> "stop";
        };
    }

    private static String reasoningText(Message message) {
        StringBuilder sb = new StringBuilder();
        for (ContentSegment segment : message.getContent()) {
            if (segment instanceof ReasoningSegment reasoning) {
                sb.append(reasoning.text());
            }
        }
        return sb.toString();
    }

    private static String contentText(JsonNode content) {
        if (content == null || content.isNull()) {
            return "";
        }
        if (content.isTextual()) {
            return content.asText();
        }
        if (content.isArray()) {
            StringBuilder sb = new StringBuilder();
            for (JsonNode part : content) {
                if ("text".equals(part.path("type").asText("text"))) {
                    sb.append(part.path("text").asText(""));
                }
            }
            return sb.toString();
        }
        return content.toString();
    }

    private static String completionId(String upstreamId) {
        return upstreamId != null ? upstreamId : "chatcmpl-" + UUID.randomUUID().toString().replace("-", "");
    }

    private static String textOrNull(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    private String toJson(Map<String, Object> arguments) {
        return write(objectMapper.valueToTree(new LinkedHashMap<>(arguments)));
    }

    private String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize response chunk", e);
        }
    }
}
