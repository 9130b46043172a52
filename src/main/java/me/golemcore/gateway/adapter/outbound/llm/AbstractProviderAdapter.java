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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.AttachmentSegment;
import me.golemcore.gateway.domain.model.CanonicalRequest;
import me.golemcore.gateway.domain.model.ConfigurationException;
import me.golemcore.gateway.domain.model.ContentSegment;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.TextSegment;
import me.golemcore.gateway.domain.model.ToolCallSegment;
import me.golemcore.gateway.domain.model.TranslationException;
import me.golemcore.gateway.domain.model.UpstreamException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Shared plumbing for provider adapters: capability degradation, JSON parsing
 * with {@link TranslationException} on malformed payloads, and argument
 * encoding.
 */
@Slf4j
public abstract class AbstractProviderAdapter implements ProviderAdapter {

    protected static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    protected final ObjectMapper objectMapper;

    protected AbstractProviderAdapter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public final WireRequest toWire(CanonicalRequest request, ProviderEndpoint endpoint) {
        boolean thinking = request.isThinkingRequested();
        if (thinking && !capabilities().thinking()) {
            request.addCapabilityNote("thinking dropped: provider " + getProviderId()
                    + " does not support reasoning parameters");
            log.debug("[Provider] {} has no thinking support, parameter omitted", getProviderId());
            thinking = false;
        }
        if (!request.getTools().isEmpty() && !capabilities().toolCalls()) {
            request.addCapabilityNote("tools dropped: provider " + getProviderId() + " does not support tool calls");
            request = request.toBuilder().tools(List.of()).build();
        }
        return encode(request, endpoint, thinking);
    }

    /**
     * Builds the wire request. {@code thinking} is already reconciled with the
     * capability set.
     */
    protected abstract WireRequest encode(CanonicalRequest request, ProviderEndpoint endpoint, boolean thinking);

    protected String resolveModel(CanonicalRequest request, ProviderEndpoint endpoint) {
        if (request.getModel() != null && !request.getModel().isBlank()) {
            return request.getModel();
        }
        if (endpoint.defaultModel() != null) {
            return endpoint.defaultModel();
        }
        throw new ConfigurationException("No model configured for provider " + getProviderId());
    }

    protected String baseUrl(ProviderEndpoint endpoint) {
        return endpoint.baseUrl() != null ? endpoint.baseUrl() : defaultBaseUrl();
    }

    protected JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            throw new TranslationException(getProviderId(), "Empty response body from " + getProviderId());
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TranslationException(getProviderId(),
                    "Malformed JSON from " + getProviderId() + ": " + e.getOriginalMessage(), e);
        }
    }

    protected JsonNode requireField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new TranslationException(getProviderId(),
                    "Missing '" + field + "' in " + getProviderId() + " payload");
        }
        return value;
    }

    /**
     * Error object delivered inside an otherwise successful stream. A numeric
     * {@code code} is taken as the HTTP status, anything else reads as 500.
     */
    protected UpstreamException streamError(JsonNode error) {
        JsonNode code = error.get("code");
        int status = code != null && code.canConvertToInt() && code.asInt() >= 400 ? code.asInt() : 500;
        return new UpstreamException(getProviderId(), status, error.toString());
    }

    protected static String textOrNull(JsonNode node, String field) {
        JsonNode value = node != null ? node.get(field) : null;
        return value != null && !value.isNull() ? value.asText() : null;
    }

    protected String toJson(Map<String, Object> arguments) {
        try {
            return objectMapper.writeValueAsString(arguments != null ? arguments : Map.of());
        } catch (JsonProcessingException e) {
            throw new TranslationException(getProviderId(), "Cannot encode tool arguments", e);
        }
    }

    protected Map<String, Object> argumentsFromString(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new TranslationException(getProviderId(), "Malformed tool arguments: " + json, e);
        }
    }

    protected Map<String, Object> argumentsFromNode(JsonNode node) {
        if (node == null || node.isNull() || !node.isObject()) {
            return Map.of();
        }
        return objectMapper.convertValue(node, MAP_TYPE);
    }

    protected ObjectNode schemaNode(Map<String, Object> schema) {
        Map<String, Object> effective = schema != null ? schema : Map.of("type", "object", "properties", Map.of());
        return objectMapper.valueToTree(effective);
    }

    /**
     * Plain-text rendering of text and resolved attachment segments, in order.
     */
    protected static String renderText(Message message) {
        StringBuilder sb = new StringBuilder();
        for (ContentSegment segment : message.getContent()) {
            if (segment instanceof TextSegment text) {
                sb.append(text.text());
            } else if (segment instanceof AttachmentSegment attachment) {
                if (!sb.isEmpty()) {
                    sb.append("\n\n");
                }
                sb.append(renderAttachment(attachment));
            }
        }
        return sb.toString();
    }

    protected static String renderAttachment(AttachmentSegment attachment) {
        String name = attachment.name() != null ? attachment.name() : attachment.uri();
        String body = attachment.isResolved() ? attachment.inlineText() : "(not resolved)";
        return "<attachment name=\"" + name + "\">\n" + body + "\n</attachment>";
    }

    /**
     * Joined text of all system messages, {@code null} when there are none.
     */
    protected static String systemPrompt(CanonicalRequest request) {
        List<Message> systems = request.systemMessages();
        if (systems.isEmpty()) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        for (Message system : systems) {
            if (!sb.isEmpty()) {
                sb.append("\n\n");
            }
            sb.append(renderText(system));
        }
        return sb.toString();
    }

    /**
     * Tool call id to tool name, for providers that address results by name.
     */
    protected static Map<String, String> toolNamesById(List<Message> messages) {
        Map<String, String> names = new HashMap<>();
        for (Message message : messages) {
            for (ToolCallSegment call : message.getToolCalls()) {
                names.put(call.id(), call.name());
            }
        }
        return names;
    }

    protected static String generateCallId() {
        return "call_" + UUID.randomUUID().toString().replace("-", "").substring(0, 24);
    }
}
