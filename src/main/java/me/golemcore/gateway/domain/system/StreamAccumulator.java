package me.golemcore.gateway.domain.system;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.CanonicalResponse;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.ReasoningSegment;
import me.golemcore.gateway.domain.model.Role;
import me.golemcore.gateway.domain.model.StreamDelta;
import me.golemcore.gateway.domain.model.TextSegment;
import me.golemcore.gateway.domain.model.TokenUsage;
import me.golemcore.gateway.domain.model.ToolCallSegment;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Folds stream deltas into a {@link CanonicalResponse}.
 *
 * <p>
 * Deltas are applied in arrival order. When the stream ends without a
 * {@link StreamDelta.Kind#FINISH} delta the response is marked
 * {@code incomplete} and keeps everything received so far; a tool call whose
 * argument JSON was cut off keeps its raw text under {@value #PARTIAL_ARGUMENTS}.
 *
 * <p>
 * Adapters may keep per-stream parsing state in {@link #state()}. Everything
 * that ends up in the response travels as a delta, so any consumer folding
 * the same deltas builds the same response.
 */
@Slf4j
public class StreamAccumulator {

    public static final String PARTIAL_ARGUMENTS = "_partial_arguments";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final String providerId;
    private final StringBuilder text = new StringBuilder();
    private final StringBuilder reasoning = new StringBuilder();
    private final Map<Integer, PendingToolCall> toolCalls = new TreeMap<>();
    private final Map<String, Object> state = new HashMap<>();
    private final List<StreamDelta> received = new ArrayList<>();

    @Getter
    private String responseId;

    @Getter
    private String model;

    private String reasoningSignature;

    @Getter
    private String finishReason;

    private TokenUsage usage;

    public StreamAccumulator(ObjectMapper objectMapper, String providerId) {
        this.objectMapper = objectMapper;
        this.providerId = providerId;
    }

    public Map<String, Object> state() {
        return state;
    }

    public void accept(StreamDelta delta) {
        received.add(delta);
        switch (delta.kind()) {
        case TEXT -> text.append(delta.text());
        case REASONING -> reasoning.append(delta.text());
        case SIGNATURE -> reasoningSignature = delta.text();
        case META -> {
            if (delta.responseId() != null) {
                responseId = delta.responseId();
            }
            if (delta.model() != null) {
                model = delta.model();
            }
        }
        case TOOL_CALL -> {
            PendingToolCall call = toolCalls.computeIfAbsent(delta.index(), i -> new PendingToolCall());
            if (delta.toolCallId() != null) {
                call.id = delta.toolCallId();
            }
            if (delta.toolName() != null) {
                call.name = delta.toolName();
            }
            if (delta.argumentsFragment() != null) {
                call.arguments.append(delta.argumentsFragment());
            }
        }
        case FINISH -> finishReason = delta.finishReason();
        case USAGE -> usage = delta.usage();
        default -> throw new IllegalStateException("Unexpected delta kind: " + delta.kind());
        }
    }

    public boolean isFinished() {
        return finishReason != null;
    }

    public int receivedCount() {
        return received.size();
    }

    public CanonicalResponse toResponse() {
        Message.MessageBuilder message = Message.builder().role(Role.ASSISTANT);
        if (!reasoning.isEmpty()) {
            message.segment(new ReasoningSegment(reasoning.toString(), reasoningSignature));
        }
        if (!text.isEmpty()) {
            message.segment(new TextSegment(text.toString()));
        }
        boolean truncatedArguments = false;
        for (PendingToolCall call : toolCalls.values()) {
            if (call.name == null) {
                continue;
            }
            String id = call.id != null ? call.id : "call_" + UUID.randomUUID().toString().replace("-", "");
            Map<String, Object> arguments = parseArguments(call.arguments.toString());
            if (arguments.containsKey(PARTIAL_ARGUMENTS)) {
                truncatedArguments = true;
            }
            message.segment(new ToolCallSegment(id, call.name, arguments));
        }

        boolean incomplete = !isFinished() || truncatedArguments;
        if (incomplete) {
            log.warn("[Stream] {} stream ended without terminal event, {} deltas kept", providerId, received.size());
        }
        return CanonicalResponse.builder()
                .id(responseId)
                .model(model)
                .providerId(providerId)
                .message(message.build())
                .finishReason(incomplete ? CanonicalResponse.FINISH_INCOMPLETE : finishReason)
                .usage(usage)
                .incomplete(incomplete)
                .build();
    }

    private Map<String, Object> parseArguments(String json) {
        if (json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            return Map.of(PARTIAL_ARGUMENTS, json);
        }
    }

    private static final class PendingToolCall {
        private String id;
        private String name;
        private final StringBuilder arguments = new StringBuilder();
    }
}
