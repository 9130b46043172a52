package me.golemcore.gateway.domain.model;

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

/**
 * Incremental piece of a streamed response, emitted in arrival order.
 *
 * <p>
 * Tool call fragments are keyed by {@code index}; {@code toolCallId} and
 * {@code toolName} appear on the first fragment of a call and
 * {@code argumentsFragment} carries raw JSON text to be concatenated.
 * {@link Kind#SIGNATURE} carries the verification token of the reasoning block
 * in {@code text}; {@link Kind#META} carries the provider's response id and
 * model. Neither is shown to clients. {@link Kind#BLOCKED} ends a stream whose
 * prompt was refused, with the reason in {@code text}.
 */
public record StreamDelta(
        Kind kind,
        String text,
        int index,
        String toolCallId,
        String toolName,
        String argumentsFragment,
        String finishReason,
        TokenUsage usage,
        String responseId,
        String model) {

    public enum Kind {
        TEXT, REASONING, SIGNATURE, TOOL_CALL, FINISH, USAGE, META, BLOCKED
    }

    public StreamDelta(Kind kind, String text, int index, String toolCallId, String toolName,
            String argumentsFragment, String finishReason, TokenUsage usage) {
        this(kind, text, index, toolCallId, toolName, argumentsFragment, finishReason, usage, null, null);
    }

    public static StreamDelta text(String text) {
        return new StreamDelta(Kind.TEXT, text, 0, null, null, null, null, null);
    }

    public static StreamDelta reasoning(String text) {
        return new StreamDelta(Kind.REASONING, text, 0, null, null, null, null, null);
    }

    public static StreamDelta signature(String signature) {
        return new StreamDelta(Kind.SIGNATURE, signature, 0, null, null, null, null, null);
    }

    public static StreamDelta blocked(String reason) {
        return new StreamDelta(Kind.BLOCKED, reason, 0, null, null, null, null, null);
    }

    public static StreamDelta meta(String responseId, String model) {
        return new StreamDelta(Kind.META, null, 0, null, null, null, null, null, responseId, model);
    }

    public static StreamDelta toolCall(int index, String id, String name, String argumentsFragment) {
        return new StreamDelta(Kind.TOOL_CALL, null, index, id, name, argumentsFragment, null, null);
    }

    public static StreamDelta finish(String finishReason) {
        return new StreamDelta(Kind.FINISH, null, 0, null, null, null, finishReason, null);
    }

    public static StreamDelta usage(TokenUsage usage) {
        return new StreamDelta(Kind.USAGE, null, 0, null, null, null, null, usage);
    }
}
