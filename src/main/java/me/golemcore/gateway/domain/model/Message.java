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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Provider-independent conversation message. A message is immutable once
 * built; translation layers create new instances instead of mutating segments.
 *
 * <p>
 * Content is an ordered list of {@link ContentSegment}s so a single assistant
 * message can carry reasoning, text and several tool calls in the order the
 * model produced them.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Message {

    @Builder.Default
    String id = UUID.randomUUID().toString();

    Role role;

    @Singular("segment")
    List<ContentSegment> content;

    Instant timestamp;

    public static Message user(String text) {
        return Message.builder().role(Role.USER).segment(new TextSegment(text)).build();
    }

    public static Message system(String text) {
        return Message.builder().role(Role.SYSTEM).segment(new TextSegment(text)).build();
    }

    public static Message assistant(String text) {
        return Message.builder().role(Role.ASSISTANT).segment(new TextSegment(text)).build();
    }

    public static Message toolResult(String toolCallId, String toolName, String content, boolean error) {
        return Message.builder()
                .role(Role.TOOL)
                .segment(new ToolResultSegment(toolCallId, toolName, content, error))
                .build();
    }

    /**
     * Concatenated text of all text segments, in order.
     */
    @JsonIgnore
    public String getText() {
        return content.stream()
                .filter(TextSegment.class::isInstance)
                .map(s -> ((TextSegment) s).text())
                .collect(Collectors.joining());
    }

    @JsonIgnore
    public List<ToolCallSegment> getToolCalls() {
        return segmentsOf(ToolCallSegment.class);
    }

    @JsonIgnore
    public List<ToolResultSegment> getToolResults() {
        return segmentsOf(ToolResultSegment.class);
    }

    @JsonIgnore
    public List<ReasoningSegment> getReasoning() {
        return segmentsOf(ReasoningSegment.class);
    }

    @JsonIgnore
    public List<AttachmentSegment> getAttachments() {
        return segmentsOf(AttachmentSegment.class);
    }

    public boolean hasToolCalls() {
        return content.stream().anyMatch(ToolCallSegment.class::isInstance);
    }

    public <T extends ContentSegment> List<T> segmentsOf(Class<T> type) {
        return content.stream().filter(type::isInstance).map(type::cast).toList();
    }

    /**
     * Returns a copy whose segments are replaced by {@code segments}.
     */
    public Message withContent(List<ContentSegment> segments) {
        return toBuilder().clearContent().content(segments).build();
    }
}
