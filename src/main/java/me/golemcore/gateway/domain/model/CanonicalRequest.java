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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider-independent chat request handed to a provider adapter.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CanonicalRequest {

    public static final String CAPABILITY_NOTES = "capability_notes";

    private String model;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private List<ToolDefinition> tools = new ArrayList<>();

    private Double temperature;
    private Integer maxTokens;
    private boolean stream;
    private ThinkingRequest thinking;
    private String sessionId;

    /** Target provider identifier; {@code null} routes to the configured default. */
    private String providerId;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public boolean isThinkingRequested() {
        return thinking != null && thinking.isEnabled();
    }

    /**
     * Records that a requested feature was dropped because the target provider
     * does not support it.
     */
    @SuppressWarnings("unchecked")
    public synchronized void addCapabilityNote(String note) {
        List<String> notes = (List<String>) metadata.computeIfAbsent(CAPABILITY_NOTES, k -> new ArrayList<String>());
        if (!notes.contains(note)) {
            notes.add(note);
        }
    }

    @SuppressWarnings("unchecked")
    public List<String> getCapabilityNotes() {
        Object notes = metadata.get(CAPABILITY_NOTES);
        return notes instanceof List<?> list ? (List<String>) list : List.of();
    }

    /**
     * System messages in their original order.
     */
    public List<Message> systemMessages() {
        return messages.stream().filter(m -> m.getRole() == Role.SYSTEM).toList();
    }

    public List<Message> conversationMessages() {
        return messages.stream().filter(m -> m.getRole() != Role.SYSTEM).toList();
    }
}
