package me.golemcore.gateway.adapter.outbound.hook;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.gateway.domain.model.hook.HookEvent;
import org.springframework.stereotype.Component;

/**
 * Renders a {@link HookEvent} as the JSON document hook handlers receive.
 *
 * <p>
 * Field names follow the Claude hook protocol: common fields
 * ({@code hook_event_name}, {@code session_id}, {@code cwd},
 * {@code permission_mode}) followed by the payload fields in snake_case.
 */
@Component
public class HookEventEncoder {

    private final ObjectMapper payloadMapper;

    public HookEventEncoder(ObjectMapper objectMapper) {
        this.payloadMapper = objectMapper.copy()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public ObjectNode encode(HookEvent event) {
        ObjectNode node = payloadMapper.createObjectNode();
        node.put("hook_event_name", event.kind().settingsName());
        node.put("event", event.kind().key());
        if (event.sessionId() != null) {
            node.put("session_id", event.sessionId());
        }
        if (event.cwd() != null) {
            node.put("cwd", event.cwd());
        }
        node.put("permission_mode", event.permissionMode());
        JsonNode payload = payloadMapper.valueToTree(event.payload());
        if (payload instanceof ObjectNode payloadObject) {
            node.setAll(payloadObject);
        }
        return node;
    }

    public String toJson(HookEvent event) {
        try {
            return payloadMapper.writeValueAsString(encode(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode hook event " + event.kind().key(), e);
        }
    }
}
