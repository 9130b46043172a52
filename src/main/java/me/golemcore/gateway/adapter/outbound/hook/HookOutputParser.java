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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gateway.domain.model.hook.HookDecision;
import me.golemcore.gateway.domain.model.hook.HookPermission;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Parses the JSON a hook handler writes back into a {@link HookDecision}.
 *
 * <p>
 * Recognized fields: {@code continue}, {@code suppressOutput},
 * {@code systemMessage}, {@code decision} (allow, approve, deny, block, ask),
 * {@code reason} / {@code stopReason}, {@code prompt}, {@code updatedInput},
 * and inside {@code hookSpecificOutput}: {@code permissionDecision},
 * {@code permissionDecisionReason}, {@code updatedInput},
 * {@code additionalContext}.
 */
@Component
public class HookOutputParser {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public HookOutputParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return the decision, or empty when {@code output} is not a JSON object
     */
    public Optional<HookDecision> parse(String output) {
        if (output == null || output.isBlank()) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(output.trim());
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        return Optional.of(fromNode(root));
    }

    HookDecision fromNode(JsonNode root) {
        HookDecision.HookDecisionBuilder builder = HookDecision.builder();
        boolean continueProcessing = !root.has("continue") || root.get("continue").asBoolean(true);
        builder.suppressOutput(root.path("suppressOutput").asBoolean(false));

        String reason = text(root, "reason");
        if (reason == null) {
            reason = text(root, "stopReason");
        }

        HookPermission permission = null;
        String decision = text(root, "decision");
        if (decision != null) {
            permission = HookPermission.fromWire(decision).orElse(null);
            if ("block".equalsIgnoreCase(decision.trim())) {
                continueProcessing = false;
            }
        }

        String systemMessage = text(root, "systemMessage");
        Map<String, Object> updatedInput = map(root.get("updatedInput"));

        JsonNode specific = root.get("hookSpecificOutput");
        if (specific != null && specific.isObject()) {
            String permissionDecision = text(specific, "permissionDecision");
            if (permissionDecision != null) {
                HookPermission specificPermission = HookPermission.fromWire(permissionDecision).orElse(null);
                if (specificPermission != null) {
                    permission = specificPermission.mostRestrictive(permission);
                }
            }
            String permissionReason = text(specific, "permissionDecisionReason");
            if (permissionReason != null && reason == null) {
                reason = permissionReason;
            }
            Map<String, Object> specificInput = map(specific.get("updatedInput"));
            if (specificInput != null) {
                updatedInput = specificInput;
            }
            String additionalContext = text(specific, "additionalContext");
            if (additionalContext != null) {
                systemMessage = systemMessage == null ? additionalContext : systemMessage + "\n" + additionalContext;
            }
        }

        return builder
                .continueProcessing(continueProcessing)
                .permission(permission)
                .reason(reason)
                .systemMessage(systemMessage)
                .updatedPrompt(text(root, "prompt"))
                .updatedInput(updatedInput)
                .build();
    }

    private Map<String, Object> map(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        return objectMapper.convertValue(node, MAP_TYPE);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }
}
