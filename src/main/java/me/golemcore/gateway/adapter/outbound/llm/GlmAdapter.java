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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.gateway.domain.model.CanonicalRequest;
import me.golemcore.gateway.domain.model.ProviderCapabilities;
import me.golemcore.gateway.domain.model.ReasoningParameterKind;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * GLM (Z.AI). Thinking is an object with an enabled/disabled type; reasoning
 * is kept across turns by turning off the top-level {@code clear_thinking}.
 */
@Component
public class GlmAdapter extends OpenAiStyleAdapter {

    private static final ProviderCapabilities CAPABILITIES = new ProviderCapabilities(
            true, true, true, ReasoningParameterKind.ENABLE_FLAG, "thinking");

    public GlmAdapter(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public String getProviderId() {
        return "glm";
    }

    @Override
    public List<String> getAliases() {
        return List.of("zai", "zhipu");
    }

    @Override
    public ProviderCapabilities capabilities() {
        return CAPABILITIES;
    }

    @Override
    public String defaultBaseUrl() {
        return "https://api.z.ai/api/paas/v4";
    }

    @Override
    protected String chatPath() {
        return "/chat/completions";
    }

    @Override
    protected void applyThinking(ObjectNode body, CanonicalRequest request, boolean thinking) {
        ObjectNode thinkingNode = body.putObject("thinking");
        thinkingNode.put("type", thinking ? "enabled" : "disabled");
        if (thinking && request.getThinking().isPreserveAcrossTurns()) {
            body.put("clear_thinking", false);
        }
    }
}
