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
 * Qwen through DashScope's compatible mode. Hybrid models think by default,
 * so the flag is always written.
 */
@Component
public class QwenAdapter extends OpenAiStyleAdapter {

    private static final ProviderCapabilities CAPABILITIES = new ProviderCapabilities(
            true, true, true, ReasoningParameterKind.ENABLE_FLAG, "enable_thinking");

    public QwenAdapter(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public String getProviderId() {
        return "qwen";
    }

    @Override
    public List<String> getAliases() {
        return List.of("alibaba", "dashscope");
    }

    @Override
    public ProviderCapabilities capabilities() {
        return CAPABILITIES;
    }

    @Override
    public String defaultBaseUrl() {
        return "https://dashscope.aliyuncs.com/compatible-mode";
    }

    @Override
    protected void applyThinking(ObjectNode body, CanonicalRequest request, boolean thinking) {
        body.put("enable_thinking", thinking);
        if (thinking && request.getThinking().getBudgetTokens() != null) {
            body.put("thinking_budget", request.getThinking().getBudgetTokens());
        }
    }
}
