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
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Any server implementing the OpenAI chat-completions API (LM Studio,
 * LocalAI, vLLM, llama.cpp). No reasoning parameter is assumed.
 */
@Component
public class OpenAiCompatibleAdapter extends OpenAiStyleAdapter {

    public OpenAiCompatibleAdapter(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public String getProviderId() {
        return "openai-compatible";
    }

    @Override
    public List<String> getAliases() {
        return List.of("local", "lmstudio", "localai");
    }

    @Override
    public ProviderCapabilities capabilities() {
        return ProviderCapabilities.withoutThinking();
    }

    @Override
    public String defaultBaseUrl() {
        return "http://localhost:1234";
    }

    @Override
    protected void applyThinking(ObjectNode body, CanonicalRequest request, boolean thinking) {
        // no reasoning parameter
    }
}
