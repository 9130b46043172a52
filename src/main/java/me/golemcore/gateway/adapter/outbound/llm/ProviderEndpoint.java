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

import java.util.Map;

/**
 * Where and how to reach one upstream provider.
 */
public record ProviderEndpoint(String baseUrl, String apiKey, String defaultModel, Integer maxTokens,
        Map<String, String> extraHeaders) {

    public ProviderEndpoint {
        if (baseUrl != null && baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
    }

    public static ProviderEndpoint of(String baseUrl, String apiKey) {
        return new ProviderEndpoint(baseUrl, apiKey, null, null, Map.of());
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
