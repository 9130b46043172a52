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

import me.golemcore.gateway.domain.model.CanonicalRequest;
import me.golemcore.gateway.domain.model.CanonicalResponse;
import me.golemcore.gateway.domain.model.ProviderCapabilities;
import me.golemcore.gateway.domain.model.StreamDelta;
import me.golemcore.gateway.domain.system.StreamAccumulator;

import java.util.List;

/**
 * Translator between the canonical model and one upstream provider's wire
 * format.
 *
 * <p>
 * Adding a provider means adding an implementation; {@link ProviderAdapterRegistry}
 * discovers adapters as Spring beans and never switches on provider names.
 *
 * @see AbstractProviderAdapter
 */
public interface ProviderAdapter {

    /**
     * Canonical provider identifier (e.g., "anthropic", "google").
     */
    String getProviderId();

    /**
     * Alternative identifiers accepted in configuration.
     */
    default List<String> getAliases() {
        return List.of();
    }

    ProviderCapabilities capabilities();

    String defaultBaseUrl();

    /**
     * Encodes {@code request} for this provider. A requested feature the
     * provider lacks is dropped and recorded as a capability note on
     * {@code request}; it never fails the request.
     */
    WireRequest toWire(CanonicalRequest request, ProviderEndpoint endpoint);

    /**
     * Decodes a complete (non-streaming) response body.
     *
     * @throws me.golemcore.gateway.domain.model.TranslationException
     *             if the body is not a valid response for this provider
     */
    CanonicalResponse fromWire(WireResponse response);

    /**
     * Decodes one streamed event payload (the {@code data:} part of an SSE
     * event) into zero or more deltas. Per-stream parsing state lives in
     * {@code accumulator}.
     *
     * @throws me.golemcore.gateway.domain.model.TranslationException
     *             if the payload is malformed
     */
    List<StreamDelta> fromWireChunk(String payload, StreamAccumulator accumulator);
}
