package me.golemcore.gateway.port.outbound;

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
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for calling upstream model providers with canonical requests. The
 * provider is chosen by {@link CanonicalRequest#getProviderId()}, falling back
 * to the configured default.
 */
public interface LlmPort {

    /**
     * Executes a chat completion request and returns the full response. Fails
     * with {@code UpstreamException} or {@code TranslationException}.
     */
    CompletableFuture<CanonicalResponse> chat(CanonicalRequest request);

    /**
     * Executes a streaming chat request. Deltas are emitted in arrival order;
     * cancelling the subscription aborts the upstream call.
     */
    default Flux<StreamDelta> chatStream(CanonicalRequest request) {
        throw new UnsupportedOperationException("Streaming not supported by this provider");
    }

    /**
     * Declared capabilities of the provider that would serve {@code providerId}.
     */
    ProviderCapabilities capabilities(String providerId);

    /**
     * Identifiers of all registered providers.
     */
    List<String> getProviderIds();
}
