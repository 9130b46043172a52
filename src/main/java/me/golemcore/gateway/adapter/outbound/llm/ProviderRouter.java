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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.CanonicalRequest;
import me.golemcore.gateway.domain.model.CanonicalResponse;
import me.golemcore.gateway.domain.model.ProviderCapabilities;
import me.golemcore.gateway.domain.model.StreamDelta;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.LlmPort;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * {@link LlmPort} implementation: resolves the adapter for the request's
 * provider, translates the request, and sends it through
 * {@link UpstreamClient}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProviderRouter implements LlmPort {

    private final ProviderAdapterRegistry registry;
    private final UpstreamClient upstreamClient;
    private final GatewayProperties properties;

    @Override
    public CompletableFuture<CanonicalResponse> chat(CanonicalRequest request) {
        try {
            request.setStream(false);
            ProviderAdapter adapter = adapterFor(request);
            WireRequest wire = adapter.toWire(request, registry.endpointFor(adapter));
            log.debug("[Provider] {} chat: model={}, messages={}, tools={}",
                    adapter.getProviderId(), request.getModel(), request.getMessages().size(),
                    request.getTools().size());
            return upstreamClient.execute(adapter, wire).thenApply(response -> {
                response.getNotes().addAll(request.getCapabilityNotes());
                return response;
            });
        } catch (RuntimeException e) { // NOSONAR - surfaced through the future
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public Flux<StreamDelta> chatStream(CanonicalRequest request) {
        return Flux.defer(() -> {
            request.setStream(true);
            ProviderAdapter adapter = adapterFor(request);
            WireRequest wire = adapter.toWire(request, registry.endpointFor(adapter));
            log.debug("[Provider] {} stream: model={}, messages={}",
                    adapter.getProviderId(), request.getModel(), request.getMessages().size());
            return upstreamClient.stream(adapter, wire);
        });
    }

    @Override
    public ProviderCapabilities capabilities(String providerId) {
        return registry.resolve(providerId != null ? providerId : properties.getProvider()).capabilities();
    }

    @Override
    public List<String> getProviderIds() {
        return registry.getProviderIds();
    }

    private ProviderAdapter adapterFor(CanonicalRequest request) {
        String providerId = request.getProviderId() != null ? request.getProviderId() : properties.getProvider();
        return registry.resolve(providerId);
    }
}
