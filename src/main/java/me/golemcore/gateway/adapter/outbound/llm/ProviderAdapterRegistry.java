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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.ConfigurationException;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of provider adapters, indexed by provider id and aliases.
 *
 * <p>
 * Selecting an adapter is a pure lookup. An unknown identifier is a
 * {@link ConfigurationException}; the configured default provider is checked in
 * {@link #init()} so a bad value stops startup before any request is sent.
 *
 * @see ProviderAdapter
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProviderAdapterRegistry {

    private final GatewayProperties properties;
    private final List<ProviderAdapter> adapters;

    private final Map<String, ProviderAdapter> adaptersById = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        for (ProviderAdapter adapter : adapters) {
            register(adapter.getProviderId(), adapter);
            for (String alias : adapter.getAliases()) {
                register(alias, adapter);
            }
            log.debug("Registered provider adapter: {} (aliases {})", adapter.getProviderId(), adapter.getAliases());
        }

        for (String configured : properties.getProviders().keySet()) {
            if (!adaptersById.containsKey(normalize(configured))) {
                throw new ConfigurationException("Unknown provider in gateway.providers: '" + configured
                        + "', known: " + getProviderIds());
            }
        }
        ProviderAdapter active = resolve(properties.getProvider());
        log.info("[Provider] Default provider: {}", active.getProviderId());
    }

    private void register(String id, ProviderAdapter adapter) {
        ProviderAdapter existing = adaptersById.putIfAbsent(normalize(id), adapter);
        if (existing != null && existing != adapter) {
            throw new ConfigurationException("Provider id '" + id + "' claimed by both "
                    + existing.getProviderId() + " and " + adapter.getProviderId());
        }
    }

    /**
     * Adapter for {@code providerId} or one of its aliases.
     *
     * @throws ConfigurationException
     *             if no adapter is registered under that id
     */
    public ProviderAdapter resolve(String providerId) {
        if (providerId == null || providerId.isBlank()) {
            throw new ConfigurationException("No provider configured");
        }
        ProviderAdapter adapter = adaptersById.get(normalize(providerId));
        if (adapter == null) {
            throw new ConfigurationException("Unknown provider '" + providerId + "', known: " + getProviderIds());
        }
        return adapter;
    }

    public boolean isKnown(String providerId) {
        return providerId != null && adaptersById.containsKey(normalize(providerId));
    }

    /**
     * Connection settings for {@code adapter}, merging {@code gateway.providers}
     * entries stored under the id or any alias with the adapter defaults.
     */
    public ProviderEndpoint endpointFor(ProviderAdapter adapter) {
        GatewayProperties.ProviderProperties config = null;
        for (Map.Entry<String, GatewayProperties.ProviderProperties> entry : properties.getProviders().entrySet()) {
            if (adaptersById.get(normalize(entry.getKey())) == adapter) {
                config = entry.getValue();
                break;
            }
        }
        if (config == null) {
            return new ProviderEndpoint(adapter.defaultBaseUrl(), null, null, null, Map.of());
        }
        String baseUrl = config.getBaseUrl() != null && !config.getBaseUrl().isBlank()
                ? config.getBaseUrl()
                : adapter.defaultBaseUrl();
        return new ProviderEndpoint(baseUrl, config.getApiKey(), config.getModel(), config.getMaxTokens(),
                config.getHeaders());
    }

    /**
     * Canonical ids of all registered adapters.
     */
    public List<String> getProviderIds() {
        List<String> ids = new ArrayList<>();
        for (ProviderAdapter adapter : adapters) {
            ids.add(adapter.getProviderId());
        }
        return ids;
    }

    private static String normalize(String id) {
        return id.trim().toLowerCase(Locale.ROOT);
    }
}
