package me.golemcore.gateway.domain.service;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.GatewayConfig;
import me.golemcore.gateway.port.outbound.ConfigSourcePort;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current configuration snapshot.
 *
 * <p>
 * Exchanges call {@link #current()} once when they start and keep that
 * snapshot. {@link #reload()} builds a new snapshot and swaps the reference,
 * so in-flight exchanges never see a half-applied change.
 */
@Service
@Slf4j
public class ConfigSnapshotHolder {

    private final ConfigSourcePort configSource;
    private final AtomicReference<GatewayConfig> snapshot = new AtomicReference<>();

    public ConfigSnapshotHolder(ConfigSourcePort configSource) {
        this.configSource = configSource;
    }

    @PostConstruct
    public void init() {
        snapshot.set(configSource.load());
        log.info("[Config] Loaded: provider={}, model={}, hooks={}", current().providerId(), current().model(),
                current().hooks().definitions().size());
    }

    public GatewayConfig current() {
        GatewayConfig config = snapshot.get();
        if (config == null) {
            config = configSource.load();
            snapshot.compareAndSet(null, config);
            config = snapshot.get();
        }
        return config;
    }

    /**
     * Rebuilds the snapshot from the configuration sources. A failing load leaves
     * the previous snapshot in place.
     */
    public GatewayConfig reload() {
        GatewayConfig fresh = configSource.load();
        snapshot.set(fresh);
        log.info("[Config] Reloaded: provider={}, model={}, hooks={}", fresh.providerId(), fresh.model(),
                fresh.hooks().definitions().size());
        return fresh;
    }

    /**
     * Installs {@code config} directly.
     */
    public void swap(GatewayConfig config) {
        snapshot.set(config);
    }
}
