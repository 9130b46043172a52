package me.golemcore.gateway.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.adapter.outbound.llm.ProviderAdapterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core beans shared across the gateway and the startup banner.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the {@link Clock} and the shared {@link ObjectMapper}</li>
 * <li>Provides the executors for hook handlers and context sources</li>
 * <li>Logs startup information (provider, model, workspace location)</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final GatewayProperties properties;
    private final ProviderAdapterRegistry providerRegistry;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Runs hook handlers and the I/O pumps of command hooks. Unbounded because
     * every matched handler of an event must start at once.
     */
    @Bean(name = "hookExecutor", destroyMethod = "shutdownNow")
    public ExecutorService hookExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("hook"));
    }

    /**
     * Runs context sources (rules, memory, attachments) under their timeouts.
     */
    @Bean(name = "contextExecutor", destroyMethod = "shutdownNow")
    public ExecutorService contextExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("context"));
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("GolemCore Gateway v{} starting...", version);
        log.info("Default provider: {} ({})", properties.getProvider(),
                providerRegistry.resolve(properties.getProvider()).getProviderId());
        log.info("Default model: {}", properties.getModel());
        log.info("Registered providers: {}", providerRegistry.getProviderIds());
        log.info("Workspace: {}", WorkspacePaths.basePath(properties));
    }
}
