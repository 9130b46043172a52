package me.golemcore.gateway.adapter.outbound.hook;

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
import me.golemcore.gateway.domain.model.hook.HookDefinition;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.HookHandler;
import me.golemcore.gateway.port.outbound.HookHandlerProvider;
import me.golemcore.gateway.port.outbound.LlmPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Builds handlers for hook definitions. Definitions are value objects, so a
 * handler built once is reused for equal definitions across config reloads.
 */
@Component
public class HookHandlerFactory implements HookHandlerProvider {

    private final HookEventEncoder encoder;
    private final HookOutputParser parser;
    private final ObjectMapper objectMapper;
    private final LlmPort llmPort;
    private final GatewayProperties properties;
    private final ExecutorService ioExecutor;
    private final Map<HookDefinition, HookHandler> handlers = new ConcurrentHashMap<>();

    public HookHandlerFactory(HookEventEncoder encoder, HookOutputParser parser, ObjectMapper objectMapper,
            @Lazy LlmPort llmPort, GatewayProperties properties,
            @Qualifier("hookExecutor") ExecutorService ioExecutor) {
        this.encoder = encoder;
        this.parser = parser;
        this.objectMapper = objectMapper;
        this.llmPort = llmPort;
        this.properties = properties;
        this.ioExecutor = ioExecutor;
    }

    @Override
    public HookHandler handlerFor(HookDefinition definition) {
        return handlers.computeIfAbsent(definition, this::create);
    }

    private HookHandler create(HookDefinition definition) {
        return switch (definition.getType()) {
        case COMMAND -> new CommandHookHandler(definition, encoder, parser, projectDir(), ioExecutor);
        case PROMPT -> new PromptHookHandler(definition, llmPort, encoder, parser, objectMapper,
                properties.getModel());
        };
    }

    private Path projectDir() {
        return Path.of(properties.getContext().getProjectDir()).toAbsolutePath().normalize();
    }
}
