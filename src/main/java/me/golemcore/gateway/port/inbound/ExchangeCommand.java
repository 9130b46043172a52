package me.golemcore.gateway.port.inbound;

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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.ThinkingRequest;
import me.golemcore.gateway.domain.model.ToolDefinition;

import java.util.List;

/**
 * One request/response exchange. {@code incoming} holds the messages that
 * form the new turn: the user prompt, optionally preceded by tool results.
 * {@code model} and {@code providerId} fall back to the configured defaults.
 */
@Value
@Builder(toBuilder = true)
public class ExchangeCommand {

    String sessionId;
    @Singular("incomingMessage")
    List<Message> incoming;
    @Singular
    List<String> systemPrompts;
    String model;
    String providerId;
    @Singular
    List<ToolDefinition> tools;
    Double temperature;
    Integer maxTokens;
    ThinkingRequest thinking;
}
