package me.golemcore.gateway.domain.model.hook;

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
import lombok.Value;

import java.time.Duration;
import java.util.Locale;

/**
 * Configured hook: which event it listens to, an optional matcher regex, and
 * how to run it.
 */
@Value
@Builder(toBuilder = true)
public class HookDefinition {

    HookEventKind event;
    String matcher;
    HookHandlerType type;

    /** Shell command, for {@link HookHandlerType#COMMAND}. */
    String command;

    /** Prompt template, for {@link HookHandlerType#PROMPT}. */
    String prompt;

    /** Model override for prompt handlers; {@code null} uses the active model. */
    String model;

    Duration timeout;

    public String describe() {
        String body = type == HookHandlerType.COMMAND ? command : prompt;
        if (body != null && body.length() > 40) {
            body = body.substring(0, 40) + "...";
        }
        return event.key() + ":" + type.name().toLowerCase(Locale.ROOT) + ":" + body;
    }
}
