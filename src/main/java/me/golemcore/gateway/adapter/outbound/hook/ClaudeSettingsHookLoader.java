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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.hook.HookDefinition;
import me.golemcore.gateway.domain.model.hook.HookEventKind;
import me.golemcore.gateway.domain.model.hook.HookHandlerType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reads hook entries from Claude-style {@code settings.json} files:
 *
 * <pre>
 * {"hooks": {"PreToolUse": [{"matcher": "Write|Edit",
 *     "hooks": [{"type": "command", "command": "./check.sh", "timeout": 30}]}]}}
 * </pre>
 *
 * Timeouts are in seconds. Unknown event names and handler types are skipped
 * with a warning; an unreadable file contributes nothing.
 */
@Component
@Slf4j
public class ClaudeSettingsHookLoader {

    private static final String SETTINGS_DIR = ".claude";
    private static final String SETTINGS_FILE = "settings.json";

    private final ObjectMapper objectMapper;

    public ClaudeSettingsHookLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Entries from the user-level file, then the project-level file.
     */
    public List<HookDefinition> load(Path userHome, Path projectDir, Map<HookHandlerType, Duration> defaults) {
        List<HookDefinition> definitions = new ArrayList<>();
        if (userHome != null) {
            definitions.addAll(loadFile(userHome.resolve(SETTINGS_DIR).resolve(SETTINGS_FILE), defaults));
        }
        if (projectDir != null) {
            Path projectSettings = projectDir.resolve(SETTINGS_DIR).resolve(SETTINGS_FILE);
            if (userHome == null || !projectSettings.toAbsolutePath().normalize()
                    .equals(userHome.resolve(SETTINGS_DIR).resolve(SETTINGS_FILE).toAbsolutePath().normalize())) {
                definitions.addAll(loadFile(projectSettings, defaults));
            }
        }
        return definitions;
    }

    List<HookDefinition> loadFile(Path file, Map<HookHandlerType, Duration> defaults) {
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            log.warn("[Hooks] Failed to read {}: {}", file, e.getMessage());
            return List.of();
        }
        JsonNode hooks = root.path("hooks");
        if (!hooks.isObject()) {
            return List.of();
        }
        List<HookDefinition> definitions = new ArrayList<>();
        hooks.fields().forEachRemaining(eventEntry -> {
            Optional<HookEventKind> kind = HookEventKind.fromSettingsName(eventEntry.getKey());
            if (kind.isEmpty()) {
                log.warn("[Hooks] Unknown hook event '{}' in {}", eventEntry.getKey(), file);
                return;
            }
            for (JsonNode group : eventEntry.getValue()) {
                String matcher = group.hasNonNull("matcher") ? group.get("matcher").asText() : null;
                for (JsonNode hook : group.path("hooks")) {
                    toDefinition(kind.get(), matcher, hook, defaults, file).ifPresent(definitions::add);
                }
            }
        });
        log.info("[Hooks] Loaded {} hook(s) from {}", definitions.size(), file);
        return definitions;
    }

    private Optional<HookDefinition> toDefinition(HookEventKind kind, String matcher, JsonNode hook,
            Map<HookHandlerType, Duration> defaults, Path file) {
        String typeName = hook.path("type").asText("command").toUpperCase(Locale.ROOT);
        HookHandlerType type;
        try {
            type = HookHandlerType.valueOf(typeName);
        } catch (IllegalArgumentException e) {
            log.warn("[Hooks] Unsupported hook type '{}' in {}", typeName, file);
            return Optional.empty();
        }
        String command = hook.hasNonNull("command") ? hook.get("command").asText() : null;
        String prompt = hook.hasNonNull("prompt") ? hook.get("prompt").asText() : null;
        if ((type == HookHandlerType.COMMAND && (command == null || command.isBlank()))
                || (type == HookHandlerType.PROMPT && (prompt == null || prompt.isBlank()))) {
            log.warn("[Hooks] {} hook for {} has no body in {}", type, kind.settingsName(), file);
            return Optional.empty();
        }
        Duration timeout = hook.has("timeout") && hook.get("timeout").canConvertToLong()
                ? Duration.ofSeconds(hook.get("timeout").asLong())
                : defaults.get(type);
        return Optional.of(HookDefinition.builder()
                .event(kind)
                .matcher(matcher)
                .type(type)
                .command(command)
                .prompt(prompt)
                .model(hook.hasNonNull("model") ? hook.get("model").asText() : null)
                .timeout(timeout)
                .build());
    }
}
