package me.golemcore.gateway.adapter.outbound.rules;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.RulesPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads project rule files ({@code CLAUDE.md}, {@code AGENTS.md}, ...) in
 * configured order. Each blob is labelled with its relative path so the model
 * can tell where an instruction came from.
 *
 * <p>
 * File contents are cached and re-read when the modification time changes.
 */
@Component
@Slf4j
public class FileRulesAdapter implements RulesPort {

    private static final int MAX_SINGLE_FILE_CHARS = 40_000;

    private final GatewayProperties properties;
    private final Map<Path, CachedRule> cache = new ConcurrentHashMap<>();

    public FileRulesAdapter(GatewayProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<String> loadRules(String projectDir) {
        Path root = Path.of(projectDir).toAbsolutePath().normalize();
        List<String> rules = new ArrayList<>();
        for (String relative : properties.getContext().getRulesFiles()) {
            Path file = root.resolve(relative).normalize();
            if (!file.startsWith(root) || !Files.isRegularFile(file)) {
                continue;
            }
            String content = read(file);
            if (!content.isBlank()) {
                rules.add("# Rules from " + relative + "\n\n" + content.strip());
            }
        }
        log.debug("[Context] Loaded {} rule file(s) from {}", rules.size(), root);
        return rules;
    }

    private String read(Path file) {
        try {
            FileTime modified = Files.getLastModifiedTime(file);
            CachedRule cached = cache.get(file);
            if (cached != null && cached.modified().equals(modified)) {
                return cached.content();
            }
            String content = Files.readString(file, StandardCharsets.UTF_8);
            if (content.length() > MAX_SINGLE_FILE_CHARS) {
                content = content.substring(0, MAX_SINGLE_FILE_CHARS) + "\n[truncated]";
            }
            cache.put(file, new CachedRule(modified, content));
            return content;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read rules file " + file, e);
        }
    }

    private record CachedRule(FileTime modified, String content) {
    }
}
