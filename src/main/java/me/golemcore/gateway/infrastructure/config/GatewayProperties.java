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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the gateway, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code gateway.*} prefix:
 * <ul>
 * <li>{@link ProviderProperties} - upstream provider endpoints and keys</li>
 * <li>{@link StorageProperties} - workspace location</li>
 * <li>{@link SessionProperties} - undo/redo depth</li>
 * <li>{@link CompactionProperties} - context budget and summarization</li>
 * <li>{@link ContextProperties} - context injection sources</li>
 * <li>{@link HooksProperties} - lifecycle hooks</li>
 * <li>{@link GuardrailsProperties} - blast radius, diff size and quality
 * gates</li>
 * <li>{@link MemoryProperties} - archival and core memory</li>
 * <li>{@link HttpProperties} - outbound HTTP client</li>
 * </ul>
 *
 * <p>
 * These values are the source for {@code GatewayConfig} snapshots. Components
 * read the snapshot captured at the start of an exchange, never this bean
 * directly, so a reload only takes effect between exchanges.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "gateway")
@Data
public class GatewayProperties {

    private String provider = "anthropic";
    private String model = "claude-sonnet-4-20250514";
    private Map<String, ProviderProperties> providers = new LinkedHashMap<>();
    private StorageProperties storage = new StorageProperties();
    private SessionProperties session = new SessionProperties();
    private CompactionProperties compaction = new CompactionProperties();
    private ContextProperties context = new ContextProperties();
    private HooksProperties hooks = new HooksProperties();
    private GuardrailsProperties guardrails = new GuardrailsProperties();
    private MemoryProperties memory = new MemoryProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class ProviderProperties {
        private String baseUrl;
        private String apiKey;
        private String model;
        private Integer maxTokens;
        private Map<String, String> headers = new LinkedHashMap<>();
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/gateway";
    }

    @Data
    public static class SessionProperties {
        private int historyDepth = 50;
        private boolean transcriptEnabled = true;
        private long lockTimeoutMs = 300000;
    }

    @Data
    public static class CompactionProperties {
        private boolean enabled = true;
        private double thresholdFraction = 0.85;
        private int defaultContextLimit = 128000;
        private Map<String, Integer> contextLimits = new LinkedHashMap<>(Map.of(
                "claude", 200000,
                "gpt-4o", 128000,
                "gpt-4", 128000,
                "gpt-3.5", 16385,
                "gemini", 1000000,
                "o1", 128000,
                "o3", 128000,
                "deepseek", 64000,
                "qwen", 131072,
                "glm", 128000));
        private int preserveRecentTurns = 0;
        private long summaryTimeoutMs = 60000;
        private int summaryMaxTokens = 4096;
        private String summaryModel;
        private double charsPerToken = 3.5;
        private int messageOverheadTokens = 4;
    }

    @Data
    public static class ContextProperties {
        private long sourceTimeoutMs = 1000;
        private int recentSessionsLimit = 5;
        private List<String> rulesFiles = new ArrayList<>(List.of("CLAUDE.md", "AGENTS.md", ".claude/CLAUDE.md"));
        private String projectDir = ".";
        private long maxAttachmentBytes = 256 * 1024;
    }

    @Data
    public static class HooksProperties {
        private boolean enabled = true;
        private boolean loadClaudeSettings = true;
        private int defaultCommandTimeoutSeconds = 60;
        private int defaultPromptTimeoutSeconds = 30;
        private List<HookEntryProperties> entries = new ArrayList<>();
    }

    @Data
    public static class HookEntryProperties {
        private String event;
        private String matcher;
        private String type = "command";
        private String command;
        private String prompt;
        private String model;
        private Integer timeoutSeconds;
    }

    @Data
    public static class GuardrailsProperties {
        private BlastRadiusProperties blastRadius = new BlastRadiusProperties();
        private DiffMonitorProperties diffMonitor = new DiffMonitorProperties();
        private QualityGatesProperties qualityGates = new QualityGatesProperties();
    }

    @Data
    public static class BlastRadiusProperties {
        private boolean enabled = false;
        private String mode = "strict";
        private List<String> allowedPaths = new ArrayList<>();
        private List<String> deniedPaths = new ArrayList<>(List.of(".env", ".env.*", "**/*.pem", "**/*.key",
                ".git/**"));
        private int maxFilesPerTurn = 0;
    }

    @Data
    public static class DiffMonitorProperties {
        private boolean enabled = false;
        private int maxLinesChanged = 500;
        private int maxFilesChanged = 20;
        private String action = "warn";
    }

    @Data
    public static class QualityGatesProperties {
        private boolean enabled = false;
        private int timeoutSeconds = 300;
        private List<QualityCheckProperties> checks = new ArrayList<>();
    }

    @Data
    public static class QualityCheckProperties {
        private String name;
        private String command;
        private boolean required = true;
    }

    @Data
    public static class MemoryProperties {
        private String databaseFile = "memory.db";
        private int maxBlockChars = 4000;
        private int searchLimit = 10;
        private int maxSearchLimit = 50;
        private int recentSessionRetentionHours = 48;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 120000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
        private int maxRequests = 128;
        private int maxRequestsPerHost = 32;
    }
}
