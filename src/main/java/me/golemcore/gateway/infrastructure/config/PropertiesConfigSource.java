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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.adapter.outbound.hook.ClaudeSettingsHookLoader;
import me.golemcore.gateway.domain.model.ConfigurationException;
import me.golemcore.gateway.domain.model.GatewayConfig;
import me.golemcore.gateway.domain.model.guardrail.GuardrailAction;
import me.golemcore.gateway.domain.model.guardrail.GuardrailMode;
import me.golemcore.gateway.domain.model.guardrail.QualityCheck;
import me.golemcore.gateway.domain.model.hook.HookDefinition;
import me.golemcore.gateway.domain.model.hook.HookEventKind;
import me.golemcore.gateway.domain.model.hook.HookHandlerType;
import me.golemcore.gateway.port.outbound.ConfigSourcePort;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds {@link GatewayConfig} snapshots from {@link GatewayProperties} plus
 * the hook entries found in Claude-style settings files.
 *
 * <p>
 * Hook order is property entries first, then user settings, then project
 * settings. That order is the declared order the hook merge relies on.
 */
@Component
@Slf4j
public class PropertiesConfigSource implements ConfigSourcePort {

    private final GatewayProperties properties;
    private final ClaudeSettingsHookLoader settingsLoader;

    public PropertiesConfigSource(GatewayProperties properties, ClaudeSettingsHookLoader settingsLoader) {
        this.properties = properties;
        this.settingsLoader = settingsLoader;
    }

    @Override
    public GatewayConfig load() {
        GatewayProperties.CompactionProperties compaction = properties.getCompaction();
        GatewayProperties.ContextProperties context = properties.getContext();
        Path projectDir = Path.of(context.getProjectDir()).toAbsolutePath().normalize();

        return new GatewayConfig(
                properties.getProvider(),
                properties.getModel(),
                properties.getSession().getHistoryDepth(),
                new GatewayConfig.CompactionSettings(
                        compaction.isEnabled(),
                        compaction.getThresholdFraction(),
                        compaction.getDefaultContextLimit(),
                        compaction.getContextLimits(),
                        compaction.getPreserveRecentTurns(),
                        Duration.ofMillis(compaction.getSummaryTimeoutMs()),
                        compaction.getSummaryMaxTokens(),
                        compaction.getSummaryModel()),
                new GatewayConfig.ContextSettings(
                        Duration.ofMillis(context.getSourceTimeoutMs()),
                        context.getRecentSessionsLimit(),
                        projectDir.toString()),
                hookSettings(projectDir),
                guardrailSettings());
    }

    private GatewayConfig.GuardrailSettings guardrailSettings() {
        GatewayProperties.GuardrailsProperties guardrails = properties.getGuardrails();
        GatewayProperties.BlastRadiusProperties blast = guardrails.getBlastRadius();
        GatewayProperties.DiffMonitorProperties diff = guardrails.getDiffMonitor();
        GatewayProperties.QualityGatesProperties gates = guardrails.getQualityGates();

        List<QualityCheck> checks = new ArrayList<>();
        for (GatewayProperties.QualityCheckProperties check : gates.getChecks()) {
            if (check.getCommand() == null || check.getCommand().isBlank()) {
                throw new ConfigurationException("Quality check " + check.getName() + " has no command");
            }
            String name = check.getName() != null ? check.getName() : check.getCommand();
            checks.add(new QualityCheck(name, check.getCommand(), check.isRequired()));
        }
        return new GatewayConfig.GuardrailSettings(
                new GatewayConfig.BlastRadius(blast.isEnabled(), parse(GuardrailMode.class, blast.getMode()),
                        blast.getAllowedPaths(), blast.getDeniedPaths(), blast.getMaxFilesPerTurn()),
                new GatewayConfig.DiffMonitor(diff.isEnabled(), diff.getMaxLinesChanged(),
                        diff.getMaxFilesChanged(), parse(GuardrailAction.class, diff.getAction())),
                new GatewayConfig.QualityGates(gates.isEnabled(), Duration.ofSeconds(gates.getTimeoutSeconds()),
                        checks));
    }

    private static <E extends Enum<E>> E parse(Class<E> type, String value) {
        if (value == null) {
            throw new ConfigurationException("Missing " + type.getSimpleName());
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown " + type.getSimpleName() + ": " + value, e);
        }
    }

    private GatewayConfig.HookSettings hookSettings(Path projectDir) {
        GatewayProperties.HooksProperties hooks = properties.getHooks();
        if (!hooks.isEnabled()) {
            return GatewayConfig.HookSettings.disabled();
        }
        Map<HookHandlerType, Duration> defaults = new EnumMap<>(HookHandlerType.class);
        defaults.put(HookHandlerType.COMMAND, Duration.ofSeconds(hooks.getDefaultCommandTimeoutSeconds()));
        defaults.put(HookHandlerType.PROMPT, Duration.ofSeconds(hooks.getDefaultPromptTimeoutSeconds()));

        List<HookDefinition> definitions = new ArrayList<>();
        for (GatewayProperties.HookEntryProperties entry : hooks.getEntries()) {
            definitions.add(toDefinition(entry, defaults));
        }
        if (hooks.isLoadClaudeSettings()) {
            Path userHome = Path.of(System.getProperty("user.home"));
            definitions.addAll(settingsLoader.load(userHome, projectDir, defaults));
        }
        log.debug("[Hooks] {} hook definition(s) configured", definitions.size());
        return new GatewayConfig.HookSettings(true, definitions);
    }

    private HookDefinition toDefinition(GatewayProperties.HookEntryProperties entry,
            Map<HookHandlerType, Duration> defaults) {
        HookEventKind kind = HookEventKind.fromKey(entry.getEvent())
                .or(() -> HookEventKind.fromSettingsName(entry.getEvent()))
                .orElseThrow(() -> new ConfigurationException("Unknown hook event: " + entry.getEvent()));
        HookHandlerType type;
        try {
            type = HookHandlerType.valueOf(entry.getType().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown hook type: " + entry.getType(), e);
        }
        if (type == HookHandlerType.COMMAND && (entry.getCommand() == null || entry.getCommand().isBlank())) {
            throw new ConfigurationException("Command hook for " + kind.key() + " has no command");
        }
        if (type == HookHandlerType.PROMPT && (entry.getPrompt() == null || entry.getPrompt().isBlank())) {
            throw new ConfigurationException("Prompt hook for " + kind.key() + " has no prompt");
        }
        Duration timeout = entry.getTimeoutSeconds() != null
                ? Duration.ofSeconds(entry.getTimeoutSeconds())
                : defaults.get(type);
        return HookDefinition.builder()
                .event(kind)
                .matcher(entry.getMatcher())
                .type(type)
                .command(entry.getCommand())
                .prompt(entry.getPrompt())
                .model(entry.getModel())
                .timeout(timeout)
                .build();
    }
}
