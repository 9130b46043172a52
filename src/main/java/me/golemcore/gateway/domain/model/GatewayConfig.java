package me.golemcore.gateway.domain.model;

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

import me.golemcore.gateway.domain.model.guardrail.GuardrailAction;
import me.golemcore.gateway.domain.model.guardrail.GuardrailMode;
import me.golemcore.gateway.domain.model.guardrail.QualityCheck;
import me.golemcore.gateway.domain.model.hook.HookDefinition;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable configuration snapshot. An exchange captures one snapshot when it
 * starts and uses it throughout; reloading builds a new snapshot and swaps
 * the reference.
 */
public record GatewayConfig(
        String providerId,
        String model,
        int historyDepth,
        CompactionSettings compaction,
        ContextSettings context,
        HookSettings hooks,
        GuardrailSettings guardrails) {

    public GatewayConfig {
        hooks = hooks == null ? HookSettings.disabled() : hooks;
        guardrails = guardrails == null ? GuardrailSettings.disabled() : guardrails;
    }

    public GatewayConfig(String providerId, String model, int historyDepth, CompactionSettings compaction,
            ContextSettings context, HookSettings hooks) {
        this(providerId, model, historyDepth, compaction, context, hooks, GuardrailSettings.disabled());
    }

    public record CompactionSettings(
            boolean enabled,
            double thresholdFraction,
            int defaultContextLimit,
            Map<String, Integer> contextLimits,
            int preserveRecentTurns,
            Duration summaryTimeout,
            int summaryMaxTokens,
            String summaryModel) {

        public CompactionSettings {
            contextLimits = contextLimits == null ? Map.of() : Map.copyOf(contextLimits);
            if (thresholdFraction <= 0 || thresholdFraction > 1) {
                throw new IllegalArgumentException("thresholdFraction must be in (0, 1]: " + thresholdFraction);
            }
        }

        /**
         * Context window for {@code model}: the longest configured prefix that the
         * model name starts with, else the default.
         */
        public int contextLimitFor(String model) {
            if (model == null) {
                return defaultContextLimit;
            }
            String normalized = model.toLowerCase(Locale.ROOT);
            String best = null;
            for (String prefix : contextLimits.keySet()) {
                if (normalized.startsWith(prefix.toLowerCase(Locale.ROOT))
                        && (best == null || prefix.length() > best.length())) {
                    best = prefix;
                }
            }
            return best != null ? contextLimits.get(best) : defaultContextLimit;
        }

        public int thresholdFor(String model) {
            return (int) Math.floor(contextLimitFor(model) * thresholdFraction);
        }
    }

    public record ContextSettings(Duration sourceTimeout, int recentSessionsLimit, String projectDir) {
    }

    public record HookSettings(boolean enabled, List<HookDefinition> definitions) {

        public HookSettings {
            definitions = definitions == null ? List.of() : List.copyOf(definitions);
        }

        public static HookSettings disabled() {
            return new HookSettings(false, List.of());
        }
    }

    /**
     * Limits on what tool calls may touch. Each part is off unless enabled; a
     * zero limit means no limit.
     */
    public record GuardrailSettings(BlastRadius blastRadius, DiffMonitor diffMonitor, QualityGates qualityGates) {

        public GuardrailSettings {
            blastRadius = blastRadius == null ? BlastRadius.disabled() : blastRadius;
            diffMonitor = diffMonitor == null ? DiffMonitor.disabled() : diffMonitor;
            qualityGates = qualityGates == null ? QualityGates.disabled() : qualityGates;
        }

        public static GuardrailSettings disabled() {
            return new GuardrailSettings(null, null, null);
        }

        public boolean guardsToolCalls() {
            return blastRadius.enabled() || diffMonitor.enabled();
        }
    }

    /**
     * Path globs are matched against paths relative to the project directory.
     * Deny patterns win over allow patterns; an empty allow list allows all.
     */
    public record BlastRadius(
            boolean enabled,
            GuardrailMode mode,
            List<String> allowedPaths,
            List<String> deniedPaths,
            int maxFilesPerTurn) {

        public BlastRadius {
            mode = mode == null ? GuardrailMode.STRICT : mode;
            allowedPaths = allowedPaths == null ? List.of() : List.copyOf(allowedPaths);
            deniedPaths = deniedPaths == null ? List.of() : List.copyOf(deniedPaths);
        }

        public static BlastRadius disabled() {
            return new BlastRadius(false, GuardrailMode.STRICT, List.of(), List.of(), 0);
        }
    }

    public record DiffMonitor(boolean enabled, int maxLinesChanged, int maxFilesChanged, GuardrailAction action) {

        public DiffMonitor {
            action = action == null ? GuardrailAction.WARN : action;
        }

        public static DiffMonitor disabled() {
            return new DiffMonitor(false, 0, 0, GuardrailAction.WARN);
        }
    }

    public record QualityGates(boolean enabled, Duration timeout, List<QualityCheck> checks) {

        public QualityGates {
            checks = checks == null ? List.of() : List.copyOf(checks);
        }

        public static QualityGates disabled() {
            return new QualityGates(false, Duration.ofMinutes(5), List.of());
        }
    }
}
