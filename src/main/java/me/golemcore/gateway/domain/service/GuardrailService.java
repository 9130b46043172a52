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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.GatewayConfig;
import me.golemcore.gateway.domain.model.ToolCallSegment;
import me.golemcore.gateway.domain.model.guardrail.DiffStats;
import me.golemcore.gateway.domain.model.guardrail.DiffWarning;
import me.golemcore.gateway.domain.model.guardrail.GuardrailMode;
import me.golemcore.gateway.domain.model.guardrail.QualityCheck;
import me.golemcore.gateway.domain.model.guardrail.QualityCheckResult;
import me.golemcore.gateway.domain.system.GlobMatcher;
import me.golemcore.gateway.port.outbound.QualityGatePort;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Guardrails for the file-touching tool calls a model asks for.
 *
 * <p>
 * The blast-radius guard checks every path argument against deny and allow
 * globs and caps the distinct files one response may touch. The diff monitor
 * adds up the lines each allowed write or edit changes, per session, and
 * warns or blocks once a threshold is crossed. Quality gates are shell checks
 * run on request.
 */
@Service
@Slf4j
public class GuardrailService {

    static final List<String> PATH_ARGUMENTS = List.of("file_path", "path", "notebook_path");

    private static final Set<String> WRITE_TOOLS = Set.of("write", "write_file", "create_file");
    private static final Set<String> EDIT_TOOLS = Set.of("edit", "edit_file", "str_replace");
    private static final Set<String> MULTI_EDIT_TOOLS = Set.of("multiedit", "multi_edit");
    private static final Set<String> NOTEBOOK_TOOLS = Set.of("notebookedit", "notebook_edit");

    private final QualityGatePort qualityGatePort;
    private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();
    private final Map<String, DiffTally> tallies = new ConcurrentHashMap<>();

    public GuardrailService(QualityGatePort qualityGatePort) {
        this.qualityGatePort = qualityGatePort;
    }

    /**
     * Starts checking the tool calls of one model response.
     */
    public Turn openTurn(String sessionId, GatewayConfig config) {
        return new Turn(sessionId, config.guardrails(), Path.of(config.context().projectDir()));
    }

    public DiffStats diffStats(String sessionId) {
        DiffTally tally = tallies.get(sessionId);
        return tally != null ? tally.snapshot() : DiffStats.empty();
    }

    /**
     * Current threshold breach of the session, if any.
     */
    public Optional<DiffWarning> checkDiff(String sessionId, GatewayConfig.DiffMonitor monitor) {
        return monitor.enabled() ? breach(diffStats(sessionId), monitor) : Optional.empty();
    }

    public void forget(String sessionId) {
        tallies.remove(sessionId);
    }

    /**
     * Runs every configured check in order. Returns an empty list when quality
     * gates are disabled.
     */
    public List<QualityCheckResult> runQualityGates(GatewayConfig config) throws InterruptedException {
        GatewayConfig.QualityGates gates = config.guardrails().qualityGates();
        if (!gates.enabled()) {
            return List.of();
        }
        Path workingDir = Path.of(config.context().projectDir());
        List<QualityCheckResult> results = new ArrayList<>();
        for (QualityCheck check : gates.checks()) {
            log.info("[Guardrails] Running quality gate '{}'", check.name());
            QualityCheckResult result = qualityGatePort.run(check, workingDir, gates.timeout());
            if (result.blocking()) {
                log.warn("[Guardrails] Required quality gate '{}' failed with exit code {}", check.name(),
                        result.exitCode());
            } else if (result.passed()) {
                log.debug("[Guardrails] Quality gate '{}' passed", check.name());
            }
            results.add(result);
        }
        return results;
    }

    static List<String> pathArguments(ToolCallSegment call) {
        List<String> paths = new ArrayList<>();
        for (String key : PATH_ARGUMENTS) {
            Object value = call.arguments().get(key);
            if (value instanceof String path && !path.isBlank()) {
                paths.add(path);
            }
        }
        return paths;
    }

    /**
     * Lines added and removed by a write or edit call; empty for calls that
     * change no file.
     */
    static Optional<LineDelta> lineDelta(ToolCallSegment call) {
        String tool = call.name() != null ? call.name().toLowerCase(Locale.ROOT) : "";
        Map<String, Object> args = call.arguments();
        if (WRITE_TOOLS.contains(tool)) {
            return Optional.of(new LineDelta(lineCount(args.get("content")), 0));
        }
        if (EDIT_TOOLS.contains(tool)) {
            return Optional.of(new LineDelta(lineCount(args.get("new_string")), lineCount(args.get("old_string"))));
        }
        if (NOTEBOOK_TOOLS.contains(tool)) {
            return Optional.of(new LineDelta(lineCount(args.get("new_source")), 0));
        }
        if (MULTI_EDIT_TOOLS.contains(tool) && args.get("edits") instanceof List<?> edits) {
            int added = 0;
            int removed = 0;
            for (Object edit : edits) {
                if (edit instanceof Map<?, ?> map) {
                    added += lineCount(map.get("new_string"));
                    removed += lineCount(map.get("old_string"));
                }
            }
            return Optional.of(new LineDelta(added, removed));
        }
        return Optional.empty();
    }

    private static int lineCount(Object text) {
        return text instanceof String s && !s.isEmpty() ? (int) s.lines().count() : 0;
    }

    private static Optional<DiffWarning> breach(DiffStats stats, GatewayConfig.DiffMonitor monitor) {
        List<String> exceeded = new ArrayList<>();
        if (monitor.maxLinesChanged() > 0 && stats.linesChanged() > monitor.maxLinesChanged()) {
            exceeded.add("lines changed " + stats.linesChanged() + "/" + monitor.maxLinesChanged());
        }
        if (monitor.maxFilesChanged() > 0 && stats.filesChanged() > monitor.maxFilesChanged()) {
            exceeded.add("files changed " + stats.filesChanged() + "/" + monitor.maxFilesChanged());
        }
        if (exceeded.isEmpty()) {
            return Optional.empty();
        }
        String message = "Diff size threshold exceeded: " + String.join(", ", exceeded);
        return Optional.of(new DiffWarning(message, stats, monitor.action()));
    }

    private Pattern pattern(String glob) {
        return patterns.computeIfAbsent(glob, GlobMatcher::compile);
    }

    /**
     * Guardrail state for the tool calls of one model response. Not thread-safe.
     */
    public final class Turn {

        private final String sessionId;
        private final GatewayConfig.GuardrailSettings settings;
        private final Path projectDir;
        private final Set<String> files = new LinkedHashSet<>();

        private Turn(String sessionId, GatewayConfig.GuardrailSettings settings, Path projectDir) {
            this.sessionId = sessionId;
            this.settings = settings;
            this.projectDir = projectDir;
        }

        /**
         * Checks {@code call} against the blast radius and the diff thresholds.
         *
         * @return the reason the call must be blocked, empty when it may proceed
         */
        public Optional<String> check(ToolCallSegment call) {
            if (!settings.guardsToolCalls()) {
                return Optional.empty();
            }
            List<String> paths = new ArrayList<>();
            GatewayConfig.BlastRadius blast = settings.blastRadius();
            for (String path : pathArguments(call)) {
                String normalized = relativize(path);
                paths.add(normalized);
                Optional<String> violation = blast.enabled() ? checkPath(blast, path, normalized) : Optional.empty();
                if (violation.isPresent()) {
                    return violation;
                }
            }
            if (blast.enabled()) {
                Optional<String> overCap = checkFileCount(blast, paths);
                if (overCap.isPresent()) {
                    return overCap;
                }
            }
            return checkProjectedDiff(call, paths);
        }

        /**
         * Adds the lines {@code call} changes to the session's diff.
         */
        public void record(ToolCallSegment call) {
            if (!settings.diffMonitor().enabled()) {
                return;
            }
            Optional<LineDelta> delta = lineDelta(call);
            List<String> paths = pathArguments(call);
            if (delta.isEmpty() || paths.isEmpty()) {
                return;
            }
            DiffTally tally = tallies.computeIfAbsent(sessionId, id -> new DiffTally());
            tally.add(relativize(paths.get(0)), delta.get());
            log.debug("[Guardrails] Session {}: {} +{} -{}", sessionId, paths.get(0), delta.get().added(),
                    delta.get().removed());
            breach(tally.snapshot(), settings.diffMonitor())
                    .filter(warning -> !warning.blocking())
                    .ifPresent(warning -> log.warn("[Guardrails] Session {}: {}", sessionId, warning.message()));
        }

        private Optional<String> checkPath(GatewayConfig.BlastRadius blast, String original, String normalized) {
            for (String glob : blast.deniedPaths()) {
                if (pattern(glob).matcher(normalized).matches()) {
                    return enforce(blast.mode(), "Blast radius: path '" + original + "' matches deny list pattern");
                }
            }
            if (!blast.allowedPaths().isEmpty()
                    && blast.allowedPaths().stream().noneMatch(glob -> pattern(glob).matcher(normalized).matches())) {
                return enforce(blast.mode(), "Blast radius: path '" + original + "' not in allowed list");
            }
            return Optional.empty();
        }

        private Optional<String> checkFileCount(GatewayConfig.BlastRadius blast, List<String> paths) {
            if (blast.maxFilesPerTurn() <= 0) {
                return Optional.empty();
            }
            Set<String> touched = new LinkedHashSet<>(files);
            touched.addAll(paths);
            if (touched.size() > blast.maxFilesPerTurn()) {
                Optional<String> violation = enforce(blast.mode(), "Blast radius: exceeded max files per turn ("
                        + touched.size() + "/" + blast.maxFilesPerTurn() + ")");
                if (violation.isPresent()) {
                    return violation;
                }
            }
            files.addAll(paths);
            return Optional.empty();
        }

        private Optional<String> checkProjectedDiff(ToolCallSegment call, List<String> paths) {
            GatewayConfig.DiffMonitor monitor = settings.diffMonitor();
            Optional<LineDelta> delta = lineDelta(call);
            if (!monitor.enabled() || delta.isEmpty() || paths.isEmpty()) {
                return Optional.empty();
            }
            DiffStats current = diffStats(sessionId);
            List<String> projectedFiles = new ArrayList<>(current.files());
            if (!projectedFiles.contains(paths.get(0))) {
                projectedFiles.add(paths.get(0));
            }
            DiffStats projected = new DiffStats(current.linesAdded() + delta.get().added(),
                    current.linesRemoved() + delta.get().removed(), projectedFiles);
            Optional<DiffWarning> warning = breach(projected, monitor);
            if (warning.isPresent() && warning.get().blocking()) {
                log.warn("[Guardrails] Session {}: {} (BLOCKED)", sessionId, warning.get().message());
                return Optional.of(warning.get().message());
            }
            return Optional.empty();
        }

        private Optional<String> enforce(GuardrailMode mode, String message) {
            if (mode == GuardrailMode.STRICT) {
                log.warn("[Guardrails] Session {}: {} (BLOCKED)", sessionId, message);
                return Optional.of(message);
            }
            log.warn("[Guardrails] Session {}: {} (advisory)", sessionId, message);
            return Optional.empty();
        }

        private String relativize(String path) {
            String normalized = GlobMatcher.normalize(path);
            Path candidate = Path.of(normalized);
            if (candidate.isAbsolute()) {
                Path absolute = candidate.normalize();
                Path root = projectDir.toAbsolutePath().normalize();
                if (absolute.startsWith(root)) {
                    return GlobMatcher.normalize(root.relativize(absolute).toString());
                }
            }
            return normalized;
        }
    }

    record LineDelta(int added, int removed) {
    }

    private static final class DiffTally {

        private int linesAdded;
        private int linesRemoved;
        private final Set<String> files = new LinkedHashSet<>();

        synchronized void add(String file, LineDelta delta) {
            linesAdded += delta.added();
            linesRemoved += delta.removed();
            files.add(file);
        }

        synchronized DiffStats snapshot() {
            return new DiffStats(linesAdded, linesRemoved, new ArrayList<>(files));
        }
    }
}
