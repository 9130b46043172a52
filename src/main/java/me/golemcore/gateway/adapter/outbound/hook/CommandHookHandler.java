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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.hook.HookDecision;
import me.golemcore.gateway.domain.model.hook.HookDefinition;
import me.golemcore.gateway.domain.model.hook.HookEvent;
import me.golemcore.gateway.domain.model.hook.HookEventKind;
import me.golemcore.gateway.domain.model.hook.HookExecutionException;
import me.golemcore.gateway.domain.model.hook.HookTimeoutException;
import me.golemcore.gateway.port.outbound.HookHandler;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Hook handler that runs a shell command.
 *
 * <p>
 * The command runs via {@code /bin/sh -c} in the project directory with
 * {@code CLAUDE_PROJECT_DIR} set. The event JSON is written to stdin. Exit
 * status decides the outcome:
 * <ul>
 * <li>{@code 0} - success; stdout is parsed as a JSON decision. Plain text
 * stdout becomes context for prompt submission and session start, and is
 * ignored otherwise</li>
 * <li>{@code 2} - blocking failure; stderr is the reason</li>
 * <li>anything else - non-blocking failure</li>
 * </ul>
 * The process is killed when the timeout elapses or the dispatch abandons the
 * handler.
 */
@Slf4j
public class CommandHookHandler implements HookHandler {

    static final int EXIT_BLOCK = 2;
    private static final int MAX_OUTPUT_CHARS = 64_000;
    private static final long STREAM_DRAIN_SECONDS = 1;

    private final HookDefinition definition;
    private final HookEventEncoder encoder;
    private final HookOutputParser parser;
    private final Path projectDir;
    private final Executor ioExecutor;

    public CommandHookHandler(HookDefinition definition, HookEventEncoder encoder, HookOutputParser parser,
            Path projectDir, Executor ioExecutor) {
        this.definition = definition;
        this.encoder = encoder;
        this.parser = parser;
        this.projectDir = projectDir;
        this.ioExecutor = ioExecutor;
    }

    @Override
    public String name() {
        return definition.describe();
    }

    @Override
    public Duration timeout() {
        return definition.getTimeout();
    }

    @Override
    public HookDecision execute(HookEvent event) throws HookExecutionException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", definition.getCommand());
        pb.directory(projectDir.toFile());
        pb.environment().put("CLAUDE_PROJECT_DIR", projectDir.toString());

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new HookExecutionException("Failed to start hook command: " + e.getMessage(), e);
        }

        try {
            CompletableFuture<String> stdout = readAsync(process.getInputStream());
            CompletableFuture<String> stderr = readAsync(process.getErrorStream());
            String input = encoder.toJson(event);
            CompletableFuture.runAsync(() -> writeInput(process, input), ioExecutor);

            if (!process.waitFor(timeout().toMillis(), TimeUnit.MILLISECONDS)) {
                throw new HookTimeoutException(name(), timeout());
            }
            int exitCode = process.exitValue();
            String out = drain(stdout);
            String err = drain(stderr);
            log.debug("[Hooks] {} exited with {}", name(), exitCode);

            if (exitCode == EXIT_BLOCK) {
                String reason = err.isBlank() ? "Blocked by hook " + name() : err.trim();
                return HookDecision.block(reason);
            }
            if (exitCode != 0) {
                throw new HookExecutionException("Hook command exited with " + exitCode
                        + (err.isBlank() ? "" : ": " + err.trim()));
            }
            return toDecision(event, out);
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    private HookDecision toDecision(HookEvent event, String stdout) {
        if (stdout.isBlank()) {
            return HookDecision.proceed();
        }
        Optional<HookDecision> parsed = parser.parse(stdout);
        if (parsed.isPresent()) {
            return parsed.get();
        }
        HookEventKind kind = event.kind();
        if (kind == HookEventKind.USER_PROMPT_SUBMIT || kind == HookEventKind.SESSION_START) {
            return HookDecision.builder().systemMessage(stdout.trim()).build();
        }
        log.warn("[Hooks] {} printed non-JSON output, ignored", name());
        return HookDecision.proceed();
    }

    private void writeInput(Process process, String json) {
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(json.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            // the command may exit without reading its input
            log.debug("[Hooks] {} closed stdin early: {}", name(), e.getMessage());
        }
    }

    private CompletableFuture<String> readAsync(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                byte[] bytes = in.readAllBytes();
                String text = new String(bytes, StandardCharsets.UTF_8);
                return text.length() > MAX_OUTPUT_CHARS ? text.substring(0, MAX_OUTPUT_CHARS) : text;
            } catch (IOException e) {
                log.debug("[Hooks] {} output stream closed: {}", name(), e.getMessage());
                return "";
            }
        }, ioExecutor);
    }

    private String drain(CompletableFuture<String> output) throws InterruptedException {
        try {
            return output.get(STREAM_DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.debug("[Hooks] {} output not drained: {}", name(), e.toString());
            output.cancel(true);
            return "";
        }
    }
}
