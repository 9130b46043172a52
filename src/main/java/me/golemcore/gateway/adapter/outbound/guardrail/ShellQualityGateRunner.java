package me.golemcore.gateway.adapter.outbound.guardrail;

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
import me.golemcore.gateway.domain.model.guardrail.QualityCheck;
import me.golemcore.gateway.domain.model.guardrail.QualityCheckResult;
import me.golemcore.gateway.port.outbound.QualityGatePort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs quality checks via {@code /bin/sh -c} in the project directory. Exit
 * status 0 passes. A check that outlives its timeout is killed and fails with
 * exit code -1.
 */
@Component
@Slf4j
public class ShellQualityGateRunner implements QualityGatePort {

    static final int NO_EXIT_CODE = -1;
    private static final int MAX_OUTPUT_CHARS = 64_000;
    private static final long STREAM_DRAIN_SECONDS = 1;

    private final Executor ioExecutor;

    public ShellQualityGateRunner(@Qualifier("hookExecutor") Executor ioExecutor) {
        this.ioExecutor = ioExecutor;
    }

    @Override
    public QualityCheckResult run(QualityCheck check, Path workingDir, Duration timeout) throws InterruptedException {
        ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", check.command());
        pb.directory(workingDir.toFile());
        pb.redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")));

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.warn("[Guardrails] Quality check '{}' could not start: {}", check.name(), e.getMessage());
            return result(check, false, NO_EXIT_CODE, "", "Failed to execute: " + e.getMessage());
        }

        try {
            CompletableFuture<String> stdout = readAsync(process.getInputStream());
            CompletableFuture<String> stderr = readAsync(process.getErrorStream());
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                return result(check, false, NO_EXIT_CODE, drain(stdout),
                        "Timed out after " + timeout.toSeconds() + "s");
            }
            int exitCode = process.exitValue();
            return result(check, exitCode == 0, exitCode, drain(stdout), drain(stderr));
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    private static QualityCheckResult result(QualityCheck check, boolean passed, int exitCode, String stdout,
            String stderr) {
        return new QualityCheckResult(check.name(), check.command(), passed, exitCode, stdout, stderr,
                check.required());
    }

    private CompletableFuture<String> readAsync(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
                return text.length() > MAX_OUTPUT_CHARS ? text.substring(0, MAX_OUTPUT_CHARS) : text;
            } catch (IOException e) {
                log.debug("[Guardrails] Check output stream closed: {}", e.getMessage());
                return "";
            }
        }, ioExecutor);
    }

    private static String drain(CompletableFuture<String> output) throws InterruptedException {
        try {
            return output.get(STREAM_DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            output.cancel(true);
            return "";
        }
    }
}
