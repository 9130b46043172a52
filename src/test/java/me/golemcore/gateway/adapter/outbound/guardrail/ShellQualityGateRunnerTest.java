package me.golemcore.gateway.adapter.outbound.guardrail;

import me.golemcore.gateway.domain.model.guardrail.QualityCheck;
import me.golemcore.gateway.domain.model.guardrail.QualityCheckResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class ShellQualityGateRunnerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @TempDir
    Path projectDir;

    private ExecutorService ioExecutor;
    private ShellQualityGateRunner runner;

    @BeforeEach
    void setUp() {
        ioExecutor = Executors.newCachedThreadPool();
        runner = new ShellQualityGateRunner(ioExecutor);
    }

    @AfterEach
    void tearDown() {
        ioExecutor.shutdownNow();
    }

    @Test
    void shouldPassOnZeroExitAndCaptureOutput() throws InterruptedException {
        QualityCheckResult result = runner.run(new QualityCheck("echo", "echo ok; echo warn >&2", true),
                projectDir, TIMEOUT);

        assertTrue(result.passed());
        assertEquals(0, result.exitCode());
        assertEquals("ok\n", result.stdout());
        assertEquals("warn\n", result.stderr());
        assertFalse(result.blocking());
    }

    @Test
    void shouldRunInProjectDirectory() throws IOException, InterruptedException {
        Files.writeString(projectDir.resolve("marker.txt"), "here");

        QualityCheckResult result = runner.run(new QualityCheck("ls", "cat marker.txt", true), projectDir, TIMEOUT);

        assertEquals("here", result.stdout());
    }

    @Test
    void shouldFailRequiredCheckOnNonZeroExit() throws InterruptedException {
        QualityCheckResult result = runner.run(new QualityCheck("lint", "exit 3", true), projectDir, TIMEOUT);

        assertFalse(result.passed());
        assertEquals(3, result.exitCode());
        assertTrue(result.blocking());
    }

    @Test
    void shouldKillCheckThatOutlivesTimeout() throws InterruptedException {
        long start = System.currentTimeMillis();

        QualityCheckResult result = runner.run(new QualityCheck("slow", "sleep 5", false), projectDir,
                Duration.ofMillis(300));

        assertTrue(System.currentTimeMillis() - start < 4000);
        assertFalse(result.passed());
        assertEquals(ShellQualityGateRunner.NO_EXIT_CODE, result.exitCode());
        assertTrue(result.stderr().startsWith("Timed out"));
    }
}
