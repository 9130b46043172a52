package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.model.GatewayConfig;
import me.golemcore.gateway.domain.model.ToolCallSegment;
import me.golemcore.gateway.domain.model.guardrail.DiffStats;
import me.golemcore.gateway.domain.model.guardrail.DiffWarning;
import me.golemcore.gateway.domain.model.guardrail.GuardrailAction;
import me.golemcore.gateway.domain.model.guardrail.GuardrailMode;
import me.golemcore.gateway.domain.model.guardrail.QualityCheck;
import me.golemcore.gateway.domain.model.guardrail.QualityCheckResult;
import me.golemcore.gateway.port.outbound.QualityGatePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class GuardrailServiceTest {

    private final List<QualityCheck> ranChecks = new ArrayList<>();
    private GuardrailService service;

    @BeforeEach
    void setUp() {
        QualityGatePort port = (check, workingDir, timeout) -> {
            ranChecks.add(check);
            boolean passed = !check.command().contains("fail");
            return new QualityCheckResult(check.name(), check.command(), passed, passed ? 0 : 1, "", "",
                    check.required());
        };
        service = new GuardrailService(port);
    }

    private static GatewayConfig config(GatewayConfig.BlastRadius blast, GatewayConfig.DiffMonitor diff,
            GatewayConfig.QualityGates gates) {
        return new GatewayConfig("anthropic", "model", 50, null,
                new GatewayConfig.ContextSettings(Duration.ofSeconds(1), 5, "/work"), null,
                new GatewayConfig.GuardrailSettings(blast, diff, gates));
    }

    private static GatewayConfig.BlastRadius strict(List<String> allowed, List<String> denied, int maxFiles) {
        return new GatewayConfig.BlastRadius(true, GuardrailMode.STRICT, allowed, denied, maxFiles);
    }

    private static ToolCallSegment read(String path) {
        return new ToolCallSegment("call_r", "Read", Map.of("file_path", path));
    }

    private static ToolCallSegment write(String path, String content) {
        return new ToolCallSegment("call_w", "Write", Map.of("file_path", path, "content", content));
    }

    private static ToolCallSegment edit(String path, String oldText, String newText) {
        return new ToolCallSegment("call_e", "Edit", Map.of("file_path", path, "old_string", oldText,
                "new_string", newText));
    }

    // ===== blast radius =====

    @Test
    void shouldLetDenyListWinOverAllowList() {
        GuardrailService.Turn turn = service.openTurn("s1", config(
                strict(List.of("**"), List.of("**/.env"), 0), null, null));

        assertEquals(Optional.of("Blast radius: path 'app/.env' matches deny list pattern"),
                turn.check(read("app/.env")));
        assertTrue(turn.check(read("app/main.py")).isEmpty());
    }

    @Test
    void shouldRejectPathOutsideAllowList() {
        GuardrailService.Turn turn = service.openTurn("s1", config(strict(List.of("src/**"), List.of(), 0),
                null, null));

        assertTrue(turn.check(read("./src/App.java")).isEmpty());
        assertTrue(turn.check(read("/work/src/App.java")).isEmpty());
        assertEquals(Optional.of("Blast radius: path '/etc/passwd' not in allowed list"),
                turn.check(read("/etc/passwd")));
    }

    @Test
    void shouldIgnoreCallsWithoutPathArguments() {
        GuardrailService.Turn turn = service.openTurn("s1", config(strict(List.of("src/**"), List.of(), 1),
                null, null));

        assertTrue(turn.check(new ToolCallSegment("call_b", "Bash", Map.of("command", "ls"))).isEmpty());
    }

    @Test
    void shouldCapDistinctFilesPerTurn() {
        GuardrailService.Turn turn = service.openTurn("s1", config(strict(List.of(), List.of(), 2), null, null));

        assertTrue(turn.check(read("a.txt")).isEmpty());
        assertTrue(turn.check(read("b.txt")).isEmpty());
        assertTrue(turn.check(read("./a.txt")).isEmpty());
        assertEquals(Optional.of("Blast radius: exceeded max files per turn (3/2)"), turn.check(read("c.txt")));
        // a blocked call does not use up the cap
        assertEquals(Optional.of("Blast radius: exceeded max files per turn (3/2)"), turn.check(read("d.txt")));

        GuardrailService.Turn next = service.openTurn("s1", config(strict(List.of(), List.of(), 2), null, null));
        assertTrue(next.check(read("c.txt")).isEmpty());
    }

    @Test
    void shouldOnlyLogInAdvisoryMode() {
        GuardrailService.Turn turn = service.openTurn("s1", config(new GatewayConfig.BlastRadius(true,
                GuardrailMode.ADVISORY, List.of("src/**"), List.of("**/.env"), 1), null, null));

        assertTrue(turn.check(read(".env")).isEmpty());
        assertTrue(turn.check(read("docs/readme.md")).isEmpty());
    }

    // ===== diff monitor =====

    @Test
    void shouldCountLinesOfWritesAndEdits() {
        GatewayConfig config = config(null, new GatewayConfig.DiffMonitor(true, 0, 0, GuardrailAction.WARN), null);
        GuardrailService.Turn turn = service.openTurn("s1", config);

        turn.record(write("/work/src/App.java", "class App {\n}\n"));
        turn.record(edit("src/App.java", "}\n", "  void run() {}\n}\n"));
        turn.record(read("src/Other.java"));

        DiffStats stats = service.diffStats("s1");
        assertEquals(4, stats.linesAdded());
        assertEquals(1, stats.linesRemoved());
        assertEquals(List.of("src/App.java"), stats.files());
        assertEquals(DiffStats.empty(), service.diffStats("s2"));
    }

    @Test
    void shouldSumMultiEditChanges() {
        GatewayConfig config = config(null, new GatewayConfig.DiffMonitor(true, 0, 0, GuardrailAction.WARN), null);
        ToolCallSegment multiEdit = new ToolCallSegment("call_m", "MultiEdit", Map.of("file_path", "a.py",
                "edits", List.of(Map.of("old_string", "x", "new_string", "y\nz"),
                        Map.of("old_string", "p\nq", "new_string", ""))));

        service.openTurn("s1", config).record(multiEdit);

        assertEquals(new DiffStats(2, 3, List.of("a.py")), service.diffStats("s1"));
    }

    @Test
    void shouldReportThresholdBreachWithItsAction() {
        GatewayConfig.DiffMonitor monitor = new GatewayConfig.DiffMonitor(true, 2, 1, GuardrailAction.WARN);
        GuardrailService.Turn turn = service.openTurn("s1", config(null, monitor, null));
        turn.record(write("a.txt", "1\n2\n"));
        assertTrue(service.checkDiff("s1", monitor).isEmpty());

        assertTrue(turn.check(write("b.txt", "3\n")).isEmpty());
        turn.record(write("b.txt", "3\n"));

        DiffWarning warning = service.checkDiff("s1", monitor).orElseThrow();
        assertEquals("Diff size threshold exceeded: lines changed 3/2, files changed 2/1", warning.message());
        assertEquals(GuardrailAction.WARN, warning.action());
        assertFalse(warning.blocking());
    }

    @Test
    void shouldBlockWriteThatWouldCrossThreshold() {
        GatewayConfig.DiffMonitor monitor = new GatewayConfig.DiffMonitor(true, 0, 1, GuardrailAction.BLOCK);
        GuardrailService.Turn turn = service.openTurn("s1", config(null, monitor, null));
        turn.record(write("a.txt", "1\n"));

        assertTrue(turn.check(edit("a.txt", "1", "2")).isEmpty());
        assertEquals(Optional.of("Diff size threshold exceeded: files changed 2/1"),
                turn.check(write("b.txt", "x")));
    }

    @Test
    void shouldForgetSessionDiff() {
        GatewayConfig config = config(null, new GatewayConfig.DiffMonitor(true, 0, 0, GuardrailAction.WARN), null);
        service.openTurn("s1", config).record(write("a.txt", "1\n"));

        service.forget("s1");

        assertEquals(0, service.diffStats("s1").linesChanged());
    }

    // ===== quality gates =====

    @Test
    void shouldRunChecksInOrder() throws InterruptedException {
        GatewayConfig config = config(null, null, new GatewayConfig.QualityGates(true, Duration.ofSeconds(5),
                List.of(new QualityCheck("lint", "make lint", true), new QualityCheck("test", "make fail", false))));

        List<QualityCheckResult> results = service.runQualityGates(config);

        assertEquals(List.of("lint", "test"), ranChecks.stream().map(QualityCheck::name).toList());
        assertTrue(results.get(0).passed());
        assertFalse(results.get(1).passed());
        assertFalse(results.get(1).blocking());
    }

    @Test
    void shouldSkipQualityGatesWhenDisabled() throws InterruptedException {
        GatewayConfig config = config(null, null, new GatewayConfig.QualityGates(false, Duration.ofSeconds(5),
                List.of(new QualityCheck("lint", "make lint", true))));

        assertTrue(service.runQualityGates(config).isEmpty());
        assertTrue(ranChecks.isEmpty());
    }

    @Test
    void shouldReadNotebookEditPathAndSource() {
        ToolCallSegment call = new ToolCallSegment("c", "NotebookEdit", Map.of("notebook_path", "nb.ipynb",
                "new_source", "print(1)"));

        assertEquals(List.of("nb.ipynb"), GuardrailService.pathArguments(call));
        assertEquals(Optional.of(new GuardrailService.LineDelta(1, 0)), GuardrailService.lineDelta(call));
    }
}
