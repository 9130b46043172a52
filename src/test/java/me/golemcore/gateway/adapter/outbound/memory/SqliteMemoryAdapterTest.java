package me.golemcore.gateway.adapter.outbound.memory;

import me.golemcore.gateway.domain.model.ActivityEntry;
import me.golemcore.gateway.domain.model.CoreMemoryBlock;
import me.golemcore.gateway.domain.model.MemoryCapacityException;
import me.golemcore.gateway.domain.model.MemoryRecord;
import me.golemcore.gateway.domain.model.MemoryStats;
import me.golemcore.gateway.domain.model.RecentSession;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.infrastructure.config.MemoryDataSourceConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SqliteMemoryAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private GatewayProperties properties;
    private JdbcTemplate jdbc;
    private TransactionTemplate transactions;
    private SqliteMemoryAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.getMemory().setMaxBlockChars(100);
        DataSource dataSource = MemoryDataSourceConfig.createDataSource(tempDir.resolve("memory.db"));
        jdbc = new JdbcTemplate(dataSource);
        transactions = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        adapter = newAdapter();
    }

    private SqliteMemoryAdapter newAdapter() {
        SqliteMemoryAdapter created = new SqliteMemoryAdapter(jdbc, transactions, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
        created.init();
        return created;
    }

    // ===== schema =====

    @Test
    void shouldRecordSchemaVersion() {
        Integer version = jdbc.queryForObject("SELECT MAX(version) FROM schema_version", Integer.class);
        assertEquals(SqliteMemoryAdapter.SCHEMA_VERSION, version);
    }

    @Test
    void shouldReopenExistingDatabaseWithoutLosingData() {
        adapter.save("keep me", List.of("x"));

        SqliteMemoryAdapter reopened = newAdapter();

        assertEquals(1, reopened.listCurrent(10).size());
        assertEquals(1, jdbc.queryForObject("SELECT COUNT(*) FROM schema_version", Integer.class));
    }

    // ===== archival =====

    @Test
    void shouldSaveAndGetRecord() {
        MemoryRecord saved = adapter.save("The build uses Maven", List.of("build", "tooling"));

        Optional<MemoryRecord> loaded = adapter.get(saved.getId());

        assertTrue(loaded.isPresent());
        assertEquals("The build uses Maven", loaded.get().getText());
        assertEquals(List.of("build", "tooling"), loaded.get().getTags());
        assertEquals(1, loaded.get().getVersion());
        assertTrue(loaded.get().isCurrent());
        assertEquals(NOW, loaded.get().getCreatedAt());
    }

    @Test
    void shouldRejectBlankText() {
        assertThrows(IllegalArgumentException.class, () -> adapter.save("  ", List.of()));
    }

    @Test
    void shouldReturnEmptyForUnknownRecord() {
        assertTrue(adapter.get(404).isEmpty());
        assertTrue(adapter.history(404).isEmpty());
    }

    @Test
    void shouldSupersedeOnUpdate() {
        MemoryRecord original = adapter.save("Tests run with JUnit 4", List.of("tests"));

        MemoryRecord updated = adapter.update(original.getId(), "Tests run with JUnit 5", null);

        assertEquals(2, updated.getVersion());
        assertEquals(original.getId(), updated.getSupersedes());
        assertEquals(List.of("tests"), updated.getTags());
        MemoryRecord old = adapter.get(original.getId()).orElseThrow();
        assertFalse(old.isCurrent());
        assertEquals(updated.getId(), old.getSupersededBy());
    }

    @Test
    void shouldRejectUpdateOfSupersededRecord() {
        MemoryRecord original = adapter.save("v1", List.of());
        adapter.update(original.getId(), "v2", List.of());

        assertThrows(IllegalStateException.class, () -> adapter.update(original.getId(), "v3", List.of()));
    }

    @Test
    void shouldRejectUpdateOfUnknownRecord() {
        assertThrows(IllegalArgumentException.class, () -> adapter.update(99, "text", List.of()));
    }

    @Test
    void shouldReturnWholeHistoryFromAnyVersion() {
        MemoryRecord v1 = adapter.save("deploy on fridays", List.of());
        MemoryRecord v2 = adapter.update(v1.getId(), "never deploy on fridays", List.of());
        MemoryRecord v3 = adapter.update(v2.getId(), "deploy only with approval", List.of());

        List<MemoryRecord> fromMiddle = adapter.history(v2.getId());

        assertEquals(List.of(v1.getId(), v2.getId(), v3.getId()),
                fromMiddle.stream().map(MemoryRecord::getId).toList());
        assertEquals(3, adapter.history(v3.getId()).size());
    }

    // ===== search =====

    @Test
    void shouldSearchCurrentRecordsOnly() {
        MemoryRecord v1 = adapter.save("database is postgres", List.of());
        adapter.update(v1.getId(), "database is sqlite", List.of());
        adapter.save("unrelated note about colors", List.of());

        List<MemoryRecord> results = adapter.search("database", 10);

        assertEquals(1, results.size());
        assertEquals("database is sqlite", results.get(0).getText());
        assertNotNull(results.get(0).getScore());
    }

    @Test
    void shouldIncludeSupersededVersionsWhenRequested() {
        MemoryRecord v1 = adapter.save("database is postgres", List.of());
        adapter.update(v1.getId(), "database is sqlite", List.of());

        List<MemoryRecord> results = adapter.searchIncludingHistory("database", 10);

        assertEquals(2, results.size());
    }

    @Test
    void shouldMatchTags() {
        adapter.save("Run the linter before committing", List.of("workflow"));

        assertEquals(1, adapter.search("workflow", 10).size());
    }

    @Test
    void shouldDeduplicateIdenticalContent() {
        adapter.save("port 8080 is reserved", List.of());
        adapter.save("port 8080 is reserved", List.of());

        assertEquals(1, adapter.search("port", 10).size());
    }

    @Test
    void shouldCapResultsAtLimit() {
        for (int i = 0; i < 5; i++) {
            adapter.save("logging note number " + i, List.of());
        }

        assertEquals(3, adapter.search("logging", 3).size());
    }

    @Test
    void shouldTreatPunctuationAsPlainText() {
        adapter.save("use AND carefully", List.of());

        assertDoesNotThrow(() -> adapter.search("\"AND\" OR (NEAR*", 10));
        assertTrue(adapter.search("?!", 10).isEmpty());
    }

    @Test
    void shouldBuildQuotedMatchExpression() {
        assertEquals("\"hello\" OR \"world\"", SqliteMemoryAdapter.toMatchExpression("Hello, world! hello"));
        assertNull(SqliteMemoryAdapter.toMatchExpression("***"));
        assertNull(SqliteMemoryAdapter.toMatchExpression(null));
    }

    @Test
    void shouldListCurrentNewestFirst() {
        MemoryRecord first = adapter.save("first", List.of());
        MemoryRecord second = adapter.save("second", List.of());
        adapter.update(first.getId(), "first revised", List.of());

        List<MemoryRecord> current = adapter.listCurrent(10);

        assertEquals(List.of("first revised", "second"), current.stream().map(MemoryRecord::getText).toList());
        assertNotEquals(second.getId(), current.get(0).getId());
    }

    @Test
    void shouldReportStats() {
        MemoryRecord v1 = adapter.save("abc", List.of());
        adapter.update(v1.getId(), "abcdef", List.of());

        MemoryStats stats = adapter.stats();

        assertEquals(2, stats.archivalCount());
        assertEquals(1, stats.currentCount());
        assertEquals(9, stats.totalSize());
        assertEquals(NOW, stats.lastUpdated());
    }

    @Test
    void shouldReportEmptyStats() {
        MemoryStats stats = adapter.stats();

        assertEquals(0, stats.archivalCount());
        assertNull(stats.lastUpdated());
    }

    // ===== core =====

    @Test
    void shouldSeedDefaultCoreBlocks() {
        List<CoreMemoryBlock> blocks = adapter.getCoreBlocks();

        assertEquals(List.of("persona", "preferences", "project"),
                blocks.stream().map(CoreMemoryBlock::name).toList());
    }

    @Test
    void shouldReplaceCoreBlockAndKeepItAcrossRestart() {
        adapter.replaceCoreBlock("project", "Spring Boot gateway");

        SqliteMemoryAdapter reopened = newAdapter();

        assertEquals("Spring Boot gateway", reopened.getCoreBlock("project").orElseThrow().content());
    }

    @Test
    void shouldRejectOversizedCoreBlockAndKeepPreviousValue() {
        adapter.replaceCoreBlock("preferences", "tabs");

        MemoryCapacityException ex = assertThrows(MemoryCapacityException.class,
                () -> adapter.replaceCoreBlock("preferences", "x".repeat(101)));

        assertEquals(100, ex.getLimit());
        assertEquals("tabs", adapter.getCoreBlock("preferences").orElseThrow().content());
    }

    @Test
    void shouldCreateNewCoreBlock() {
        adapter.replaceCoreBlock("scratch", "notes");

        assertEquals(4, adapter.getCoreBlocks().size());
    }

    // ===== recent sessions and activity =====

    @Test
    void shouldSaveAndListRecentSessions() {
        adapter.saveRecentSession(RecentSession.builder()
                .sessionId("s1")
                .summary("Refactored parser")
                .filesModified(List.of("Parser.java", "Lexer.java"))
                .startedAt(NOW.minus(Duration.ofHours(2)))
                .endedAt(NOW.minus(Duration.ofHours(1)))
                .build());
        adapter.saveRecentSession(RecentSession.builder()
                .sessionId("s2")
                .summary("Fixed tests")
                .endedAt(NOW.minus(Duration.ofMinutes(5)))
                .build());

        List<RecentSession> sessions = adapter.getRecentSessions(5);

        assertEquals(List.of("s2", "s1"), sessions.stream().map(RecentSession::getSessionId).toList());
        assertEquals(List.of("Parser.java", "Lexer.java"), sessions.get(1).getFilesModified());
        assertTrue(sessions.get(0).getIssuesWorked().isEmpty());
    }

    @Test
    void shouldHideAndPruneExpiredSessions() {
        adapter.saveRecentSession(RecentSession.builder()
                .sessionId("old")
                .summary("ancient")
                .endedAt(NOW.minus(Duration.ofHours(72)))
                .build());

        assertTrue(adapter.getRecentSessions(5).isEmpty());
        assertEquals(1, adapter.pruneRecentSessions());
        assertEquals(0, jdbc.queryForObject("SELECT COUNT(*) FROM recent_sessions", Integer.class));
    }

    @Test
    void shouldDeriveFilesAndIssuesFromActivity() {
        adapter.logActivity(new ActivityEntry("s1", ActivityEntry.FILE_EDIT, "b.java", null, null));
        adapter.logActivity(new ActivityEntry("s1", ActivityEntry.FILE_WRITE, "a.java", null, null));
        adapter.logActivity(new ActivityEntry("s1", ActivityEntry.FILE_EDIT, "a.java", "second edit", null));
        adapter.logActivity(new ActivityEntry("s1", ActivityEntry.ISSUE, "GH-12", null, null));
        adapter.logActivity(new ActivityEntry("s2", ActivityEntry.FILE_EDIT, "other.java", null, null));

        assertEquals(List.of("a.java", "b.java"), adapter.getFilesModified("s1"));
        assertEquals(List.of("GH-12"), adapter.getIssuesWorked("s1"));
    }
}
