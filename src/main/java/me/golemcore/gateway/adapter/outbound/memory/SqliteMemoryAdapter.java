package me.golemcore.gateway.adapter.outbound.memory;

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

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.ActivityEntry;
import me.golemcore.gateway.domain.model.CoreMemoryBlock;
import me.golemcore.gateway.domain.model.MemoryCapacityException;
import me.golemcore.gateway.domain.model.MemoryRecord;
import me.golemcore.gateway.domain.model.MemoryStats;
import me.golemcore.gateway.domain.model.RecentSession;
import me.golemcore.gateway.domain.system.KeyedLocks;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.MemoryPort;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * SQLite implementation of {@link MemoryPort}.
 *
 * <p>
 * Archival records are versioned rows; an update inserts a successor row and
 * links the pair through {@code supersedes}/{@code superseded_by}. Nothing is
 * deleted, so full history stays queryable. Full-text search uses an FTS5
 * index kept in sync by triggers and ranks with {@code bm25}.
 *
 * <p>
 * Writes are serialized per logical key: the record chain for archival
 * updates, the block name for core memory.
 */
@Component
@Slf4j
public class SqliteMemoryAdapter implements MemoryPort {

    static final int SCHEMA_VERSION = 2;
    static final Map<String, String> DEFAULT_CORE_BLOCKS = defaultCoreBlocks();

    private static final Pattern QUERY_TOKEN = Pattern.compile("[\\p{L}\\p{N}_]+");
    private static final String LIST_SEPARATOR = "\n";
    private static final String ARCHIVAL_COLUMNS = "id, content, tags, version, supersedes, superseded_by, created_at";
    private static final String NEW_RECORD_KEY = "archival:new";

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactions;
    private final GatewayProperties.MemoryProperties settings;
    private final Clock clock;
    private final KeyedLocks writeLocks = new KeyedLocks("memory");

    public SqliteMemoryAdapter(JdbcTemplate jdbc, TransactionTemplate transactions, GatewayProperties properties,
            Clock clock) {
        this.jdbc = jdbc;
        this.transactions = transactions;
        this.settings = properties.getMemory();
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        jdbc.execute("CREATE TABLE IF NOT EXISTS schema_version (version INTEGER PRIMARY KEY)");
        Integer current = jdbc.queryForObject("SELECT COALESCE(MAX(version), 0) FROM schema_version", Integer.class);
        int from = current != null ? current : 0;
        if (from < 1) {
            migrateArchivalAndCore();
        }
        if (from < 2) {
            migrateRecentContext();
        }
        if (from < SCHEMA_VERSION) {
            jdbc.update("INSERT OR REPLACE INTO schema_version (version) VALUES (?)", SCHEMA_VERSION);
            log.info("[Memory] Schema migrated from v{} to v{}", from, SCHEMA_VERSION);
        }
        seedCoreBlocks();
        int pruned = pruneRecentSessions();
        if (pruned > 0) {
            log.debug("[Memory] Pruned {} expired recent session(s)", pruned);
        }
    }

    private void migrateArchivalAndCore() {
        jdbc.execute("""
                CREATE TABLE IF NOT EXISTS archival_memory (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    content TEXT NOT NULL,
                    tags TEXT NOT NULL DEFAULT '',
                    version INTEGER NOT NULL DEFAULT 1,
                    supersedes INTEGER REFERENCES archival_memory(id),
                    superseded_by INTEGER REFERENCES archival_memory(id),
                    created_at INTEGER NOT NULL
                )""");
        jdbc.execute("""
                CREATE VIRTUAL TABLE IF NOT EXISTS archival_memory_fts USING fts5(
                    content, tags, content=archival_memory, content_rowid=id
                )""");
        jdbc.execute("""
                CREATE TRIGGER IF NOT EXISTS archival_memory_ai AFTER INSERT ON archival_memory BEGIN
                    INSERT INTO archival_memory_fts(rowid, content, tags) VALUES (new.id, new.content, new.tags);
                END""");
        jdbc.execute("""
                CREATE TRIGGER IF NOT EXISTS archival_memory_au AFTER UPDATE ON archival_memory BEGIN
                    INSERT INTO archival_memory_fts(archival_memory_fts, rowid, content, tags)
                        VALUES ('delete', old.id, old.content, old.tags);
                    INSERT INTO archival_memory_fts(rowid, content, tags) VALUES (new.id, new.content, new.tags);
                END""");
        jdbc.execute("""
                CREATE TABLE IF NOT EXISTS core_memory (
                    name TEXT PRIMARY KEY,
                    content TEXT NOT NULL,
                    updated_at INTEGER NOT NULL
                )""");
    }

    private void migrateRecentContext() {
        jdbc.execute("""
                CREATE TABLE IF NOT EXISTS recent_sessions (
                    session_id TEXT PRIMARY KEY,
                    summary TEXT NOT NULL,
                    files_modified TEXT NOT NULL DEFAULT '',
                    issues_worked TEXT NOT NULL DEFAULT '',
                    started_at INTEGER,
                    ended_at INTEGER NOT NULL
                )""");
        jdbc.execute("CREATE INDEX IF NOT EXISTS idx_recent_sessions_ended ON recent_sessions(ended_at)");
        jdbc.execute("""
                CREATE TABLE IF NOT EXISTS recent_activity (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    session_id TEXT NOT NULL,
                    activity_type TEXT NOT NULL,
                    target TEXT NOT NULL,
                    details TEXT,
                    created_at INTEGER NOT NULL
                )""");
        jdbc.execute("CREATE INDEX IF NOT EXISTS idx_recent_activity_session ON recent_activity(session_id)");
        jdbc.execute("CREATE INDEX IF NOT EXISTS idx_recent_activity_created ON recent_activity(created_at)");
    }

    private void seedCoreBlocks() {
        long now = clock.millis();
        DEFAULT_CORE_BLOCKS.forEach((name, content) -> jdbc.update(
                "INSERT OR IGNORE INTO core_memory (name, content, updated_at) VALUES (?, ?, ?)",
                name, content, now));
    }

    // ==================== Archival ====================

    @Override
    public MemoryRecord save(String text, List<String> tags) {
        requireText(text);
        return writeLocks.withLock(NEW_RECORD_KEY, () -> {
            long id = insertRecord(text, tags, 1, null);
            log.debug("[Memory] Saved archival record {}", id);
            return get(id).orElseThrow();
        });
    }

    @Override
    public MemoryRecord update(long id, String text, List<String> tags) {
        requireText(text);
        return writeLocks.withLock(chainKey(id), () -> transactions.execute(status -> {
            MemoryRecord previous = get(id)
                    .orElseThrow(() -> new IllegalArgumentException("Memory record " + id + " not found"));
            if (!previous.isCurrent()) {
                throw new IllegalStateException("Memory record " + id + " was superseded by "
                        + previous.getSupersededBy());
            }
            List<String> newTags = tags != null ? tags : previous.getTags();
            long newId = insertRecord(text, newTags, previous.getVersion() + 1, id);
            jdbc.update("UPDATE archival_memory SET superseded_by = ? WHERE id = ?", newId, id);
            log.debug("[Memory] Record {} superseded by {} (v{})", id, newId, previous.getVersion() + 1);
            return get(newId).orElseThrow();
        }));
    }

    @Override
    public Optional<MemoryRecord> get(long id) {
        List<MemoryRecord> rows = jdbc.query("SELECT " + ARCHIVAL_COLUMNS + " FROM archival_memory WHERE id = ?",
                recordMapper(false), id);
        return rows.stream().findFirst();
    }

    @Override
    public List<MemoryRecord> search(String query, int limit) {
        return runSearch(query, limit, false);
    }

    @Override
    public List<MemoryRecord> searchIncludingHistory(String query, int limit) {
        return runSearch(query, limit, true);
    }

    private List<MemoryRecord> runSearch(String query, int limit, boolean includeHistory) {
        String match = toMatchExpression(query);
        if (match == null) {
            return List.of();
        }
        int cap = effectiveLimit(limit);
        String sql = "SELECT am.id, am.content, am.tags, am.version, am.supersedes, am.superseded_by, am.created_at,"
                + " bm25(archival_memory_fts) AS rank"
                + " FROM archival_memory_fts JOIN archival_memory am ON archival_memory_fts.rowid = am.id"
                + " WHERE archival_memory_fts MATCH ?"
                + (includeHistory ? "" : " AND am.superseded_by IS NULL")
                + " ORDER BY rank LIMIT ?";
        // over-fetch so duplicates removed below do not shrink the page
        List<MemoryRecord> rows = jdbc.query(sql, recordMapper(true), match, cap * 2);
        Map<String, MemoryRecord> unique = new LinkedHashMap<>();
        for (MemoryRecord row : rows) {
            unique.putIfAbsent(row.getText(), row);
            if (unique.size() == cap) {
                break;
            }
        }
        return new ArrayList<>(unique.values());
    }

    @Override
    public List<MemoryRecord> history(long id) {
        Optional<MemoryRecord> start = get(id);
        if (start.isEmpty()) {
            return List.of();
        }
        MemoryRecord first = start.get();
        while (first.getSupersedes() != null) {
            Optional<MemoryRecord> previous = get(first.getSupersedes());
            if (previous.isEmpty()) {
                break;
            }
            first = previous.get();
        }
        List<MemoryRecord> chain = new ArrayList<>();
        MemoryRecord cursor = first;
        chain.add(cursor);
        while (cursor.getSupersededBy() != null) {
            Optional<MemoryRecord> next = get(cursor.getSupersededBy());
            if (next.isEmpty()) {
                break;
            }
            cursor = next.get();
            chain.add(cursor);
        }
        return chain;
    }

    @Override
    public List<MemoryRecord> listCurrent(int limit) {
        return jdbc.query("SELECT " + ARCHIVAL_COLUMNS + " FROM archival_memory WHERE superseded_by IS NULL"
                + " ORDER BY created_at DESC, id DESC LIMIT ?", recordMapper(false), effectiveLimit(limit));
    }

    @Override
    public MemoryStats stats() {
        return jdbc.queryForObject("""
                SELECT COUNT(*) AS total,
                       COALESCE(SUM(CASE WHEN superseded_by IS NULL THEN 1 ELSE 0 END), 0) AS current_count,
                       COALESCE(SUM(LENGTH(content)), 0) AS total_size,
                       MAX(created_at) AS last_updated
                FROM archival_memory""",
                (rs, rowNum) -> new MemoryStats(
                        rs.getLong("total"),
                        rs.getLong("current_count"),
                        rs.getLong("total_size"),
                        instantOrNull(rs, "last_updated")));
    }

    private long insertRecord(String text, List<String> tags, int version, Long supersedes) {
        KeyHolder keys = new GeneratedKeyHolder();
        long now = clock.millis();
        String tagText = tags == null ? "" : String.join(",", tags);
        jdbc.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                    "INSERT INTO archival_memory (content, tags, version, supersedes, created_at)"
                            + " VALUES (?, ?, ?, ?, ?)",
                    Statement.RETURN_GENERATED_KEYS);
            ps.setString(1, text);
            ps.setString(2, tagText);
            ps.setInt(3, version);
            if (supersedes != null) {
                ps.setLong(4, supersedes);
            } else {
                ps.setNull(4, Types.INTEGER);
            }
            ps.setLong(5, now);
            return ps;
        }, keys);
        Number key = keys.getKey();
        if (key == null) {
            throw new IllegalStateException("No id generated for archival record");
        }
        return key.longValue();
    }

    private String chainKey(long id) {
        return "archival:" + id;
    }

    private int effectiveLimit(int limit) {
        int requested = limit > 0 ? limit : settings.getSearchLimit();
        return Math.min(requested, settings.getMaxSearchLimit());
    }

    /**
     * Turns free text into an FTS5 expression: every word token quoted and OR-ed,
     * so user punctuation can never be read as query syntax.
     */
    static String toMatchExpression(String query) {
        if (query == null) {
            return null;
        }
        Set<String> tokens = new LinkedHashSet<>();
        Matcher matcher = QUERY_TOKEN.matcher(query);
        while (matcher.find()) {
            tokens.add(matcher.group().toLowerCase(Locale.ROOT));
        }
        if (tokens.isEmpty()) {
            return null;
        }
        return tokens.stream().map(t -> "\"" + t + "\"").collect(Collectors.joining(" OR "));
    }

    // ==================== Core ====================

    @Override
    public List<CoreMemoryBlock> getCoreBlocks() {
        return jdbc.query("SELECT name, content, updated_at FROM core_memory ORDER BY name", coreMapper());
    }

    @Override
    public Optional<CoreMemoryBlock> getCoreBlock(String name) {
        return jdbc.query("SELECT name, content, updated_at FROM core_memory WHERE name = ?", coreMapper(), name)
                .stream().findFirst();
    }

    @Override
    public CoreMemoryBlock replaceCoreBlock(String name, String content) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Core memory block name is required");
        }
        String value = content == null ? "" : content;
        if (value.length() > settings.getMaxBlockChars()) {
            throw new MemoryCapacityException(name, value.length(), settings.getMaxBlockChars());
        }
        return writeLocks.withLock("core:" + name, () -> {
            long now = clock.millis();
            jdbc.update("INSERT OR REPLACE INTO core_memory (name, content, updated_at) VALUES (?, ?, ?)",
                    name, value, now);
            log.debug("[Memory] Core block '{}' replaced ({} chars)", name, value.length());
            return new CoreMemoryBlock(name, value, Instant.ofEpochMilli(now));
        });
    }

    // ==================== Sessions and activity ====================

    @Override
    public void saveRecentSession(RecentSession session) {
        Instant endedAt = session.getEndedAt() != null ? session.getEndedAt() : clock.instant();
        jdbc.update("""
                INSERT OR REPLACE INTO recent_sessions
                    (session_id, summary, files_modified, issues_worked, started_at, ended_at)
                VALUES (?, ?, ?, ?, ?, ?)""",
                session.getSessionId(),
                session.getSummary() != null ? session.getSummary() : "",
                String.join(LIST_SEPARATOR, session.getFilesModified()),
                String.join(LIST_SEPARATOR, session.getIssuesWorked()),
                session.getStartedAt() != null ? session.getStartedAt().toEpochMilli() : null,
                endedAt.toEpochMilli());
    }

    @Override
    public List<RecentSession> getRecentSessions(int limit) {
        return jdbc.query("""
                SELECT session_id, summary, files_modified, issues_worked, started_at, ended_at
                FROM recent_sessions WHERE ended_at > ? ORDER BY ended_at DESC LIMIT ?""",
                (rs, rowNum) -> RecentSession.builder()
                        .sessionId(rs.getString("session_id"))
                        .summary(rs.getString("summary"))
                        .filesModified(splitLines(rs.getString("files_modified")))
                        .issuesWorked(splitLines(rs.getString("issues_worked")))
                        .startedAt(instantOrNull(rs, "started_at"))
                        .endedAt(instantOrNull(rs, "ended_at"))
                        .build(),
                retentionCutoff(), limit);
    }

    @Override
    public int pruneRecentSessions() {
        long cutoff = retentionCutoff();
        int sessions = jdbc.update("DELETE FROM recent_sessions WHERE ended_at < ?", cutoff);
        int activities = jdbc.update("DELETE FROM recent_activity WHERE created_at < ?", cutoff);
        return sessions + activities;
    }

    @Override
    public void logActivity(ActivityEntry entry) {
        Instant createdAt = entry.createdAt() != null ? entry.createdAt() : clock.instant();
        jdbc.update("INSERT INTO recent_activity (session_id, activity_type, target, details, created_at)"
                + " VALUES (?, ?, ?, ?, ?)",
                entry.sessionId(), entry.activityType(), entry.target(), entry.details(), createdAt.toEpochMilli());
    }

    @Override
    public List<String> getFilesModified(String sessionId) {
        return jdbc.queryForList("SELECT DISTINCT target FROM recent_activity WHERE session_id = ?"
                + " AND activity_type IN (?, ?) ORDER BY target", String.class,
                sessionId, ActivityEntry.FILE_WRITE, ActivityEntry.FILE_EDIT);
    }

    @Override
    public List<String> getIssuesWorked(String sessionId) {
        return jdbc.queryForList("SELECT DISTINCT target FROM recent_activity WHERE session_id = ?"
                + " AND activity_type = ? ORDER BY target", String.class, sessionId, ActivityEntry.ISSUE);
    }

    private long retentionCutoff() {
        return clock.instant().minus(Duration.ofHours(settings.getRecentSessionRetentionHours())).toEpochMilli();
    }

    // ==================== Mapping ====================

    private static RowMapper<MemoryRecord> recordMapper(boolean withScore) {
        return (rs, rowNum) -> MemoryRecord.builder()
                .id(rs.getLong("id"))
                .text(rs.getString("content"))
                .tags(splitTags(rs.getString("tags")))
                .version(rs.getInt("version"))
                .supersedes(longOrNull(rs, "supersedes"))
                .supersededBy(longOrNull(rs, "superseded_by"))
                .createdAt(instantOrNull(rs, "created_at"))
                .score(withScore ? rs.getDouble("rank") : null)
                .build();
    }

    private static RowMapper<CoreMemoryBlock> coreMapper() {
        return (rs, rowNum) -> new CoreMemoryBlock(rs.getString("name"), rs.getString("content"),
                instantOrNull(rs, "updated_at"));
    }

    private static List<String> splitTags(String tags) {
        if (tags == null || tags.isBlank()) {
            return new ArrayList<>();
        }
        return Arrays.stream(tags.split(",")).map(String::trim).filter(t -> !t.isEmpty())
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private static List<String> splitLines(String text) {
        if (text == null || text.isBlank()) {
            return new ArrayList<>();
        }
        return text.lines().filter(l -> !l.isBlank()).collect(Collectors.toCollection(ArrayList::new));
    }

    private static Long longOrNull(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Instant instantOrNull(ResultSet rs, String column) throws SQLException {
        Long millis = longOrNull(rs, column);
        return millis != null ? Instant.ofEpochMilli(millis) : null;
    }

    private static void requireText(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Memory text must not be empty");
        }
    }

    private static Map<String, String> defaultCoreBlocks() {
        Map<String, String> blocks = new LinkedHashMap<>();
        blocks.put("persona", "I am an AI assistant helping with this project. "
                + "I will learn about the codebase and remember important details across sessions.");
        blocks.put("project", "No project information recorded yet.");
        blocks.put("preferences", "No user preferences recorded yet.");
        return Collections.unmodifiableMap(blocks);
    }
}
