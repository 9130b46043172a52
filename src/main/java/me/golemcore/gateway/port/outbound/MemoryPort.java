package me.golemcore.gateway.port.outbound;

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

import me.golemcore.gateway.domain.model.ActivityEntry;
import me.golemcore.gateway.domain.model.CoreMemoryBlock;
import me.golemcore.gateway.domain.model.MemoryRecord;
import me.golemcore.gateway.domain.model.MemoryStats;
import me.golemcore.gateway.domain.model.RecentSession;

import java.util.List;
import java.util.Optional;

/**
 * Port for the persistent memory store: versioned archival records, named core
 * memory blocks, recent-session summaries and the activity log.
 */
public interface MemoryPort {

    // ==================== Archival ====================

    MemoryRecord save(String text, List<String> tags);

    /**
     * Stores a new version of record {@code id} and marks the old version
     * superseded.
     *
     * @throws IllegalArgumentException
     *             if the record does not exist
     * @throws IllegalStateException
     *             if the record was already superseded
     */
    MemoryRecord update(long id, String text, List<String> tags);

    Optional<MemoryRecord> get(long id);

    /**
     * Ranked full-text search over current records, deduplicated and capped at
     * {@code limit}.
     */
    List<MemoryRecord> search(String query, int limit);

    /**
     * Same as {@link #search(String, int)} but superseded versions are included.
     */
    List<MemoryRecord> searchIncludingHistory(String query, int limit);

    /**
     * All versions of the record chain containing {@code id}, oldest first.
     */
    List<MemoryRecord> history(long id);

    List<MemoryRecord> listCurrent(int limit);

    MemoryStats stats();

    // ==================== Core ====================

    List<CoreMemoryBlock> getCoreBlocks();

    Optional<CoreMemoryBlock> getCoreBlock(String name);

    /**
     * Replaces the whole block.
     *
     * @throws me.golemcore.gateway.domain.model.MemoryCapacityException
     *             if {@code content} exceeds the block size limit
     */
    CoreMemoryBlock replaceCoreBlock(String name, String content);

    // ==================== Sessions and activity ====================

    void saveRecentSession(RecentSession session);

    List<RecentSession> getRecentSessions(int limit);

    int pruneRecentSessions();

    void logActivity(ActivityEntry entry);

    List<String> getFilesModified(String sessionId);

    List<String> getIssuesWorked(String sessionId);
}
