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

import me.golemcore.gateway.domain.model.Session;
import me.golemcore.gateway.domain.model.TokenUsage;
import me.golemcore.gateway.domain.model.Turn;

import java.util.List;
import java.util.Optional;

/**
 * Port for session lifecycle and turn history. Every mutation is persisted
 * before it returns. Returned sessions are published snapshots and must not be
 * modified by callers.
 */
public interface SessionPort {

    /**
     * Returns the session, loading it from storage or creating it when absent.
     * A {@code null} id creates a session with a generated id.
     */
    Session getOrCreate(String sessionId);

    Optional<Session> get(String sessionId);

    /**
     * Reloads the session from storage, discarding any cached copy.
     */
    Optional<Session> resume(String sessionId);

    /**
     * Appends turns in order to the current snapshot, adds {@code usage} to the
     * session counter and persists once. The caller holds the session lock.
     *
     * @return the new snapshot
     */
    Session appendTurns(String sessionId, List<Turn> turns, TokenUsage usage);

    default Session appendTurns(String sessionId, List<Turn> turns) {
        return appendTurns(sessionId, turns, null);
    }

    /**
     * Persists {@code session} and publishes it as the current snapshot. When
     * persisting fails the previous snapshot stays current.
     */
    void save(Session session);

    Optional<Turn> undo(String sessionId);

    Optional<Turn> redo(String sessionId);

    Session end(String sessionId);

    /**
     * Replaces the notes carried into the session's handoff. Blank notes clear
     * them.
     *
     * @return the new snapshot
     * @throws IllegalArgumentException
     *             if the session does not exist
     */
    Session updateHandoffNotes(String sessionId, String notes);

    void delete(String sessionId);

    List<Session> listAll();
}
