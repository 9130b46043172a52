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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.GatewayException;
import me.golemcore.gateway.domain.model.Session;
import me.golemcore.gateway.domain.model.SessionStatus;
import me.golemcore.gateway.domain.model.TokenUsage;
import me.golemcore.gateway.domain.model.Turn;
import me.golemcore.gateway.domain.system.KeyedLocks;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.SessionPort;
import me.golemcore.gateway.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Service for managing gateway sessions: turn history, undo/redo and
 * lifecycle. Sessions are cached in memory and persisted as JSON snapshots
 * ({@code sessions/<id>.json}) after every mutation. Appended turns and
 * lifecycle events are also written to an append-only JSONL transcript
 * ({@code transcripts/<id>.jsonl}) that is never rewritten.
 *
 * <p>
 * Published sessions are never modified: each mutation works on a copy that
 * replaces the cached snapshot only after it was persisted, so a failed write
 * leaves memory and disk in agreement and readers never see a half-applied
 * change. Mutations of one session are serialized through {@link #getLocks()}. The
 * exchange pipeline holds the lock for a whole exchange; the operations here
 * that take the lock themselves are the ones called from outside an exchange
 * (undo, redo, end, delete).
 */
@Service
@Slf4j
public class SessionService implements SessionPort {

    static final String SESSIONS_DIR = "sessions";
    static final String TRANSCRIPTS_DIR = "transcripts";
    private static final String JSON_EXTENSION = ".json";
    private static final String JSONL_EXTENSION = ".jsonl";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final GatewayProperties properties;
    private final KeyedLocks locks = new KeyedLocks("session");
    private final Map<String, Session> sessionCache = new ConcurrentHashMap<>();

    public SessionService(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            GatewayProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.properties = properties;
    }

    public KeyedLocks getLocks() {
        return locks;
    }

    @Override
    public Session getOrCreate(String sessionId) {
        String id = sessionId != null && !sessionId.isBlank() ? sessionId : UUID.randomUUID().toString();
        return sessionCache.computeIfAbsent(id, key -> load(key).orElseGet(() -> create(key)));
    }

    private Session create(String id) {
        Session session = Session.builder()
                .id(id)
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .build();
        persist(session);
        recordEvent(id, "session_created", null);
        log.info("[Session] Created {}", id);
        return session;
    }

    @Override
    public Optional<Session> get(String sessionId) {
        Session cached = sessionCache.get(sessionId);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<Session> loaded = load(sessionId);
        loaded.ifPresent(session -> sessionCache.putIfAbsent(sessionId, session));
        return loaded.map(session -> sessionCache.get(sessionId));
    }

    @Override
    public Optional<Session> resume(String sessionId) {
        sessionCache.remove(sessionId);
        return get(sessionId);
    }

    @Override
    public Session appendTurns(String sessionId, List<Turn> turns, TokenUsage usage) {
        Session working = require(sessionId).copy();
        if (working.isEnded()) {
            throw new IllegalStateException("Session " + sessionId + " has ended");
        }
        for (Turn turn : turns) {
            working.appendTurn(turn);
        }
        working.getUsage().add(usage);
        save(working);
        for (Turn turn : turns) {
            recordEvent(sessionId, "turn", turn);
        }
        log.debug("[Session] {}: appended {} turn(s), budget {}", sessionId, turns.size(),
                working.getBudgetUsed());
        return working;
    }

    @Override
    public void save(Session session) {
        session.setUpdatedAt(clock.instant());
        persist(session);
        sessionCache.put(session.getId(), session);
    }

    /**
     * Makes {@code snapshot} the current session without persisting it. Used
     * for transient states such as {@link SessionStatus#COMPACTING} and to roll
     * them back.
     */
    void publish(Session snapshot) {
        sessionCache.put(snapshot.getId(), snapshot);
    }

    @Override
    public Optional<Turn> undo(String sessionId) {
        return locks.withLock(sessionId, () -> {
            Session session = require(sessionId).copy();
            Optional<Turn> undone = session.undoLast(properties.getSession().getHistoryDepth());
            if (undone.isPresent()) {
                save(session);
                recordEvent(sessionId, "undo", Map.of("turnId", undone.get().getId()));
                log.debug("[Session] {}: undid turn {}", sessionId, undone.get().getId());
            }
            return undone;
        });
    }

    @Override
    public Optional<Turn> redo(String sessionId) {
        return locks.withLock(sessionId, () -> {
            Session session = require(sessionId).copy();
            if (session.isEnded()) {
                throw new IllegalStateException("Session " + sessionId + " has ended");
            }
            Optional<Turn> restored = session.redoLast();
            if (restored.isPresent()) {
                save(session);
                recordEvent(sessionId, "redo", Map.of("turnId", restored.get().getId()));
                log.debug("[Session] {}: redid turn {}", sessionId, restored.get().getId());
            }
            return restored;
        });
    }

    @Override
    public Session end(String sessionId) {
        return locks.withLock(sessionId, () -> {
            Session session = require(sessionId);
            if (session.isEnded()) {
                return session;
            }
            Session ended = session.copy();
            ended.setStatus(SessionStatus.ENDED);
            save(ended);
            recordEvent(sessionId, "session_ended", null);
            log.info("[Session] Ended {}", sessionId);
            return ended;
        });
    }

    @Override
    public Session updateHandoffNotes(String sessionId, String notes) {
        return locks.withLock(sessionId, () -> {
            Session updated = require(sessionId).copy();
            updated.setHandoffNotes(notes == null || notes.isBlank() ? null : notes.strip());
            save(updated);
            recordEvent(sessionId, "handoff_notes", updated.getHandoffNotes());
            return updated;
        });
    }

    @Override
    public void delete(String sessionId) {
        locks.withLock(sessionId, () -> {
            sessionCache.remove(sessionId);
            storagePort.deleteObject(SESSIONS_DIR, sessionId + JSON_EXTENSION).join();
            log.info("[Session] Deleted {}", sessionId);
        });
    }

    @Override
    public List<Session> listAll() {
        List<String> files = storagePort.listObjects(SESSIONS_DIR, "").join();
        for (String file : files) {
            if (file.endsWith(JSON_EXTENSION)) {
                String id = file.substring(0, file.length() - JSON_EXTENSION.length());
                if (!sessionCache.containsKey(id)) {
                    load(id).ifPresent(session -> sessionCache.putIfAbsent(id, session));
                }
            }
        }
        List<Session> sessions = new ArrayList<>(sessionCache.values());
        sessions.sort(Comparator.comparing(Session::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())));
        return sessions;
    }

    /**
     * Appends one event line to the session transcript. Transcript failures are
     * logged and do not fail the mutation that produced the event.
     */
    public void recordEvent(String sessionId, String type, Object payload) {
        if (!properties.getSession().isTranscriptEnabled()) {
            return;
        }
        ObjectNode line = objectMapper.createObjectNode();
        line.put("type", type);
        line.put("sessionId", sessionId);
        line.put("timestamp", clock.instant().toString());
        if (payload != null) {
            line.set("data", objectMapper.valueToTree(payload));
        }
        try {
            storagePort.appendText(TRANSCRIPTS_DIR, sessionId + JSONL_EXTENSION,
                    objectMapper.writeValueAsString(line) + "\n").join();
        } catch (JsonProcessingException | CompletionException e) {
            log.warn("[Session] Failed to write transcript for {}: {}", sessionId, e.getMessage());
        }
    }

    private Session require(String sessionId) {
        return get(sessionId).orElseThrow(() -> new IllegalArgumentException("Session not found: " + sessionId));
    }

    private Optional<Session> load(String sessionId) {
        String json;
        try {
            json = storagePort.getText(SESSIONS_DIR, sessionId + JSON_EXTENSION).join();
        } catch (CompletionException e) {
            throw new GatewayException("Failed to read session " + sessionId, e.getCause());
        }
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            Session session = objectMapper.readValue(json, Session.class);
            log.debug("[Session] Loaded {} ({} turns)", sessionId, session.getTurns().size());
            return Optional.of(session);
        } catch (JsonProcessingException e) {
            throw new GatewayException("Corrupt session file for " + sessionId, e);
        }
    }

    private void persist(Session session) {
        try {
            String json = objectMapper.writeValueAsString(session);
            storagePort.putTextAtomic(SESSIONS_DIR, session.getId() + JSON_EXTENSION, json, false).join();
        } catch (JsonProcessingException e) {
            throw new GatewayException("Failed to serialize session " + session.getId(), e);
        } catch (CompletionException e) {
            log.error("[Session] Failed to persist {}", session.getId(), e.getCause());
            throw new GatewayException("Failed to persist session " + session.getId(), e.getCause());
        }
    }
}
