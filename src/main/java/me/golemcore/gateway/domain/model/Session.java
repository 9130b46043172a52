package me.golemcore.gateway.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Conversation session: ordered turn history, budget counter and lifecycle
 * status.
 *
 * <p>
 * The turn list always has the shape {@code [summary?] verbatim*}: at most
 * one compaction summary, and only in first position. Mutators reject any
 * change that would break this shape. The redo stack holds turns popped by
 * undo, most recent last.
 *
 * <p>
 * A session published by the session service is never mutated again:
 * mutations run on {@link #copy()} and the copy replaces the published
 * instance once it is persisted, so readers need no lock.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Session {

    private String id;

    @Builder.Default
    private List<Turn> turns = new ArrayList<>();

    @Builder.Default
    private List<Turn> redoStack = new ArrayList<>();

    private int budgetUsed;

    @Builder.Default
    private SessionStatus status = SessionStatus.ACTIVE;

    private Instant createdAt;
    private Instant updatedAt;

    @Builder.Default
    private TokenUsage usage = new TokenUsage();

    private int compactionCount;

    private String handoffNotes;

    /**
     * Appends a verbatim turn and adds its size to the budget. Clears the redo
     * stack.
     */
    public void appendTurn(Turn turn) {
        if (turn.isSummary()) {
            throw new IllegalArgumentException("Summary turns can only be installed by compaction");
        }
        turns.add(turn);
        budgetUsed += turn.getEstimatedSize();
        redoStack.clear();
    }

    /**
     * Replaces the first {@code replacedCount} turns with {@code summary}.
     */
    public void installSummary(Turn summary, int replacedCount) {
        if (!summary.isSummary()) {
            throw new IllegalArgumentException("Expected a compaction summary turn");
        }
        if (replacedCount < 0 || replacedCount > turns.size()) {
            throw new IllegalArgumentException("Invalid replaced turn count: " + replacedCount);
        }
        List<Turn> kept = new ArrayList<>(turns.subList(replacedCount, turns.size()));
        if (kept.stream().anyMatch(Turn::isSummary)) {
            throw new IllegalStateException("Existing summary must be part of the compacted prefix");
        }
        turns.clear();
        turns.add(summary);
        turns.addAll(kept);
        redoStack.clear();
        budgetUsed = kept.stream().mapToInt(Turn::getEstimatedSize).sum() + summary.getEstimatedSize();
        compactionCount++;
    }

    /**
     * Moves the newest verbatim turn onto the redo stack. The summary turn is
     * never undone. The redo stack keeps at most {@code maxDepth} turns.
     *
     * @return the undone turn, empty when there is nothing to undo
     */
    public Optional<Turn> undoLast(int maxDepth) {
        if (turns.isEmpty() || turns.get(turns.size() - 1).isSummary()) {
            return Optional.empty();
        }
        Turn last = turns.remove(turns.size() - 1);
        budgetUsed = Math.max(0, budgetUsed - last.getEstimatedSize());
        redoStack.add(last);
        while (maxDepth > 0 && redoStack.size() > maxDepth) {
            redoStack.remove(0);
        }
        return Optional.of(last);
    }

    /**
     * Re-appends the most recently undone turn.
     *
     * @return the restored turn, empty when the redo stack is empty
     */
    public Optional<Turn> redoLast() {
        if (redoStack.isEmpty()) {
            return Optional.empty();
        }
        Turn turn = redoStack.remove(redoStack.size() - 1);
        turns.add(turn);
        budgetUsed += turn.getEstimatedSize();
        return Optional.of(turn);
    }

    /**
     * Copy with its own turn list, redo stack and usage counter. Turns and
     * messages are immutable and shared.
     */
    public Session copy() {
        TokenUsage usageCopy = new TokenUsage();
        usageCopy.add(usage);
        return toBuilder()
                .turns(new ArrayList<>(turns))
                .redoStack(new ArrayList<>(redoStack))
                .usage(usageCopy)
                .build();
    }

    @JsonIgnore
    public boolean isEnded() {
        return status == SessionStatus.ENDED;
    }

    @JsonIgnore
    public boolean hasSummary() {
        return !turns.isEmpty() && turns.get(0).isSummary();
    }

    /**
     * All messages of the active history, oldest first.
     */
    @JsonIgnore
    public List<Message> getHistoryMessages() {
        List<Message> messages = new ArrayList<>();
        for (Turn turn : turns) {
            messages.addAll(turn.getMessages());
        }
        return messages;
    }

    /**
     * Number of verbatim turns in the active history.
     */
    @JsonIgnore
    public int getVerbatimTurnCount() {
        return hasSummary() ? turns.size() - 1 : turns.size();
    }

    public void recalculateBudget() {
        budgetUsed = turns.stream().mapToInt(Turn::getEstimatedSize).sum();
    }
}
