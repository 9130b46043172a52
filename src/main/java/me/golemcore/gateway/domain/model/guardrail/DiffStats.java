package me.golemcore.gateway.domain.model.guardrail;

import java.util.List;

/**
 * Accumulated size of the file changes a session's tool calls asked for.
 */
public record DiffStats(int linesAdded, int linesRemoved, List<String> files) {

    public DiffStats {
        files = files == null ? List.of() : List.copyOf(files);
    }

    public static DiffStats empty() {
        return new DiffStats(0, 0, List.of());
    }

    public int linesChanged() {
        return linesAdded + linesRemoved;
    }

    public int filesChanged() {
        return files.size();
    }
}
