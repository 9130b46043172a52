package me.golemcore.gateway.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Short summary of a finished session, kept for cross-session continuity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecentSession {

    private String sessionId;
    private String summary;

    @Builder.Default
    private List<String> filesModified = new ArrayList<>();

    @Builder.Default
    private List<String> issuesWorked = new ArrayList<>();

    private Instant startedAt;
    private Instant endedAt;
}
