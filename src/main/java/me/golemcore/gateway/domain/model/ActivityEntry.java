package me.golemcore.gateway.domain.model;

import java.time.Instant;

/**
 * Single entry in the activity log, e.g. a file edit performed by a tool.
 *
 * @param activityType
 *            one of {@code file_write}, {@code file_edit}, {@code issue} or a
 *            free-form type
 */
public record ActivityEntry(String sessionId, String activityType, String target, String details,
        Instant createdAt) {

    public static final String FILE_WRITE = "file_write";
    public static final String FILE_EDIT = "file_edit";
    public static final String ISSUE = "issue";
}
