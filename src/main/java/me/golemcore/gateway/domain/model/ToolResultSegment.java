package me.golemcore.gateway.domain.model;

import java.util.Objects;

public record ToolResultSegment(String toolCallId, String toolName, String content, boolean error)
        implements ContentSegment {

    public ToolResultSegment {
        Objects.requireNonNull(toolCallId, "toolCallId");
        content = content == null ? "" : content;
    }

    @Override
    public int textLength() {
        return content.length();
    }
}
