package me.golemcore.gateway.domain.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One typed piece of a message body. The set of segment kinds is closed: text,
 * tool call request, tool call result, reasoning block and attachment
 * reference.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TextSegment.class, name = "text"),
        @JsonSubTypes.Type(value = ToolCallSegment.class, name = "tool_call"),
        @JsonSubTypes.Type(value = ToolResultSegment.class, name = "tool_result"),
        @JsonSubTypes.Type(value = ReasoningSegment.class, name = "reasoning"),
        @JsonSubTypes.Type(value = AttachmentSegment.class, name = "attachment")
})
public interface ContentSegment {

    /**
     * Approximate number of characters this segment contributes to a prompt.
     */
    int textLength();
}
