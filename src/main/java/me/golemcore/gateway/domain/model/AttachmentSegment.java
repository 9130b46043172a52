package me.golemcore.gateway.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * Reference to external data attached to a message. {@code inlineText} holds
 * the resolved content once an attachment resolver has read it.
 */
public record AttachmentSegment(String uri, String mediaType, String name, String inlineText)
        implements ContentSegment {

    public AttachmentSegment {
        Objects.requireNonNull(uri, "uri");
    }

    @JsonIgnore
    public boolean isResolved() {
        return inlineText != null;
    }

    @Override
    public int textLength() {
        return inlineText != null ? inlineText.length() : uri.length();
    }
}
