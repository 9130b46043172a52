package me.golemcore.gateway.domain.model;

import java.util.Objects;

public record TextSegment(String text) implements ContentSegment {

    public TextSegment {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public int textLength() {
        return text.length();
    }
}
