package me.golemcore.gateway.domain.model;

/**
 * Thinking/reasoning text emitted by a model. {@code signature} carries the
 * opaque verification token some providers require when the block is sent
 * back on a later turn.
 *
 * <p>
 * A {@code redacted} segment has no readable text; the provider's encrypted
 * payload travels in {@code signature} and is echoed back unchanged.
 */
public record ReasoningSegment(String text, String signature, boolean redacted) implements ContentSegment {

    public ReasoningSegment {
        text = text == null ? "" : text;
    }

    public ReasoningSegment(String text, String signature) {
        this(text, signature, false);
    }

    public static ReasoningSegment redacted(String data) {
        return new ReasoningSegment("", data, true);
    }

    @Override
    public int textLength() {
        return text.length();
    }
}
