package me.golemcore.gateway.domain.model;

import java.util.List;

/**
 * Outcome of context injection.
 *
 * @param messages
 *            full provider message list: one system message, history, then
 *            the incoming messages
 * @param incoming
 *            the incoming messages with attachments resolved, as they should
 *            be stored in history
 * @param skippedSources
 *            context sources that failed or timed out and contributed nothing
 */
public record AssembledContext(List<Message> messages, List<Message> incoming, List<String> skippedSources) {

    public AssembledContext {
        messages = List.copyOf(messages);
        incoming = List.copyOf(incoming);
        skippedSources = List.copyOf(skippedSources);
    }
}
